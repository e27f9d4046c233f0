package in.equiptrack.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.equiptrack.application.service.AuditTrail;
import in.equiptrack.application.service.EquipmentRegistry;
import in.equiptrack.application.service.IdentityStore;
import in.equiptrack.application.service.LedgerStatisticsService;
import in.equiptrack.application.service.LoanLedger;
import in.equiptrack.application.service.SnapshotCoordinator;
import in.equiptrack.auth.SessionTokenService;
import in.equiptrack.domain.audit.AuditQuery;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.common.LedgerException;
import in.equiptrack.domain.equipment.EquipmentFilter;
import in.equiptrack.domain.equipment.EquipmentMetadata;
import in.equiptrack.domain.equipment.EquipmentStatus;
import in.equiptrack.domain.loan.Loan;
import in.equiptrack.domain.user.NewUser;
import in.equiptrack.domain.user.Permission;
import in.equiptrack.domain.user.Role;
import in.equiptrack.domain.user.User;
import in.equiptrack.security.SecureAuditLogger;
import in.equiptrack.util.LedgerJson;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP API handlers with session authentication.
 *
 * Every request except login, health and metrics carries {@code Authorization: Bearer <token>}.
 * The token only identifies the caller; capabilities are re-checked against the live
 * identity store by each service call, so a deactivated account loses access at once.
 *
 * Handlers run on worker threads ({@link BlockingHandler}) because ledger writes wait on
 * locks and storage I/O.
 */
public final class LedgerApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(LedgerApiHandlers.class);
    private static final ObjectMapper MAPPER = LedgerJson.MAPPER;

    // JSON Response Keys
    private static final String JSON_SUCCESS = "success";
    private static final String JSON_DATA = "data";
    private static final String JSON_ERROR = "error";
    private static final String JSON_CODE = "code";

    private static final Duration DEFAULT_ACTIVITY_WINDOW = Duration.ofHours(24);

    private final SecureAuditLogger security = new SecureAuditLogger("LedgerApi");
    private final SessionTokenService tokens;
    private final IdentityStore identity;
    private final EquipmentRegistry registry;
    private final LoanLedger loans;
    private final LedgerStatisticsService stats;
    private final AuditTrail auditTrail;
    private final SnapshotCoordinator snapshots;

    public LedgerApiHandlers(SessionTokenService tokens, IdentityStore identity, EquipmentRegistry registry,
                             LoanLedger loans, LedgerStatisticsService stats, AuditTrail auditTrail,
                             SnapshotCoordinator snapshots) {
        this.tokens = tokens;
        this.identity = identity;
        this.registry = registry;
        this.loans = loans;
        this.stats = stats;
        this.auditTrail = auditTrail;
        this.snapshots = snapshots;
    }

    /**
     * Full handler chain: CORS, then blocking dispatch, then routes.
     *
     * @param metricsHandler served at {@code /metrics}
     */
    public HttpHandler routes(HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", this::health)
            // Auth
            .post("/api/auth/login", this::login)
            .post("/api/auth/logout", this::logout)
            .put("/api/auth/password", this::changePassword)
            // Equipment
            .get("/api/equipment", this::listEquipment)
            .post("/api/equipment", this::registerEquipment)
            .get("/api/equipment/by-code/{code}", this::equipmentByCode)
            .get("/api/equipment/{id}", this::getEquipment)
            .put("/api/equipment/{id}", this::updateEquipment)
            .post("/api/equipment/{id}/transition", this::transitionEquipment)
            .get("/api/equipment/{id}/loans", this::equipmentLoanHistory)
            // Loans
            .post("/api/loans", this::issueLoan)
            .get("/api/loans/open", this::openLoans)
            .get("/api/loans/overdue", this::overdueLoans)
            .get("/api/loans/{id}", this::getLoan)
            .post("/api/loans/{id}/return", this::returnLoan)
            .get("/api/supervisors/{id}/loans", this::supervisorLoans)
            // Reports
            .get("/api/stats/dashboard", this::dashboard)
            .get("/api/stats/supervisors", this::supervisorSummaries)
            .get("/api/stats/categories", this::categoryCounts)
            .get("/api/stats/long-running", this::longRunningLoans)
            .get("/api/audit", this::audit)
            // Administration
            .get("/api/admin/users", this::listUsers)
            .post("/api/admin/users", this::createUser)
            .put("/api/admin/users/{id}/role", this::changeRole)
            .put("/api/admin/users/{id}/loan-limit", this::setLoanLimit)
            .post("/api/admin/users/{id}/deactivate", this::deactivateUser)
            .get("/api/admin/snapshots", this::listSnapshots)
            .post("/api/admin/snapshots", this::createSnapshot)
            .post("/api/admin/snapshots/{id}/restore", this::restoreSnapshot)
            .setFallbackHandler(exchange ->
                sendError(exchange, StatusCodes.NOT_FOUND, null, "No route for " + exchange.getRequestPath()));

        HttpHandler blocking = new BlockingHandler(routes);

        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(StatusCodes.OK);
                exchange.endExchange();
            } else {
                blocking.handleRequest(exchange);
            }
        };
    }

    // ═══════════════════════════════════════════════════════════════
    // Health + Auth
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("status", "UP");
        node.put("auditEntries", auditTrail.size());
        node.put("latestAuditSeq", auditTrail.latestSeq());
        node.put("timestamp", Instant.now().toString());
        sendJson(exchange, StatusCodes.OK, node);
    }

    /**
     * POST /api/auth/login {"username","password"}
     */
    public void login(HttpServerExchange exchange) {
        withBody(exchange, body -> {
            String userId = identity.authenticate(text(body, "username"), text(body, "password"));
            User user = identity.find(userId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.AUTH_FAILED));

            ObjectNode data = MAPPER.createObjectNode();
            data.put("token", tokens.issue(user));
            data.put("userId", user.userId());
            data.put("displayName", user.displayName());
            data.put("role", user.role().name());
            return data;
        });
    }

    /**
     * POST /api/auth/logout
     */
    public void logout(HttpServerExchange exchange) {
        guarded(exchange, () -> {
            String token = extractToken(exchange);
            if (token != null) {
                tokens.revoke(token);
            }
            return Map.of("loggedOut", true);
        });
    }

    /**
     * PUT /api/auth/password {"oldPassword","newPassword"}
     */
    public void changePassword(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        withBody(exchange, body -> {
            identity.changePassword(actor, text(body, "oldPassword"), text(body, "newPassword"));
            return Map.of("changed", true);
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Equipment
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/equipment?status=&category=&q=
     */
    public void listEquipment(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.VIEW_INVENTORY);
            String status = queryParam(exchange, "status");
            EquipmentFilter filter = new EquipmentFilter(
                status == null ? null : parseEnum(EquipmentStatus.class, status),
                queryParam(exchange, "category"),
                queryParam(exchange, "q"));
            return registry.list(filter);
        });
    }

    /**
     * POST /api/equipment {"code","name","category","location","notes"}
     */
    public void registerEquipment(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        withBody(exchange, body -> {
            String equipmentId = registry.register(metadata(body), text(body, "code"), actor);
            return registry.lookup(equipmentId);
        }, StatusCodes.CREATED);
    }

    /**
     * GET /api/equipment/{id}
     */
    public void getEquipment(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.VIEW_INVENTORY);
            return registry.lookup(pathParam(exchange, "id"));
        });
    }

    /**
     * GET /api/equipment/by-code/{code}
     */
    public void equipmentByCode(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.VIEW_INVENTORY);
            return registry.byCode(pathParam(exchange, "code"));
        });
    }

    /**
     * PUT /api/equipment/{id} {"name","category","location","notes"}
     */
    public void updateEquipment(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        String equipmentId = pathParam(exchange, "id");
        withBody(exchange, body -> registry.updateDetails(equipmentId, metadata(body), actor));
    }

    /**
     * POST /api/equipment/{id}/transition {"status"}
     */
    public void transitionEquipment(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        String equipmentId = pathParam(exchange, "id");
        withBody(exchange, body -> registry.transition(equipmentId,
            parseEnum(EquipmentStatus.class, text(body, "status")), actor));
    }

    /**
     * GET /api/equipment/{id}/loans
     */
    public void equipmentLoanHistory(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.VIEW_REPORTS);
            String equipmentId = pathParam(exchange, "id");
            registry.lookup(equipmentId);
            return loans.historyFor(equipmentId);
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Loans
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /api/loans {"equipmentId" | "equipmentIds":[], "supervisorId", "location", "notes"}
     *
     * A supervisor issuing to themselves may omit supervisorId.
     */
    public void issueLoan(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        withBody(exchange, body -> {
            List<String> equipmentIds = new ArrayList<>();
            if (body.hasNonNull("equipmentIds")) {
                body.get("equipmentIds").forEach(n -> equipmentIds.add(n.asText()));
            } else {
                equipmentIds.add(required(body, "equipmentId"));
            }
            String supervisorId = body.hasNonNull("supervisorId") ? body.get("supervisorId").asText() : actor;
            List<String> loanIds = loans.issueAll(equipmentIds, supervisorId, actor,
                text(body, "location"), text(body, "notes"));
            return loanIds.stream().map(loans::lookup).map(this::loanView).toList();
        }, StatusCodes.CREATED);
    }

    /**
     * GET /api/loans/{id}
     */
    public void getLoan(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.VIEW_INVENTORY);
            return loanView(loans.lookup(pathParam(exchange, "id")));
        });
    }

    /**
     * POST /api/loans/{id}/return {"inspect": bool}
     */
    public void returnLoan(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        String loanId = pathParam(exchange, "id");
        withBody(exchange, body -> loanView(loans.returnLoan(loanId, actor,
            body.hasNonNull("inspect") && body.get("inspect").asBoolean())));
    }

    /**
     * GET /api/loans/open
     */
    public void openLoans(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.VIEW_REPORTS);
            return loans.openLoans().stream().map(this::loanView).toList();
        });
    }

    /**
     * GET /api/loans/overdue
     */
    public void overdueLoans(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.VIEW_REPORTS);
            return loans.overdueLoans().stream().map(this::loanView).toList();
        });
    }

    /**
     * GET /api/supervisors/{id}/loans. Supervisors may always read their own.
     */
    public void supervisorLoans(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            String supervisorId = pathParam(exchange, "id");
            if (!actor.equals(supervisorId)) {
                identity.require(actor, Permission.VIEW_REPORTS);
            }
            return loans.openLoansFor(supervisorId).stream().map(this::loanView).toList();
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Reports
    // ═══════════════════════════════════════════════════════════════

    public void dashboard(HttpServerExchange exchange) {
        report(exchange, stats::dashboard);
    }

    public void supervisorSummaries(HttpServerExchange exchange) {
        report(exchange, stats::supervisorLoanSummaries);
    }

    public void categoryCounts(HttpServerExchange exchange) {
        report(exchange, stats::equipmentCountsByCategory);
    }

    public void longRunningLoans(HttpServerExchange exchange) {
        report(exchange, () -> stats.longRunningLoans().stream().map(this::loanView).toList());
    }

    /**
     * GET /api/audit?entityId=&actorId=&sinceMinutes=
     *
     * Without filters returns the last 24 hours.
     */
    public void audit(HttpServerExchange exchange) {
        report(exchange, () -> {
            String entityId = queryParam(exchange, "entityId");
            String actorId = queryParam(exchange, "actorId");
            String since = queryParam(exchange, "sinceMinutes");
            if (entityId == null && actorId == null) {
                Duration window = since == null ? DEFAULT_ACTIVITY_WINDOW : Duration.ofMinutes(parseLong(since));
                return stats.recentActivity(window);
            }
            Instant from = since == null ? null : Instant.now().minus(Duration.ofMinutes(parseLong(since)));
            return auditTrail.query(new AuditQuery(entityId, actorId, from, null)).toList();
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Administration
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/admin/users
     */
    public void listUsers(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.MANAGE_USERS);
            return identity.listUsers().stream().map(LedgerApiHandlers::userView).toList();
        });
    }

    /**
     * POST /api/admin/users {"username","displayName","password","role","loanLimit","email","phone","department"}
     */
    public void createUser(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        withBody(exchange, body -> {
            NewUser request = new NewUser(
                text(body, "username"),
                text(body, "displayName"),
                text(body, "password"),
                parseEnum(Role.class, required(body, "role")),
                body.hasNonNull("loanLimit") ? body.get("loanLimit").asInt() : null,
                text(body, "email"),
                text(body, "phone"),
                text(body, "department"));
            return userView(identity.createUser(request, actor));
        }, StatusCodes.CREATED);
    }

    /**
     * PUT /api/admin/users/{id}/role {"role"}
     */
    public void changeRole(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        String userId = pathParam(exchange, "id");
        withBody(exchange, body ->
            userView(identity.changeRole(userId, parseEnum(Role.class, required(body, "role")), actor)));
    }

    /**
     * PUT /api/admin/users/{id}/loan-limit {"loanLimit": n | null}
     */
    public void setLoanLimit(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        String userId = pathParam(exchange, "id");
        withBody(exchange, body -> userView(identity.setLoanLimit(userId,
            body.hasNonNull("loanLimit") ? body.get("loanLimit").asInt() : null, actor)));
    }

    /**
     * POST /api/admin/users/{id}/deactivate
     */
    public void deactivateUser(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> userView(identity.deactivate(pathParam(exchange, "id"), actor)));
    }

    /**
     * GET /api/admin/snapshots
     */
    public void listSnapshots(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.CREATE_SNAPSHOT);
            return snapshots.listSnapshots();
        });
    }

    /**
     * POST /api/admin/snapshots
     */
    public void createSnapshot(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> snapshots.snapshot(actor), StatusCodes.CREATED);
    }

    /**
     * POST /api/admin/snapshots/{id}/restore
     */
    public void restoreSnapshot(HttpServerExchange exchange) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> snapshots.restore(pathParam(exchange, "id"), actor));
    }

    // ═══════════════════════════════════════════════════════════════
    // Error mapping
    // ═══════════════════════════════════════════════════════════════

    /**
     * HTTP status for a ledger error code.
     */
    static int statusFor(LedgerErrorCode code) {
        switch (code) {
            case INVALID_INPUT:
            case INVALID_TRANSITION:
                return StatusCodes.BAD_REQUEST;
            case AUTH_FAILED:
                return StatusCodes.UNAUTHORIZED;
            case UNAUTHORIZED:
                return StatusCodes.FORBIDDEN;
            case NOT_FOUND:
                return StatusCodes.NOT_FOUND;
            case DUPLICATE_CODE:
            case EQUIPMENT_UNAVAILABLE:
            case LIMIT_EXCEEDED:
            case ALREADY_RETURNED:
                return StatusCodes.CONFLICT;
            case INCOMPATIBLE_SNAPSHOT:
                return StatusCodes.UNPROCESSABLE_ENTITY;
            case STORAGE_UNAVAILABLE:
            case SNAPSHOT_FAILED:
                return StatusCodes.SERVICE_UNAVAILABLE;
            default:
                return StatusCodes.INTERNAL_SERVER_ERROR;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    @FunctionalInterface
    private interface Action {
        Object run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        Object run(JsonNode body) throws Exception;
    }

    private void report(HttpServerExchange exchange, Action action) {
        String actor = authenticate(exchange);
        if (actor == null) return;
        guarded(exchange, () -> {
            identity.require(actor, Permission.VIEW_REPORTS);
            return action.run();
        });
    }

    private void guarded(HttpServerExchange exchange, Action action) {
        guarded(exchange, action, StatusCodes.OK);
    }

    private void guarded(HttpServerExchange exchange, Action action, int successStatus) {
        try {
            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.set(JSON_DATA, MAPPER.valueToTree(action.run()));
            sendJson(exchange, successStatus, response);
        } catch (LedgerException e) {
            int status = statusFor(e.getCode());
            if (status >= 500) {
                security.logError(exchange.getRequestMethod() + " " + exchange.getRequestPath(),
                    security.getRedactedExceptionMessage(e));
            } else {
                log.debug("{} {} rejected: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage());
            }
            sendError(exchange, status, e.getCode().name(), e.getMessage());
        } catch (JsonProcessingException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, LedgerErrorCode.INVALID_INPUT.name(), "Malformed JSON body");
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, LedgerErrorCode.INVALID_INPUT.name(), e.getMessage());
        } catch (Exception e) {
            log.error("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                security.getRedactedExceptionMessage(e), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, null, "Internal error");
        }
    }

    private void withBody(HttpServerExchange exchange, BodyAction action) {
        withBody(exchange, action, StatusCodes.OK);
    }

    private void withBody(HttpServerExchange exchange, BodyAction action, int successStatus) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> guarded(ex, () -> {
            JsonNode json = body == null || body.isBlank() ? MAPPER.createObjectNode() : MAPPER.readTree(body);
            return action.run(json);
        }, successStatus), StandardCharsets.UTF_8);
    }

    /**
     * Resolve the caller from the bearer token, or send 401 and return null.
     */
    private String authenticate(HttpServerExchange exchange) {
        String token = extractToken(exchange);
        if (token == null) {
            sendError(exchange, StatusCodes.UNAUTHORIZED, LedgerErrorCode.AUTH_FAILED.name(), "Unauthorized");
            return null;
        }
        String userId = tokens.validate(token)
            .map(SessionTokenService.SessionClaims::userId)
            .filter(id -> identity.find(id).map(User::isActive).orElse(false))
            .orElse(null);
        if (userId == null) {
            sendError(exchange, StatusCodes.UNAUTHORIZED, LedgerErrorCode.AUTH_FAILED.name(), "Unauthorized");
        }
        return userId;
    }

    private static String extractToken(HttpServerExchange exchange) {
        String authHeader = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            return authHeader.substring(7);
        }
        return null;
    }

    private Map<String, Object> loanView(Loan loan) {
        return Map.of("loan", loan, "status", loans.effectiveStatus(loan));
    }

    private static ObjectNode userView(User user) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("userId", user.userId());
        node.put("username", user.username());
        node.put("displayName", user.displayName());
        node.put("role", user.role().name());
        node.put("status", user.status().name());
        if (user.loanLimit() != null) {
            node.put("loanLimit", user.loanLimit());
        }
        node.put("email", user.email());
        node.put("phone", user.phone());
        node.put("department", user.department());
        return node;
    }

    private static EquipmentMetadata metadata(JsonNode body) {
        return new EquipmentMetadata(text(body, "name"), text(body, "category"),
            text(body, "location"), text(body, "notes"));
    }

    private static String text(JsonNode body, String field) {
        return body.hasNonNull(field) ? body.get(field).asText() : null;
    }

    private static String required(JsonNode body, String field) {
        String value = text(body, field);
        if (value == null || value.isBlank()) {
            throw LedgerException.invalidInput(field + " is required");
        }
        return value;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        if (value == null) {
            throw LedgerException.invalidInput(type.getSimpleName() + " is required");
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw LedgerException.invalidInput("unknown " + type.getSimpleName() + ": " + value);
        }
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw LedgerException.invalidInput("not a number: " + value);
        }
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.peekFirst();
    }

    private static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int status, String code, String message) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(JSON_SUCCESS, false);
        if (code != null) {
            node.put(JSON_CODE, code);
        }
        node.put(JSON_ERROR, message);
        sendJson(exchange, status, node);
    }
}
