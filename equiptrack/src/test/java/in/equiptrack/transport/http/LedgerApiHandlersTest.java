package in.equiptrack.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.equiptrack.auth.SaltedSha256CredentialHasher;
import in.equiptrack.auth.SessionTokenService;
import in.equiptrack.bootstrap.LedgerEngine;
import in.equiptrack.config.LedgerConfig;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;
import in.equiptrack.infrastructure.metrics.PrometheusMetricsHandler;
import in.equiptrack.infrastructure.persistence.InMemoryLedgerStorage;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the JSON API over a real Undertow listener.
 */
public class LedgerApiHandlersTest {

    private static final int TEST_PORT = 19092;
    private static final String BASE = "http://localhost:" + TEST_PORT;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LedgerEngine engine;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        LedgerConfig config = LedgerConfig.of(Duration.ofDays(7), 2, Duration.ofDays(14));
        Clock clock = Clock.systemUTC();
        engine = new LedgerEngine(new InMemoryLedgerStorage(), new SaltedSha256CredentialHasher(1),
            config, clock, LedgerMetrics.NOOP);
        engine.identity().bootstrapAdmin("admin", "admin-pass-1");

        SessionTokenService tokens = new SessionTokenService("api-test-session-secret", config.sessionTimeout(), clock);
        LedgerApiHandlers api = new LedgerApiHandlers(tokens, engine.identity(), engine.registry(),
            engine.loans(), engine.statistics(), engine.auditTrail(), engine.snapshots());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(api.routes(new PrometheusMetricsHandler(new CollectorRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
        engine.snapshots().stop();
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private HttpResponse<String> send(String method, String path, String token, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(BASE + path))
            .timeout(Duration.ofSeconds(10))
            .method(method, body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body));
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    private String login(String username, String password) throws Exception {
        HttpResponse<String> response = send("POST", "/api/auth/login", null,
            "{\"username\":\"" + username + "\",\"password\":\"" + password + "\"}");
        assertEquals(200, response.statusCode(), response.body());
        return json(response).path("data").path("token").asText();
    }

    private String createSupervisor(String adminToken, String username) throws Exception {
        HttpResponse<String> response = send("POST", "/api/admin/users", adminToken,
            "{\"username\":\"" + username + "\",\"displayName\":\"Site Lead\",\"password\":\"lead-pass-1\","
                + "\"role\":\"supervisor\",\"department\":\"Operations\"}");
        assertEquals(201, response.statusCode(), response.body());
        return json(response).path("data").path("userId").asText();
    }

    private String registerEquipment(String adminToken, String code) throws Exception {
        HttpResponse<String> response = send("POST", "/api/equipment", adminToken,
            "{\"code\":\"" + code + "\",\"name\":\"Drill\",\"category\":\"Power Tools\",\"location\":\"Warehouse A\"}");
        assertEquals(201, response.statusCode(), response.body());
        return json(response).path("data").path("equipmentId").asText();
    }

    // ═══════════════════════════════════════════════════════════════
    // Tests
    // ═══════════════════════════════════════════════════════════════

    @Test
    public void testHealthIsPublic() throws Exception {
        HttpResponse<String> response = send("GET", "/api/health", null, null);

        assertEquals(200, response.statusCode());
        assertEquals("UP", json(response).path("status").asText());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
    }

    @Test
    public void testPreflightShortCircuits() throws Exception {
        HttpResponse<String> response = send("OPTIONS", "/api/loans", null, null);

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("POST"));
    }

    @Test
    public void testLoginFailureIsUniform() throws Exception {
        HttpResponse<String> wrong = send("POST", "/api/auth/login", null,
            "{\"username\":\"admin\",\"password\":\"wrong-pass\"}");
        HttpResponse<String> unknown = send("POST", "/api/auth/login", null,
            "{\"username\":\"ghost\",\"password\":\"wrong-pass\"}");

        assertEquals(401, wrong.statusCode());
        assertEquals(401, unknown.statusCode());
        assertEquals("AUTH_FAILED", json(wrong).path("code").asText());
        assertEquals(json(wrong).path("error"), json(unknown).path("error"));
    }

    @Test
    public void testProtectedRoutesRequireToken() throws Exception {
        assertEquals(401, send("GET", "/api/equipment", null, null).statusCode());
        assertEquals(401, send("GET", "/api/equipment", "garbage.token.value", null).statusCode());
    }

    @Test
    public void testMalformedBodyIsBadRequest() throws Exception {
        String admin = login("admin", "admin-pass-1");

        HttpResponse<String> response = send("POST", "/api/equipment", admin, "{not json");

        assertEquals(400, response.statusCode());
        assertEquals("INVALID_INPUT", json(response).path("code").asText());
    }

    @Test
    public void testLoanLifecycleOverHttp() throws Exception {
        String admin = login("admin", "admin-pass-1");
        String supervisorId = createSupervisor(admin, "lead1");
        String equipmentId = registerEquipment(admin, "EQ-001");
        String supervisor = login("lead1", "lead-pass-1");

        HttpResponse<String> issued = send("POST", "/api/loans", supervisor,
            "{\"equipmentId\":\"" + equipmentId + "\",\"location\":\"Site 4\"}");
        assertEquals(201, issued.statusCode(), issued.body());
        JsonNode loan = json(issued).path("data").get(0);
        String loanId = loan.path("loan").path("loanId").asText();
        assertEquals(supervisorId, loan.path("loan").path("supervisorId").asText());
        assertEquals("OPEN", loan.path("status").asText());

        HttpResponse<String> again = send("POST", "/api/loans", supervisor,
            "{\"equipmentId\":\"" + equipmentId + "\"}");
        assertEquals(409, again.statusCode());
        assertEquals("EQUIPMENT_UNAVAILABLE", json(again).path("code").asText());

        HttpResponse<String> byCode = send("GET", "/api/equipment/by-code/EQ-001", supervisor, null);
        assertEquals("LOANED", json(byCode).path("data").path("status").asText());

        HttpResponse<String> mine = send("GET", "/api/supervisors/" + supervisorId + "/loans", supervisor, null);
        assertEquals(1, json(mine).path("data").size());

        HttpResponse<String> returned = send("POST", "/api/loans/" + loanId + "/return", supervisor, "{}");
        assertEquals(200, returned.statusCode(), returned.body());
        assertEquals("RETURNED", json(returned).path("data").path("status").asText());

        HttpResponse<String> twice = send("POST", "/api/loans/" + loanId + "/return", supervisor, "{}");
        assertEquals(409, twice.statusCode());
        assertEquals("ALREADY_RETURNED", json(twice).path("code").asText());
    }

    @Test
    public void testReturnWithInspectionGoesToMaintenance() throws Exception {
        String admin = login("admin", "admin-pass-1");
        createSupervisor(admin, "lead2");
        String equipmentId = registerEquipment(admin, "EQ-002");
        String supervisor = login("lead2", "lead-pass-1");

        HttpResponse<String> issued = send("POST", "/api/loans", supervisor,
            "{\"equipmentIds\":[\"" + equipmentId + "\"]}");
        String loanId = json(issued).path("data").get(0).path("loan").path("loanId").asText();

        send("POST", "/api/loans/" + loanId + "/return", supervisor, "{\"inspect\":true}");

        HttpResponse<String> equipment = send("GET", "/api/equipment/" + equipmentId, supervisor, null);
        assertEquals("MAINTENANCE", json(equipment).path("data").path("status").asText());
    }

    @Test
    public void testCapabilitiesEnforced() throws Exception {
        String admin = login("admin", "admin-pass-1");
        createSupervisor(admin, "lead3");
        String supervisor = login("lead3", "lead-pass-1");

        HttpResponse<String> register = send("POST", "/api/equipment", supervisor,
            "{\"code\":\"EQ-009\",\"name\":\"Saw\",\"category\":\"Power Tools\",\"location\":\"Yard\"}");
        assertEquals(403, register.statusCode());
        assertEquals("UNAUTHORIZED", json(register).path("code").asText());

        assertEquals(403, send("GET", "/api/admin/users", supervisor, null).statusCode());
        assertEquals(403, send("POST", "/api/admin/snapshots", supervisor, null).statusCode());
    }

    @Test
    public void testUserViewsHideCredentialHash() throws Exception {
        String admin = login("admin", "admin-pass-1");
        createSupervisor(admin, "lead4");

        HttpResponse<String> users = send("GET", "/api/admin/users", admin, null);

        assertEquals(200, users.statusCode());
        assertFalse(users.body().contains("credentialHash"));
        assertEquals(2, json(users).path("data").size());
    }

    @Test
    public void testDeactivatedUserTokenStopsWorking() throws Exception {
        String admin = login("admin", "admin-pass-1");
        String supervisorId = createSupervisor(admin, "lead5");
        String supervisor = login("lead5", "lead-pass-1");

        assertEquals(200, send("POST", "/api/admin/users/" + supervisorId + "/deactivate", admin, null).statusCode());

        assertEquals(401, send("GET", "/api/equipment", supervisor, null).statusCode());
    }

    @Test
    public void testLogoutRevokesToken() throws Exception {
        String admin = login("admin", "admin-pass-1");

        assertEquals(200, send("POST", "/api/auth/logout", admin, null).statusCode());

        assertEquals(401, send("GET", "/api/equipment", admin, null).statusCode());
    }

    @Test
    public void testSnapshotAndRestoreOverHttp() throws Exception {
        String admin = login("admin", "admin-pass-1");
        registerEquipment(admin, "EQ-010");

        HttpResponse<String> created = send("POST", "/api/admin/snapshots", admin, null);
        assertEquals(201, created.statusCode(), created.body());
        String snapshotId = json(created).path("data").path("snapshotId").asText();

        registerEquipment(admin, "EQ-011");
        HttpResponse<String> restored = send("POST", "/api/admin/snapshots/" + snapshotId + "/restore", admin, null);
        assertEquals(200, restored.statusCode(), restored.body());

        HttpResponse<String> list = send("GET", "/api/equipment", admin, null);
        assertEquals(1, json(list).path("data").size());

        HttpResponse<String> missing = send("POST", "/api/admin/snapshots/backup_missing/restore", admin, null);
        assertEquals(404, missing.statusCode());
    }

    @Test
    public void testDashboardReport() throws Exception {
        String admin = login("admin", "admin-pass-1");
        registerEquipment(admin, "EQ-020");

        HttpResponse<String> response = send("GET", "/api/stats/dashboard", admin, null);

        assertEquals(200, response.statusCode());
        assertEquals(1, json(response).path("data").path("totalEquipment").asInt());
    }

    @Test
    public void testUnknownRouteIs404() throws Exception {
        assertEquals(404, send("GET", "/api/nothing-here", null, null).statusCode());
    }

    @Test
    public void testMetricsRouteServed() throws Exception {
        assertEquals(200, send("GET", "/metrics", null, null).statusCode());
    }

    @ParameterizedTest
    @EnumSource(LedgerErrorCode.class)
    public void testEveryErrorCodeHasClientOrServiceStatus(LedgerErrorCode code) {
        int status = LedgerApiHandlers.statusFor(code);

        assertTrue(status >= 400 && status != 500, code + " -> " + status);
    }

    @Test
    public void testErrorStatusMapping() {
        assertEquals(409, LedgerApiHandlers.statusFor(LedgerErrorCode.LIMIT_EXCEEDED));
        assertEquals(403, LedgerApiHandlers.statusFor(LedgerErrorCode.UNAUTHORIZED));
        assertEquals(401, LedgerApiHandlers.statusFor(LedgerErrorCode.AUTH_FAILED));
        assertEquals(422, LedgerApiHandlers.statusFor(LedgerErrorCode.INCOMPATIBLE_SNAPSHOT));
        assertEquals(503, LedgerApiHandlers.statusFor(LedgerErrorCode.SNAPSHOT_FAILED));
    }
}
