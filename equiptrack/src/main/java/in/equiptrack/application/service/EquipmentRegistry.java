package in.equiptrack.application.service;

import in.equiptrack.domain.audit.AuditAction;
import in.equiptrack.domain.audit.AuditDraft;
import in.equiptrack.domain.audit.EntityType;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.common.LedgerException;
import in.equiptrack.domain.equipment.Equipment;
import in.equiptrack.domain.equipment.EquipmentFilter;
import in.equiptrack.domain.equipment.EquipmentMetadata;
import in.equiptrack.domain.equipment.EquipmentStatus;
import in.equiptrack.domain.user.Permission;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;
import in.equiptrack.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Equipment Registry.
 *
 * PURPOSE:
 * Registers equipment, looks it up by id or QR code, and owns status transitions.
 * {@link #applyTransition} is the single place that decides transition legality; the loan
 * ledger drives its LOANED edges through it inside its own transactions.
 *
 * The public {@link #transition} entry point does not touch LOANED in either direction:
 * those edges exist only as part of issuing or returning a loan, which keeps
 * "LOANED iff exactly one open loan" true.
 */
public final class EquipmentRegistry {
    private static final Logger log = LoggerFactory.getLogger(EquipmentRegistry.class);

    private final LedgerStore store;
    private final IdentityStore identity;
    private final InputValidator validator;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public EquipmentRegistry(LedgerStore store, IdentityStore identity, InputValidator validator,
                             Clock clock, LedgerMetrics metrics) {
        this.store = store;
        this.identity = identity;
        this.validator = validator;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Register new equipment in AVAILABLE status.
     *
     * @param metadata name, category, location, notes
     * @param code     QR code value, unique and immutable
     * @param actorId  administrator performing the registration
     * @return the new equipment id
     * @throws LedgerException DUPLICATE_CODE if the code is already assigned
     */
    public String register(EquipmentMetadata metadata, String code, String actorId) {
        return tracked("register", () -> {
            identity.require(actorId, Permission.REGISTER_EQUIPMENT);
            validateMetadata(metadata);
            if (!validator.isValidEquipmentCode(code)) {
                throw LedgerException.invalidInput("equipment code does not match the required pattern: " + code);
            }

            String equipmentId = store.write(tx -> {
                if (tx.equipmentByCode(code).isPresent()) {
                    throw new LedgerException(LedgerErrorCode.DUPLICATE_CODE, code);
                }
                Equipment equipment = Equipment.register(newEquipmentId(tx), code, metadata, clock.instant());
                tx.put(equipment);
                tx.audit(AuditDraft.of(actorId, AuditAction.EQUIPMENT_REGISTERED, EntityType.EQUIPMENT,
                    equipment.equipmentId(), null, EquipmentStatus.AVAILABLE.name()).withDetails("code=" + code));
                return equipment.equipmentId();
            });
            log.info("Equipment registered: {} code={} by {}", equipmentId, code, actorId);
            return equipmentId;
        });
    }

    /**
     * Move equipment between AVAILABLE, MAINTENANCE and RETIRED.
     *
     * @throws LedgerException NOT_FOUND, INVALID_TRANSITION, or UNAUTHORIZED
     */
    public Equipment transition(String equipmentId, EquipmentStatus target, String actorId) {
        return tracked("transition", () -> {
            if (target == null) {
                throw LedgerException.invalidInput("target status is required");
            }
            identity.require(actorId, target == EquipmentStatus.RETIRED
                ? Permission.RETIRE_EQUIPMENT
                : Permission.RECORD_MAINTENANCE);

            Equipment updated = store.write(tx -> {
                Equipment current = tx.equipment(equipmentId)
                    .orElseThrow(() -> LedgerException.notFound("equipment", equipmentId));
                if (target == EquipmentStatus.LOANED || current.status() == EquipmentStatus.LOANED) {
                    throw new LedgerException(LedgerErrorCode.INVALID_TRANSITION,
                        current.status() + " -> " + target + " only through loan issue or return");
                }
                return applyTransition(tx, current, target, actorId, null);
            });
            log.info("Equipment {} -> {} by {}", equipmentId, target, actorId);
            return updated;
        });
    }

    /**
     * Edit name, category, location and notes. Retired equipment is read-only.
     */
    public Equipment updateDetails(String equipmentId, EquipmentMetadata metadata, String actorId) {
        return tracked("updateDetails", () -> {
            identity.require(actorId, Permission.EDIT_EQUIPMENT);
            validateMetadata(metadata);

            return store.write(tx -> {
                Equipment current = tx.equipment(equipmentId)
                    .orElseThrow(() -> LedgerException.notFound("equipment", equipmentId));
                if (current.status().isTerminal()) {
                    throw new LedgerException(LedgerErrorCode.INVALID_TRANSITION, "retired equipment cannot be edited");
                }
                Equipment updated = current.withMetadata(metadata, clock.instant());
                tx.put(updated);
                tx.audit(AuditDraft.of(actorId, AuditAction.EQUIPMENT_UPDATED, EntityType.EQUIPMENT,
                    equipmentId, current.status().name(), current.status().name())
                    .withDetails(describeChanges(current.metadata(), metadata)));
                return updated;
            });
        });
    }

    /**
     * @throws LedgerException NOT_FOUND
     */
    public Equipment lookup(String equipmentId) {
        return store.current().equipment(equipmentId)
            .orElseThrow(() -> LedgerException.notFound("equipment", equipmentId));
    }

    /**
     * Resolve a scanned QR code.
     *
     * @throws LedgerException NOT_FOUND
     */
    public Equipment byCode(String code) {
        return store.current().equipmentByCode(code)
            .orElseThrow(() -> LedgerException.notFound("equipment code", code));
    }

    /**
     * Equipment matching the filter, ordered by id.
     */
    public List<Equipment> list(EquipmentFilter filter) {
        EquipmentFilter f = filter == null ? EquipmentFilter.all() : filter;
        return store.current().allEquipment().stream()
            .filter(f::matches)
            .toList();
    }

    /**
     * Stage a status change inside an open ledger transaction.
     *
     * @param details optional audit details
     * @throws LedgerException INVALID_TRANSITION if the edge is not legal
     */
    Equipment applyTransition(LedgerTransaction tx, Equipment current, EquipmentStatus target,
                              String actorId, String details) {
        if (!current.status().canTransitionTo(target)) {
            throw new LedgerException(LedgerErrorCode.INVALID_TRANSITION,
                current.equipmentId() + " " + current.status() + " -> " + target);
        }
        Instant now = clock.instant();
        Equipment updated = current.withStatus(target, now);
        tx.put(updated);
        tx.audit(AuditDraft.of(actorId, AuditAction.EQUIPMENT_TRANSITIONED, EntityType.EQUIPMENT,
            current.equipmentId(), current.status().name(), target.name()).withDetails(details));
        return updated;
    }

    private <T> T tracked(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (LedgerException e) {
            metrics.recordRejection(operation, e.getCode());
            throw e;
        }
    }

    private void validateMetadata(EquipmentMetadata metadata) {
        if (metadata == null) {
            throw LedgerException.invalidInput("equipment metadata is required");
        }
        try {
            validator.validateText("name", metadata.name(), true);
            validator.validateText("category", metadata.category(), true);
            validator.validateText("location", metadata.location(), false);
            validator.validateText("notes", metadata.notes(), false);
        } catch (IllegalArgumentException e) {
            throw LedgerException.invalidInput(e.getMessage());
        }
    }

    private static String describeChanges(EquipmentMetadata before, EquipmentMetadata after) {
        StringBuilder sb = new StringBuilder();
        appendChange(sb, "name", before.name(), after.name());
        appendChange(sb, "category", before.category(), after.category());
        appendChange(sb, "location", before.location(), after.location());
        appendChange(sb, "notes", before.notes(), after.notes());
        return sb.length() == 0 ? "no changes" : sb.toString();
    }

    private static void appendChange(StringBuilder sb, String field, String before, String after) {
        if (before == null ? after == null : before.equals(after)) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(field).append(": ").append(before).append(" -> ").append(after);
    }

    private static String newEquipmentId(LedgerTransaction tx) {
        String id;
        do {
            id = "EQ-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        } while (tx.equipment(id).isPresent());
        return id;
    }
}
