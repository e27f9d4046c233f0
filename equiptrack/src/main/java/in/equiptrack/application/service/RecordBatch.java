package in.equiptrack.application.service;

import in.equiptrack.domain.audit.AuditDraft;
import in.equiptrack.util.LedgerJson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record writes of one mutation plus the audit drafts that describe it.
 *
 * Keeps the previous version of every overwritten record so the write can be undone if
 * the audit append fails.
 */
final class RecordBatch {

    private final Map<String, byte[]> puts = new LinkedHashMap<>();
    private final Map<String, byte[]> previous = new LinkedHashMap<>();
    private final List<String> created = new ArrayList<>();
    private final List<AuditDraft> audit = new ArrayList<>();

    RecordBatch put(String key, Object value, Object previousValue) {
        puts.put(key, LedgerJson.toBytes(value));
        if (previousValue == null) {
            created.add(key);
        } else {
            previous.put(key, LedgerJson.toBytes(previousValue));
        }
        return this;
    }

    RecordBatch audit(AuditDraft draft) {
        audit.add(draft);
        return this;
    }

    Map<String, byte[]> puts() {
        return Collections.unmodifiableMap(puts);
    }

    /**
     * Writes that restore the overwritten records.
     */
    Map<String, byte[]> undoPuts() {
        return Collections.unmodifiableMap(previous);
    }

    /**
     * Keys that did not exist before this batch.
     */
    List<String> undoDeletes() {
        return Collections.unmodifiableList(created);
    }

    List<AuditDraft> auditDrafts() {
        return Collections.unmodifiableList(audit);
    }
}
