package in.equiptrack.infrastructure.persistence;

import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.application.port.output.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of LedgerStorage.
 *
 * Records live in {@code ledger_records}, snapshots in {@code ledger_snapshots}. A batch is one
 * JDBC transaction: either every put and delete commits or none do.
 */
public final class PostgresLedgerStorage implements LedgerStorage {
    private static final Logger log = LoggerFactory.getLogger(PostgresLedgerStorage.class);

    private static final String CREATE_RECORDS_SQL = """
            CREATE TABLE IF NOT EXISTS ledger_records (
                record_key  TEXT PRIMARY KEY,
                value       BYTEA NOT NULL,
                updated_at  TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;

    private static final String CREATE_SNAPSHOTS_SQL = """
            CREATE TABLE IF NOT EXISTS ledger_snapshots (
                snapshot_id TEXT PRIMARY KEY,
                blob        BYTEA NOT NULL,
                created_at  TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO ledger_records (record_key, value, updated_at)
            VALUES (?, ?, NOW())
            ON CONFLICT (record_key) DO UPDATE SET
                value = EXCLUDED.value,
                updated_at = NOW()
            """;

    private static final String DELETE_SQL = "DELETE FROM ledger_records WHERE record_key = ?";

    private final DataSource dataSource;

    public PostgresLedgerStorage(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create tables if they do not exist. Called once at startup.
     */
    public void initSchema() {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {
            st.execute(CREATE_RECORDS_SQL);
            st.execute(CREATE_SNAPSHOTS_SQL);
            log.info("Ledger schema ready");
        } catch (SQLException e) {
            log.error("Failed to initialize ledger schema: {}", e.getMessage(), e);
            throw new StorageUnavailableException("Failed to initialize ledger schema", e);
        }
    }

    @Override
    public Optional<byte[]> atomicRead(String key) {
        String sql = "SELECT value FROM ledger_records WHERE record_key = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getBytes("value"));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Error reading record {}: {}", key, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to read record " + key, e);
        }
    }

    @Override
    public void atomicWrite(String key, byte[] value) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, key);
            ps.setBytes(2, value);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error writing record {}: {}", key, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to write record " + key, e);
        }
    }

    @Override
    public void atomicWriteAll(Map<String, byte[]> puts, Collection<String> deletes) {
        if (puts.isEmpty() && deletes.isEmpty()) {
            return;
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (!deletes.isEmpty()) {
                    try (PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
                        for (String key : deletes) {
                            ps.setString(1, key);
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }

                if (!puts.isEmpty()) {
                    try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
                        for (Map.Entry<String, byte[]> e : puts.entrySet()) {
                            ps.setString(1, e.getKey());
                            ps.setBytes(2, e.getValue());
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }

                conn.commit();
                log.debug("Committed batch: {} puts, {} deletes", puts.size(), deletes.size());
            } catch (SQLException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Error writing batch ({} puts, {} deletes): {}", puts.size(), deletes.size(), e.getMessage(), e);
            throw new StorageUnavailableException("Failed to write batch", e);
        }
    }

    @Override
    public Map<String, byte[]> readAll(String prefix) {
        String sql = """
                SELECT record_key, value
                FROM ledger_records
                WHERE record_key LIKE ?
                ORDER BY record_key ASC
                """;

        Map<String, byte[]> result = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, escapeLike(prefix) + "%");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.put(rs.getString("record_key"), rs.getBytes("value"));
                }
            }
        } catch (SQLException e) {
            log.error("Error reading records with prefix {}: {}", prefix, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to read records with prefix " + prefix, e);
        }
        return result;
    }

    @Override
    public void durableSnapshotWrite(String snapshotId, byte[] blob) {
        String sql = "INSERT INTO ledger_snapshots (snapshot_id, blob) VALUES (?, ?)";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, snapshotId);
            ps.setBytes(2, blob);
            ps.executeUpdate();
            log.info("Snapshot written: {} ({} bytes)", snapshotId, blob.length);
        } catch (SQLException e) {
            log.error("Error writing snapshot {}: {}", snapshotId, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to write snapshot " + snapshotId, e);
        }
    }

    @Override
    public Optional<byte[]> readSnapshot(String snapshotId) {
        String sql = "SELECT blob FROM ledger_snapshots WHERE snapshot_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, snapshotId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getBytes("blob"));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Error reading snapshot {}: {}", snapshotId, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to read snapshot " + snapshotId, e);
        }
    }

    @Override
    public List<String> listSnapshots() {
        String sql = "SELECT snapshot_id FROM ledger_snapshots ORDER BY created_at ASC, snapshot_id ASC";

        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("snapshot_id"));
            }
        } catch (SQLException e) {
            log.error("Error listing snapshots: {}", e.getMessage(), e);
            throw new StorageUnavailableException("Failed to list snapshots", e);
        }
        return ids;
    }

    @Override
    public void deleteSnapshot(String snapshotId) {
        String sql = "DELETE FROM ledger_snapshots WHERE snapshot_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, snapshotId);
            if (ps.executeUpdate() > 0) {
                log.info("Snapshot deleted: {}", snapshotId);
            }
        } catch (SQLException e) {
            log.error("Error deleting snapshot {}: {}", snapshotId, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to delete snapshot " + snapshotId, e);
        }
    }

    private static void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            log.warn("Rollback failed: {}", rollbackError.getMessage());
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
