package in.equiptrack.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.application.port.output.StorageUnavailableException;
import in.equiptrack.util.LedgerJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-backed storage.
 *
 * All records live in one JSON document ({@code ledger.json}, key -> base64 value). Every
 * batch rewrites the document to a temp file, forces it to disk and atomically moves it over
 * the previous version, so a crash leaves either the old or the new state. Snapshots are
 * separate files under {@code snapshots/}.
 *
 * THREAD-SAFETY: record methods synchronize on the instance. Snapshot methods take no
 * lock: each snapshot id owns its own file and temp file, so a slow snapshot write never
 * holds up a ledger commit.
 */
public final class FileLedgerStorage implements LedgerStorage {
    private static final Logger log = LoggerFactory.getLogger(FileLedgerStorage.class);
    private static final TypeReference<TreeMap<String, byte[]>> RECORDS_TYPE = new TypeReference<>() {};
    private static final Pattern SNAPSHOT_ID = Pattern.compile("^[A-Za-z0-9_-]{1,100}$");
    private static final String SNAPSHOT_SUFFIX = ".json";

    private final Path ledgerFile;
    private final Path snapshotDir;
    private TreeMap<String, byte[]> records;

    public FileLedgerStorage(Path dataDir) {
        this.ledgerFile = dataDir.resolve("ledger.json");
        this.snapshotDir = dataDir.resolve("snapshots");
        try {
            Files.createDirectories(snapshotDir);
            if (Files.exists(ledgerFile)) {
                this.records = LedgerJson.MAPPER.readValue(ledgerFile.toFile(), RECORDS_TYPE);
                log.info("Loaded {} records from {}", records.size(), ledgerFile);
            } else {
                this.records = new TreeMap<>();
                log.info("No ledger file at {}, starting empty", ledgerFile);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot open ledger storage at " + dataDir, e);
        }
    }

    @Override
    public synchronized Optional<byte[]> atomicRead(String key) {
        byte[] value = records.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public synchronized void atomicWrite(String key, byte[] value) {
        atomicWriteAll(Map.of(key, value), List.of());
    }

    @Override
    public synchronized void atomicWriteAll(Map<String, byte[]> puts, Collection<String> deletes) {
        TreeMap<String, byte[]> next = new TreeMap<>(records);
        for (String key : deletes) {
            next.remove(key);
        }
        for (Map.Entry<String, byte[]> e : puts.entrySet()) {
            next.put(e.getKey(), e.getValue().clone());
        }

        try {
            writeAtomically(ledgerFile, LedgerJson.MAPPER.writeValueAsBytes(next));
        } catch (IOException e) {
            log.error("Failed to write ledger file {}: {}", ledgerFile, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to write ledger file", e);
        }
        this.records = next;
    }

    @Override
    public synchronized Map<String, byte[]> readAll(String prefix) {
        Map<String, byte[]> result = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> e : records.tailMap(prefix, true).entrySet()) {
            if (!e.getKey().startsWith(prefix)) {
                break;
            }
            result.put(e.getKey(), e.getValue().clone());
        }
        return result;
    }

    @Override
    public void durableSnapshotWrite(String snapshotId, byte[] blob) {
        Path target = snapshotPath(snapshotId);
        try {
            writeAtomically(target, blob);
            log.info("Snapshot written: {} ({} bytes)", target, blob.length);
        } catch (IOException e) {
            log.error("Failed to write snapshot {}: {}", target, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to write snapshot " + snapshotId, e);
        }
    }

    @Override
    public Optional<byte[]> readSnapshot(String snapshotId) {
        Path source = snapshotPath(snapshotId);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(source));
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read snapshot " + snapshotId, e);
        }
    }

    @Override
    public List<String> listSnapshots() {
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(snapshotDir)) {
            files.map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(SNAPSHOT_SUFFIX))
                .map(name -> name.substring(0, name.length() - SNAPSHOT_SUFFIX.length()))
                .sorted()
                .forEach(ids::add);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to list snapshots in " + snapshotDir, e);
        }
        return ids;
    }

    @Override
    public void deleteSnapshot(String snapshotId) {
        Path target = snapshotPath(snapshotId);
        try {
            if (Files.deleteIfExists(target)) {
                log.info("Snapshot deleted: {}", target);
            }
        } catch (IOException e) {
            log.error("Failed to delete snapshot {}: {}", target, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to delete snapshot " + snapshotId, e);
        }
    }

    private Path snapshotPath(String snapshotId) {
        if (snapshotId == null || !SNAPSHOT_ID.matcher(snapshotId).matches()) {
            throw new IllegalArgumentException("Invalid snapshot id: " + snapshotId);
        }
        return snapshotDir.resolve(snapshotId + SNAPSHOT_SUFFIX);
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
