package in.equiptrack.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared JSON mapping for persisted records, snapshots and HTTP bodies.
 */
public final class LedgerJson {

    public static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Serialize a record. Domain records always serialize, so failure is a programming error.
     */
    public static byte[] toBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromBytes(byte[] bytes, Class<T> type) throws IOException {
        return MAPPER.readValue(bytes, type);
    }

    /**
     * Decode every value of a storage scan, in key order.
     *
     * @throws UncheckedIOException naming the first corrupt key
     */
    public static <T> List<T> decodeAll(Map<String, byte[]> records, Class<T> type) {
        List<T> result = new ArrayList<>(records.size());
        for (Map.Entry<String, byte[]> record : records.entrySet()) {
            try {
                result.add(MAPPER.readValue(record.getValue(), type));
            } catch (IOException e) {
                throw new UncheckedIOException("Corrupt record " + record.getKey(), e);
            }
        }
        return result;
    }

    private LedgerJson() {}
}
