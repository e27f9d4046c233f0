package in.equiptrack.infrastructure.metrics;

import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.equipment.EquipmentStatus;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class PrometheusMetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private Undertow server;
    private PrometheusLedgerMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusLedgerMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
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
    }

    private String scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"),
            "Content-Type should be text/plain");
        return response.body();
    }

    @Test
    public void testMetricsContainPrometheusFormat() throws Exception {
        String body = scrape();

        assertTrue(body.contains("# HELP"), "Should contain HELP declarations");
        assertTrue(body.contains("# TYPE"), "Should contain TYPE declarations");
        assertTrue(body.contains("ledger_loans_issued_total"), "Should contain loans issued counter");
    }

    @Test
    public void testLoanAndRejectionCounters() throws Exception {
        metrics.recordLoanIssued();
        metrics.recordLoanIssued();
        metrics.recordLoanReturned(true);
        metrics.recordRejection("issue", LedgerErrorCode.LIMIT_EXCEEDED);

        String body = scrape();

        assertTrue(body.contains("ledger_loans_issued_total 2.0"), "Should count two loans");
        assertTrue(body.contains("ledger_loans_returned_total{outcome=\"maintenance\",} 1.0"),
            "Should label return outcome");
        assertTrue(body.contains("operation=\"issue\",code=\"LIMIT_EXCEEDED\""),
            "Should label rejection operation and code");
    }

    @Test
    public void testInventoryGauge() throws Exception {
        metrics.updateInventory(Map.of(EquipmentStatus.AVAILABLE, 4L, EquipmentStatus.LOANED, 1L));

        String body = scrape();

        assertTrue(body.contains("ledger_equipment{status=\"AVAILABLE\",} 4.0"));
        assertTrue(body.contains("ledger_equipment{status=\"LOANED\",} 1.0"));
        assertTrue(body.contains("ledger_equipment{status=\"RETIRED\",} 0.0"), "Missing statuses report zero");
    }

    @Test
    public void testSnapshotHistogram() throws Exception {
        metrics.recordSnapshot(true, Duration.ofMillis(40));
        metrics.recordSnapshot(false, Duration.ofSeconds(2));
        metrics.recordRestore(true);

        String body = scrape();

        assertTrue(body.contains("ledger_snapshot_duration_seconds_bucket"), "Should contain histogram buckets");
        assertTrue(body.contains("ledger_snapshot_duration_seconds_count 2.0"));
        assertTrue(body.contains("ledger_snapshots_total{result=\"failure\",} 1.0"));
        assertTrue(body.contains("ledger_restores_total{result=\"success\",} 1.0"));
        assertTrue(body.contains("le=\"+Inf\""), "Should have +Inf bucket");
    }
}
