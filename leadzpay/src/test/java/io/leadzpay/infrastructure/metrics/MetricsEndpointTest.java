package io.leadzpay.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private Undertow server;
    private PrometheusMarketplaceMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusMarketplaceMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(
                Handlers.path()
                    .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            )
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

    private HttpResponse<String> scrape() throws Exception {
        return scrape("");
    }

    private HttpResponse<String> scrape(String query) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics" + query))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointReturns200() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"),
            "Content-Type should be Prometheus text format");
    }

    @Test
    public void testMetricsEndpointExposesMarketplaceMetrics() throws Exception {
        metrics.recordTransition("request");
        metrics.recordLeadSubmitted(new BigDecimal("40"));

        String body = scrape().body();

        assertTrue(body.contains("leadzpay_connection_transitions_total{action=\"request\",} 1.0"));
        assertTrue(body.contains("leadzpay_lead_payout_total 40.0"));
    }

    @Test
    public void testNameFilterLimitsOutput() throws Exception {
        metrics.recordTransition("accept");
        metrics.recordLeadSubmitted(new BigDecimal("25"));

        String body = scrape("?name=leadzpay_lead_payout_total").body();

        assertTrue(body.contains("leadzpay_lead_payout_total 25.0"));
        assertFalse(body.contains("leadzpay_connection_transitions_total{"));
    }
}
