package io.leadzpay.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves the marketplace registry at GET /metrics in text format 0.0.4.
 *
 * Scrapers can narrow the output with repeated {@code name} (or {@code name[]}) query
 * parameters, e.g. {@code /metrics?name=leadzpay_leads_submitted_total}. The names are
 * sample names, so counters are matched with their {@code _total} suffix.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        Set<String> names = requestedNames(exchange);

        StringWriter body = new StringWriter();
        try {
            TextFormat.write004(body, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("Metrics export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("metrics export failed");
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(body.toString());
        log.debug("Scrape served {} bytes (filter={})", body.getBuffer().length(), names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new HashSet<>();
        for (String param : new String[] {"name", "name[]"}) {
            Deque<String> values = exchange.getQueryParameters().get(param);
            if (values != null) {
                values.stream().filter(v -> !v.isBlank()).forEach(names::add);
            }
        }
        return names;
    }
}
