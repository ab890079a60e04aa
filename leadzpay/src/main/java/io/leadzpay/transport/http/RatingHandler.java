package io.leadzpay.transport.http;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.common.MarketplaceException;
import io.leadzpay.domain.rating.CarrierConfig;
import io.leadzpay.domain.rating.QuoteResult;
import io.leadzpay.infrastructure.metrics.MarketplaceMetrics;
import io.leadzpay.service.rating.CarrierCatalog;
import io.leadzpay.service.rating.RatingEngine;
import io.undertow.server.HttpServerExchange;

import java.util.List;
import java.util.Map;

import static io.leadzpay.transport.http.HttpSupport.handle;
import static io.leadzpay.transport.http.HttpSupport.pathParam;
import static io.leadzpay.transport.http.HttpSupport.queryParam;
import static io.leadzpay.transport.http.HttpSupport.readBody;
import static io.leadzpay.transport.http.HttpSupport.sendJson;

/**
 * HTTP handler for carrier lookup and quote rating. No identity is required.
 */
public final class RatingHandler {

    private final CarrierCatalog catalog;
    private final RatingEngine ratingEngine;
    private final MarketplaceMetrics metrics;

    public RatingHandler(CarrierCatalog catalog, RatingEngine ratingEngine, MarketplaceMetrics metrics) {
        this.catalog = catalog;
        this.ratingEngine = ratingEngine;
        this.metrics = metrics;
    }

    /**
     * GET /api/carriers - Available carriers in catalog order
     */
    public void listCarriers(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, Map.of("carriers", catalog.listAvailable())));
    }

    /**
     * GET /api/carriers/{carrierId}
     */
    public void getCarrier(HttpServerExchange exchange) {
        handle(exchange, () -> {
            String carrierId = pathParam(exchange, "carrierId");
            CarrierConfig carrier = catalog.findById(carrierId)
                .orElseThrow(() -> new MarketplaceException(ErrorCode.CARRIER_NOT_FOUND, "Unknown carrier: " + carrierId));
            sendJson(exchange, carrier);
        });
    }

    /**
     * POST /api/quotes - Ranked quotes from every eligible carrier
     */
    public void computeQuotes(HttpServerExchange exchange) {
        handle(exchange, () -> {
            QuoteRequest request = readBody(exchange, QuoteRequest.class);
            List<QuoteResult> quotes = ratingEngine.computeQuotes(request.toProfile());
            metrics.recordQuotesComputed(quotes.size());
            sendJson(exchange, Map.of("quotes", quotes));
        });
    }

    /**
     * GET /api/quotes/preview?carModel=&state=&carrierId= - One carrier across coverage tiers
     */
    public void previewCoverages(HttpServerExchange exchange) {
        handle(exchange, () -> {
            String carModel = queryParam(exchange, "carModel");
            if (carModel == null) {
                throw new InvalidRequestException("carModel is required");
            }
            List<QuoteResult> quotes = ratingEngine.quoteAllCoverages(
                carModel, queryParam(exchange, "state"), queryParam(exchange, "carrierId"));
            metrics.recordQuotesComputed(quotes.size());
            sendJson(exchange, Map.of("quotes", quotes));
        });
    }
}
