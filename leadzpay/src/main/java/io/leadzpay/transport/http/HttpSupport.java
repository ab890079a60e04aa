package io.leadzpay.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.common.MarketplaceException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON request/response plumbing shared by the API handlers.
 *
 * All exception-to-status mapping happens in {@link #handle}; handlers just throw.
 * Handlers run on worker threads (the routes are wrapped in a BlockingHandler), so
 * request bodies are read from the blocking input stream.
 */
public final class HttpSupport {
    private static final Logger log = LoggerFactory.getLogger(HttpSupport.class);

    public static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @FunctionalInterface
    public interface ApiAction {
        void run() throws Exception;
    }

    /**
     * Run a handler body, converting any failure into the {"error", "message"} response.
     */
    public static void handle(HttpServerExchange exchange, ApiAction action) {
        try {
            action.run();
        } catch (MarketplaceException e) {
            int status = statusFor(e.getCode());
            log.info("{} {} -> {} {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                status, e.getCode().wireName(), e.getMessage());
            sendError(exchange, status, e.getCode(), e.getMessage());
        } catch (JsonProcessingException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, ErrorCode.INVALID_REQUEST,
                "Malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, ErrorCode.INVALID_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR, "Internal server error");
        }
    }

    static int statusFor(ErrorCode code) {
        return switch (code) {
            case INVALID_TERMS, INVALID_REQUEST -> StatusCodes.BAD_REQUEST;
            case UNAUTHENTICATED -> StatusCodes.UNAUTHORIZED;
            case ACCESS_DENIED -> StatusCodes.FORBIDDEN;
            case CONNECTION_NOT_FOUND, LEAD_NOT_FOUND, CARRIER_NOT_FOUND -> StatusCodes.NOT_FOUND;
            case INVALID_TRANSITION, DUPLICATE_CONNECTION, CONCURRENT_UPDATE,
                 EXCLUSIVITY_CONFLICT, INVALID_LEAD_TRANSITION -> StatusCodes.CONFLICT;
            case INTERNAL_ERROR -> StatusCodes.INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Parse the request body. An empty body is rejected.
     */
    public static <T> T readBody(HttpServerExchange exchange, Class<T> type) throws IOException {
        if (!exchange.isBlocking()) {
            exchange.startBlocking();
        }
        byte[] body = exchange.getInputStream().readAllBytes();
        if (body.length == 0) {
            throw new InvalidRequestException("Request body is required");
        }
        return MAPPER.readValue(body, type);
    }

    public static String pathParam(HttpServerExchange exchange, String name) {
        String value = queryParam(exchange, name);
        if (value == null) {
            throw new InvalidRequestException("Missing path parameter: " + name);
        }
        return value;
    }

    public static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.getFirst();
        return value == null || value.isBlank() ? null : value;
    }

    public static void sendJson(HttpServerExchange exchange, int status, Object data) throws JsonProcessingException {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json);
    }

    public static void sendJson(HttpServerExchange exchange, Object data) throws JsonProcessingException {
        sendJson(exchange, StatusCodes.OK, data);
    }

    public static void sendError(HttpServerExchange exchange, int status, ErrorCode code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code.wireName());
        body.put("message", message);
        try {
            sendJson(exchange, status, body);
        } catch (JsonProcessingException e) {
            log.error("Failed to send error response: {}", e.getMessage());
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("{\"error\":\"internal_error\"}");
        }
    }

    private HttpSupport() {}
}
