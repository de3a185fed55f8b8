package com.safee.jobs.scheduler.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safee.jobs.scheduler.metrics.SchedulerMetrics;
import com.safee.jobs.store.DuplicateScheduleException;
import com.safee.jobs.store.JobValidationException;
import com.safee.jobs.store.NotFoundException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Base for the JSON resources: routes one exchange and maps domain exceptions to status codes.
 * Responses never carry stack traces.
 */
abstract class JsonHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(JsonHandler.class);
    private static final Pattern UUID_SEGMENT = Pattern.compile("[0-9a-fA-F-]{36}");

    protected final ObjectMapper mapper;
    private final SchedulerMetrics metrics;

    JsonHandler(ObjectMapper mapper, SchedulerMetrics metrics) {
        this.mapper = mapper;
        this.metrics = metrics;
    }

    @Override
    public final void handle(HttpExchange exchange) throws IOException {
        try {
            route(exchange);
        } catch (JsonProcessingException e) {
            respondJson(exchange, 400, new ErrorResponse("bad_request", "Malformed JSON: " + e.getOriginalMessage()));
        } catch (JobValidationException | IllegalArgumentException e) {
            respondJson(exchange, 400, new ErrorResponse("bad_request", e.getMessage()));
        } catch (NotFoundException e) {
            respondJson(exchange, 404, new ErrorResponse("not_found", e.getMessage()));
        } catch (DuplicateScheduleException e) {
            respondJson(exchange, 409, new ErrorResponse("conflict", e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            respondJson(exchange, 500, new ErrorResponse("internal_error", "Internal error"));
        } finally {
            exchange.close();
        }
    }

    protected abstract void route(HttpExchange exchange) throws IOException;

    protected <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            T body = mapper.readValue(is, type);
            if (body == null) {
                throw new IllegalArgumentException("request body is required");
            }
            return body;
        }
    }

    protected void respondJson(HttpExchange exchange, int code, Object value) throws IOException {
        byte[] data = mapper.writeValueAsBytes(value);
        metrics.observeRequest(normalizePath(exchange.getRequestURI().getPath()), exchange.getRequestMethod(), code);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    protected void respondNoContent(HttpExchange exchange) throws IOException {
        metrics.observeRequest(normalizePath(exchange.getRequestURI().getPath()), exchange.getRequestMethod(), 204);
        exchange.sendResponseHeaders(204, -1);
    }

    protected void methodNotAllowed(HttpExchange exchange) throws IOException {
        respondJson(exchange, 405, new ErrorResponse("method_not_allowed", exchange.getRequestMethod()));
    }

    protected static boolean is(HttpExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod());
    }

    protected static UUID parseId(String raw, String what) {
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("bad " + what + " id: " + raw);
        }
    }

    protected static Map<String, String> query(HttpExchange exchange) {
        Map<String, String> out = new HashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String k = eq < 0 ? pair : pair.substring(0, eq);
            String v = eq < 0 ? "" : pair.substring(eq + 1);
            out.put(URLDecoder.decode(k, StandardCharsets.UTF_8), URLDecoder.decode(v, StandardCharsets.UTF_8));
        }
        return out;
    }

    /** Collapses ids so the request counter keeps a bounded label set. */
    static String normalizePath(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (String segment : rawPath.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            out.append('/').append(UUID_SEGMENT.matcher(segment).matches() ? ":id" : segment);
        }
        return out.length() == 0 ? "/" : out.toString();
    }
}
