package io.sendshield.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.sendshield.config.ConfigException;
import io.sendshield.config.QueueConfigPatch;
import io.sendshield.model.ActivityType;
import io.sendshield.model.DeviceHealth;
import io.sendshield.model.MessageKind;
import io.sendshield.model.MessagePayload;
import io.sendshield.model.Priority;
import io.sendshield.model.QueuedMessage;
import io.sendshield.model.SendOptions;
import io.sendshield.model.SendRequest;
import io.sendshield.queue.ValidationException;
import io.sendshield.runtime.SendShieldRuntime;
import io.sendshield.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON control surface over the JDK {@link HttpServer}.
 *
 * <p>Read routes are open. Admin routes ({@code POST /queue/clear}, {@code PUT /queue/config},
 * {@code POST /accounts/{id}/warmup}, {@code POST /accounts/{id}/cooldown},
 * {@code POST /accounts/{id}/activity},
 * {@code POST /settings/reload}) require {@code Authorization: Bearer <token>} when an admin
 * token is configured. Mutating routes are limited per remote address per minute.
 */
public final class ControlApi implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ControlApi.class);

    static final int DEFAULT_HISTORY_LIMIT = 50;

    private final SendShieldRuntime runtime;
    private final String adminToken;
    private final WriteRateLimiter writeLimiter;
    private final Clock clock;
    private HttpServer server;

    public ControlApi(SendShieldRuntime runtime, String adminToken, int writeLimitPerMinute, Clock clock) {
        this.runtime = runtime;
        this.adminToken = adminToken == null ? "" : adminToken.trim();
        this.writeLimiter = new WriteRateLimiter(writeLimitPerMinute);
        this.clock = clock;
    }

    public synchronized void start(String host, int port) throws IOException {
        if (server != null) {
            throw new IllegalStateException("Control API already started");
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(host, port), 0);
        created.createContext("/queue", exchange -> handle(exchange, this::enqueue));
        created.createContext("/queue/status", exchange -> handle(exchange, this::queueStatus));
        created.createContext("/queue/messages/", exchange -> handle(exchange, this::message));
        created.createContext("/queue/history", exchange -> handle(exchange, this::history));
        created.createContext("/queue/clear", exchange -> handle(exchange, this::clear));
        created.createContext("/queue/config", exchange -> handle(exchange, this::config));
        created.createContext("/accounts/", exchange -> handle(exchange, this::account));
        created.createContext("/health/accounts", exchange -> handle(exchange, this::healthAccounts));
        created.createContext("/health/attention", exchange -> handle(exchange, this::healthAttention));
        created.createContext("/dashboard", exchange -> handle(exchange, this::dashboard));
        created.createContext("/settings/reload", exchange -> handle(exchange, this::reloadSettings));
        created.setExecutor(null);
        created.start();
        server = created;
        log.info("Control API listening on http://{}:{}", host, port());
    }

    public synchronized int port() {
        if (server == null) {
            throw new IllegalStateException("Control API not started");
        }
        return server.getAddress().getPort();
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
    }

    private void enqueue(HttpExchange exchange) throws IOException {
        if (!"/queue".equals(exchange.getRequestURI().getPath())) {
            writeJson(exchange, Map.of("error", "not_found"), 404);
            return;
        }
        if (!allowMethods(exchange, "POST") || !allowWriteRate(exchange, "/queue")) {
            return;
        }
        EnqueueBody body = readBody(exchange, EnqueueBody.class);
        String messageId = runtime.enqueue(body.toRequest());
        writeJson(exchange, Map.of("messageId", messageId, "status", "queued"), 202);
    }

    private void queueStatus(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        writeJson(exchange, runtime.queueStatus(), 200);
    }

    private void message(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        String id = exchange.getRequestURI().getPath().substring("/queue/messages/".length());
        Optional<QueuedMessage> message = runtime.findMessage(id);
        if (message.isEmpty()) {
            writeJson(exchange, Map.of("error", "not_found", "messageId", id), 404);
            return;
        }
        writeJson(exchange, message.get(), 200);
    }

    private void history(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        int limit = parseInt(parseQuery(exchange.getRequestURI()).get("limit"), DEFAULT_HISTORY_LIMIT);
        writeJson(exchange, Map.of("messages", runtime.history(limit)), 200);
    }

    private void clear(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "POST")) {
            return;
        }
        String actor = authorizeAdmin(exchange);
        if (actor == null || !allowWriteRate(exchange, "/queue/clear")) {
            return;
        }
        int removed = runtime.clearQueue(actor);
        writeJson(exchange, Map.of("clearedMessages", removed), 200);
    }

    private void config(HttpExchange exchange) throws IOException {
        if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            writeJson(exchange, runtime.queue().config(), 200);
            return;
        }
        if (!allowMethods(exchange, "PUT", "GET")) {
            return;
        }
        String actor = authorizeAdmin(exchange);
        if (actor == null || !allowWriteRate(exchange, "/queue/config")) {
            return;
        }
        QueueConfigPatch patch = readBody(exchange, QueueConfigPatch.class);
        writeJson(exchange, runtime.updateQueueConfig(patch, actor), 200);
    }

    private void account(HttpExchange exchange) throws IOException {
        String[] parts = exchange.getRequestURI().getPath().substring("/accounts/".length()).split("/");
        if (parts.length != 2 || parts[0].isBlank()) {
            writeJson(exchange, Map.of("error", "not_found"), 404);
            return;
        }
        String accountId = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
        switch (parts[1]) {
            case "health" -> {
                if (!allowMethods(exchange, "GET")) {
                    return;
                }
                Optional<DeviceHealth> health = runtime.accountHealth(accountId);
                if (health.isEmpty()) {
                    writeJson(exchange, Map.of("error", "not_found", "accountId", accountId), 404);
                    return;
                }
                writeJson(exchange, health.get(), 200);
            }
            case "queue-status" -> {
                if (!allowMethods(exchange, "GET")) {
                    return;
                }
                writeJson(exchange, runtime.accountQueueStatus(accountId), 200);
            }
            case "warmup" -> {
                if (!allowMethods(exchange, "POST")) {
                    return;
                }
                String actor = authorizeAdmin(exchange);
                if (actor == null || !allowWriteRate(exchange, "/accounts/warmup")) {
                    return;
                }
                runtime.startWarmup(accountId, actor);
                writeJson(exchange, Map.of("accountId", accountId, "warmupStarted", true), 200);
            }
            case "cooldown" -> {
                if (!allowMethods(exchange, "POST")) {
                    return;
                }
                String actor = authorizeAdmin(exchange);
                if (actor == null || !allowWriteRate(exchange, "/accounts/cooldown")) {
                    return;
                }
                CooldownBody body = readBody(exchange, CooldownBody.class);
                if (body.durationMs() == null || body.durationMs() < 1L) {
                    throw new IllegalArgumentException("durationMs must be >= 1");
                }
                String reason = body.reason() == null || body.reason().isBlank() ? "operator cooldown" : body.reason();
                DeviceHealth health = runtime.startCooldown(accountId, Duration.ofMillis(body.durationMs()), reason, actor);
                writeJson(exchange, health, 200);
            }
            case "activity" -> {
                if (!allowMethods(exchange, "POST")) {
                    return;
                }
                String actor = authorizeAdmin(exchange);
                if (actor == null || !allowWriteRate(exchange, "/accounts/activity")) {
                    return;
                }
                ActivityBody body = readBody(exchange, ActivityBody.class);
                DeviceHealth health = runtime.recordDeviceEvent(accountId, ActivityType.fromWireName(body.type()), body.reason());
                writeJson(exchange, health, 200);
            }
            default -> writeJson(exchange, Map.of("error", "not_found"), 404);
        }
    }

    private void healthAccounts(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        writeJson(exchange, runtime.healthOverview(), 200);
    }

    private void healthAttention(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        List<DeviceHealth> attention = runtime.attention();
        writeJson(exchange, Map.of("accounts", attention, "count", attention.size()), 200);
    }

    private void dashboard(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) {
            return;
        }
        writeJson(exchange, runtime.dashboard(), 200);
    }

    private void reloadSettings(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "POST")) {
            return;
        }
        String actor = authorizeAdmin(exchange);
        if (actor == null || !allowWriteRate(exchange, "/settings/reload")) {
            return;
        }
        writeJson(exchange, runtime.reloadSettings(actor), 200);
    }

    private void handle(HttpExchange exchange, Route route) throws IOException {
        try {
            route.handle(exchange);
        } catch (ValidationException e) {
            writeJson(exchange, Map.of("error", "validation_error", "field", e.field(), "message", e.getMessage()), 400);
        } catch (ConfigException e) {
            writeJson(exchange, Map.of("error", "config_error", "violations", e.violations()), 400);
        } catch (IllegalArgumentException e) {
            writeJson(exchange, Map.of("error", "bad_request", "message", String.valueOf(e.getMessage())), 400);
        } catch (RuntimeException e) {
            log.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
            writeJson(exchange, Map.of("error", "internal_error"), 500);
        } finally {
            exchange.close();
        }
    }

    /**
     * Returns the acting principal, or null after writing a 401/403 response.
     */
    private String authorizeAdmin(HttpExchange exchange) throws IOException {
        if (adminToken.isBlank()) {
            return "anonymous";
        }
        String token = extractToken(exchange);
        if (token == null) {
            writeJson(exchange, Map.of("error", "missing_token"), 401);
            return null;
        }
        if (!MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8), adminToken.getBytes(StandardCharsets.UTF_8))) {
            writeJson(exchange, Map.of("error", "forbidden_token"), 403);
            return null;
        }
        return "admin";
    }

    private boolean allowWriteRate(HttpExchange exchange, String route) throws IOException {
        if (writeLimiter.disabled()) {
            return true;
        }
        String remote = exchange.getRemoteAddress() == null || exchange.getRemoteAddress().getAddress() == null
                ? "unknown"
                : exchange.getRemoteAddress().getAddress().getHostAddress();
        if (writeLimiter.tryAcquire(remote, clock.millis())) {
            return true;
        }
        exchange.getResponseHeaders().set("Retry-After", "60");
        writeJson(exchange, Map.of("error", "rate_limited", "route", route), 429);
        return false;
    }

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
        return false;
    }

    private static String extractToken(HttpExchange exchange) {
        String authz = exchange.getRequestHeaders().getFirst("Authorization");
        if (authz != null && authz.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = authz.substring(7).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        return null;
    }

    private static <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        try {
            return Jsons.mapper().readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            out.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return out;
    }

    private static int parseInt(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + raw, e);
        }
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }

    /**
     * Wire shape of {@code POST /queue}. Accepts both the short ({@code to}, {@code type},
     * {@code content}) and the long field names.
     */
    record EnqueueBody(
            String accountId,
            @JsonAlias({"to"}) String recipient,
            @JsonAlias({"type"}) String kind,
            @JsonAlias({"content", "body"}) String text,
            String mediaBase64,
            @JsonAlias({"mediaType"}) String mimeType,
            String caption,
            Double latitude,
            Double longitude,
            String description,
            String priority,
            Integer maxAttempts,
            SendOptions options
    ) {
        SendRequest toRequest() {
            MessageKind messageKind = MessageKind.fromString(kind);
            MessagePayload payload = switch (messageKind) {
                case TEXT -> MessagePayload.text(text);
                case MEDIA -> MessagePayload.media(mediaBase64, mimeType, caption != null ? caption : text);
                case LOCATION -> new MessagePayload(null, null, null, latitude, longitude, description);
            };
            return new SendRequest(
                    accountId,
                    recipient,
                    messageKind,
                    payload,
                    options == null ? SendOptions.NONE : options,
                    Priority.fromString(priority),
                    maxAttempts
            );
        }
    }

    record CooldownBody(Long durationMs, String reason) {
    }

    record ActivityBody(String type, String reason) {
    }
}
