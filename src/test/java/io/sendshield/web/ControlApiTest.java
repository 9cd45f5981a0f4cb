package io.sendshield.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.sendshield.MutableClock;
import io.sendshield.ScriptedAccountClient;
import io.sendshield.client.DeviceLifecycle;
import io.sendshield.config.SendShieldConfig;
import io.sendshield.model.SendRequest;
import io.sendshield.runtime.RuntimeOptions;
import io.sendshield.runtime.SendShieldRuntime;
import io.sendshield.runtime.StoreKind;
import io.sendshield.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;

final class ControlApiTest {
    private static final String TOKEN = "test-admin-token";
    private static final HttpClient HTTP = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Test
    void enqueueThenInspectMessage() throws Exception {
        Path root = Files.createTempDirectory("sendshield-api-enqueue-");
        MutableClock clock = new MutableClock();
        try (SendShieldRuntime runtime = newRuntime(root, clock);
             ControlApi api = new ControlApi(runtime, TOKEN, 0, clock)) {
            api.start("127.0.0.1", 0);

            HttpResponse<String> accepted = send(api, "POST", "/queue",
                    "{\"accountId\":\"acct-a\",\"to\":\"15551234567\",\"content\":\"hello\",\"priority\":\"high\"}", null);
            Assertions.assertEquals(202, accepted.statusCode());
            JsonNode body = Jsons.mapper().readTree(accepted.body());
            String id = body.path("messageId").asText();
            Assertions.assertTrue(id.startsWith("msg_"));
            Assertions.assertEquals("queued", body.path("status").asText());

            JsonNode status = Jsons.mapper().readTree(send(api, "GET", "/queue/status", null, null).body());
            Assertions.assertEquals(1, status.path("pending").asInt());
            Assertions.assertEquals(1, status.path("totalQueued").asInt());

            HttpResponse<String> message = send(api, "GET", "/queue/messages/" + id, null, null);
            Assertions.assertEquals(200, message.statusCode());
            JsonNode stored = Jsons.mapper().readTree(message.body());
            Assertions.assertEquals("pending", stored.path("status").asText());
            Assertions.assertEquals("high", stored.path("priority").asText());

            runtime.queue().tick();
            JsonNode history = Jsons.mapper().readTree(send(api, "GET", "/queue/history?limit=5", null, null).body());
            Assertions.assertEquals(1, history.path("messages").size());
            Assertions.assertEquals("sent", history.path("messages").get(0).path("status").asText());

            Assertions.assertEquals(404, send(api, "GET", "/queue/messages/msg_missing", null, null).statusCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidRequestsGetClientErrors() throws Exception {
        Path root = Files.createTempDirectory("sendshield-api-invalid-");
        MutableClock clock = new MutableClock();
        try (SendShieldRuntime runtime = newRuntime(root, clock);
             ControlApi api = new ControlApi(runtime, TOKEN, 0, clock)) {
            api.start("127.0.0.1", 0);

            HttpResponse<String> blank = send(api, "POST", "/queue", "{\"accountId\":\"acct-a\",\"to\":\"\",\"content\":\"hi\"}", null);
            Assertions.assertEquals(400, blank.statusCode());
            JsonNode error = Jsons.mapper().readTree(blank.body());
            Assertions.assertEquals("validation_error", error.path("error").asText());
            Assertions.assertEquals("recipient", error.path("field").asText());

            Assertions.assertEquals(400, send(api, "POST", "/queue", "{oops", null).statusCode());
            Assertions.assertEquals(400, send(api, "POST", "/queue",
                    "{\"accountId\":\"acct-a\",\"to\":\"1\",\"content\":\"hi\",\"priority\":\"urgent\"}", null).statusCode());
            Assertions.assertEquals(405, send(api, "GET", "/queue", null, null).statusCode());
            Assertions.assertEquals(405, send(api, "POST", "/queue/status", "{}", null).statusCode());
            Assertions.assertEquals(0, runtime.queueStatus().totalQueued());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void adminRoutesRequireBearerToken() throws Exception {
        Path root = Files.createTempDirectory("sendshield-api-admin-");
        MutableClock clock = new MutableClock();
        try (SendShieldRuntime runtime = newRuntime(root, clock);
             ControlApi api = new ControlApi(runtime, TOKEN, 0, clock)) {
            api.start("127.0.0.1", 0);
            runtime.enqueue(SendRequest.text("acct-a", "15551234567", "hello"));

            HttpResponse<String> missing = send(api, "POST", "/queue/clear", "{}", null);
            Assertions.assertEquals(401, missing.statusCode());
            Assertions.assertEquals("missing_token", Jsons.mapper().readTree(missing.body()).path("error").asText());
            Assertions.assertEquals(403, send(api, "POST", "/queue/clear", "{}", "wrong").statusCode());
            Assertions.assertEquals(1, runtime.queueStatus().pending());

            HttpResponse<String> cleared = send(api, "POST", "/queue/clear", "{}", TOKEN);
            Assertions.assertEquals(200, cleared.statusCode());
            Assertions.assertEquals(1, Jsons.mapper().readTree(cleared.body()).path("clearedMessages").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void queueConfigCanBeReadAndUpdated() throws Exception {
        Path root = Files.createTempDirectory("sendshield-api-config-");
        MutableClock clock = new MutableClock();
        try (SendShieldRuntime runtime = newRuntime(root, clock);
             ControlApi api = new ControlApi(runtime, TOKEN, 0, clock)) {
            api.start("127.0.0.1", 0);

            JsonNode current = Jsons.mapper().readTree(send(api, "GET", "/queue/config", null, null).body());
            Assertions.assertEquals(10, current.path("messagesPerMinute").asInt());

            HttpResponse<String> rejected = send(api, "PUT", "/queue/config", "{\"burstLimit\":50}", TOKEN);
            Assertions.assertEquals(400, rejected.statusCode());
            Assertions.assertEquals("config_error", Jsons.mapper().readTree(rejected.body()).path("error").asText());

            HttpResponse<String> updated = send(api, "PUT", "/queue/config", "{\"messagesPerMinute\":20,\"burstLimit\":5}", TOKEN);
            Assertions.assertEquals(200, updated.statusCode());
            Assertions.assertEquals(20, runtime.queue().config().messagesPerMinute());
            Assertions.assertEquals(5, runtime.queue().config().burstLimit());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void accountRoutesExposeHealthWarmupAndCooldown() throws Exception {
        Path root = Files.createTempDirectory("sendshield-api-accounts-");
        MutableClock clock = new MutableClock();
        try (SendShieldRuntime runtime = newRuntime(root, clock);
             ControlApi api = new ControlApi(runtime, TOKEN, 0, clock)) {
            api.start("127.0.0.1", 0);

            Assertions.assertEquals(404, send(api, "GET", "/accounts/acct-a/health", null, null).statusCode());
            Assertions.assertEquals(401, send(api, "POST", "/accounts/acct-a/warmup", "{}", null).statusCode());
            Assertions.assertEquals(200, send(api, "POST", "/accounts/acct-a/warmup", "{}", TOKEN).statusCode());

            JsonNode health = Jsons.mapper().readTree(send(api, "GET", "/accounts/acct-a/health", null, null).body());
            Assertions.assertEquals("warning", health.path("status").asText());
            Assertions.assertTrue(health.path("metrics").path("warmupPhase").asBoolean());

            Assertions.assertEquals(400, send(api, "POST", "/accounts/acct-a/cooldown", "{\"durationMs\":0}", TOKEN).statusCode());
            Assertions.assertEquals(200, send(api, "POST", "/accounts/acct-a/cooldown",
                    "{\"durationMs\":600000,\"reason\":\"spam report\"}", TOKEN).statusCode());

            JsonNode queueStatus = Jsons.mapper().readTree(send(api, "GET", "/accounts/acct-a/queue-status", null, null).body());
            Assertions.assertFalse(queueStatus.path("safety").path("safe").asBoolean());
            Assertions.assertEquals("cooldown active: spam report", queueStatus.path("safety").path("reason").asText());

            JsonNode attention = Jsons.mapper().readTree(send(api, "GET", "/health/attention", null, null).body());
            Assertions.assertEquals(1, attention.path("count").asInt());
            JsonNode overview = Jsons.mapper().readTree(send(api, "GET", "/health/accounts", null, null).body());
            Assertions.assertEquals(1, overview.path("summary").path("total").asInt());
            Assertions.assertEquals(200, send(api, "GET", "/dashboard", null, null).statusCode());
            Assertions.assertEquals(404, send(api, "GET", "/accounts/acct-a/unknown", null, null).statusCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deviceActivityRouteFeedsDisconnectsIntoHealth() throws Exception {
        Path root = Files.createTempDirectory("sendshield-api-activity-");
        MutableClock clock = new MutableClock();
        try (SendShieldRuntime runtime = newRuntime(root, clock);
             ControlApi api = new ControlApi(runtime, TOKEN, 0, clock)) {
            api.start("127.0.0.1", 0);
            String disconnected = "{\"type\":\"disconnected\",\"reason\":\"phone offline\"}";

            Assertions.assertEquals(401, send(api, "POST", "/accounts/acct-a/activity", disconnected, null).statusCode());
            Assertions.assertEquals(405, send(api, "GET", "/accounts/acct-a/activity", null, TOKEN).statusCode());
            Assertions.assertEquals(400, send(api, "POST", "/accounts/acct-a/activity", "{\"type\":\"sent\"}", TOKEN).statusCode());
            Assertions.assertEquals(400, send(api, "POST", "/accounts/acct-a/activity", "{\"type\":\"exploded\"}", TOKEN).statusCode());
            for (int i = 0; i < 4; i++) {
                Assertions.assertEquals(200, send(api, "POST", "/accounts/acct-a/activity", disconnected, TOKEN).statusCode());
                clock.advance(Duration.ofMinutes(5));
            }
            HttpResponse<String> reconnected = send(api, "POST", "/accounts/acct-a/activity", "{\"type\":\"reconnected\"}", TOKEN);
            Assertions.assertEquals(200, reconnected.statusCode());

            JsonNode health = Jsons.mapper().readTree(reconnected.body());
            Assertions.assertEquals(4, health.path("metrics").path("disconnectionCount24h").asInt());
            Assertions.assertEquals(65, health.path("score").asInt());
            Assertions.assertEquals("warning", health.path("status").asText());
            Assertions.assertEquals("disconnected 4 times in 24h", health.path("warnings").path(0).asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mutatingRoutesAreRateLimited() throws Exception {
        Path root = Files.createTempDirectory("sendshield-api-ratelimit-");
        MutableClock clock = new MutableClock();
        try (SendShieldRuntime runtime = newRuntime(root, clock);
             ControlApi api = new ControlApi(runtime, TOKEN, 2, clock)) {
            api.start("127.0.0.1", 0);
            String body = "{\"accountId\":\"acct-a\",\"to\":\"15551234567\",\"content\":\"hello\"}";

            Assertions.assertEquals(202, send(api, "POST", "/queue", body, null).statusCode());
            Assertions.assertEquals(202, send(api, "POST", "/queue", body, null).statusCode());
            HttpResponse<String> limited = send(api, "POST", "/queue", body, null);
            Assertions.assertEquals(429, limited.statusCode());
            Assertions.assertEquals("60", limited.headers().firstValue("Retry-After").orElse(""));
            Assertions.assertEquals(200, send(api, "GET", "/queue/status", null, null).statusCode());

            clock.advance(Duration.ofMinutes(1));
            Assertions.assertEquals(202, send(api, "POST", "/queue", body, null).statusCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsReloadIsAnAdminRoute() throws Exception {
        Path root = Files.createTempDirectory("sendshield-api-settings-");
        MutableClock clock = new MutableClock();
        try (SendShieldRuntime runtime = newRuntime(root, clock);
             ControlApi api = new ControlApi(runtime, TOKEN, 0, clock)) {
            api.start("127.0.0.1", 0);

            Assertions.assertEquals(401, send(api, "POST", "/settings/reload", "{}", null).statusCode());
            HttpResponse<String> reloaded = send(api, "POST", "/settings/reload", "{}", TOKEN);
            Assertions.assertEquals(200, reloaded.statusCode());
            Assertions.assertEquals("defaults", Jsons.mapper().readTree(reloaded.body()).path("message").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    private static SendShieldRuntime newRuntime(Path root, MutableClock clock) {
        RuntimeOptions options = new RuntimeOptions(
                StoreKind.MEMORY,
                new ScriptedAccountClient(clock),
                DeviceLifecycle.ALWAYS_READY,
                clock,
                Map.of("MESSAGE_MIN_DELAY", "0", "MESSAGE_MAX_DELAY", "0", "ENABLE_TYPING_DELAY", "false"),
                Runnable::run
        );
        SendShieldRuntime runtime = new SendShieldRuntime(new SendShieldConfig(root), options);
        runtime.init();
        return runtime;
    }

    private static HttpResponse<String> send(ControlApi api, String method, String path, String body, String token) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + api.port() + path))
                .timeout(Duration.ofSeconds(5))
                .method(method, body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return HTTP.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
