package io.sendshield.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sendshield.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scrubs credentials, message content and phone numbers out of JSON before it reaches the
 * audit trail.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SECRET_HINTS = Set.of(
            "password", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Set<String> CONTENT_KEYS = Set.of(
            "text", "body", "caption", "mediabase64", "description"
    );
    private static final Set<String> RECIPIENT_KEYS = Set.of("recipient", "to", "phone");
    // kept verbatim even when they look opaque
    private static final Set<String> REFERENCE_KEYS = Set.of("id", "config", "changed_fields");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey() == null ? "" : entry.getKey().toLowerCase(Locale.ROOT);
                JsonNode value = entry.getValue();
                if (isSecretKey(key)) {
                    out.put(entry.getKey(), MASK);
                } else if (CONTENT_KEYS.contains(key) && value.isTextual()) {
                    out.put(entry.getKey(), MASK + "(" + value.asText("").length() + " chars)");
                } else if (RECIPIENT_KEYS.contains(key) && value.isTextual()) {
                    out.put(entry.getKey(), maskRecipient(value.asText("")));
                } else if (REFERENCE_KEYS.contains(key) || key.endsWith("_id")) {
                    out.set(entry.getKey(), value);
                } else {
                    out.set(entry.getKey(), masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().valueToTree(MASK);
        }
        return input;
    }

    /**
     * Keeps the last four characters of the number part, e.g. {@code ***4567@c.us}.
     */
    public static String maskRecipient(String recipient) {
        if (recipient == null || recipient.isBlank()) {
            return recipient;
        }
        int at = recipient.indexOf('@');
        String number = at < 0 ? recipient : recipient.substring(0, at);
        String suffix = at < 0 ? "" : recipient.substring(at);
        if (number.length() <= 4) {
            return MASK + suffix;
        }
        return MASK + number.substring(number.length() - 4) + suffix;
    }

    private static boolean isSecretKey(String key) {
        if (key.isBlank()) {
            return false;
        }
        for (String hint : SECRET_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 24) {
            return false;
        }
        // long opaque strings (tokens, keys) never reach the audit trail
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    }
}
