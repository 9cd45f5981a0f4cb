package io.sendshield.model;

/**
 * Body of a queued message. Which fields are populated depends on the {@link MessageKind}:
 * text carries {@code text}; media carries {@code mediaBase64}, {@code mimeType} and an
 * optional caption in {@code text}; location carries the coordinates and an optional
 * {@code description}.
 */
public record MessagePayload(
        String text,
        String mediaBase64,
        String mimeType,
        Double latitude,
        Double longitude,
        String description
) {
    public static final String DEFAULT_MIME_TYPE = "image/jpeg";

    public static MessagePayload text(String body) {
        return new MessagePayload(body, null, null, null, null, null);
    }

    public static MessagePayload media(String base64, String mimeType, String caption) {
        return new MessagePayload(caption, base64, mimeType, null, null, null);
    }

    public static MessagePayload location(double latitude, double longitude, String description) {
        return new MessagePayload(null, null, null, latitude, longitude, description);
    }

    public String effectiveMimeType() {
        return mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType;
    }

    public int textLength() {
        return text == null ? 0 : text.length();
    }
}
