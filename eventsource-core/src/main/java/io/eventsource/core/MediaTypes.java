package io.eventsource.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Minimal helpers for comparing {@code Content-Type} header values.
 */
public final class MediaTypes {
    private MediaTypes() {}

    /**
     * Strips parameters and whitespace from a content type and lowercases it.
     *
     * @param contentType raw header value, may be null
     * @return the bare media type, or an empty string for null
     */
    public static String mediaType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String type = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return type.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isEventStream(Optional<String> contentType) {
        return contentType.isPresent() && Protocol.CT_EVENT_STREAM.equals(mediaType(contentType.get()));
    }
}
