package com.atelier.sync.core.blob;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

/** Decoded {@code data:} URL. */
public record InlinePayload(String contentType, byte[] data) {

    private static final String DEFAULT_CONTENT_TYPE = "text/plain";

    /** Parses {@code data:[<mediatype>][;base64],<data>}. Empty when {@code value} is not a well-formed data URL. */
    public static Optional<InlinePayload> parse(String value) {
        if (value == null || !value.regionMatches(true, 0, "data:", 0, 5)) return Optional.empty();
        int comma = value.indexOf(',');
        if (comma < 0) return Optional.empty();
        String header = value.substring(5, comma);
        String body = value.substring(comma + 1);
        boolean base64 = header.toLowerCase(Locale.ROOT).endsWith(";base64");
        String mediaType = base64 ? header.substring(0, header.length() - ";base64".length()) : header;
        int params = mediaType.indexOf(';');
        if (params >= 0) mediaType = mediaType.substring(0, params);
        String contentType = mediaType.isBlank() ? DEFAULT_CONTENT_TYPE : mediaType.trim();
        try {
            byte[] data = base64
                    ? Base64.getMimeDecoder().decode(body)
                    : URLDecoder.decode(body, StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8);
            return Optional.of(new InlinePayload(contentType, data));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** File extension for the content type, {@code bin} when unknown. */
    public String extension() {
        int slash = contentType.indexOf('/');
        if (slash < 0) return "bin";
        String subtype = contentType.substring(slash + 1).toLowerCase(Locale.ROOT);
        return switch (subtype) {
            case "jpeg" -> "jpg";
            case "svg+xml" -> "svg";
            case "" -> "bin";
            default -> subtype;
        };
    }
}
