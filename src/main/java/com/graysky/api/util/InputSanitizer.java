package com.graysky.api.util;

import com.google.common.base.Preconditions;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * HTML-escapes user text and caps its length.
 *
 * Escaping happens first and truncation second, so the limit counts escaped
 * characters: {@code sanitize("a&b", 3)} is {@code "a&a"}. Stored records were
 * written with this exact order and character mapping; changing either would
 * make new submissions stop matching old identities.
 */
public final class InputSanitizer {

    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_FIELD_LENGTH = 500;
    public static final int MAX_ANSWER_KEY_LENGTH = 50;

    private static final Escaper HTML_ESCAPER = Escapers.builder()
            .addEscape('&', "&amp;")
            .addEscape('<', "&lt;")
            .addEscape('>', "&gt;")
            .addEscape('"', "&quot;")
            .addEscape('\'', "&#x27;")
            .build();

    private InputSanitizer() {
    }

    /**
     * @return the escaped text cut to {@code maxLength} code points, or "" for null/empty input
     */
    public static String sanitize(String raw, int maxLength) {
        Preconditions.checkArgument(maxLength >= 0, "maxLength must be >= 0: %s", maxLength);
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String escaped = HTML_ESCAPER.escape(raw);
        if (escaped.codePointCount(0, escaped.length()) <= maxLength) {
            return escaped;
        }
        return escaped.substring(0, escaped.offsetByCodePoints(0, maxLength));
    }

    /**
     * Optional fields stay absent when the caller sent nothing (null or empty).
     */
    public static String sanitizeOptional(String raw, int maxLength) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return sanitize(raw, maxLength);
    }

    /**
     * Raw length in code points, as measured by the validation limits.
     */
    public static int length(String raw) {
        return raw == null ? 0 : raw.codePointCount(0, raw.length());
    }
}
