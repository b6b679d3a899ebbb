package com.aldar.middleware.transcript;

import java.util.regex.Pattern;

/**
 * Text normalization shared by matching, deduplication and attachment lookups.
 */
public final class ContentText {

    public static final int SIGNATURE_LENGTH = 100;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ContentText() {
    }

    public static String normalize(String content) {
        if (content == null) {
            return "";
        }
        return WHITESPACE.matcher(content.strip()).replaceAll(" ");
    }

    public static String signature(String content) {
        String normalized = normalize(content);
        return normalized.length() <= SIGNATURE_LENGTH ? normalized : normalized.substring(0, SIGNATURE_LENGTH);
    }

    public static boolean isBlank(String content) {
        return content == null || content.isBlank();
    }
}
