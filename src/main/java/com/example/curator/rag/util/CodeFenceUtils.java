package com.example.curator.rag.util;

import java.util.regex.Pattern;

public final class CodeFenceUtils {
    // ```json, ```JSON and bare ``` markers, wherever they appear
    private static final Pattern FENCE_MARKER = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);

    /**
     * Removes Markdown code-fence markers and trims, leaving the fenced body in place.
     */
    public static String stripFences(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return FENCE_MARKER.matcher(input).replaceAll("").trim();
    }

    private CodeFenceUtils(){}
}
