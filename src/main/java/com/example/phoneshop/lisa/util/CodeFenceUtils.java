package com.example.phoneshop.lisa.util;

import java.util.regex.Pattern;

public final class CodeFenceUtils {

    private static final Pattern FENCE_OPEN = Pattern.compile("```(?:json|python)?\\n?", Pattern.CASE_INSENSITIVE);

    /** Removes markdown code fences, keeping what was inside them. */
    public static String stripFences(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return FENCE_OPEN.matcher(input).replaceAll("").replace("```", "");
    }

    private CodeFenceUtils(){}
}
