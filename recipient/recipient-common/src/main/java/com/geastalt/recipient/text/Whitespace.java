/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.text;

/**
 * Whitespace handling for values pasted out of spreadsheets, which regularly carry
 * zero-width and no-break spaces that are invisible to the user.
 */
public final class Whitespace {

    public static final String ASCII_WHITESPACE = " \t\n\r\f\u000B";

    // Mongolian vowel separator, zero width space, zero width non-joiner,
    // zero width joiner, word joiner, zero width no-break space
    public static final String OBSCURE_ZERO_WIDTH_WHITESPACE = "\u180E\u200B\u200C\u200D\u2060\uFEFF";

    // no-break space, narrow no-break space
    public static final String OBSCURE_FULL_WIDTH_WHITESPACE = "\u00A0\u202F";

    public static final String ALL_WHITESPACE =
            ASCII_WHITESPACE + OBSCURE_ZERO_WIDTH_WHITESPACE + OBSCURE_FULL_WIDTH_WHITESPACE;

    private Whitespace() {}

    /**
     * Removes zero-width characters anywhere in the value, then strips ASCII
     * whitespace from both ends. Returns null for null.
     */
    public static String stripAndRemoveObscureWhitespace(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return strip(removeCharacters(value, OBSCURE_ZERO_WIDTH_WHITESPACE), ASCII_WHITESPACE);
    }

    /**
     * Strips every kind of whitespace, plus {@code extraCharacters}, from both ends.
     */
    public static String stripAll(String value, String extraCharacters) {
        if (value == null) {
            return null;
        }
        return strip(value, ALL_WHITESPACE + extraCharacters);
    }

    /**
     * Removes every occurrence of each character in {@code characters}.
     */
    public static String removeCharacters(String value, String characters) {
        StringBuilder result = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (characters.indexOf(c) < 0) {
                result.append(c);
            }
        }
        return result.toString();
    }

    private static String strip(String value, String characters) {
        int start = 0;
        int end = value.length();
        while (start < end && characters.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && characters.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
