/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.text;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Case and spacing insensitive keys for spreadsheet column headers and template
 * placeholders. {@code "Phone Number"}, {@code "phone_number"} and
 * {@code "PHONE-NUMBER"} all share the key {@code "phonenumber"}.
 */
public final class ColumnKeys {

    private static final String IGNORED_CHARACTERS = " _-";

    private ColumnKeys() {}

    public static String of(String header) {
        if (header == null) {
            return null;
        }
        return Whitespace.removeCharacters(header, IGNORED_CHARACTERS).toLowerCase(Locale.ROOT);
    }

    public static Set<String> of(Collection<String> headers) {
        Set<String> keys = new LinkedHashSet<>();
        for (String header : headers) {
            keys.add(of(header));
        }
        return keys;
    }
}
