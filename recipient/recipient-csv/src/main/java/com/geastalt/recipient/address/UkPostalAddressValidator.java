/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.address;

import com.geastalt.recipient.text.ColumnKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lightweight postal address check for letters. The address is lines 1 to 6
 * followed by line 7, or by the postcode column when line 7 is empty.
 */
@Slf4j
@Component
public class UkPostalAddressValidator implements PostalAddressValidator {

    public static final int MIN_LINES = 3;
    public static final int MAX_LINES = 7;

    // Outward and inward code, space optional
    private static final Pattern UK_POSTCODE = Pattern.compile(
            "^[A-Z]{1,2}\\d[A-Z\\d]? ?\\d[A-Z]{2}$"
    );

    // Characters that printers and postal providers reject at the start of a line
    private static final String INVALID_FIRST_CHARACTERS = "@()=[]\"\\/,<>";

    @Override
    public boolean isValid(Map<String, String> values, boolean allowInternational) {
        List<String> lines = addressLines(values);

        if (lines.size() < MIN_LINES || lines.size() > MAX_LINES) {
            log.debug("Address has {} lines", lines.size());
            return false;
        }
        for (String line : lines) {
            if (INVALID_FIRST_CHARACTERS.indexOf(line.charAt(0)) >= 0) {
                return false;
            }
        }
        return allowInternational || isUkPostcode(lines.get(lines.size() - 1));
    }

    public static boolean isUkPostcode(String value) {
        String normalised = value.strip().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        return UK_POSTCODE.matcher(normalised).matches();
    }

    private static List<String> addressLines(Map<String, String> values) {
        List<String> lines = new ArrayList<>();
        for (String header : AddressColumns.ADDRESS_LINES_1_TO_6) {
            addIfPresent(lines, values.get(ColumnKeys.of(header)));
        }
        String lastLine = values.get(ColumnKeys.of(AddressColumns.ADDRESS_LINE_7));
        if (lastLine == null || lastLine.isBlank()) {
            lastLine = values.get(ColumnKeys.of(AddressColumns.POSTCODE));
        }
        addIfPresent(lines, lastLine);
        return lines;
    }

    private static void addIfPresent(List<String> lines, String value) {
        if (value != null && !value.isBlank()) {
            lines.add(value.strip());
        }
    }
}
