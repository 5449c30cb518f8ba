/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.address;

import com.geastalt.recipient.text.ColumnKeys;

import java.util.List;
import java.util.Set;

/**
 * Column headers that make up a postal address in a letter recipient file.
 */
public final class AddressColumns {

    public static final String POSTCODE = "postcode";
    public static final String ADDRESS_LINE_7 = "address line 7";

    public static final List<String> ADDRESS_LINES_1_TO_6 = List.of(
            "address line 1", "address line 2", "address line 3",
            "address line 4", "address line 5", "address line 6");

    /** All address columns, in the order they are shown to users. */
    public static final List<String> HEADERS = List.of(
            "address line 1", "address line 2", "address line 3",
            "address line 4", "address line 5", "address line 6",
            POSTCODE, ADDRESS_LINE_7);

    public static final Set<String> LINES_1_TO_6_AND_POSTCODE_KEYS = keys(ADDRESS_LINES_1_TO_6, POSTCODE);
    public static final Set<String> LINES_1_TO_7_KEYS = keys(ADDRESS_LINES_1_TO_6, ADDRESS_LINE_7);

    private static final Set<String> ALL_KEYS = Set.copyOf(ColumnKeys.of(HEADERS));

    private AddressColumns() {}

    public static boolean isAddressColumn(String header) {
        return header != null && ALL_KEYS.contains(ColumnKeys.of(header));
    }

    private static Set<String> keys(List<String> lines, String last) {
        Set<String> keys = ColumnKeys.of(lines);
        keys.add(ColumnKeys.of(last));
        return Set.copyOf(keys);
    }
}
