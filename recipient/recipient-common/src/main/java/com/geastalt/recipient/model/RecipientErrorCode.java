/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of reasons a recipient fails validation. The messages are shown to
 * users next to the offending spreadsheet cell.
 */
@Getter
@RequiredArgsConstructor
public enum RecipientErrorCode {
    UNKNOWN_CHARACTER("Mobile numbers can only include: 0 1 2 3 4 5 6 7 8 9 ( ) + -"),
    NOT_A_UK_MOBILE("This does not look like a UK mobile number - double check the mobile number you entered"),
    TOO_SHORT("Mobile number is too short"),
    TOO_LONG("Mobile number is too long"),
    UNSUPPORTED_COUNTRY_CODE("Country code not found - double check the mobile number you entered"),
    INVALID_NUMBER("Not a valid phone number"),
    INVALID_EMAIL("Not a valid email address");

    private final String message;
}
