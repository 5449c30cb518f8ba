/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import com.geastalt.recipient.address.AddressColumns;
import com.geastalt.recipient.template.TemplateType;

import java.util.List;

/**
 * The columns a recipient file must have to identify who each row is sent to.
 */
public final class RecipientColumns {

    public static final String EMAIL_ADDRESS = "email address";
    public static final String PHONE_NUMBER = "phone number";

    private RecipientColumns() {}

    public static List<String> forTemplateType(TemplateType templateType) {
        return switch (templateType) {
            case EMAIL -> List.of(EMAIL_ADDRESS);
            case SMS -> List.of(PHONE_NUMBER);
            case LETTER -> AddressColumns.HEADERS;
        };
    }

    /**
     * How many recipient columns a file needs. Letters need at least three address lines.
     */
    public static int requiredCount(TemplateType templateType) {
        return templateType == TemplateType.LETTER ? 3 : 1;
    }
}
