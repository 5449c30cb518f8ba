/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.model;

import java.util.Objects;

/**
 * Reason a phone number or email address was rejected.
 */
public record RecipientError(
        RecipientErrorCode code,
        String message
) {
    public RecipientError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates an error carrying the code's standard user-facing message.
     */
    public static RecipientError of(RecipientErrorCode code) {
        return new RecipientError(code, code.getMessage());
    }
}
