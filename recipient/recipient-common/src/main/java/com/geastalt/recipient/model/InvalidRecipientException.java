/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.model;

import lombok.Getter;

/**
 * Thrown by {@link ValidationResult#orElseThrow()} for callers that prefer an
 * exception over inspecting the result.
 */
@Getter
public class InvalidRecipientException extends IllegalArgumentException {

    private final RecipientError error;

    public InvalidRecipientException(RecipientError error) {
        super(error.message());
        this.error = error;
    }

    public RecipientErrorCode getCode() {
        return error.code();
    }
}
