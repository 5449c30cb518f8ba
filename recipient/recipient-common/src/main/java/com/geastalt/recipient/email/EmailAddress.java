/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.email;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An email address that has passed {@link EmailAddressValidator}. The address is
 * lower-cased and keeps any internationalized domain in its Unicode form.
 */
@Getter
@EqualsAndHashCode
public final class EmailAddress {

    private final String address;

    EmailAddress(String address) {
        this.address = address;
    }

    @Override
    public String toString() {
        return address;
    }
}
