/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.billing;

import java.util.Objects;

/**
 * Billing details for a validated phone number. Crown dependency numbers share
 * the UK country code but are billed as international.
 */
public record BillingInfo(
        int billableUnits,
        boolean international,
        boolean crownDependency,
        String countryPrefix
) {
    public BillingInfo {
        Objects.requireNonNull(countryPrefix, "countryPrefix must not be null");
        if (billableUnits < 1) {
            throw new IllegalArgumentException("billableUnits must be at least 1");
        }
    }
}
