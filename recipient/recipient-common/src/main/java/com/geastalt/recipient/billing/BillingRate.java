/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.billing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of the international billing rates table, keyed by dialing prefix.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BillingRate(
        @JsonProperty("names") List<String> names,
        @JsonProperty("billable_units") int billableUnits,
        @JsonProperty("attributes") Attributes attributes
) {
    public BillingRate {
        names = names == null ? List.of() : List.copyOf(names);
        if (billableUnits < 1) {
            throw new IllegalArgumentException("billableUnits must be at least 1");
        }
    }

    /**
     * Some destination networks reject alphanumeric sender IDs, in which case a
     * numeric sender has to be used instead.
     */
    public boolean alphanumericSenderAllowed() {
        return attributes == null || !"NO".equalsIgnoreCase(attributes.alpha());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Attributes(
            @JsonProperty("alpha") String alpha
    ) {}
}
