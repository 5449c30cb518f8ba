/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.config;

import com.geastalt.recipient.billing.BillingRateTable;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for phone, email and guestlist validation.
 */
@Configuration
@ConfigurationProperties(prefix = "recipient.validation")
@Getter
@Setter
public class RecipientValidationConfig {

    private int guestlistCacheSize = 32;
    private String billingRatesResource = BillingRateTable.DEFAULT_RESOURCE;

    @Bean
    public BillingRateTable billingRateTable() {
        return BillingRateTable.fromClasspath(billingRatesResource);
    }
}
