/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv.config;

import com.geastalt.recipient.csv.RecipientCsv;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Limits applied to recipient file uploads.
 */
@Configuration
@ConfigurationProperties(prefix = "recipient.csv")
@Getter
@Setter
public class RecipientCsvConfig {

    private int maxRows = RecipientCsv.DEFAULT_MAX_ROWS;
    private int maxErrorsShown = RecipientCsv.DEFAULT_MAX_ERRORS_SHOWN;
    private int maxInitialRowsShown = RecipientCsv.DEFAULT_MAX_INITIAL_ROWS_SHOWN;
}
