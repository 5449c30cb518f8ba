/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import com.geastalt.recipient.address.PostalAddressValidator;
import com.geastalt.recipient.csv.config.RecipientCsvConfig;
import com.geastalt.recipient.email.EmailAddressValidator;
import com.geastalt.recipient.guestlist.GuestlistMatcher;
import com.geastalt.recipient.phone.PhoneNumberValidator;
import com.geastalt.recipient.template.Template;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for checking uploaded recipient files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecipientCsvService {

    private final PhoneNumberValidator phoneNumberValidator;
    private final EmailAddressValidator emailAddressValidator;
    private final GuestlistMatcher guestlistMatcher;
    private final PostalAddressValidator postalAddressValidator;
    private final RecipientCsvConfig config;

    /**
     * A builder with the validators and configured limits already set.
     */
    public RecipientCsv.RecipientCsvBuilder builder() {
        return RecipientCsv.builder()
                .phoneNumberValidator(phoneNumberValidator)
                .emailAddressValidator(emailAddressValidator)
                .guestlistMatcher(guestlistMatcher)
                .postalAddressValidator(postalAddressValidator)
                .maxRows(config.getMaxRows())
                .maxErrorsShown(config.getMaxErrorsShown())
                .maxInitialRowsShown(config.getMaxInitialRowsShown());
    }

    /**
     * Reads and checks a file with default options, logging a summary.
     */
    public RecipientCsv ingest(String fileData, Template template) {
        return summarize(builder()
                .fileData(fileData)
                .template(template)
                .build());
    }

    /**
     * Reads every row of the file and logs what was found.
     */
    public RecipientCsv summarize(RecipientCsv recipientCsv) {
        boolean hasErrors = recipientCsv.hasErrors();
        log.info("Checked {} rows for {} template: errors={}, rowsWithErrors={}, missingColumns={}",
                recipientCsv.size(),
                recipientCsv.getTemplateType(),
                hasErrors,
                recipientCsv.getRowsWithErrors().size(),
                recipientCsv.getMissingColumnHeaders());
        if (recipientCsv.isTooManyRows()) {
            log.warn("Recipient file has {} rows, more than the limit of {}",
                    recipientCsv.size(), recipientCsv.getMaxRows());
        }
        return recipientCsv;
    }
}
