/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient;

import com.geastalt.recipient.billing.BillingRateTable;
import com.geastalt.recipient.config.RecipientValidationConfig;
import com.geastalt.recipient.guestlist.GuestlistMatcher;
import com.geastalt.recipient.phone.PhoneNumberFormatter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {"recipient.validation.guestlist-cache-size=16"})
class RecipientCommonApplicationTests {

    @Autowired
    private RecipientValidationConfig config;

    @Autowired
    private BillingRateTable billingRateTable;

    @Autowired
    private GuestlistMatcher guestlistMatcher;

    @Autowired
    private PhoneNumberFormatter phoneNumberFormatter;

    @Test
    void contextLoads() {
        assertEquals(16, config.getGuestlistCacheSize());
        assertTrue(billingRateTable.isKnownPrefix("44"));
    }

    @Test
    void validatorsAreWired() {
        assertTrue(guestlistMatcher.isAllowed("07700 900123", List.of("+447700900123")));
        assertEquals("07700 900123", phoneNumberFormatter.formatHumanReadable("+447700900123"));
    }
}
