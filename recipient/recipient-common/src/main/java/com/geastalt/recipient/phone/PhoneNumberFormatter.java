/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.phone;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.PhoneNumberUtil.PhoneNumberFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Formats phone numbers for display. UK numbers are shown the way people dial
 * them at home ({@code 07700 900123}), everything else in international format
 * ({@code +33 6 12 34 56 78}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PhoneNumberFormatter {

    private final PhoneNumberValidator phoneNumberValidator;
    private final PhoneNumberUtil phoneNumberUtil = PhoneNumberUtil.getInstance();

    /**
     * Formats the number for display, or returns the input unchanged if it is not a
     * valid number so it can still be shown back to the user.
     */
    public String formatHumanReadable(String rawInput) {
        return phoneNumberValidator.validate(rawInput, true)
                .map(this::format)
                .orElse(rawInput);
    }

    public String format(PhoneNumber phoneNumber) {
        PhoneNumberFormat format = phoneNumber.isInternational()
                ? PhoneNumberFormat.INTERNATIONAL
                : PhoneNumberFormat.NATIONAL;
        try {
            return phoneNumberUtil.format(phoneNumberUtil.parse("+" + phoneNumber.getNumber(), null), format);
        } catch (NumberParseException e) {
            log.warn("Could not format validated number: {}", e.getMessage());
            return phoneNumber.getNumber();
        }
    }
}
