/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.phone;

import com.geastalt.recipient.billing.BillingInfo;
import com.geastalt.recipient.billing.BillingRateTable;
import com.geastalt.recipient.model.RecipientErrorCode;
import com.geastalt.recipient.model.ValidationResult;
import com.geastalt.recipient.text.Whitespace;
import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Validates UK and international phone numbers for text messaging.
 *
 * <p>UK numbers must be mobiles. International numbers are accepted only when the
 * caller allows them and their dialing code appears in the billing rates table.
 * Every accepted number must also be a valid number for its region according to
 * the libphonenumber metadata, with the exception of the Ofcom range reserved for
 * TV and film ({@code 07700 900000} to {@code 07700 900999}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PhoneNumberValidator {

    private static final String IGNORED_CHARACTERS = Whitespace.ALL_WHITESPACE + "()-+";

    // Jersey, Guernsey and the Isle of Man share +44 but are billed as international
    private static final Set<String> CROWN_DEPENDENCY_RANGES = Set.of(
            "7781", "7839", "7911", "7509", "7797", "7937", "7700", "7829", "7624", "7524", "7924");

    private static final String TV_RANGE = "7700900";

    private static final int UK_MOBILE_LENGTH = 10;
    private static final int MIN_INTERNATIONAL_LENGTH = 8;
    private static final int MAX_INTERNATIONAL_LENGTH = 15;

    private final BillingRateTable billingRateTable;
    private final PhoneNumberUtil phoneNumberUtil = PhoneNumberUtil.getInstance();

    /**
     * Validates a phone number exactly as entered.
     */
    public ValidationResult<PhoneNumber> validate(String rawInput, boolean allowInternational) {
        if (rawInput == null) {
            return ValidationResult.failure(RecipientErrorCode.INVALID_NUMBER);
        }
        return normalise(rawInput)
                .flatMap(digits -> isUkStyle(rawInput, digits) || !allowInternational
                        ? validateUkNumber(digits)
                        : validateInternationalNumber(digits))
                .flatMap(this::checkNumberingPlan)
                .map(number -> toPhoneNumber(rawInput, number));
    }

    /**
     * Validates a phone number, giving numbers that are nearly right the benefit of
     * the doubt. Spreadsheets often leave a stray leading zero or a plus sign with
     * no country code ({@code 0+447700900100}, {@code +07700900100}). The strict
     * failure is reported if the relaxed attempt fails too.
     */
    public ValidationResult<PhoneNumber> validateBestEffort(String rawInput, boolean allowInternational) {
        return validate(rawInput, allowInternational)
                .orElseTry(() -> validate(thoroughlyNormalise(rawInput), allowInternational)
                        .map(phoneNumber -> new PhoneNumber(rawInput, phoneNumber.getNumber(),
                                phoneNumber.getPrefix(), phoneNumber.isCrownDependency())));
    }

    public ValidationResult<String> validateAndFormat(String rawInput, boolean allowInternational) {
        return validate(rawInput, allowInternational).map(PhoneNumber::getNumber);
    }

    /**
     * For callers that should carry on with whatever they were given, for example
     * numbers echoed back by an SMS provider. Invalid input is returned unchanged.
     */
    public String tryValidateAndFormat(String rawInput, boolean allowInternational, String logMessage) {
        return validateAndFormat(rawInput, allowInternational)
                .onFailure(error -> {
                    if (logMessage != null) {
                        log.warn("{}: {}", logMessage, error.message());
                    }
                })
                .orElse(rawInput);
    }

    /**
     * Whether the input looks like it was meant to be a UK number. Input with
     * characters that can never be part of a phone number is not.
     */
    public boolean isUkPhoneNumber(String rawInput) {
        if (rawInput == null) {
            return false;
        }
        return normalise(rawInput)
                .map(digits -> isUkStyle(rawInput, digits))
                .orElse(false);
    }

    public Optional<String> getInternationalPrefix(String digits) {
        return billingRateTable.findLongestPrefix(digits);
    }

    public BillingInfo getBillingInfo(PhoneNumber phoneNumber) {
        int billableUnits = billingRateTable.getRequiredRate(phoneNumber.getPrefix()).billableUnits();
        return new BillingInfo(billableUnits, phoneNumber.isInternational(),
                phoneNumber.isCrownDependency(), phoneNumber.getPrefix());
    }

    /**
     * Validates with international numbers allowed and returns the billing details.
     *
     * @throws com.geastalt.recipient.model.InvalidRecipientException if the number is invalid
     */
    public BillingInfo getBillingInfo(String rawInput) {
        return getBillingInfo(validate(rawInput, true).orElseThrow());
    }

    /**
     * Some destinations reject alphanumeric sender IDs, so messages to them must
     * come from a numeric sender.
     */
    public boolean useNumericSender(PhoneNumber phoneNumber) {
        return !billingRateTable.getRequiredRate(phoneNumber.getPrefix()).alphanumericSenderAllowed();
    }

    private ValidationResult<String> normalise(String rawInput) {
        String digits = Whitespace.removeCharacters(rawInput, IGNORED_CHARACTERS);
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                return ValidationResult.failure(RecipientErrorCode.UNKNOWN_CHARACTER);
            }
        }
        return ValidationResult.success(stripLeadingZeros(digits));
    }

    private boolean isUkStyle(String rawInput, String digits) {
        if (rawInput.startsWith("0") && !rawInput.startsWith("00")) {
            return true;
        }
        return digits.startsWith(PhoneNumber.UK_PREFIX)
                || (digits.startsWith("7") && digits.length() < 11);
    }

    private ValidationResult<String> validateUkNumber(String digits) {
        String national = digits.startsWith(PhoneNumber.UK_PREFIX)
                ? stripLeadingZeros(digits.substring(PhoneNumber.UK_PREFIX.length()))
                : digits;
        if (!national.startsWith("7")) {
            return ValidationResult.failure(RecipientErrorCode.NOT_A_UK_MOBILE);
        }
        if (national.length() > UK_MOBILE_LENGTH) {
            return ValidationResult.failure(RecipientErrorCode.TOO_LONG);
        }
        if (national.length() < UK_MOBILE_LENGTH) {
            return ValidationResult.failure(RecipientErrorCode.TOO_SHORT);
        }
        return ValidationResult.success(PhoneNumber.UK_PREFIX + national);
    }

    private ValidationResult<String> validateInternationalNumber(String digits) {
        if (digits.length() < MIN_INTERNATIONAL_LENGTH) {
            return ValidationResult.failure(RecipientErrorCode.TOO_SHORT);
        }
        if (digits.length() > MAX_INTERNATIONAL_LENGTH) {
            return ValidationResult.failure(RecipientErrorCode.TOO_LONG);
        }
        if (billingRateTable.findLongestPrefix(digits).isEmpty()) {
            return ValidationResult.failure(RecipientErrorCode.UNSUPPORTED_COUNTRY_CODE);
        }
        return ValidationResult.success(digits);
    }

    private ValidationResult<String> checkNumberingPlan(String number) {
        if (isTvNumber(number)) {
            return ValidationResult.success(number);
        }
        try {
            Phonenumber.PhoneNumber parsed = phoneNumberUtil.parse("+" + number, null);
            if (phoneNumberUtil.isValidNumber(parsed)) {
                return ValidationResult.success(number);
            }
            log.debug("Number with prefix {} is not allocated in the numbering plan",
                    billingRateTable.findLongestPrefix(number).orElse("?"));
        } catch (NumberParseException e) {
            log.debug("Could not parse number: {}", e.getMessage());
        }
        return ValidationResult.failure(RecipientErrorCode.INVALID_NUMBER);
    }

    private PhoneNumber toPhoneNumber(String rawInput, String number) {
        String prefix = billingRateTable.findLongestPrefix(number)
                .orElseThrow(() -> new IllegalStateException("No billing prefix for validated number"));
        return new PhoneNumber(rawInput, number, prefix, isCrownDependency(number));
    }

    static boolean isTvNumber(String number) {
        return number.length() == 12 && number.startsWith(PhoneNumber.UK_PREFIX + TV_RANGE);
    }

    static boolean isCrownDependency(String number) {
        return number.startsWith(PhoneNumber.UK_PREFIX)
                && number.length() >= 9
                && CROWN_DEPENDENCY_RANGES.contains(number.substring(2, 6))
                && !number.startsWith(TV_RANGE, 2);
    }

    private static String thoroughlyNormalise(String rawInput) {
        return rawInput == null ? null : stripLeadingZeros(rawInput.replace("+", ""));
    }

    private static String stripLeadingZeros(String digits) {
        int start = 0;
        while (start < digits.length() && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }
}
