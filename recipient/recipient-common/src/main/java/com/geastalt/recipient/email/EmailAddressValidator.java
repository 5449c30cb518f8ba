/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.email;

import com.geastalt.recipient.model.RecipientErrorCode;
import com.geastalt.recipient.model.ValidationResult;
import com.geastalt.recipient.text.Whitespace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.IDN;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural email address validation. Checks the shape of the address and its
 * domain; never checks that the mailbox exists.
 */
@Slf4j
@Component
public class EmailAddressValidator {

    // No quotes or semicolons in the local part
    private static final Pattern VALID_LOCAL_CHARS = Pattern.compile(
            "^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~\\-]+@([^.@][^@\\s]+)$");

    private static final Pattern HOSTNAME_PART = Pattern.compile(
            "^(xn|[a-z0-9]+)(-?-[a-z0-9]+)*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TLD_PART = Pattern.compile(
            "^([a-z]{2,63}|xn--([a-z0-9]+-)*[a-z0-9]+)$", Pattern.CASE_INSENSITIVE);

    private static final int MAX_ADDRESS_LENGTH = 320;
    private static final int MAX_DOMAIN_LENGTH = 253;
    private static final int MAX_LABEL_LENGTH = 63;

    public ValidationResult<EmailAddress> validate(String rawInput) {
        if (rawInput == null) {
            return invalid();
        }
        String address = Whitespace.stripAndRemoveObscureWhitespace(rawInput);

        Matcher matcher = VALID_LOCAL_CHARS.matcher(address);
        if (!matcher.matches()) {
            return invalid();
        }
        if (address.length() > MAX_ADDRESS_LENGTH || address.contains("..")) {
            return invalid();
        }

        String asciiDomain;
        try {
            asciiDomain = IDN.toASCII(matcher.group(1));
        } catch (IllegalArgumentException e) {
            log.debug("Domain failed IDNA conversion: {}", e.getMessage());
            return invalid();
        }
        if (!isValidDomain(asciiDomain)) {
            return invalid();
        }

        return ValidationResult.success(new EmailAddress(address.toLowerCase(Locale.ROOT)));
    }

    public ValidationResult<String> validateAndFormat(String rawInput) {
        return validate(rawInput).map(EmailAddress::getAddress);
    }

    private static boolean isValidDomain(String domain) {
        if (domain.length() > MAX_DOMAIN_LENGTH) {
            return false;
        }
        String[] parts = domain.split("\\.", -1);
        if (parts.length < 2) {
            return false;
        }
        for (String part : parts) {
            if (part.isEmpty() || part.length() > MAX_LABEL_LENGTH || !HOSTNAME_PART.matcher(part).matches()) {
                return false;
            }
        }
        return TLD_PART.matcher(parts[parts.length - 1]).matches();
    }

    private static <T> ValidationResult<T> invalid() {
        return ValidationResult.failure(RecipientErrorCode.INVALID_EMAIL);
    }
}
