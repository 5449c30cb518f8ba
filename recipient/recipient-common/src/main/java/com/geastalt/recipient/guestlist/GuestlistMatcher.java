/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.guestlist;

import com.geastalt.recipient.config.RecipientValidationConfig;
import com.geastalt.recipient.email.EmailAddressValidator;
import com.geastalt.recipient.phone.PhoneNumber;
import com.geastalt.recipient.phone.PhoneNumberValidator;
import com.geastalt.recipient.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a recipient is on a guestlist. Recipients are compared in
 * canonical form, so {@code 07700 900123} matches {@code +447700900123} and
 * {@code Test@Example.com} matches {@code test@example.com}.
 */
@Slf4j
@Component
public class GuestlistMatcher {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final PhoneNumberValidator phoneNumberValidator;
    private final EmailAddressValidator emailAddressValidator;
    private final RecipientCanonicalizationCache cache;

    public GuestlistMatcher(PhoneNumberValidator phoneNumberValidator,
                            EmailAddressValidator emailAddressValidator,
                            RecipientValidationConfig config) {
        this.phoneNumberValidator = phoneNumberValidator;
        this.emailAddressValidator = emailAddressValidator;
        this.cache = new RecipientCanonicalizationCache(config.getGuestlistCacheSize());
        log.info("Guestlist matcher initialized with cache size {}", config.getGuestlistCacheSize());
    }

    /**
     * True if the recipient's canonical form matches the canonical form of any
     * guestlist entry.
     */
    public boolean isAllowed(String recipient, Collection<String> guestlist) {
        if (guestlist == null || guestlist.isEmpty()) {
            return false;
        }
        return canonicalizeAll(guestlist).contains(canonicalize(recipient));
    }

    public Set<String> canonicalizeAll(Collection<String> recipients) {
        Set<String> canonical = new HashSet<>();
        for (String recipient : recipients) {
            canonical.add(canonicalize(recipient));
        }
        return canonical;
    }

    /**
     * Phone numbers become their normalised digits, email addresses and UUIDs are
     * lower-cased and anything else is returned as given. Null becomes the empty string.
     */
    public String canonicalize(String recipient) {
        if (recipient == null) {
            return "";
        }
        return cache.computeIfAbsent(recipient, this::computeCanonicalForm);
    }

    private String computeCanonicalForm(String recipient) {
        ValidationResult<String> phone = phoneNumberValidator.validate(recipient, true)
                .map(PhoneNumber::getNumber);
        if (phone.isSuccess()) {
            return phone.getValue();
        }
        ValidationResult<String> email = emailAddressValidator.validateAndFormat(recipient);
        if (email.isSuccess()) {
            return email.getValue();
        }
        if (UUID_PATTERN.matcher(recipient).matches()) {
            return recipient.toLowerCase(Locale.ROOT);
        }
        return recipient;
    }

    RecipientCanonicalizationCache getCache() {
        return cache;
    }
}
