/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.phone;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * A phone number that has passed validation. Instances only come out of
 * {@link PhoneNumberValidator}, so holding one means the number is usable.
 */
@Getter
@EqualsAndHashCode(of = "number")
public final class PhoneNumber {

    public static final String UK_PREFIX = "44";

    private final String rawInput;

    /** Digits only, including the country code, without a leading {@code +}. */
    private final String number;

    /** Dialing prefix as it appears in the billing rates table. */
    private final String prefix;

    private final boolean international;
    private final boolean crownDependency;

    PhoneNumber(String rawInput, String number, String prefix, boolean crownDependency) {
        this.rawInput = rawInput;
        this.number = Objects.requireNonNull(number, "number must not be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
        this.crownDependency = crownDependency;
        this.international = !UK_PREFIX.equals(prefix) || crownDependency;
    }

    /**
     * True for anything dialed with +44, which includes Jersey, Guernsey and the Isle of Man.
     */
    public boolean isUkPhoneNumber() {
        return UK_PREFIX.equals(prefix);
    }

    /**
     * The form sent to SMS providers.
     */
    public String getNormalisedFormat() {
        return number;
    }

    @Override
    public String toString() {
        return number;
    }
}
