/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.address;

import java.util.Map;

/**
 * Checks whether the address columns of a letter recipient make a postable address.
 */
public interface PostalAddressValidator {

    /**
     * @param values              recipient values keyed by column key; non-address
     *                            columns are ignored
     * @param allowInternational  whether the address may be outside the UK
     */
    boolean isValid(Map<String, String> values, boolean allowInternational);
}
