/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.template;

import java.util.List;
import java.util.Map;

/**
 * A message template that a recipient file is checked against.
 *
 * <p>Implementations are stateful: {@link #setValues(Map)} sets the personalisation
 * for one recipient and the length checks then apply to the message rendered with
 * those values.
 */
public interface Template {

    TemplateType getTemplateType();

    /**
     * Placeholder names in the order they first appear, without duplicates.
     */
    List<String> getPlaceholders();

    /**
     * Sets the personalisation for the next checks. Values are strings, lists of
     * strings for repeated columns, or null. Keys are matched case and spacing
     * insensitively.
     */
    void setValues(Map<String, ?> values);

    boolean isMessageTooLong();

    boolean isMessageEmpty();

    /**
     * Letters only: whether any QR code would hold more data than can be printed.
     */
    default boolean hasQrCodeWithTooMuchData() {
        return false;
    }
}
