/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The value of one column in one row of a recipient file, with its error.
 *
 * <p>Most cells hold a single value. A column whose header appears more than once
 * collects one value per occurrence, and a column with no value holds none.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Cell {

    public static final String MISSING_FIELD_ERROR = "Missing";

    private static final Cell EMPTY = new Cell(null, null, List.of(), null, true);

    private final String key;
    private final String header;
    private final List<String> values;
    private final String error;
    private final boolean ignore;

    private Cell(String key, String header, List<String> values, String error, boolean ignore) {
        this.key = key;
        this.header = header;
        this.values = values;
        this.error = error;
        this.ignore = ignore;
    }

    /**
     * Creates a cell, resolving its error straight away. Pass a null resolver to
     * skip validation.
     */
    static Cell of(String key, String header, List<String> values,
                   CellErrorResolver errorResolver, Set<String> placeholderKeys) {
        List<String> copy = Collections.unmodifiableList(new ArrayList<>(values));
        String error = errorResolver == null ? null : errorResolver.resolve(key, copy);
        return new Cell(key, header, copy, error, !placeholderKeys.contains(key));
    }

    /**
     * The cell read for a column the row does not have.
     */
    public static Cell empty() {
        return EMPTY;
    }

    /**
     * The single value, the first of several values, or null.
     */
    public String getData() {
        return values.isEmpty() ? null : values.get(0);
    }

    public boolean isMultiValued() {
        return values.size() > 1;
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * True when the error says the recipient itself is invalid rather than absent.
     */
    public boolean hasRecipientError() {
        return error != null && !MISSING_FIELD_ERROR.equals(error);
    }

    /**
     * The value as a template sees it: a list for repeated columns, otherwise the
     * single value or null.
     */
    public Object getTemplateValue() {
        return isMultiValued() ? values : getData();
    }
}
