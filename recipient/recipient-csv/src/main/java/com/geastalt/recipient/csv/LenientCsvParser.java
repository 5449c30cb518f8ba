/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import com.opencsv.AbstractCSVParser;
import com.opencsv.enums.CSVReaderNullFieldIndicator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Comma separated line parser that accepts any line. A quote opens a quoted field
 * only at the start of a field, after any skipped spaces. Anywhere else it is an
 * ordinary character, as is text following the closing quote of a field.
 *
 * <p>Quoted fields may continue onto following lines. A record whose quoted field
 * is still open when the input ends is finished with {@link #closePendingRecord()}.
 */
final class LenientCsvParser extends AbstractCSVParser {

    public static final char SEPARATOR = ',';
    public static final char QUOTE = '"';

    private enum State {
        START_FIELD,
        IN_FIELD,
        IN_QUOTED_FIELD,
        QUOTE_IN_QUOTED_FIELD
    }

    // Fields already returned for a record that is still waiting on an open quote
    private final List<String> pendingFields = new ArrayList<>();

    LenientCsvParser() {
        super(SEPARATOR, QUOTE, CSVReaderNullFieldIndicator.NEITHER);
    }

    @Override
    protected String[] parseLine(String nextLine, boolean multi) {
        if (nextLine == null) {
            return isPending() ? closePendingRecord() : null;
        }

        boolean continuing = multi && isPending();
        if (!continuing) {
            pendingFields.clear();
        }
        StringBuilder field = new StringBuilder(continuing ? pending : "");
        State state = continuing ? State.IN_QUOTED_FIELD : State.START_FIELD;
        pending = null;

        List<String> fields = new ArrayList<>();
        for (int i = 0; i < nextLine.length(); i++) {
            char c = nextLine.charAt(i);
            switch (state) {
                case START_FIELD -> {
                    if (c == quotechar) {
                        state = State.IN_QUOTED_FIELD;
                    } else if (c == separator) {
                        fields.add("");
                    } else if (c != ' ') {
                        field.append(c);
                        state = State.IN_FIELD;
                    }
                }
                case IN_FIELD -> {
                    if (c == separator) {
                        fields.add(take(field));
                        state = State.START_FIELD;
                    } else {
                        field.append(c);
                    }
                }
                case IN_QUOTED_FIELD -> {
                    if (c == quotechar) {
                        state = State.QUOTE_IN_QUOTED_FIELD;
                    } else {
                        field.append(c);
                    }
                }
                case QUOTE_IN_QUOTED_FIELD -> {
                    if (c == quotechar) {
                        field.append(c);
                        state = State.IN_QUOTED_FIELD;
                    } else if (c == separator) {
                        fields.add(take(field));
                        state = State.START_FIELD;
                    } else {
                        field.append(c);
                        state = State.IN_FIELD;
                    }
                }
            }
        }

        if (state == State.IN_QUOTED_FIELD && multi) {
            pending = field.append(NEWLINE).toString();
            pendingFields.addAll(fields);
            return fields.toArray(new String[0]);
        }

        fields.add(field.toString());
        pendingFields.clear();
        return fields.toArray(new String[0]);
    }

    /**
     * Ends a record whose quoted field was never closed, returning every field of
     * the record with the open field holding the text read so far.
     */
    String[] closePendingRecord() {
        List<String> fields = new ArrayList<>(pendingFields);
        if (pending != null) {
            fields.add(pending.endsWith(NEWLINE)
                    ? pending.substring(0, pending.length() - NEWLINE.length())
                    : pending);
        }
        pending = null;
        pendingFields.clear();
        return fields.toArray(new String[0]);
    }

    @Override
    protected String convertToCsvValue(String value, boolean applyQuotesToAll) {
        String text = value == null ? "" : value;
        String escaped = text.replace(quotecharAsString, quoteDoubledAsString);
        return isSurroundWithQuotes(text, applyQuotesToAll)
                ? quotecharAsString + escaped + quotecharAsString
                : escaped;
    }

    @Override
    public void setErrorLocale(Locale errorLocale) {
        // Lines are never rejected, so there are no messages to localise
    }

    private static String take(StringBuilder field) {
        String value = field.toString();
        field.setLength(0);
        return value;
    }
}
