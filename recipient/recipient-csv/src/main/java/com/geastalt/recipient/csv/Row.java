/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import com.geastalt.recipient.address.PostalAddressValidator;
import com.geastalt.recipient.template.Template;
import com.geastalt.recipient.template.TemplateType;
import com.geastalt.recipient.text.ColumnKeys;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One data row of a recipient file. Cells are keyed by column key, so lookups
 * ignore case, spaces, underscores and hyphens.
 *
 * <p>Everything a row reports is worked out when it is built, apart from the
 * postal address check which runs on first use.
 */
public final class Row {

    /** Zero-based position among the data rows. */
    @Getter
    private final int index;

    private final Map<String, Cell> cells;

    /** Values beyond the last header, kept as they were in the file. */
    @Getter
    private final List<String> extraValues;

    private final TemplateType templateType;
    private final List<String> recipientColumnHeaders;
    private final Set<String> placeholderKeys;
    private final PostalAddressValidator postalAddressValidator;
    private final boolean allowInternationalLetters;
    private final boolean validated;

    @Getter
    private final boolean messageTooLong;

    @Getter
    private final boolean messageEmpty;

    @Getter
    private final boolean qrCodeTooLong;

    private Boolean badPostalAddress;

    /**
     * Builds the row's cells and, when a template is given, checks the message it
     * renders for this row. A null error resolver and template skip validation.
     *
     * @param values column key to the values collected for that column, in file order
     * @param headers column key to the header as first written in the file
     */
    @Builder(access = AccessLevel.PACKAGE)
    private Row(int index,
                Map<String, List<String>> values,
                Map<String, String> headers,
                List<String> extraValues,
                TemplateType templateType,
                List<String> recipientColumnHeaders,
                Set<String> placeholderKeys,
                CellErrorResolver errorResolver,
                Template template,
                PostalAddressValidator postalAddressValidator,
                boolean allowInternationalLetters) {
        this.index = index;
        this.templateType = Objects.requireNonNull(templateType, "templateType must not be null");
        this.recipientColumnHeaders = List.copyOf(recipientColumnHeaders);
        this.placeholderKeys = Set.copyOf(placeholderKeys);
        this.extraValues = extraValues == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(extraValues));
        this.postalAddressValidator = postalAddressValidator;
        this.allowInternationalLetters = allowInternationalLetters;
        this.validated = template != null;

        Map<String, Cell> built = new LinkedHashMap<>();
        values.forEach((key, columnValues) -> built.put(key,
                Cell.of(key, headers == null ? key : headers.getOrDefault(key, key), columnValues,
                        errorResolver, this.placeholderKeys)));
        this.cells = Collections.unmodifiableMap(built);

        if (template != null) {
            template.setValues(getRecipientAndPersonalisation());
            // Email bodies are not length checked per row
            this.messageTooLong = templateType != TemplateType.EMAIL && template.isMessageTooLong();
            this.messageEmpty = template.isMessageEmpty();
            this.qrCodeTooLong = templateType == TemplateType.LETTER && template.hasQrCodeWithTooMuchData();
        } else {
            this.messageTooLong = false;
            this.messageEmpty = false;
            this.qrCodeTooLong = false;
        }
    }

    /**
     * The cell for a column, or an empty cell if the row has no such column.
     */
    public Cell get(String header) {
        Cell cell = header == null ? null : cells.get(ColumnKeys.of(header));
        return cell == null ? Cell.empty() : cell;
    }

    public Map<String, Cell> getCells() {
        return cells;
    }

    /**
     * Row number as the user sees it in their spreadsheet, counting the header row.
     */
    public int getSpreadsheetRowNumber() {
        return index + 2;
    }

    /**
     * The value of the first recipient column, which is the phone number or email
     * address for text messages and emails.
     */
    public String getRecipient() {
        return get(recipientColumnHeaders.get(0)).getData();
    }

    /**
     * Values of every recipient column in order. Letters have one per address column.
     */
    public List<String> getRecipientValues() {
        List<String> recipientValues = new ArrayList<>();
        for (String header : recipientColumnHeaders) {
            recipientValues.add(get(header).getData());
        }
        return Collections.unmodifiableList(recipientValues);
    }

    /**
     * Template values for the placeholders this row fills, keyed by column key.
     */
    public Map<String, Object> getPersonalisation() {
        Map<String, Object> personalisation = new LinkedHashMap<>();
        cells.forEach((key, cell) -> {
            if (placeholderKeys.contains(key)) {
                personalisation.put(key, cell.getTemplateValue());
            }
        });
        return personalisation;
    }

    public Map<String, Object> getRecipientAndPersonalisation() {
        Map<String, Object> all = new LinkedHashMap<>();
        cells.forEach((key, cell) -> all.put(key, cell.getTemplateValue()));
        return all;
    }

    public boolean hasError() {
        return hasErrorSpanningMultipleCells() || cells.values().stream().anyMatch(Cell::hasError);
    }

    public boolean hasErrorSpanningMultipleCells() {
        return messageTooLong || messageEmpty || hasBadPostalAddress() || qrCodeTooLong;
    }

    public boolean hasMissingData() {
        return cells.values().stream().anyMatch(cell -> Cell.MISSING_FIELD_ERROR.equals(cell.getError()));
    }

    public boolean hasBadRecipient() {
        if (templateType == TemplateType.LETTER) {
            return hasBadPostalAddress();
        }
        return get(recipientColumnHeaders.get(0)).hasRecipientError();
    }

    /**
     * Letters only. Not checked when the file is read without validation.
     */
    public boolean hasBadPostalAddress() {
        if (templateType != TemplateType.LETTER || !validated || postalAddressValidator == null) {
            return false;
        }
        if (badPostalAddress == null) {
            Map<String, String> addressValues = new LinkedHashMap<>();
            cells.forEach((key, cell) -> addressValues.put(key, cell.getData()));
            badPostalAddress = !postalAddressValidator.isValid(addressValues, allowInternationalLetters);
        }
        return badPostalAddress;
    }

    @Override
    public String toString() {
        return "Row{index=" + index + ", cells=" + cells.values() + "}";
    }
}
