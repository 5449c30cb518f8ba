/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import com.geastalt.recipient.address.AddressColumns;
import com.geastalt.recipient.address.PostalAddressValidator;
import com.geastalt.recipient.email.EmailAddressValidator;
import com.geastalt.recipient.guestlist.GuestlistMatcher;
import com.geastalt.recipient.model.ValidationResult;
import com.geastalt.recipient.phone.PhoneNumberValidator;
import com.geastalt.recipient.template.Template;
import com.geastalt.recipient.template.TemplateType;
import com.geastalt.recipient.text.ColumnKeys;
import com.geastalt.recipient.text.Whitespace;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A recipient file checked against a template.
 *
 * <p>The file is read lazily. Rows are built as they are streamed and the full list
 * is kept once anything needs all of them. Every summary is worked out on first use
 * and then kept, as the file text never changes. Problems with individual rows are
 * reported through {@link Row} and {@link Cell}, never thrown.
 *
 * <p>Not thread safe; use one instance per upload.
 */
@Slf4j
public class RecipientCsv {

    public static final int DEFAULT_MAX_ROWS = 100_000;
    public static final int DEFAULT_MAX_ERRORS_SHOWN = 20;
    public static final int DEFAULT_MAX_INITIAL_ROWS_SHOWN = 10;

    @Getter
    private final String fileData;

    @Getter
    private final Template template;

    @Getter
    private final TemplateType templateType;

    @Getter
    private final List<String> guestlist;

    @Getter
    private final long remainingMessages;

    @Getter
    private final boolean allowInternationalSms;

    @Getter
    private final boolean allowInternationalLetters;

    @Getter
    private final boolean shouldValidate;

    @Getter
    private final int maxErrorsShown;

    @Getter
    private final int maxInitialRowsShown;

    @Getter
    private final int maxRows;

    /** Recipient column headers for the template type. */
    @Getter
    private final List<String> recipientColumnHeaders;

    /** Template placeholders followed by the recipient column headers. */
    @Getter
    private final List<String> placeholders;

    private final Set<String> recipientColumnKeys;
    private final Set<String> placeholderKeys;

    private final PhoneNumberValidator phoneNumberValidator;
    private final EmailAddressValidator emailAddressValidator;
    private final GuestlistMatcher guestlistMatcher;
    private final PostalAddressValidator postalAddressValidator;

    private List<String> rawColumnHeaders;
    private List<Row> rows;
    private Set<String> duplicateRecipientColumnHeaders;
    private Set<String> missingColumnHeaders;
    private Boolean allowedToSendTo;
    private Boolean hasErrors;

    @Builder
    private RecipientCsv(String fileData,
                         Template template,
                         Collection<String> guestlist,
                         Long remainingMessages,
                         boolean allowInternationalSms,
                         boolean allowInternationalLetters,
                         Boolean shouldValidate,
                         Integer maxErrorsShown,
                         Integer maxInitialRowsShown,
                         Integer maxRows,
                         PhoneNumberValidator phoneNumberValidator,
                         EmailAddressValidator emailAddressValidator,
                         GuestlistMatcher guestlistMatcher,
                         PostalAddressValidator postalAddressValidator) {
        Objects.requireNonNull(fileData, "fileData must not be null");
        this.template = Objects.requireNonNull(template, "template must not be null");
        this.phoneNumberValidator = Objects.requireNonNull(phoneNumberValidator, "phoneNumberValidator must not be null");
        this.emailAddressValidator = Objects.requireNonNull(emailAddressValidator, "emailAddressValidator must not be null");
        this.guestlistMatcher = Objects.requireNonNull(guestlistMatcher, "guestlistMatcher must not be null");
        this.postalAddressValidator = Objects.requireNonNull(postalAddressValidator, "postalAddressValidator must not be null");

        this.fileData = Whitespace.stripAll(fileData, ",");
        this.templateType = template.getTemplateType();
        this.guestlist = guestlist == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(guestlist));
        this.remainingMessages = remainingMessages == null ? Long.MAX_VALUE : remainingMessages;
        this.allowInternationalSms = allowInternationalSms;
        this.allowInternationalLetters = allowInternationalLetters;
        this.shouldValidate = shouldValidate == null || shouldValidate;
        this.maxErrorsShown = maxErrorsShown == null ? DEFAULT_MAX_ERRORS_SHOWN : maxErrorsShown;
        this.maxInitialRowsShown = maxInitialRowsShown == null ? DEFAULT_MAX_INITIAL_ROWS_SHOWN : maxInitialRowsShown;
        this.maxRows = maxRows == null ? DEFAULT_MAX_ROWS : maxRows;

        this.recipientColumnHeaders = RecipientColumns.forTemplateType(templateType);
        List<String> allPlaceholders = new ArrayList<>(template.getPlaceholders());
        allPlaceholders.addAll(recipientColumnHeaders);
        this.placeholders = List.copyOf(allPlaceholders);
        this.recipientColumnKeys = ColumnKeys.of(recipientColumnHeaders);
        this.placeholderKeys = ColumnKeys.of(placeholders);
    }

    // Rows

    /**
     * Reads the file afresh, building each row as it is consumed. Positions at or
     * beyond {@link #getMaxRows()} come back as null without being read into a row.
     * Close the stream if it is not consumed to the end.
     */
    public Stream<Row> streamRows() {
        List<String> headers = getRawColumnHeaders();
        CsvRecordReader reader = new CsvRecordReader(fileData);
        if (reader.hasNext()) {
            reader.next();
        }
        Spliterator<List<String>> records = Spliterators.spliteratorUnknownSize(
                reader, Spliterator.ORDERED | Spliterator.NONNULL);
        int[] position = {0};
        return StreamSupport.stream(records, false)
                .map(record -> toRow(position[0]++, headers, record))
                .onClose(reader::close);
    }

    /**
     * All rows, with null for rows beyond {@link #getMaxRows()}.
     */
    public List<Row> getRows() {
        if (rows == null) {
            List<Row> all = new ArrayList<>();
            try (Stream<Row> stream = streamRows()) {
                stream.forEachOrdered(all::add);
            }
            rows = Collections.unmodifiableList(all);
            log.debug("Read {} rows for {} template", rows.size(), templateType);
        }
        return rows;
    }

    public int size() {
        return getRows().size();
    }

    public Row get(int index) {
        return getRows().get(index);
    }

    private Row toRow(int index, List<String> headers, List<String> record) {
        if (index >= maxRows) {
            return null;
        }

        Map<String, List<String>> values = new LinkedHashMap<>();
        Map<String, String> headersByKey = new HashMap<>();

        int paired = Math.min(headers.size(), record.size());
        for (int i = 0; i < paired; i++) {
            String header = headers.get(i);
            String value = emptyToNull(Whitespace.stripAndRemoveObscureWhitespace(record.get(i)));
            String key = ColumnKeys.of(header);
            headersByKey.putIfAbsent(key, header);
            if (recipientColumnKeys.contains(key)) {
                values.put(key, value == null ? new ArrayList<>() : new ArrayList<>(List.of(value)));
            } else {
                insertOrAppend(values, header, key, value);
            }
        }

        List<String> extraValues = List.of();
        if (record.size() > headers.size()) {
            extraValues = record.subList(headers.size(), record.size());
        } else {
            for (String header : headers.subList(record.size(), headers.size())) {
                String key = ColumnKeys.of(header);
                headersByKey.putIfAbsent(key, header);
                insertOrAppend(values, header, key, null);
            }
        }

        return Row.builder()
                .index(index)
                .values(values)
                .headers(headersByKey)
                .extraValues(extraValues)
                .templateType(templateType)
                .recipientColumnHeaders(recipientColumnHeaders)
                .placeholderKeys(placeholderKeys)
                .errorResolver(shouldValidate ? this::getErrorForField : null)
                .template(shouldValidate ? template : null)
                .postalAddressValidator(postalAddressValidator)
                .allowInternationalLetters(allowInternationalLetters)
                .build();
    }

    /**
     * Repeated columns collect their values. A later value replaces an earlier one
     * that was empty.
     */
    private static void insertOrAppend(Map<String, List<String>> values, String header, String key, String value) {
        if (header.isEmpty() && value == null) {
            return;
        }
        List<String> existing = values.get(key);
        if (existing == null || existing.isEmpty()) {
            values.put(key, value == null ? new ArrayList<>() : new ArrayList<>(Collections.singletonList(value)));
        } else if (existing.size() > 1 || existing.get(0) != null) {
            existing.add(value);
        } else {
            existing.set(0, value);
        }
    }

    private String getErrorForField(String key, List<String> values) {
        if (isAddressColumn(key)) {
            return null;
        }

        if (recipientColumnKeys.contains(key)) {
            if (values.size() != 1 || values.get(0) == null || values.get(0).isEmpty()) {
                return getDuplicateRecipientColumnHeaders().isEmpty() ? Cell.MISSING_FIELD_ERROR : null;
            }
            ValidationResult<?> result = switch (templateType) {
                case EMAIL -> emailAddressValidator.validate(values.get(0));
                case SMS -> phoneNumberValidator.validate(values.get(0), allowInternationalSms);
                case LETTER -> ValidationResult.success(values.get(0));
            };
            if (!result.isSuccess()) {
                return result.getError().message();
            }
        }

        if (!placeholderKeys.contains(key)) {
            return null;
        }

        if (values.isEmpty() || (values.size() == 1 && (values.get(0) == null || values.get(0).isEmpty()))) {
            return Cell.MISSING_FIELD_ERROR;
        }
        return null;
    }

    // Headers

    /**
     * The header row exactly as written, duplicates included.
     */
    public List<String> getRawColumnHeaders() {
        if (rawColumnHeaders == null) {
            try (CsvRecordReader reader = new CsvRecordReader(fileData)) {
                rawColumnHeaders = reader.hasNext() ? List.copyOf(reader.next()) : List.of();
            }
        }
        return rawColumnHeaders;
    }

    /**
     * Headers in file order with exact duplicates removed.
     */
    public List<String> getColumnHeaders() {
        return List.copyOf(new LinkedHashSet<>(getRawColumnHeaders()));
    }

    public Set<String> getColumnHeaderKeys() {
        return ColumnKeys.of(getColumnHeaders());
    }

    /**
     * Placeholders and recipient columns the file does not have. Letter address
     * columns are left out as {@link #hasRecipientColumns()} covers them.
     */
    public Set<String> getMissingColumnHeaders() {
        if (missingColumnHeaders == null) {
            Set<String> headerKeys = getColumnHeaderKeys();
            LinkedHashSet<String> missing = placeholders.stream()
                    .filter(placeholder -> !headerKeys.contains(ColumnKeys.of(placeholder)))
                    .filter(placeholder -> !isAddressColumn(placeholder))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            missingColumnHeaders = Collections.unmodifiableSet(missing);
        }
        return missingColumnHeaders;
    }

    /**
     * Every header naming a recipient column that appears more than once, in any spelling.
     */
    public Set<String> getDuplicateRecipientColumnHeaders() {
        if (duplicateRecipientColumnHeaders == null) {
            Map<String, Long> counts = getRawColumnHeaders().stream()
                    .map(ColumnKeys::of)
                    .filter(recipientColumnKeys::contains)
                    .collect(Collectors.groupingBy(key -> key, Collectors.counting()));
            LinkedHashSet<String> duplicates = getRawColumnHeaders().stream()
                    .filter(header -> counts.getOrDefault(ColumnKeys.of(header), 0L) > 1)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            duplicateRecipientColumnHeaders = Collections.unmodifiableSet(duplicates);
        }
        return duplicateRecipientColumnHeaders;
    }

    /**
     * Whether there are enough recipient columns to address anyone. Letters need
     * three of lines 1 to 6 with the postcode, or three of lines 1 to 7.
     */
    public boolean hasRecipientColumns() {
        Set<String> headerKeys = getColumnHeaderKeys();
        int required = RecipientColumns.requiredCount(templateType);
        List<Set<String>> candidates = templateType == TemplateType.LETTER
                ? List.of(AddressColumns.LINES_1_TO_6_AND_POSTCODE_KEYS, AddressColumns.LINES_1_TO_7_KEYS)
                : List.of(recipientColumnKeys);
        for (Set<String> candidate : candidates) {
            if (candidate.stream().filter(headerKeys::contains).count() >= required) {
                return true;
            }
        }
        return false;
    }

    private boolean isAddressColumn(String header) {
        return templateType == TemplateType.LETTER && AddressColumns.isAddressColumn(header);
    }

    // Table level checks

    public boolean isTooManyRows() {
        return size() > maxRows;
    }

    public boolean isMoreRowsThanCanSend() {
        return size() > remainingMessages;
    }

    /**
     * False if a guestlist is set and any recipient is not on it. Letters are never
     * restricted.
     */
    public boolean isAllowedToSendTo() {
        if (allowedToSendTo == null) {
            allowedToSendTo = checkAllowedToSendTo();
        }
        return allowedToSendTo;
    }

    private boolean checkAllowedToSendTo() {
        if (templateType == TemplateType.LETTER || guestlist.isEmpty()) {
            return true;
        }
        Set<String> allowed = guestlistMatcher.canonicalizeAll(guestlist);
        return getRows().stream()
                .filter(Objects::nonNull)
                .allMatch(row -> allowed.contains(guestlistMatcher.canonicalize(row.getRecipient())));
    }

    /**
     * True if anything would stop the file being sent. Cheap table level checks run
     * first; row errors are only looked at when those all pass.
     */
    public boolean hasErrors() {
        if (hasErrors == null) {
            hasErrors = !getMissingColumnHeaders().isEmpty()
                    || !getDuplicateRecipientColumnHeaders().isEmpty()
                    || isMoreRowsThanCanSend()
                    || isTooManyRows()
                    || !isAllowedToSendTo()
                    || getRows().stream().anyMatch(row -> row != null && row.hasError());
            if (hasErrors) {
                log.debug("Recipient file for {} template has errors", templateType);
            }
        }
        return hasErrors;
    }

    // Row filters

    public List<Row> getRowsWithErrors() {
        return filterRows(Row::hasError);
    }

    public List<Row> getRowsWithBadRecipients() {
        return filterRows(Row::hasBadRecipient);
    }

    public List<Row> getRowsWithMissingData() {
        return filterRows(Row::hasMissingData);
    }

    public List<Row> getRowsWithMessageTooLong() {
        return filterRows(Row::isMessageTooLong);
    }

    public List<Row> getRowsWithEmptyMessage() {
        return filterRows(Row::isMessageEmpty);
    }

    public List<Row> getRowsWithBadQrCodes() {
        return filterRows(Row::isQrCodeTooLong);
    }

    /**
     * The first rows of the file, for a preview. May contain null for rows beyond
     * the maximum.
     */
    public List<Row> getInitialRows() {
        List<Row> all = getRows();
        return all.subList(0, Math.min(maxInitialRowsShown, all.size()));
    }

    public List<Row> getInitialRowsWithErrors() {
        return getRowsWithErrors().stream()
                .limit(maxErrorsShown)
                .toList();
    }

    /**
     * Rows to show the user: the first rows with errors when there are any and no
     * columns are missing, otherwise the first rows of the file.
     */
    public List<Row> getDisplayedRows() {
        if (getRows().stream().anyMatch(row -> row != null && row.hasError())
                && getMissingColumnHeaders().isEmpty()) {
            return getInitialRowsWithErrors();
        }
        return getInitialRows();
    }

    private List<Row> filterRows(Predicate<Row> predicate) {
        return getRows().stream()
                .filter(Objects::nonNull)
                .filter(predicate)
                .toList();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
