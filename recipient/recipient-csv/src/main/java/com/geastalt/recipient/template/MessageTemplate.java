/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.template;

import com.geastalt.recipient.text.ColumnKeys;
import lombok.Getter;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Plain text template with {@code ((name))} placeholders. A placeholder written
 * {@code ((name??text))} is conditional: it renders {@code text} when the value
 * for {@code name} is present and nothing otherwise.
 */
public class MessageTemplate implements Template {

    public static final int SMS_CHAR_COUNT_LIMIT = 918;
    public static final int EMAIL_CHAR_COUNT_LIMIT = 2_000_000;
    public static final int QR_CODE_MAX_BYTES = 504;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\(\\(([^()]+)\\)\\)");
    private static final String CONDITIONAL_SEPARATOR = "??";
    private static final String QR_CODE_PREFIX = "qr:";

    @Getter
    private final TemplateType templateType;

    @Getter
    private final String content;

    @Getter
    private final List<String> placeholders;

    private final StringSubstitutor substitutor;
    private Map<String, Object> values = Map.of();

    public MessageTemplate(TemplateType templateType, String content) {
        this.templateType = Objects.requireNonNull(templateType, "templateType must not be null");
        this.content = Objects.requireNonNull(content, "content must not be null");
        this.placeholders = findPlaceholders(content);
        this.substitutor = new StringSubstitutor((StringLookup) this::lookup, "((", "))", '\\');
        this.substitutor.setValueDelimiterMatcher(null);
        this.substitutor.setDisableSubstitutionInValues(true);
    }

    @Override
    public void setValues(Map<String, ?> values) {
        Map<String, Object> byKey = new HashMap<>();
        if (values != null) {
            for (Entry<String, ?> entry : values.entrySet()) {
                if (entry.getKey() != null) {
                    byKey.put(ColumnKeys.of(entry.getKey()), entry.getValue());
                }
            }
        }
        this.values = byKey;
    }

    /**
     * The content with every placeholder that has a value filled in. Placeholders
     * without a value are left as written.
     */
    public String render() {
        return substitutor.replace(content);
    }

    @Override
    public boolean isMessageTooLong() {
        return switch (templateType) {
            case SMS -> render().length() > SMS_CHAR_COUNT_LIMIT;
            case EMAIL -> render().length() > EMAIL_CHAR_COUNT_LIMIT;
            case LETTER -> false;
        };
    }

    @Override
    public boolean isMessageEmpty() {
        return render().isBlank();
    }

    @Override
    public boolean hasQrCodeWithTooMuchData() {
        if (templateType != TemplateType.LETTER) {
            return false;
        }
        return render().lines()
                .map(String::strip)
                .filter(line -> line.toLowerCase(Locale.ROOT).startsWith(QR_CODE_PREFIX))
                .map(line -> line.substring(QR_CODE_PREFIX.length()).strip())
                .anyMatch(payload -> payload.getBytes(StandardCharsets.UTF_8).length > QR_CODE_MAX_BYTES);
    }

    private String lookup(String placeholder) {
        int separator = placeholder.indexOf(CONDITIONAL_SEPARATOR);
        if (separator >= 0) {
            String value = format(values.get(ColumnKeys.of(placeholder.substring(0, separator))));
            return value == null || value.isEmpty()
                    ? ""
                    : placeholder.substring(separator + CONDITIONAL_SEPARATOR.length());
        }
        return format(values.get(ColumnKeys.of(placeholder)));
    }

    private static String format(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .collect(Collectors.joining(", "));
        }
        return value == null ? null : value.toString();
    }

    private static List<String> findPlaceholders(String content) {
        Map<String, String> byKey = new LinkedHashMap<>();
        Matcher matcher = PLACEHOLDER.matcher(content);
        while (matcher.find()) {
            String name = matcher.group(1);
            int separator = name.indexOf(CONDITIONAL_SEPARATOR);
            if (separator >= 0) {
                name = name.substring(0, separator);
            }
            name = name.strip();
            byKey.putIfAbsent(ColumnKeys.of(name), name);
        }
        return List.copyOf(byKey.values());
    }
}
