/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import com.geastalt.recipient.model.RecipientErrorCode;
import com.geastalt.recipient.template.MessageTemplate;
import com.geastalt.recipient.template.TemplateType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.geastalt.recipient.csv.RecipientCsvFixtures.recipientCsv;
import static com.geastalt.recipient.csv.RecipientCsvFixtures.sms;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RecipientCsv.
 */
class RecipientCsvTest {

    private static final String LETTER_HEADERS = "name,address line 1,address line 2,address line 3,postcode";

    private static String smsRows(int count) {
        return "phone number,name\n" + IntStream.range(0, count)
                .mapToObj(i -> String.format("07700900%03d,Person %d", i, i))
                .collect(Collectors.joining("\n"));
    }

    @Test
    @DisplayName("Should report errors row by row")
    void shouldReportRowErrors() {
        var csv = sms("phone number,name\n07700900123,Jo\n07700 900 12,Sam");

        assertEquals(2, csv.size());
        assertFalse(csv.get(0).hasError());
        assertTrue(csv.get(1).hasError());
        assertTrue(csv.get(1).hasBadRecipient());
        assertEquals(RecipientErrorCode.TOO_SHORT.getMessage(), csv.get(1).get("Phone Number").getError());
        assertTrue(csv.hasErrors());
        assertEquals(List.of(csv.get(1)), csv.getRowsWithErrors());
        assertEquals(List.of(csv.get(1)), csv.getRowsWithBadRecipients());
    }

    @Test
    @DisplayName("Should find no errors in a clean file")
    void shouldAcceptCleanFile() {
        var csv = sms("Phone Number,Name\n07700900123,Jo\n+44 7700 900124,Sam");

        assertFalse(csv.hasErrors());
        assertTrue(csv.getRowsWithErrors().isEmpty());
        assertTrue(csv.getMissingColumnHeaders().isEmpty());
        assertTrue(csv.hasRecipientColumns());
        assertEquals("Jo", csv.get(0).get("name").getData());
        assertEquals("07700900123", csv.get(0).getRecipient());
    }

    @Test
    @DisplayName("Should strip whitespace and commas around the file and obscure whitespace in values")
    void shouldNormaliseWhitespace() {
        var csv = sms("\n,phone number,name\n\u200B07700900123 ,  Jo\n,,\n");

        assertEquals(List.of("phone number", "name"), csv.getColumnHeaders());
        assertEquals(1, csv.size());
        assertEquals("07700900123", csv.get(0).getRecipient());
        assertFalse(csv.hasErrors());
    }

    @Test
    @DisplayName("Should read rows with unbalanced quotes instead of failing")
    void shouldReadRowsWithUnbalancedQuotes() {
        var csv = sms("phone number,name\n07700900123,O\"Brien x\n07700900124,y");

        assertEquals(2, csv.size());
        assertEquals("O\"Brien x", csv.get(0).get("name").getData());
        assertEquals("y", csv.get(1).get("name").getData());
        assertFalse(csv.hasErrors());
    }

    @Test
    @DisplayName("Should read a last row whose quoted value is never closed")
    void shouldReadRowWithOpenQuote() {
        var csv = sms("phone number,name\n07700900123,Jo\n07700900124,\"Bob");

        assertEquals(2, csv.size());
        assertEquals("Bob", csv.get(1).get("name").getData());
        assertFalse(csv.hasErrors());
    }

    @Test
    @DisplayName("Should report placeholders and recipient columns that are missing")
    void shouldReportMissingColumns() {
        var csv = recipientCsv("name,colour\nJo,red", TemplateType.SMS, "Hello ((name)) on ((day))").build();

        assertEquals(Set.of("day", "phone number"), csv.getMissingColumnHeaders());
        assertFalse(csv.hasRecipientColumns());
        assertTrue(csv.hasErrors());
    }

    @Test
    @DisplayName("Should mark missing placeholder values and ignore unknown columns")
    void shouldMarkMissingValues() {
        var csv = sms("phone number,name,shoe size\n07700900123");
        var row = csv.get(0);

        assertEquals(Cell.MISSING_FIELD_ERROR, row.get("name").getError());
        assertNull(row.get("shoe size").getError());
        assertTrue(row.get("shoe size").isIgnore());
        assertTrue(row.hasMissingData());
        assertFalse(row.hasBadRecipient());
        assertEquals(List.of(row), csv.getRowsWithMissingData());
    }

    @Test
    @DisplayName("Should report a missing recipient as missing rather than invalid")
    void shouldReportMissingRecipient() {
        var row = sms("phone number,name\n,Jo").get(0);

        assertEquals(Cell.MISSING_FIELD_ERROR, row.get("phone number").getError());
        assertFalse(row.hasBadRecipient());
        assertTrue(row.hasError());
    }

    @Test
    @DisplayName("Should suppress missing recipient errors when recipient columns are duplicated")
    void shouldSuppressMissingErrorsForDuplicateColumns() {
        var csv = sms("phone number,Phone_Number,name\n,,Jo");

        assertEquals(Set.of("phone number", "Phone_Number"), csv.getDuplicateRecipientColumnHeaders());
        assertNull(csv.get(0).get("phone number").getError());
        assertTrue(csv.hasErrors());
    }

    @Test
    @DisplayName("Should collect values from repeated personalisation columns")
    void shouldCollectRepeatedColumns() {
        var csv = recipientCsv("phone number,colour,Colour,COLOUR\n07700900123,red,,blue\n07700900124,,green,",
                TemplateType.SMS, "Colours: ((colour))").build();

        var first = csv.get(0).get("colour");
        var second = csv.get(1).get("colour");

        assertEquals(Arrays.asList("red", null, "blue"), first.getValues());
        assertEquals(Arrays.asList("red", null, "blue"), csv.get(0).getPersonalisation().get("colour"));
        assertEquals(Arrays.asList("green", null), second.getValues());
        assertTrue(second.isMultiValued());
    }

    @Test
    @DisplayName("Should keep values beyond the last header as extra values")
    void shouldKeepExtraValues() {
        var row = sms("phone number,name\n07700900123,Jo,extra one,extra two").get(0);

        assertEquals(List.of("extra one", "extra two"), row.getExtraValues());
        assertEquals(Set.of("phonenumber", "name"), row.getCells().keySet());
    }

    @Test
    @DisplayName("Should return an empty cell for columns the row does not have")
    void shouldReturnEmptyCellForUnknownColumn() {
        var row = sms("phone number,name\n07700900123,Jo").get(0);

        assertSame(Cell.empty(), row.get("favourite colour"));
        assertSame(Cell.empty(), row.get(null));
        assertEquals(2, row.getSpreadsheetRowNumber());
    }

    @Test
    @DisplayName("Should cap the number of rows read")
    void shouldCapRows() {
        var csv = recipientCsv(smsRows(3), TemplateType.SMS, "Hello ((name))")
                .maxRows(2)
                .build();

        assertEquals(3, csv.size());
        assertTrue(csv.isTooManyRows());
        assertNotNull(csv.get(1));
        assertNull(csv.get(2));
        assertTrue(csv.getRowsWithErrors().isEmpty());
        assertTrue(csv.hasErrors());
    }

    @Test
    @DisplayName("Should flag more rows than the remaining allowance")
    void shouldFlagMoreRowsThanCanSend() {
        var csv = recipientCsv(smsRows(2), TemplateType.SMS, "Hello ((name))")
                .remainingMessages(1L)
                .build();

        assertTrue(csv.isMoreRowsThanCanSend());
        assertFalse(csv.isTooManyRows());
        assertTrue(csv.hasErrors());
    }

    @Test
    @DisplayName("Should only send to guestlisted recipients when a guestlist is set")
    void shouldCheckGuestlist() {
        var allowed = recipientCsv("phone number,name\n07700900123,Jo", TemplateType.SMS, "Hello ((name))")
                .guestlist(List.of("+447700900123", "test@example.com"))
                .build();
        var notAllowed = recipientCsv("phone number,name\n07700900124,Sam", TemplateType.SMS, "Hello ((name))")
                .guestlist(List.of("+447700900123"))
                .build();

        assertTrue(allowed.isAllowedToSendTo());
        assertFalse(allowed.hasErrors());
        assertFalse(notAllowed.isAllowedToSendTo());
        assertTrue(notAllowed.hasErrors());
    }

    @Test
    @DisplayName("Should never restrict letters by guestlist")
    void shouldNotRestrictLetters() {
        var csv = recipientCsv(LETTER_HEADERS + "\nJo,1 High Street,Town,County,SW1A 1AA",
                TemplateType.LETTER, "Dear ((name))")
                .guestlist(List.of("someone else"))
                .build();

        assertTrue(csv.isAllowedToSendTo());
    }

    @Test
    @DisplayName("Should apply the international text message setting")
    void shouldApplyInternationalSmsSetting() {
        var file = "phone number,name\n+33 6 12 34 56 78,Jo";

        var ukOnly = recipientCsv(file, TemplateType.SMS, "Hello ((name))").build();
        var international = recipientCsv(file, TemplateType.SMS, "Hello ((name))")
                .allowInternationalSms(true)
                .build();

        assertEquals(RecipientErrorCode.NOT_A_UK_MOBILE.getMessage(), ukOnly.get(0).get("phone number").getError());
        assertFalse(international.hasErrors());
    }

    @Test
    @DisplayName("Should validate email recipients")
    void shouldValidateEmailRecipients() {
        var csv = recipientCsv("email address,name\ntest@example.com,Jo\nnot-an-email,Sam",
                TemplateType.EMAIL, "Hello ((name))").build();

        assertFalse(csv.get(0).hasError());
        assertEquals("Not a valid email address", csv.get(1).get("Email Address").getError());
        assertEquals(1, csv.getRowsWithBadRecipients().size());
    }

    @Test
    @DisplayName("Should skip all checks when validation is turned off")
    void shouldSkipValidation() {
        var csv = recipientCsv("phone number,name\nnot a number,\n", TemplateType.SMS, "((name))")
                .shouldValidate(false)
                .build();
        var row = csv.get(0);

        assertFalse(row.hasError());
        assertFalse(row.isMessageEmpty());
        assertNull(row.get("phone number").getError());
        assertFalse(csv.hasErrors());
    }

    @Test
    @DisplayName("Should flag text messages that are too long, but not emails")
    void shouldFlagLongMessages() {
        var body = "x".repeat(MessageTemplate.SMS_CHAR_COUNT_LIMIT + 1);

        var smsCsv = recipientCsv("phone number,body\n07700900123," + body, TemplateType.SMS, "((body))").build();
        var emailCsv = recipientCsv("email address,body\ntest@example.com," + body, TemplateType.EMAIL, "((body))")
                .build();

        assertEquals(1, smsCsv.getRowsWithMessageTooLong().size());
        assertTrue(smsCsv.get(0).hasErrorSpanningMultipleCells());
        assertTrue(emailCsv.getRowsWithMessageTooLong().isEmpty());
        assertFalse(emailCsv.hasErrors());
    }

    @Test
    @DisplayName("Should flag messages that render empty")
    void shouldFlagEmptyMessages() {
        var csv = recipientCsv("phone number,vip\n07700900123,\n07700900124,yes",
                TemplateType.SMS, "((vip??Welcome back))").build();

        assertEquals(List.of(csv.get(0)), csv.getRowsWithEmptyMessage());
        assertFalse(csv.get(1).hasError());
    }

    @Test
    @DisplayName("Should check letter addresses at row level")
    void shouldCheckLetterAddresses() {
        var csv = recipientCsv(LETTER_HEADERS + "\nJo,1 High Street,Town,County,SW1A 1AA\nSam,1 High Street,,,SW1A 1AA",
                TemplateType.LETTER, "Dear ((name))").build();

        assertTrue(csv.hasRecipientColumns());
        assertTrue(csv.getMissingColumnHeaders().isEmpty());
        assertFalse(csv.get(0).hasError());
        assertNull(csv.get(1).get("address line 2").getError());
        assertTrue(csv.get(1).hasBadPostalAddress());
        assertEquals(List.of(csv.get(1)), csv.getRowsWithBadRecipients());
        assertEquals(Arrays.asList("1 High Street", "Town", "County", null, null, null, "SW1A 1AA", null),
                csv.get(0).getRecipientValues());
    }

    @Test
    @DisplayName("Should accept international letters only when allowed")
    void shouldApplyInternationalLetterSetting() {
        var file = LETTER_HEADERS + "\nJo,1 Rue de Rivoli,Paris,France,";

        var ukOnly = recipientCsv(file, TemplateType.LETTER, "Dear ((name))").build();
        var international = recipientCsv(file, TemplateType.LETTER, "Dear ((name))")
                .allowInternationalLetters(true)
                .build();

        assertTrue(ukOnly.get(0).hasBadPostalAddress());
        assertFalse(international.get(0).hasBadPostalAddress());
    }

    @Test
    @DisplayName("Should need three address columns for letters")
    void shouldNeedThreeAddressColumns() {
        var csv = recipientCsv("name,address line 1,postcode\nJo,1 High Street,SW1A 1AA",
                TemplateType.LETTER, "Dear ((name))").build();

        assertFalse(csv.hasRecipientColumns());
    }

    @Test
    @DisplayName("Should flag letters with QR codes holding too much data")
    void shouldFlagBadQrCodes() {
        var csv = recipientCsv(LETTER_HEADERS + ",link\nJo,1 High Street,Town,County,SW1A 1AA," + "a".repeat(600),
                TemplateType.LETTER, "Dear ((name))\nqr: ((link))").build();

        assertEquals(1, csv.getRowsWithBadQrCodes().size());
        assertTrue(csv.hasErrors());
    }

    @Test
    @DisplayName("Should show the first rows, or the first rows with errors")
    void shouldChooseDisplayedRows() {
        var clean = sms(smsRows(15));
        var withErrors = recipientCsv(smsRows(15).replace("07700900003", "12").replace("07700900009", "34"),
                TemplateType.SMS, "Hello ((name))")
                .maxErrorsShown(1)
                .build();

        assertEquals(10, clean.getInitialRows().size());
        assertEquals(clean.getInitialRows(), clean.getDisplayedRows());
        assertEquals(2, withErrors.getRowsWithErrors().size());
        assertEquals(List.of(withErrors.get(3)), withErrors.getDisplayedRows());
    }

    @Test
    @DisplayName("Should stream rows lazily and keep the full list once read")
    void shouldCacheRows() {
        var csv = sms(smsRows(5));

        try (var rows = csv.streamRows()) {
            assertEquals(0, rows.findFirst().orElseThrow().getIndex());
        }
        assertSame(csv.getRows(), csv.getRows());
        assertEquals(5, csv.size());
        assertFalse(csv.hasErrors());
        assertFalse(csv.hasErrors());
    }

    @Test
    @DisplayName("Should reject a missing template or file")
    void shouldRejectMissingInputs() {
        assertThrows(NullPointerException.class,
                () -> recipientCsv("phone number", TemplateType.SMS, "Hi").template(null).build());
        assertThrows(NullPointerException.class,
                () -> recipientCsv(null, TemplateType.SMS, "Hi").build());
    }

    @Test
    @DisplayName("Should list placeholders followed by recipient columns")
    void shouldListPlaceholders() {
        var csv = sms("phone number,name\n07700900123,Jo");

        assertEquals(List.of("name", "phone number"), csv.getPlaceholders());
        assertEquals(List.of("phone number"), csv.getRecipientColumnHeaders());
    }
}
