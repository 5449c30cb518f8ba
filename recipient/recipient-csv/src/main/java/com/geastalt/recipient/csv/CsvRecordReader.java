/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reads CSV records one at a time using OpenCSV.
 *
 * <p>Comma separated, {@code "} quoted with doubled quotes inside quoted fields,
 * no escape character. Spaces at the start of a field are skipped and quoted
 * fields may span lines. Stray quotes are kept as text and a quoted field left
 * open at the end of the input ends there, so malformed quoting never fails a
 * read. Read failures surface as {@link UncheckedIOException}.
 */
@Slf4j
public class CsvRecordReader implements Iterator<List<String>>, Closeable {

    private final LenientCsvParser parser;
    private final CSVReader csvReader;
    private List<String> next;
    private boolean finished;
    private long recordsRead;

    public CsvRecordReader(String text) {
        this.parser = new LenientCsvParser();
        this.csvReader = new CSVReaderBuilder(new StringReader(text))
                .withCSVParser(parser)
                .withSkipLines(0)
                .build();
    }

    @Override
    public boolean hasNext() {
        if (next == null && !finished) {
            next = readNext();
            finished = next == null;
        }
        return next != null;
    }

    @Override
    public List<String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more CSV records");
        }
        List<String> record = next;
        next = null;
        return record;
    }

    public long getRecordsRead() {
        return recordsRead;
    }

    @Override
    public void close() {
        log.debug("Closing CSV reader after {} records", recordsRead);
        try {
            csvReader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close CSV reader", e);
        }
    }

    private List<String> readNext() {
        try {
            String[] fields = csvReader.readNext();
            if (fields == null) {
                return null;
            }
            recordsRead++;
            return Arrays.asList(fields);
        } catch (CsvMalformedLineException e) {
            if (!parser.isPending()) {
                log.error("Malformed CSV record #{}: {}", recordsRead + 1, e.getMessage());
                throw new UncheckedIOException("Failed to read CSV record", e);
            }
            log.warn("CSV record #{} has a quoted field left open at the end of the input", recordsRead + 1);
            recordsRead++;
            return Arrays.asList(parser.closePendingRecord());
        } catch (CsvValidationException e) {
            log.error("Error validating CSV record #{}: {}", recordsRead + 1, e.getMessage());
            throw new UncheckedIOException(new IOException("CSV validation error", e));
        } catch (IOException e) {
            log.error("Error reading CSV record #{}: {}", recordsRead + 1, e.getMessage());
            throw new UncheckedIOException("Failed to read CSV record", e);
        }
    }
}
