/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.billing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * International billing rates keyed by dialing prefix. Prefixes overlap (for
 * example {@code 1} and {@code 1664} for Montserrat), so lookups always pick the
 * longest prefix the number starts with.
 */
@Slf4j
public class BillingRateTable {

    public static final String DEFAULT_RESOURCE = "international_billing_rates.yml";

    private final Map<String, BillingRate> ratesByPrefix;
    private final List<String> prefixesLongestFirst;

    public BillingRateTable(Map<String, BillingRate> ratesByPrefix) {
        if (ratesByPrefix == null || ratesByPrefix.isEmpty()) {
            throw new IllegalArgumentException("Billing rates must not be empty");
        }
        this.ratesByPrefix = Map.copyOf(ratesByPrefix);
        this.prefixesLongestFirst = ratesByPrefix.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    /**
     * Loads the table from a YAML resource on the classpath.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static BillingRateTable fromClasspath(String resource) {
        ClassLoader classLoader = BillingRateTable.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Billing rates resource not found: " + resource);
            }
            Map<String, BillingRate> rates = new YAMLMapper()
                    .readValue(in, new TypeReference<LinkedHashMap<String, BillingRate>>() {});
            log.info("Loaded {} billing rate prefixes from {}", rates.size(), resource);
            return new BillingRateTable(rates);
        } catch (IOException e) {
            log.error("Failed to read billing rates from {}: {}", resource, e.getMessage());
            throw new IllegalStateException("Failed to read billing rates from " + resource, e);
        }
    }

    /**
     * Returns the longest known prefix that the given digits start with.
     */
    public Optional<String> findLongestPrefix(String digits) {
        if (digits == null) {
            return Optional.empty();
        }
        return prefixesLongestFirst.stream()
                .filter(digits::startsWith)
                .findFirst();
    }

    public Optional<BillingRate> getRate(String prefix) {
        return Optional.ofNullable(ratesByPrefix.get(prefix));
    }

    /**
     * Gets the rate for a prefix that is known to be in the table.
     *
     * @throws IllegalArgumentException if the prefix is unknown
     */
    public BillingRate getRequiredRate(String prefix) {
        return getRate(prefix)
                .orElseThrow(() -> new IllegalArgumentException("Unknown billing prefix: " + prefix));
    }

    public boolean isKnownPrefix(String prefix) {
        return ratesByPrefix.containsKey(prefix);
    }

    /**
     * All known prefixes, longest first.
     */
    public List<String> getPrefixes() {
        return prefixesLongestFirst;
    }
}
