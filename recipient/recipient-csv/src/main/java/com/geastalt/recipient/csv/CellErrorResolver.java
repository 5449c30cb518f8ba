/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.csv;

import java.util.List;

/**
 * Works out the error message for one cell, or null if the cell is fine.
 */
@FunctionalInterface
public interface CellErrorResolver {

    String resolve(String columnKey, List<String> values);
}
