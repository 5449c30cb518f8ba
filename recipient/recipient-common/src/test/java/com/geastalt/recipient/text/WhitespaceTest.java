/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class WhitespaceTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "  hello  ",
            "\thello\n",
            "hel\u200Blo",
            "\uFEFFhello\u200D",
            "\u180Ehello\u2060 "
    })
    @DisplayName("Should strip ASCII whitespace and remove zero-width characters")
    void shouldStripAndRemoveObscureWhitespace(String value) {
        assertEquals("hello", Whitespace.stripAndRemoveObscureWhitespace(value));
    }

    @Test
    @DisplayName("Should keep no-break spaces inside the value")
    void shouldKeepInnerNoBreakSpace() {
        assertEquals("a\u00A0b", Whitespace.stripAndRemoveObscureWhitespace(" a\u00A0b "));
    }

    @Test
    @DisplayName("Should pass null and empty values through")
    void shouldPassNullAndEmptyThrough() {
        assertNull(Whitespace.stripAndRemoveObscureWhitespace(null));
        assertEquals("", Whitespace.stripAndRemoveObscureWhitespace(""));
    }

    @Test
    @DisplayName("Should strip every kind of whitespace and extra characters from the ends")
    void shouldStripAllWithExtraCharacters() {
        assertEquals("a, b", Whitespace.stripAll("\u00A0,\n a, b ,,\u202F", ","));
    }

    @Test
    @DisplayName("Should remove characters anywhere in the value")
    void shouldRemoveCharacters() {
        assertEquals("07700900123", Whitespace.removeCharacters("(07700) 900-123", "() -"));
    }
}
