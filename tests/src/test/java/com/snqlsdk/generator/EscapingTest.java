package com.snqlsdk.generator;

import com.snqlsdk.test.TestBase;
import com.snqlsdk.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Escaping}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Generator
@DisplayName("Escaping Tests")
public class EscapingTest extends TestBase {

    @Nested
    @DisplayName("Escape")
    class EscapeTests {

        @Test
        @DisplayName("Single-quoted strings escape only the single quote")
        void testSingleQuote() {
            assertThat(Escaping.quote("O'Reilly \"says\"", Escaping.SINGLE_QUOTE))
                .isEqualTo("'O\\'Reilly \"says\"'");
        }

        @Test
        @DisplayName("Double-quoted strings escape only the double quote")
        void testDoubleQuote() {
            assertThat(Escaping.quote("O'Reilly \"says\"", Escaping.DOUBLE_QUOTE))
                .isEqualTo("\"O'Reilly \\\"says\\\"\"");
        }

        @Test
        @DisplayName("Backslashes and whitespace controls use short escapes")
        void testShortEscapes() {
            assertThat(Escaping.escape("a\\b\nc\rd\te", Escaping.SINGLE_QUOTE))
                .isEqualTo("a\\\\b\\nc\\rd\\te");
        }

        @Test
        @DisplayName("Other control characters use hex escapes")
        void testHexEscapes() {
            assertThat(Escaping.escape("bell\u0007del\u007f", Escaping.SINGLE_QUOTE))
                .isEqualTo("bell\\x07del\\x7f");
        }

        @Test
        @DisplayName("Non-ASCII text is kept as is")
        void testUnicode() {
            assertThat(Escaping.escape("café 日本", Escaping.DOUBLE_QUOTE)).isEqualTo("café 日本");
        }
    }

    @Nested
    @DisplayName("Unescape")
    class UnescapeTests {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "plain",
            "it's",
            "say \"hi\"",
            "back\\slash",
            "tab\there\nnewline\rreturn",
            "nul\u0000bell\u0007",
            "trailing\\"
        })
        @DisplayName("Unescape reverses escape for both delimiters")
        void testInverse(String value) {
            assertThat(Escaping.unescape(Escaping.escape(value, '\''), '\'')).isEqualTo(value);
            assertThat(Escaping.unescape(Escaping.escape(value, '"'), '"')).isEqualTo(value);
        }

        @Test
        @DisplayName("An unescaped delimiter is rejected")
        void testUnescapedDelimiter() {
            assertThatThrownBy(() -> Escaping.unescape("a\"b", '"'))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unescaped delimiter");
        }

        @Test
        @DisplayName("The other quote character needs no escape")
        void testOtherQuote() {
            assertThat(Escaping.unescape("it's", '"')).isEqualTo("it's");
        }

        @Test
        @DisplayName("A dangling backslash is rejected")
        void testDanglingBackslash() {
            assertThatThrownBy(() -> Escaping.unescape("abc\\", '"'))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Dangling");
        }

        @Test
        @DisplayName("Unknown escape sequences are rejected")
        void testUnknownEscape() {
            assertThatThrownBy(() -> Escaping.unescape("a\\qb", '"'))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown escape sequence");
        }

        @Test
        @DisplayName("Malformed hex escapes are rejected")
        void testBadHex() {
            assertThatThrownBy(() -> Escaping.unescape("\\x4", '"'))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Truncated");
            assertThatThrownBy(() -> Escaping.unescape("\\xzz", '"'))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid");
        }
    }
}
