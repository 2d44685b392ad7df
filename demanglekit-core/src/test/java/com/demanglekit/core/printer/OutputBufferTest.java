package com.demanglekit.core.printer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OutputBuffer}.
 */
class OutputBufferTest {

    @Test
    void appendUnsigned_largeValue_isNotNegative() {
        OutputBuffer out = new OutputBuffer();

        out.appendUnsigned(-1L);

        assertThat(out.toString()).isEqualTo("18446744073709551615");
    }

    @Test
    void appendHex_isUpperCaseWithoutPrefix() {
        OutputBuffer out = new OutputBuffer();

        out.appendHex(0xabcdefL).append(' ').appendHex(0);

        assertThat(out.toString()).isEqualTo("ABCDEF 0");
    }

    @Test
    void appendQuoted_escapesControlCharacters() {
        OutputBuffer out = new OutputBuffer();

        out.appendQuoted("a\\b\tc\nd\re\"f\0g\u0001");

        assertThat(out.toString()).isEqualTo("\"a\\\\b\\tc\\nd\\re\\\"f\\0g\\x01\"");
    }

    @Test
    void appendQuoted_nonAscii_isWrittenAsUtf8Bytes() {
        OutputBuffer out = new OutputBuffer();

        out.appendQuoted("é");

        assertThat(out.toString()).isEqualTo("\"\\xC3\\xA9\"");
    }

    @Test
    void length_tracksAppendedText() {
        OutputBuffer out = new OutputBuffer();

        out.append("abc").append('d');

        assertThat(out.length()).isEqualTo(4);
    }
}
