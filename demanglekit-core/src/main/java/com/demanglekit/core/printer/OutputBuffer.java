package com.demanglekit.core.printer;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Append-only text accumulator owned by a single render.
 *
 * <p>Numbers are written as unsigned decimal or upper-case hex. Quoted strings use C-style
 * escapes; any byte outside printable ASCII is written as {@code \xHH}.
 */
final class OutputBuffer {

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private final StringBuilder text = new StringBuilder();

    OutputBuffer append(String value) {
        text.append(value);
        return this;
    }

    OutputBuffer append(char value) {
        text.append(value);
        return this;
    }

    /**
     * Appends {@code value} as an unsigned decimal number.
     */
    OutputBuffer appendUnsigned(long value) {
        text.append(Long.toUnsignedString(value));
        return this;
    }

    /**
     * Appends {@code value} as an unsigned upper-case hex number without prefix.
     */
    OutputBuffer appendHex(long value) {
        text.append(Long.toHexString(value).toUpperCase(Locale.ROOT));
        return this;
    }

    /**
     * Appends {@code value} in double quotes, escaping backslash, tab, newline, carriage
     * return, double quote and NUL, and every other control or non-ASCII byte as {@code \xHH}.
     */
    OutputBuffer appendQuoted(String value) {
        text.append('"');
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            switch (c) {
                case '\\' -> text.append("\\\\");
                case '\t' -> text.append("\\t");
                case '\n' -> text.append("\\n");
                case '\r' -> text.append("\\r");
                case '"' -> text.append("\\\"");
                case 0 -> text.append("\\0");
                default -> {
                    if (c < 0x20 || c >= 0x7F) {
                        text.append("\\x").append(HEX_DIGITS[c >> 4]).append(HEX_DIGITS[c & 0xF]);
                    } else {
                        text.append((char) c);
                    }
                }
            }
        }
        text.append('"');
        return this;
    }

    int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
