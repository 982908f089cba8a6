package org.llasm.compiler.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * The quoting rule shared by quoted identifiers and string literals.
 * <p>
 * Inside quotes, a backslash followed by two hex digits denotes one byte and {@code \\} denotes a
 * single backslash. Any other backslash is kept as is. Source characters outside the escapes
 * contribute their UTF-8 bytes.
 */
public final class EscapeCodec {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private EscapeCodec() {}

    /**
     * @param s A spelling that may be quoted.
     * @return {@code true} if {@code s} is at least two characters long and both starts and ends with {@code "}.
     */
    public static boolean isQuoted(String s) {
        return s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"");
    }

    /**
     * Strips the surrounding quotes of a quoted spelling and unescapes its content.
     *
     * @param quoted The quoted spelling, including the quotes.
     * @return The raw bytes denoted by the spelling.
     * @throws IllegalArgumentException if {@code quoted} is not quoted.
     */
    public static byte[] unquote(String quoted) {
        if (!isQuoted(quoted)) {
            throw new IllegalArgumentException("not a quoted string: " + quoted);
        }
        return unescape(quoted.substring(1, quoted.length() - 1));
    }

    /**
     * Unescapes the content of a quoted spelling (without the quotes).
     *
     * @param s The escaped content.
     * @return The raw bytes.
     */
    public static byte[] unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s.getBytes(StandardCharsets.UTF_8);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(s.length());
        int start = 0;
        int i = 0;
        while (i < s.length()) {
            if (s.charAt(i) != '\\') {
                i++;
                continue;
            }
            out.writeBytes(s.substring(start, i).getBytes(StandardCharsets.UTF_8));
            if (i + 1 < s.length() && s.charAt(i + 1) == '\\') {
                out.write('\\');
                i += 2;
            } else if (i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.write(Character.digit(s.charAt(i + 1), 16) << 4 | Character.digit(s.charAt(i + 2), 16));
                i += 3;
            } else {
                out.write('\\');
                i++;
            }
            start = i;
        }
        out.writeBytes(s.substring(start).getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    /**
     * Escapes raw bytes so that {@link #unescape(String)} reproduces them. Printable ASCII other than
     * {@code "} and {@code \} is kept, every other byte becomes {@code \XX}.
     *
     * @param bytes The raw bytes.
     * @return The escaped content, without quotes.
     */
    public static String escape(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c >= 0x20 && c <= 0x7E && c != '"' && c != '\\') {
                sb.append((char) c);
            } else {
                sb.append('\\').append(HEX[c >> 4]).append(HEX[c & 0xF]);
            }
        }
        return sb.toString();
    }

    /**
     * @param bytes The raw bytes.
     * @return The escaped content surrounded by quotes.
     */
    public static String quote(byte[] bytes) {
        return '"' + escape(bytes) + '"';
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
