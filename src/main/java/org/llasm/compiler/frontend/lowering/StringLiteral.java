package org.llasm.compiler.frontend.lowering;

import java.util.Arrays;

/**
 * A decoded string literal. Literal content need not be valid text (binary blobs are common),
 * so both the raw bytes and their UTF-8 reading are kept.
 *
 * @param text The bytes read as UTF-8; malformed sequences are replaced.
 * @param bytes The raw bytes.
 */
public record StringLiteral(String text, byte[] bytes) {

    public StringLiteral {
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringLiteral that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "StringLiteral{" + IdentifierDecoder.quoteForMessage(text) + ", " + bytes.length + " bytes}";
    }
}
