// file: core/src/main/java/io/diffserve/core/Hash.java
package io.diffserve.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Content address of a stored chunk.
 * <p>
 * Layout:
 *  - 20 bytes: the first 20 bytes of SHA-512(chunk).
 *  - String form: 32 chars of base32 over the alphabet "0-9a-v" (5 bits per char,
 *    160 bits total, so no padding).
 * <p>
 * Hashes double as the stateIDs handed to clients, so the string form is the only
 * representation that ever leaves the process. They are comparable for equality only.
 */
public final class Hash {
    public static final int BYTE_LEN = 20;
    public static final int STRING_LEN = 32;

    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuv".toCharArray();
    private static final Pattern PATTERN = Pattern.compile("^[0-9a-v]{32}$");

    private final byte[] digest;

    private Hash(byte[] digest) {
        this.digest = digest;
    }

    /** Hash a chunk of bytes. */
    public static Hash of(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        byte[] full = newSha512().digest(chunk);
        return new Hash(Arrays.copyOf(full, BYTE_LEN));
    }

    /** Wrap raw digest bytes, e.g. when decoding a stored record. */
    public static Hash fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != BYTE_LEN) {
            throw new IllegalArgumentException("hash must be " + BYTE_LEN + " bytes, got " + bytes.length);
        }
        return new Hash(Arrays.copyOf(bytes, BYTE_LEN));
    }

    /** True if s is a syntactically valid hash string. */
    public static boolean isValid(String s) {
        return s != null && PATTERN.matcher(s).matches();
    }

    /**
     * Parse the 32-char string form.
     *
     * @throws IllegalArgumentException if s is not a valid hash string
     */
    public static Hash parse(String s) {
        if (!isValid(s)) {
            throw new IllegalArgumentException("invalid hash: " + s);
        }
        byte[] out = new byte[BYTE_LEN];
        long buffer = 0;
        int bits = 0;
        int pos = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            int v = c <= '9' ? c - '0' : c - 'a' + 10;
            buffer = (buffer << 5) | v;
            bits += 5;
            if (bits >= 8) {
                bits -= 8;
                out[pos++] = (byte) (buffer >>> bits);
            }
        }
        return new Hash(out);
    }

    public byte[] bytes() {
        return Arrays.copyOf(digest, BYTE_LEN);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(STRING_LEN);
        long buffer = 0;
        int bits = 0;
        for (byte b : digest) {
            buffer = (buffer << 8) | (b & 0xff);
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                sb.append(ALPHABET[(int) (buffer >>> bits) & 0x1f]);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash other)) return false;
        return Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    private static MessageDigest newSha512() {
        try {
            return MessageDigest.getInstance("SHA-512");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
