// file: core/src/main/java/io/diffserve/core/Checksum.java
package io.diffserve.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Order-independent content checksum of a snapshot.
 * <p>
 * Each entry contributes SHA-256(int32 len(key) || key || canonical(value)); the
 * entry digests are combined as a multiset hash (see {@link ChecksumAccumulator})
 * and the combined state is rendered as a SHA-256 digest.
 * <p>
 * Properties:
 *  - depends only on the set of (key, value) pairs, never on insertion order,
 *  - entries can be folded in and out, so snapshots maintain it incrementally,
 *  - finding two different sets with the same checksum is as hard as the
 *    discrete log problem in a 3072-bit prime field,
 *  - the empty snapshot has the all-zero checksum.
 * <p>
 * Instances are immutable; the string form is 64 lowercase hex characters.
 */
public final class Checksum {
    public static final int BYTE_LEN = 32;
    public static final int STRING_LEN = BYTE_LEN * 2;

    private static final Pattern PATTERN = Pattern.compile("^[0-9a-f]{64}$");
    private static final HexFormat HEX = HexFormat.of();
    private static final Checksum EMPTY = new Checksum(new byte[BYTE_LEN]);

    private final byte[] value;

    private Checksum(byte[] value) {
        this.value = value;
    }

    public static Checksum empty() {
        return EMPTY;
    }

    /** True if s is 64 hex characters. Upper-case input is rejected. */
    public static boolean isValid(String s) {
        return s != null && PATTERN.matcher(s).matches();
    }

    public static Checksum parse(String s) {
        if (!isValid(s)) {
            throw new IllegalArgumentException("invalid checksum: " + s);
        }
        return new Checksum(HEX.parseHex(s));
    }

    static Checksum of(byte[] value) {
        Objects.requireNonNull(value, "value");
        if (value.length != BYTE_LEN) {
            throw new IllegalArgumentException("checksum must be " + BYTE_LEN + " bytes");
        }
        return new Checksum(Arrays.copyOf(value, BYTE_LEN));
    }

    /**
     * Digest of a single entry. Snapshots keep these around so diffs can compare
     * values without re-encoding them.
     */
    public static byte[] entryDigest(String key, byte[] canonicalValue) {
        byte[] k = key.getBytes(StandardCharsets.UTF_8);
        MessageDigest md = sha256();
        md.update(ByteBuffer.allocate(4).putInt(k.length).array());
        md.update(k);
        md.update(canonicalValue);
        return md.digest();
    }

    @Override
    public String toString() {
        return HEX.formatHex(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Checksum other)) return false;
        return MessageDigest.isEqual(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    static MessageDigest sha256() {
        return digest("SHA-256");
    }

    static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
