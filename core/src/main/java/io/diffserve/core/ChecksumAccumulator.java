// file: core/src/main/java/io/diffserve/core/ChecksumAccumulator.java
package io.diffserve.core;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * Multiplicative multiset hash (MuHash) over the prime field p = 2^3072 - 1103717.
 * <p>
 * Every entry digest is expanded to a 3072-bit field element with SHA-512 in
 * counter mode. Adding an entry multiplies it into the numerator, removing one
 * multiplies it into the denominator; the set value is numerator / denominator.
 * Multiplication commutes, so the result ignores order, and removal only needs
 * one modular inverse when the value is finally read.
 * <p>
 * Not thread-safe; owned by a single {@link Snapshot.Builder} at a time.
 */
final class ChecksumAccumulator {

    static final BigInteger PRIME = BigInteger.ONE.shiftLeft(3072).subtract(BigInteger.valueOf(1103717));

    private static final int ELEMENT_BYTES = 384;
    private static final int EXPAND_BLOCKS = ELEMENT_BYTES / 64;

    private BigInteger numerator;
    private BigInteger denominator;
    private int count;

    ChecksumAccumulator() {
        this(BigInteger.ONE, BigInteger.ONE, 0);
    }

    private ChecksumAccumulator(BigInteger numerator, BigInteger denominator, int count) {
        this.numerator = numerator;
        this.denominator = denominator;
        this.count = count;
    }

    ChecksumAccumulator copy() {
        return new ChecksumAccumulator(numerator, denominator, count);
    }

    ChecksumAccumulator add(byte[] entryDigest) {
        numerator = numerator.multiply(element(entryDigest)).mod(PRIME);
        count++;
        return this;
    }

    ChecksumAccumulator remove(byte[] entryDigest) {
        denominator = denominator.multiply(element(entryDigest)).mod(PRIME);
        count--;
        return this;
    }

    /** Fold the denominator into the numerator so later reads skip the inverse. */
    ChecksumAccumulator normalize() {
        if (!denominator.equals(BigInteger.ONE)) {
            numerator = numerator.multiply(denominator.modInverse(PRIME)).mod(PRIME);
            denominator = BigInteger.ONE;
        }
        return this;
    }

    Checksum checksum() {
        if (count == 0) {
            return Checksum.empty();
        }
        normalize();
        return Checksum.of(Checksum.sha256().digest(toFixedBytes(numerator)));
    }

    static BigInteger element(byte[] entryDigest) {
        Objects.requireNonNull(entryDigest, "entryDigest");
        if (entryDigest.length != Checksum.BYTE_LEN) {
            throw new IllegalArgumentException("entry digest must be " + Checksum.BYTE_LEN + " bytes");
        }
        byte[] wide = new byte[ELEMENT_BYTES];
        MessageDigest md = Checksum.digest("SHA-512");
        for (int i = 0; i < EXPAND_BLOCKS; i++) {
            md.update(entryDigest);
            md.update((byte) i);
            System.arraycopy(md.digest(), 0, wide, i * 64, 64);
        }
        BigInteger e = new BigInteger(1, wide).mod(PRIME);
        // zero has no inverse; the chance of hitting it is 2^-3072
        return e.signum() == 0 ? BigInteger.ONE : e;
    }

    private static byte[] toFixedBytes(BigInteger v) {
        byte[] raw = v.toByteArray();
        byte[] out = new byte[ELEMENT_BYTES];
        int n = Math.min(raw.length, ELEMENT_BYTES);
        System.arraycopy(raw, raw.length - n, out, ELEMENT_BYTES - n, n);
        return out;
    }
}
