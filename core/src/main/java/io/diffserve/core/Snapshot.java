// file: core/src/main/java/io/diffserve/core/Snapshot.java
package io.diffserve.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable key -> JSON value map with an eagerly computed {@link Checksum}.
 * <p>
 * Invariants:
 *  - keys are non-empty strings, held in String natural order (the canonical order
 *    for diffing, checksumming and serialization),
 *  - values are deep-copied on the way in; values handed out by {@link #entries()}
 *    and {@link #get(String)} are shared and must be treated as read-only,
 *  - every entry carries its digest, so two snapshots can be compared entry by entry
 *    without re-encoding values,
 *  - the checksum is a pure function of the (key, value) set.
 */
public final class Snapshot implements Iterable<Snapshot.Entry> {

    private static final Snapshot EMPTY =
            new Snapshot(Collections.emptyNavigableMap(), new ChecksumAccumulator());

    private final NavigableMap<String, Entry> entries;
    // normalized; copied before a builder touches it
    private final ChecksumAccumulator accumulator;
    private final Checksum checksum;

    private Snapshot(NavigableMap<String, Entry> entries, ChecksumAccumulator accumulator) {
        this.entries = entries;
        this.accumulator = accumulator;
        this.checksum = accumulator.checksum();
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    /** Build a snapshot from an arbitrary map. Iteration order of the input is irrelevant. */
    public static Snapshot of(Map<String, ? extends JsonNode> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        Builder b = new Builder();
        for (Map.Entry<String, ? extends JsonNode> e : pairs.entrySet()) {
            b.put(e.getKey(), e.getValue());
        }
        return b.build();
    }

    /**
     * Build a snapshot from a JSON object, e.g. a client view.
     *
     * @throws IllegalArgumentException if the node is not an object
     */
    public static Snapshot fromJson(JsonNode object) {
        if (object == null || !object.isObject()) {
            throw new IllegalArgumentException("snapshot must be a JSON object");
        }
        Builder b = new Builder();
        object.fields().forEachRemaining(e -> b.put(e.getKey(), e.getValue()));
        return b.build();
    }

    /** The snapshot as a JSON object with members in key order. */
    public ObjectNode toJson() {
        ObjectNode out = CanonicalJson.nodes().objectNode();
        for (Entry e : entries.values()) {
            out.set(e.key(), e.value().deepCopy());
        }
        return out;
    }

    /** Canonical bytes of {@link #toJson()}; this is what the content store hashes. */
    public byte[] encode() {
        return CanonicalJson.encode(toJson());
    }

    public Checksum checksum() {
        return checksum;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    /** Value for key, or null if absent. */
    public JsonNode get(String key) {
        Entry e = entries.get(key);
        return e == null ? null : e.value();
    }

    public NavigableSet<String> keys() {
        return Collections.unmodifiableNavigableSet(entries.navigableKeySet());
    }

    /** Entries in key order. */
    public Iterable<Entry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    @Override
    public Iterator<Entry> iterator() {
        return entries().iterator();
    }

    public Snapshot with(String key, JsonNode value) {
        return toBuilder().put(key, value).build();
    }

    public Snapshot without(String key) {
        return toBuilder().remove(key).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /** Content equality: same keys, and every value has the same canonical form. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot other)) return false;
        if (!checksum.equals(other.checksum) || entries.size() != other.entries.size()) return false;
        Iterator<Entry> a = entries.values().iterator();
        Iterator<Entry> b = other.entries.values().iterator();
        while (a.hasNext()) {
            Entry x = a.next();
            Entry y = b.next();
            if (!x.key().equals(y.key()) || !x.sameValue(y)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return checksum.hashCode();
    }

    @Override
    public String toString() {
        return "Snapshot{size=" + entries.size() + ", checksum=" + checksum + "}";
    }

    /**
     * One key/value pair plus the digest folded into the checksum.
     * The digest bytes are shared; callers must not mutate them.
     */
    public record Entry(String key, JsonNode value, byte[] digest) {

        public boolean sameValue(Entry other) {
            return Arrays.equals(digest, other.digest);
        }

        /** Equal when keys match and the values have the same canonical form. */
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry other)) return false;
            return key.equals(other.key) && sameValue(other);
        }

        @Override
        public int hashCode() {
            return 31 * key.hashCode() + Arrays.hashCode(digest);
        }

        @Override
        public String toString() {
            return "Entry{" + key + "=" + value + "}";
        }
    }

    /**
     * Mutable builder that keeps the checksum up to date on every change,
     * so applying a patch costs O(changed entries) hashing.
     */
    public static final class Builder {
        private final TreeMap<String, Entry> entries;
        private ChecksumAccumulator accumulator;

        public Builder() {
            this.entries = new TreeMap<>();
            this.accumulator = new ChecksumAccumulator();
        }

        private Builder(Snapshot from) {
            this.entries = new TreeMap<>(from.entries);
            this.accumulator = from.accumulator.copy();
        }

        public Builder put(String key, JsonNode value) {
            Objects.requireNonNull(key, "key");
            if (key.isEmpty()) {
                throw new IllegalArgumentException("key must not be empty");
            }
            JsonNode copy = value == null ? CanonicalJson.nodes().nullNode() : value.deepCopy();
            byte[] digest = Checksum.entryDigest(key, CanonicalJson.encode(copy));
            Entry previous = entries.put(key, new Entry(key, copy, digest));
            if (previous != null) {
                accumulator.remove(previous.digest());
            }
            accumulator.add(digest);
            return this;
        }

        public Builder remove(String key) {
            Entry previous = entries.remove(key);
            if (previous != null) {
                accumulator.remove(previous.digest());
            }
            return this;
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public Builder clear() {
            entries.clear();
            accumulator = new ChecksumAccumulator();
            return this;
        }

        public Snapshot build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new Snapshot(Collections.unmodifiableNavigableMap(new TreeMap<>(entries)),
                    accumulator.copy().normalize());
        }
    }
}
