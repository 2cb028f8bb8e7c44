// file: core/src/main/java/io/diffserve/core/patch/Patch.java
package io.diffserve.core.patch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.diffserve.core.Snapshot;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable sequence of {@link PatchOp}s.
 * <p>
 * Order matters: a {@code remove "/"} must run before the adds that rebuild the
 * document, and removals of changed keys run before their re-adds.
 * Serializes as a bare JSON array.
 */
public final class Patch implements Iterable<PatchOp> {

    private static final Patch EMPTY = new Patch(List.of());

    private final List<PatchOp> ops;

    private Patch(List<PatchOp> ops) {
        this.ops = ops;
    }

    public static Patch empty() {
        return EMPTY;
    }

    @JsonCreator
    public static Patch of(List<PatchOp> ops) {
        Objects.requireNonNull(ops, "ops");
        return ops.isEmpty() ? EMPTY : new Patch(List.copyOf(ops));
    }

    @JsonValue
    public List<PatchOp> ops() {
        return ops;
    }

    public int size() {
        return ops.size();
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    @Override
    public Iterator<PatchOp> iterator() {
        return ops.iterator();
    }

    /**
     * Apply this patch to a snapshot and return the result.
     * <p>
     * Strict semantics:
     *  - remove "/" clears the document,
     *  - remove "/k" requires k to exist,
     *  - add "/k" inserts or overwrites k,
     *  - add "/" is rejected.
     *
     * @throws IllegalArgumentException if an op cannot be applied
     */
    public Snapshot apply(Snapshot base) {
        Objects.requireNonNull(base, "base");
        if (ops.isEmpty()) {
            return base;
        }
        Snapshot.Builder b = base.toBuilder();
        for (PatchOp op : ops) {
            switch (op.op()) {
                case REMOVE -> {
                    if (op.isRoot()) {
                        b.clear();
                    } else {
                        String key = op.key();
                        if (!b.containsKey(key)) {
                            throw new IllegalArgumentException("cannot remove missing path " + op.path());
                        }
                        b.remove(key);
                    }
                }
                case ADD -> {
                    if (op.isRoot()) {
                        throw new IllegalArgumentException("add on the document root is not supported");
                    }
                    b.put(op.key(), op.value());
                }
            }
        }
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Patch other && ops.equals(other.ops);
    }

    @Override
    public int hashCode() {
        return ops.hashCode();
    }

    @Override
    public String toString() {
        return "Patch" + ops;
    }
}
