// file: core/src/main/java/io/diffserve/core/patch/SnapshotDiff.java
package io.diffserve.core.patch;

import io.diffserve.core.Snapshot;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Computes the ordered patch that turns one snapshot into another.
 * <p>
 * Output shape:
 *  - base == null: {@code remove "/"}, then one add per target key (full bootstrap).
 *  - equal content: empty patch. Matching checksums alone are not trusted;
 *    the entries are compared before the patch is skipped.
 *  - otherwise two groups, each in key order:
 *      1) removes for keys deleted from base or whose value changed,
 *      2) adds for keys new in target or whose value changed.
 *    A changed value is therefore always a remove/add pair on the same path;
 *    no replace op is ever emitted.
 * <p>
 * Both snapshots are walked once, in parallel, in key order, comparing entry
 * digests. Cost is linear in the number of distinct keys and no value is
 * re-encoded. The same (base, target) pair always yields an identical patch.
 */
public final class SnapshotDiff {

    private SnapshotDiff() {
    }

    public static Patch diff(Snapshot base, Snapshot target) {
        Objects.requireNonNull(target, "target");
        if (base == null) {
            return bootstrap(target);
        }
        if (base.equals(target)) {
            return Patch.empty();
        }

        List<PatchOp> removes = new ArrayList<>();
        List<PatchOp> adds = new ArrayList<>();

        Iterator<Snapshot.Entry> left = base.iterator();
        Iterator<Snapshot.Entry> right = target.iterator();
        Snapshot.Entry l = next(left);
        Snapshot.Entry r = next(right);

        while (l != null || r != null) {
            int cmp;
            if (l == null) {
                cmp = 1;
            } else if (r == null) {
                cmp = -1;
            } else {
                cmp = l.key().compareTo(r.key());
            }

            if (cmp < 0) {
                // only in base
                removes.add(PatchOp.remove(l.key()));
                l = next(left);
            } else if (cmp > 0) {
                // only in target
                adds.add(PatchOp.add(r.key(), r.value()));
                r = next(right);
            } else {
                if (!l.sameValue(r)) {
                    removes.add(PatchOp.remove(l.key()));
                    adds.add(PatchOp.add(r.key(), r.value()));
                }
                l = next(left);
                r = next(right);
            }
        }

        List<PatchOp> ops = new ArrayList<>(removes.size() + adds.size());
        ops.addAll(removes);
        ops.addAll(adds);
        return Patch.of(ops);
    }

    /** Full replacement: clear the document, then add every key of target. */
    public static Patch bootstrap(Snapshot target) {
        Objects.requireNonNull(target, "target");
        List<PatchOp> ops = new ArrayList<>(target.size() + 1);
        ops.add(PatchOp.removeAll());
        for (Snapshot.Entry e : target) {
            ops.add(PatchOp.add(e.key(), e.value()));
        }
        return Patch.of(ops);
    }

    private static Snapshot.Entry next(Iterator<Snapshot.Entry> it) {
        return it.hasNext() ? it.next() : null;
    }
}
