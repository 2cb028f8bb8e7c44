// file: core/src/main/java/io/diffserve/core/patch/PatchOp.java
package io.diffserve.core.patch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Objects;

/**
 * Single JSON-Patch style operation against a snapshot.
 * <p>
 * Paths are JSON Pointers (RFC 6901) of depth one: "/" + escaped key, where
 * '~' becomes "~0" and '/' becomes "~1". The bare path "/" addresses the whole
 * document and is only ever used by {@code remove}.
 * <p>
 * Wire form:
 *   {"op":"add","path":"/foo","value":"bar"}
 *   {"op":"remove","path":"/foo"}
 * "value" is omitted for removes and written (possibly as null) for adds.
 */
@JsonSerialize(using = PatchOp.Serializer.class)
public record PatchOp(Op op, String path, JsonNode value) {

    public static final String ROOT = "/";

    public PatchOp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(path, "path");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        if (op == Op.ADD && value == null) {
            throw new IllegalArgumentException("add requires a value");
        }
        if (op == Op.REMOVE && value != null) {
            throw new IllegalArgumentException("remove takes no value");
        }
    }

    public static PatchOp add(String key, JsonNode value) {
        return new PatchOp(Op.ADD, pathFor(key), value);
    }

    public static PatchOp remove(String key) {
        return new PatchOp(Op.REMOVE, pathFor(key), null);
    }

    public static PatchOp removeAll() {
        return new PatchOp(Op.REMOVE, ROOT, null);
    }

    public boolean isRoot() {
        return ROOT.equals(path);
    }

    /** Key addressed by this op. Not valid for the root path. */
    public String key() {
        if (isRoot()) {
            throw new IllegalStateException("root path has no key");
        }
        String raw = path.substring(1);
        if (raw.indexOf('/') >= 0) {
            throw new IllegalArgumentException("nested paths are not supported: " + path);
        }
        return raw.replace("~1", "/").replace("~0", "~");
    }

    static String pathFor(String key) {
        Objects.requireNonNull(key, "key");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        return "/" + key.replace("~", "~0").replace("/", "~1");
    }

    public static final class Serializer extends StdSerializer<PatchOp> {

        public Serializer() {
            super(PatchOp.class);
        }

        @Override
        public void serialize(PatchOp op, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("op", op.op().wire());
            gen.writeStringField("path", op.path());
            if (op.value() != null) {
                gen.writeFieldName("value");
                gen.writeTree(op.value());
            }
            gen.writeEndObject();
        }
    }

    public enum Op {
        ADD("add"),
        REMOVE("remove");

        private final String wire;

        Op(String wire) {
            this.wire = wire;
        }

        @JsonValue
        public String wire() {
            return wire;
        }

        @JsonCreator
        public static Op fromWire(String s) {
            for (Op op : values()) {
                if (op.wire.equals(s)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("unsupported patch op: " + s);
        }
    }
}
