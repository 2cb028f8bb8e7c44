// file: core/src/main/java/io/diffserve/core/CanonicalJson.java
package io.diffserve.core;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Deterministic JSON encoding used for hashing and for stored chunks.
 * <p>
 * Rules:
 *  - object members are written sorted by name (String natural order),
 *  - numbers are normalized: integral values are written without a fraction,
 *    everything else as a BigDecimal with trailing zeros stripped,
 *  - no whitespace.
 * <p>
 * Two logically equal JSON values therefore always encode to identical bytes,
 * regardless of how they were parsed or built.
 */
public final class CanonicalJson {

    /** Shared mapper for parsing; ObjectMapper is thread-safe once configured. */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private static final JsonFactory FACTORY = MAPPER.getFactory();

    private CanonicalJson() {
    }

    public static JsonNodeFactory nodes() {
        return MAPPER.getNodeFactory();
    }

    /** Encode a JSON value canonically. */
    public static byte[] encode(JsonNode node) {
        var out = new ByteArrayOutputStream();
        try (JsonGenerator gen = FACTORY.createGenerator(out)) {
            write(gen, node);
        } catch (IOException e) {
            throw new UncheckedIOException("canonical encoding failed", e);
        }
        return out.toByteArray();
    }

    /** Parse bytes previously produced by {@link #encode(JsonNode)} (or any JSON). */
    public static JsonNode decode(byte[] bytes) {
        try {
            return MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("invalid JSON chunk", e);
        }
    }

    private static void write(JsonGenerator gen, JsonNode node) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            gen.writeNull();
        } else if (node.isObject()) {
            List<String> names = new ArrayList<>(node.size());
            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                names.add(it.next());
            }
            names.sort(null);
            gen.writeStartObject();
            for (String name : names) {
                gen.writeFieldName(name);
                write(gen, node.get(name));
            }
            gen.writeEndObject();
        } else if (node.isArray()) {
            gen.writeStartArray();
            for (JsonNode element : node) {
                write(gen, element);
            }
            gen.writeEndArray();
        } else if (node.isNumber()) {
            writeNumber(gen, node);
        } else if (node.isBoolean()) {
            gen.writeBoolean(node.booleanValue());
        } else if (node.isTextual()) {
            gen.writeString(node.textValue());
        } else if (node.isBinary()) {
            gen.writeBinary(node.binaryValue());
        } else {
            // POJO nodes and other exotic kinds never come out of the parser.
            throw new IllegalArgumentException("unsupported JSON node type: " + node.getNodeType());
        }
    }

    private static void writeNumber(JsonGenerator gen, JsonNode node) throws IOException {
        if (node.isIntegralNumber()) {
            gen.writeNumber(node.bigIntegerValue());
            return;
        }
        if (node.isDouble() || node.isFloat()) {
            double d = node.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("non-finite number in JSON value");
            }
        }
        BigDecimal normalized = node.decimalValue().stripTrailingZeros();
        if (normalized.scale() <= 0) {
            gen.writeNumber(normalized.toBigIntegerExact());
        } else {
            gen.writeNumber(normalized);
        }
    }
}
