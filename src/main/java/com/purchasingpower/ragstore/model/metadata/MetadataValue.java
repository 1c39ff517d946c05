package com.purchasingpower.ragstore.model.metadata;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One value of a chunk's open metadata mapping.
 *
 * <p>Metadata is opaque to the store: it is kept as a tree of tagged values and
 * written back exactly as it was received. The only place the store looks
 * inside it is keyword scoring, which reads the scalar leaves through
 * {@link #appendText(StringBuilder)}.
 *
 * <p>Example:
 * <pre>
 * Map&lt;String, MetadataValue&gt; metadata = Map.of(
 *     "source", MetadataValue.of("alpha"),
 *     "chunk_index", MetadataValue.of(3),
 *     "topics", MetadataValue.array(List.of(MetadataValue.of("risk"))));
 * </pre>
 */
@JsonSerialize(using = MetadataValueSerializer.class)
@JsonDeserialize(using = MetadataValueDeserializer.class)
public abstract class MetadataValue {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        ARRAY,
        OBJECT
    }

    MetadataValue() {
    }

    public abstract Kind getKind();

    /**
     * Appends the scalar leaves of this value, separated by spaces.
     * Object keys are not included.
     */
    public abstract void appendText(StringBuilder out);

    public static MetadataValue of(String value) {
        return value == null ? NullValue.INSTANCE : new StringValue(value);
    }

    public static MetadataValue of(long value) {
        return new NumberValue(value);
    }

    public static MetadataValue of(double value) {
        return new NumberValue(value);
    }

    public static MetadataValue of(BigDecimal value) {
        return value == null ? NullValue.INSTANCE : new NumberValue(value);
    }

    public static MetadataValue of(boolean value) {
        return BooleanValue.of(value);
    }

    public static MetadataValue nullValue() {
        return NullValue.INSTANCE;
    }

    public static MetadataValue array(List<MetadataValue> items) {
        return new ArrayValue(items);
    }

    public static MetadataValue object(Map<String, MetadataValue> fields) {
        return new ObjectValue(fields);
    }

    /**
     * Flattens a whole metadata mapping into searchable text.
     */
    public static String textOf(Map<String, MetadataValue> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (MetadataValue value : metadata.values()) {
            if (value != null) {
                value.appendText(out);
            }
        }
        return out.toString();
    }

    /**
     * Defensive copy preserving insertion order.
     */
    public static Map<String, MetadataValue> copyOf(Map<String, MetadataValue> metadata) {
        Map<String, MetadataValue> copy = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> copy.put(key, value != null ? value : NullValue.INSTANCE));
        }
        return copy;
    }
}
