package com.purchasingpower.ragstore.model.metadata;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads arbitrary JSON into the {@link MetadataValue} variant tree.
 */
public class MetadataValueDeserializer extends StdDeserializer<MetadataValue> {

    public MetadataValueDeserializer() {
        super(MetadataValue.class);
    }

    @Override
    public MetadataValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        return fromNode(node);
    }

    @Override
    public MetadataValue getNullValue(DeserializationContext context) {
        return NullValue.INSTANCE;
    }

    public static MetadataValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isBoolean()) {
            return BooleanValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            if (node.isIntegralNumber()) {
                return new NumberValue(node.canConvertToLong() ? (Number) node.longValue() : node.bigIntegerValue());
            }
            return new NumberValue(node.isBigDecimal() ? node.decimalValue() : (Number) node.doubleValue());
        }
        if (node.isArray()) {
            List<MetadataValue> items = new ArrayList<>();
            for (JsonNode item : node) {
                items.add(fromNode(item));
            }
            return new ArrayValue(items);
        }
        if (node.isObject()) {
            Map<String, MetadataValue> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(field.getKey(), fromNode(field.getValue()));
            }
            return new ObjectValue(fields);
        }
        // binary / POJO nodes do not occur in parsed request bodies
        return new StringValue(node.asText());
    }
}
