package com.purchasingpower.ragstore.model.metadata;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Writes a {@link MetadataValue} back as the plain JSON it was read from.
 */
public class MetadataValueSerializer extends StdSerializer<MetadataValue> {

    public MetadataValueSerializer() {
        super(MetadataValue.class);
    }

    @Override
    public void serialize(MetadataValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        switch (value.getKind()) {
            case STRING -> gen.writeString(((StringValue) value).getValue());
            case NUMBER -> writeNumber(((NumberValue) value).getValue(), gen);
            case BOOLEAN -> gen.writeBoolean(((BooleanValue) value).isValue());
            case NULL -> gen.writeNull();
            case ARRAY -> {
                gen.writeStartArray();
                for (MetadataValue item : ((ArrayValue) value).getItems()) {
                    serialize(item, gen, provider);
                }
                gen.writeEndArray();
            }
            case OBJECT -> {
                gen.writeStartObject();
                for (Map.Entry<String, MetadataValue> field : ((ObjectValue) value).getFields().entrySet()) {
                    gen.writeFieldName(field.getKey());
                    serialize(field.getValue(), gen, provider);
                }
                gen.writeEndObject();
            }
        }
    }

    private void writeNumber(Number number, JsonGenerator gen) throws IOException {
        if (number instanceof BigDecimal decimal) {
            gen.writeNumber(decimal);
        } else if (number instanceof BigInteger integer) {
            gen.writeNumber(integer);
        } else if (number instanceof Double || number instanceof Float) {
            gen.writeNumber(number.doubleValue());
        } else {
            gen.writeNumber(number.longValue());
        }
    }
}
