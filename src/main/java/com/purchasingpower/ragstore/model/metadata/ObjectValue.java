package com.purchasingpower.ragstore.model.metadata;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class ObjectValue extends MetadataValue {

    private final Map<String, MetadataValue> fields;

    ObjectValue(Map<String, MetadataValue> fields) {
        this.fields = Collections.unmodifiableMap(MetadataValue.copyOf(fields));
    }

    @Override
    public Kind getKind() {
        return Kind.OBJECT;
    }

    @Override
    public void appendText(StringBuilder out) {
        for (MetadataValue value : fields.values()) {
            value.appendText(out);
        }
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
