package com.purchasingpower.ragstore.model.metadata;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class ArrayValue extends MetadataValue {

    private final List<MetadataValue> items;

    ArrayValue(List<MetadataValue> items) {
        List<MetadataValue> copy = new ArrayList<>();
        if (items != null) {
            for (MetadataValue item : items) {
                copy.add(item != null ? item : NullValue.INSTANCE);
            }
        }
        this.items = Collections.unmodifiableList(copy);
    }

    @Override
    public Kind getKind() {
        return Kind.ARRAY;
    }

    @Override
    public void appendText(StringBuilder out) {
        for (MetadataValue item : items) {
            item.appendText(out);
        }
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
