package com.purchasingpower.ragstore.model.metadata;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class StringValue extends MetadataValue {

    private final String value;

    StringValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind getKind() {
        return Kind.STRING;
    }

    @Override
    public void appendText(StringBuilder out) {
        out.append(value).append(' ');
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
