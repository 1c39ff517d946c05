package com.purchasingpower.ragstore.model.metadata;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class BooleanValue extends MetadataValue {

    static final BooleanValue TRUE = new BooleanValue(true);
    static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean value;

    private BooleanValue(boolean value) {
        this.value = value;
    }

    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Kind getKind() {
        return Kind.BOOLEAN;
    }

    @Override
    public void appendText(StringBuilder out) {
        out.append(value).append(' ');
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
