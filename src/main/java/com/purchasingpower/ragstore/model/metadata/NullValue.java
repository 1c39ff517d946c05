package com.purchasingpower.ragstore.model.metadata;

public final class NullValue extends MetadataValue {

    static final NullValue INSTANCE = new NullValue();

    private NullValue() {
    }

    @Override
    public Kind getKind() {
        return Kind.NULL;
    }

    @Override
    public void appendText(StringBuilder out) {
        // nothing searchable
    }

    @Override
    public String toString() {
        return "null";
    }
}
