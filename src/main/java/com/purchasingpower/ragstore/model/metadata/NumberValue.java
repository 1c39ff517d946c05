package com.purchasingpower.ragstore.model.metadata;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Numeric metadata. Keeps the boxed type it was parsed as (Long, BigInteger,
 * Double or BigDecimal) so integers are written back without a fraction.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class NumberValue extends MetadataValue {

    private final Number value;

    NumberValue(Number value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind getKind() {
        return Kind.NUMBER;
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
