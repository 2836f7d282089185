package com.funnel.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Value of one dimension on a funnel record. Categorical strings, enum
 * constants and numeric buckets all reduce to a canonical label, which is
 * what records are grouped by.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class DimensionValue {

    public static final String NOT_SET_LABEL = "(not set)";

    private static final DimensionValue NOT_SET = new DimensionValue(Kind.NOT_SET, NOT_SET_LABEL);

    public enum Kind {
        CATEGORICAL,
        NUMERIC_BUCKET,
        NOT_SET
    }

    private final Kind kind;

    @EqualsAndHashCode.Include
    private final String label;

    private DimensionValue(Kind kind, String label) {
        this.kind = kind;
        this.label = label;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DimensionValue of(String label) {
        if (label == null || label.isBlank() || NOT_SET_LABEL.equals(label.trim())) {
            return NOT_SET;
        }
        return new DimensionValue(Kind.CATEGORICAL, label.trim());
    }

    public static DimensionValue of(Enum<?> value) {
        if (value == null) {
            return NOT_SET;
        }
        return new DimensionValue(Kind.CATEGORICAL, value.name());
    }

    /**
     * Places a numeric observation into a fixed-width bucket labelled
     * {@code "lower-upper"}, e.g. {@code bucket(1366, 500)} is {@code "1000-1500"}.
     */
    public static DimensionValue bucket(double value, double width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Bucket width must be > 0, got " + width);
        }
        double lower = Math.floor(value / width) * width;
        String label = plain(lower) + "-" + plain(lower + width);
        return new DimensionValue(Kind.NUMERIC_BUCKET, label);
    }

    public static DimensionValue notSet() {
        return NOT_SET;
    }

    public boolean isNotSet() {
        return kind == Kind.NOT_SET;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }

    private static String plain(double v) {
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString().toLowerCase(Locale.ROOT);
    }
}
