package com.funnel.insights.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DimensionValueTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private enum DeviceCategory { MOBILE, DESKTOP }

    @Test
    void of_blankOrNotSetLabel_isNotSet() {
        assertThat(DimensionValue.of("  ").isNotSet()).isTrue();
        assertThat(DimensionValue.of((String) null).isNotSet()).isTrue();
        assertThat(DimensionValue.of("(not set)").isNotSet()).isTrue();
        assertThat(DimensionValue.of(" Social ").getLabel()).isEqualTo("Social");
    }

    @Test
    void of_enum_usesConstantName() {
        DimensionValue value = DimensionValue.of(DeviceCategory.MOBILE);

        assertThat(value.getKind()).isEqualTo(DimensionValue.Kind.CATEGORICAL);
        assertThat(value).isEqualTo(DimensionValue.of("MOBILE"));
    }

    @Test
    void bucket_labelsFixedWidthRange() {
        assertThat(DimensionValue.bucket(1366, 500).getLabel()).isEqualTo("1000-1500");
        assertThat(DimensionValue.bucket(0.25, 0.1).getKind()).isEqualTo(DimensionValue.Kind.NUMERIC_BUCKET);
        assertThatThrownBy(() -> DimensionValue.bucket(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void funnelRecord_readsDimensionValuesFromPlainStrings() throws Exception {
        FunnelRecord record = objectMapper.readValue("""
                {"dimensions": {"channel": "Social", "device": ""}, "viewItem": 800,
                 "addToCart": 65, "purchase": 5, "date": "2025-02-18"}
                """, FunnelRecord.class);

        assertThat(record.dimensionValue("channel").getLabel()).isEqualTo("Social");
        assertThat(record.hasDimension("device")).isFalse();
        assertThat(record.hasDimension("browser")).isFalse();
        assertThat(record.getDate()).isEqualTo(LocalDate.of(2025, 2, 18));
        assertThat(objectMapper.writeValueAsString(record)).contains("\"channel\":\"Social\"");
    }
}
