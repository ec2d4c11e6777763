package com.verity.dataquality.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class DataTypeTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "'DECIMAL(18,2)', DECIMAL",
            "Number, DECIMAL",
            "currency, DECIMAL",
            "Percent, DECIMAL",
            "float, DECIMAL",
            "Boolean, BOOLEAN",
            "datetime, DATE",
            "Timestamp, DATE",
            "date, DATE",
            "Picklist, STRING",
            "Text, STRING",
            "Integer, INTEGER",
            "bigint, INTEGER",
            "'  INT  ', INTEGER",
            "geography, STRING"
    })
    void shouldNormalizeRawDeclarations(String raw, DataType expected) {
        assertThat(DataType.fromTypeSpec(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Null and blank declarations should default to STRING")
    void blankShouldBeString() {
        assertThat(DataType.fromTypeSpec(null)).isEqualTo(DataType.STRING);
        assertThat(DataType.fromTypeSpec("   ")).isEqualTo(DataType.STRING);
    }
}
