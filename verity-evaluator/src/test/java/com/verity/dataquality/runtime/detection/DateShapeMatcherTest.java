package com.verity.dataquality.runtime.detection;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DateShapeMatcherTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-01-15", "2024-1-5", "01/15/2024", "1/5/2024", "01-15-2024",
            "2024/01/15", "15.01.2024", "2024-01-15T10:30:00", "2024-01-15 10:30",
            "2024-01-15T10:30:00.123+01:00"
    })
    void knownShapes(String value) {
        assertThat(DateShapeMatcher.hasKnownShape(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Jan 15, 2024", "20240115", "15/01/24", "2024.01.15", "today"})
    void unknownShapes(String value) {
        assertThat(DateShapeMatcher.hasKnownShape(value)).isFalse();
    }
}
