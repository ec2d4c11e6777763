package com.verity.dataquality.runtime.detection;

import com.verity.dataquality.api.exceptions.PreconditionViolationException;
import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.DuplicateEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DuplicateDetectorTest {

    private final DuplicateDetector detector = new DuplicateDetector();

    private static Map<String, String> row(String id, String name) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("name", name);
        return row;
    }

    @Test
    @DisplayName("Later copies of a row should reference the first occurrence")
    void wholeRowDuplicates() {
        Map<String, String> a = row("1", "A");
        List<DataRecord> records = DataRecord.fromRows(List.of(a, row("2", "B"), a, row("3", "C"), a));

        List<DuplicateEntry> duplicates = detector.detectDuplicates(records, null);

        assertThat(duplicates).extracting(DuplicateEntry::rowIndex).containsExactly(3, 5);
        assertThat(duplicates).extracting(DuplicateEntry::firstSeenRowIndex).containsExactly(1, 1);
        assertThat(duplicates.get(0).keyFields()).containsExactly("id", "name");
        assertThat(duplicates.get(0).keyValues()).containsExactly("1", "A");
    }

    @Test
    @DisplayName("Should key on the given fields only")
    void keyedDuplicates() {
        List<DataRecord> records = DataRecord.fromRows(List.of(row("1", "A"), row("1", "B"), row("2", "A")));

        List<DuplicateEntry> duplicates = detector.detectDuplicates(records, List.of("id"));

        assertThat(duplicates).singleElement().satisfies(d -> {
            assertThat(d.rowIndex()).isEqualTo(2);
            assertThat(d.firstSeenRowIndex()).isEqualTo(1);
            assertThat(d.keyValues()).containsExactly("1");
        });
    }

    @Test
    @DisplayName("Absent and empty key values should be treated alike")
    void nullEqualsEmpty() {
        Map<String, String> withNull = new HashMap<>();
        withNull.put("id", null);
        List<DataRecord> records = DataRecord.fromRows(List.of(withNull, Map.of("id", ""), Map.of("other", "x")));

        List<DuplicateEntry> duplicates = detector.detectDuplicates(records, List.of("id"));

        assertThat(duplicates).extracting(DuplicateEntry::rowIndex).containsExactly(2, 3);
        assertThat(duplicates).extracting(DuplicateEntry::firstSeenRowIndex).containsOnly(1);
    }

    @Test
    @DisplayName("Values containing the display separator should not collide")
    void separatorInValues() {
        List<DataRecord> records = DataRecord.fromRows(List.of(row("a|b", "c"), row("a", "b|c")));

        assertThat(detector.detectDuplicates(records, null)).isEmpty();
    }

    @Test
    @DisplayName("Empty datasets have no duplicates; null datasets are misuse")
    void edgeCases() {
        assertThat(detector.detectDuplicates(List.of(), List.of("id"))).isEmpty();
        assertThatThrownBy(() -> detector.detectDuplicates(null, null))
                .isInstanceOf(PreconditionViolationException.class);
    }
}
