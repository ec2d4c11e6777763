package com.verity.dataquality.compiler;

import com.verity.dataquality.api.exceptions.RuleSetLoadException;
import com.verity.dataquality.api.model.DataType;
import com.verity.dataquality.api.model.FieldRule;
import com.verity.dataquality.api.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleSetLoaderTest {

    private RuleSetLoader loader;
    private Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        loader = new RuleSetLoader(OpenTelemetry.noop().getTracer("test"));
        tempDir = Files.createTempDirectory("rule_set_loader_test");
    }

    @AfterEach
    void tearDown() throws IOException {
        Files.walk(tempDir)
                .sorted(java.util.Comparator.reverseOrder())
                .map(Path::toFile)
                .forEach(java.io.File::delete);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Should load canonical CSV columns")
    void shouldLoadCanonicalCsv() throws IOException {
        Path file = write("rules.csv", """
                fieldName,dataType,required,minLength,maxLength,pattern,allowedValues,description
                id,int,true,,,,,Primary key
                amount,"DECIMAL(18,2)",yes,,,,,
                status,string,no,1,10,^[A-Z]+$,"ACTIVE, INACTIVE",
                """);

        RuleSet rules = loader.load(file);

        assertThat(rules.fieldNames()).containsExactly("id", "amount", "status");
        assertThat(rules.skippedRows()).isEmpty();

        FieldRule id = rules.rule("id").orElseThrow();
        assertThat(id.dataType()).isEqualTo(DataType.INTEGER);
        assertThat(id.required()).isTrue();
        assertThat(id.description()).isEqualTo("Primary key");

        FieldRule amount = rules.rule("amount").orElseThrow();
        assertThat(amount.dataType()).isEqualTo(DataType.DECIMAL);
        assertThat(amount.originalTypeSpec()).isEqualTo("DECIMAL(18,2)");

        FieldRule status = rules.rule("status").orElseThrow();
        assertThat(status.required()).isFalse();
        assertThat(status.minLength()).isEqualTo(1);
        assertThat(status.maxLength()).isEqualTo(10);
        assertThat(status.pattern()).isEqualTo("^[A-Z]+$");
        assertThat(status.allowedValues()).containsExactly("ACTIVE", "INACTIVE");
    }

    @Test
    @DisplayName("Aliased mapping headers should load the same rules as canonical ones")
    void aliasedHeadersShouldMatchCanonical() throws IOException {
        Path canonical = write("canonical.csv", """
                fieldName,dataType,required
                customer_id,integer,true
                email,string,false
                """);
        Path aliased = write("aliased.csv", """
                Target Field Name,Target Data Type,Null Allowed
                customer_id,integer,No
                email,string,Yes
                """);

        assertThat(loader.load(aliased).rules()).isEqualTo(loader.load(canonical).rules());
    }

    @Test
    @DisplayName("Explicit required column should win over Null Allowed")
    void requiredColumnShouldWin() {
        RuleSet rules = loader.fromRows(List.of(
                Map.of("fieldName", "a", "required", "false", "Null Allowed", "No"),
                Map.of("fieldName", "b", "Null Allowed", "no"),
                Map.of("fieldName", "c")
        ));

        assertThat(rules.rule("a").orElseThrow().required()).isFalse();
        assertThat(rules.rule("b").orElseThrow().required()).isTrue();
        assertThat(rules.rule("c").orElseThrow().required()).isFalse();
    }

    @Test
    @DisplayName("Should detect pipe delimiter in rule files")
    void shouldReadPipeDelimitedRules() throws IOException {
        Path file = write("rules.txt", """
                Field Name|Data Type|Required
                code|string|Y
                """);

        RuleSet rules = loader.load(file);

        assertThat(rules.fieldNames()).containsExactly("code");
        assertThat(rules.rules().get(0).required()).isTrue();
    }

    @Test
    @DisplayName("Should skip rows without a field name and keep loading")
    void shouldSkipRowsWithoutFieldName() throws IOException {
        Path file = write("rules.csv", """
                fieldName,dataType
                ,string
                name,string
                name,int
                """);

        RuleSet rules = loader.load(file);

        assertThat(rules.fieldNames()).containsExactly("name");
        assertThat(rules.rule("name").orElseThrow().dataType()).isEqualTo(DataType.STRING);
        assertThat(rules.skippedRows()).hasSize(2);
        assertThat(rules.skippedRows().get(0)).contains("Rule row 1");
        assertThat(rules.skippedRows().get(1)).contains("repeats field 'name'");
    }

    @Test
    @DisplayName("Non-numeric lengths should be treated as absent")
    void nonNumericLengthsShouldBeAbsent() {
        RuleSet rules = loader.fromRows(List.of(
                Map.of("fieldName", "a", "minLength", "n/a", "maxLength", "12")));

        FieldRule rule = rules.rules().get(0);
        assertThat(rule.minLength()).isNull();
        assertThat(rule.maxLength()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should load JSON rule definitions")
    void shouldLoadJson() throws IOException {
        Path file = write("rules.json", """
                [
                    {"fieldName": "qty", "dataType": "integer", "required": true, "maxLength": 5},
                    {"fieldName": "color", "dataType": "picklist", "allowedValues": ["red", "green"]}
                ]
                """);

        RuleSet rules = loader.load(file);

        FieldRule qty = rules.rule("qty").orElseThrow();
        assertThat(qty.required()).isTrue();
        assertThat(qty.maxLength()).isEqualTo(5);

        FieldRule color = rules.rule("color").orElseThrow();
        assertThat(color.dataType()).isEqualTo(DataType.STRING);
        assertThat(color.allowedValues()).containsExactly("red", "green");
    }

    @Test
    @DisplayName("Should keep rules that declare an invalid regex")
    void shouldKeepInvalidPattern() {
        RuleSet rules = loader.fromRows(List.of(Map.of("fieldName", "a", "pattern", "[unclosed")));

        assertThat(rules.rules().get(0).pattern()).isEqualTo("[unclosed");
    }

    @Test
    @DisplayName("Should throw when no rules can be loaded")
    void shouldThrowForEmptyRules() throws IOException {
        Path file = write("rules.json", "[]");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(RuleSetLoadException.class)
                .hasMessageContaining("yielded no rules");
    }

    @Test
    @DisplayName("Should throw for a missing file")
    void shouldThrowForMissingFile() {
        Path missing = tempDir.resolve("absent.json");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(RuleSetLoadException.class)
                .hasMessageContaining("Failed to read rule definitions")
                .hasCauseInstanceOf(IOException.class);
    }
}
