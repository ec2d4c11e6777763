package com.verity.dataquality.runtime.evaluation;

import com.verity.dataquality.api.exceptions.PreconditionViolationException;
import com.verity.dataquality.api.model.Dataset;
import com.verity.dataquality.api.model.DuplicateEntry;
import com.verity.dataquality.api.model.ErrorCategory;
import com.verity.dataquality.api.model.FieldRule;
import com.verity.dataquality.api.model.FormattingIssue;
import com.verity.dataquality.api.model.RuleSet;
import com.verity.dataquality.api.model.ValidationOutcome;
import com.verity.dataquality.api.model.ValidationReport;
import com.verity.dataquality.compiler.RuleSetLoader;
import com.verity.dataquality.compiler.dataset.DatasetLoader;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationEngineTest {

    @TempDir
    Path tempDir;

    private InMemorySpanExporter spanExporter;
    private Tracer tracer;
    private ValidationEngine engine;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        tracer = tracerProvider.get("test-tracer");
        engine = new ValidationEngine(tracer, ValidationConfig.builder(key -> null).build());
    }

    @Test
    @DisplayName("Should validate a dataset loaded from disk end to end")
    void endToEnd() throws IOException {
        Path rulesFile = tempDir.resolve("mapping.csv");
        Files.writeString(rulesFile, """
                Target Field Name,Target Data Type,Null Allowed,Max Length,Allowed Values
                customer_id,Integer,No,,
                email,Text,Yes,,
                balance,"DECIMAL(10,2)",Yes,,
                status,Picklist,No,,"Active,Closed"
                joined,Date,Yes,,
                """);
        Path dataFile = tempDir.resolve("customers.csv");
        Files.writeString(dataFile, """
                customer_id|email|balance|status|joined|region
                1|ann@example.com|100.00|Active|2024-01-15|EU
                2|Bob@Example.com|12.5|Active|2024-02-30|EU
                x| carl@example.com |7.25|Gone|Jan 5, 2024|US
                1|ann@example.com|100.00|Active|2024-01-15|EU
                """);

        RuleSet rules = new RuleSetLoader(tracer).load(rulesFile);
        Dataset dataset = new DatasetLoader(tracer).load(dataFile);

        ValidationReport report = engine.validate(dataset, rules, List.of("customer_id"));

        assertThat(report.outcomes()).extracting(ValidationOutcome::isValid)
                .containsExactly(true, false, false, true);
        assertThat(report.outcomes().get(1).errors())
                .anySatisfy(e -> assertThat(e).contains("Field 'balance'"))
                .anySatisfy(e -> assertThat(e).contains("Field 'joined'"));
        assertThat(report.outcomes().get(2).errors())
                .anySatisfy(e -> assertThat(e).contains("Field 'customer_id'"))
                .anySatisfy(e -> assertThat(e).contains("invalid value 'Gone'"));

        assertThat(report.duplicates()).extracting(DuplicateEntry::rowIndex).containsExactly(4);
        assertThat(report.duplicates().get(0).firstSeenRowIndex()).isEqualTo(1);

        assertThat(report.formattingIssues()).extracting(FormattingIssue::rowIndex).containsExactly(2, 3);

        assertThat(report.headerMatch().missing()).isEmpty();
        assertThat(report.headerMatch().unexpected()).containsExactly("region");

        assertThat(report.summary().totalRecords()).isEqualTo(4);
        assertThat(report.summary().validRecords()).isEqualTo(2);
        assertThat(report.summary().successRate()).isEqualTo(50.0);
        assertThat(report.summary().errorsByField()).containsExactly(
                Map.entry("balance", 1), Map.entry("joined", 1),
                Map.entry("customer_id", 1), Map.entry("status", 1));
        assertThat(report.summary().errorsByCategory())
                .containsEntry(ErrorCategory.DATA_TYPE, 3)
                .containsEntry(ErrorCategory.ALLOWED_VALUES, 1)
                .hasSize(2);
    }

    @Test
    @DisplayName("A record can be valid and still have formatting issues")
    void formattingDoesNotAffectValidity() {
        RuleSet rules = RuleSet.of(
                FieldRule.of("id", "int", true),
                FieldRule.of("name", "string", false),
                FieldRule.of("email", "string", false));
        Dataset dataset = Dataset.fromRows(List.of(
                Map.of("id", "1", "name", "Ann", "email", "ann@example.com"),
                Map.of("id", "2", "name", " padded ", "email", "Ann@Example.com"),
                Map.of("id", "x", "name", "Bob", "email", "bob@example.com")));

        ValidationReport report = engine.validate(dataset, rules);

        assertThat(report.outcomes()).extracting(ValidationOutcome::isValid).containsExactly(true, true, false);
        assertThat(report.formattingIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.rowIndex()).isEqualTo(2);
            assertThat(issue.issues()).hasSize(2);
        });
        assertThat(report.outcomes().get(1).errors()).isEmpty();
        assertThat(report.invalidOutcomes()).extracting(ValidationOutcome::rowIndex).containsExactly(3);
        assertThat(report.summary().validRecords()).isEqualTo(2);
    }

    @Test
    @DisplayName("Detectors can be switched off")
    void detectorsCanBeDisabled() {
        ValidationEngine quiet = new ValidationEngine(tracer, ValidationConfig.builder(key -> null)
                .detectDuplicates(false)
                .detectFormatting(false)
                .build());
        RuleSet rules = RuleSet.of(FieldRule.of("name", "string", false));
        Dataset dataset = Dataset.fromRows(List.of(Map.of("name", " a "), Map.of("name", " a ")));

        ValidationReport report = quiet.validate(dataset, rules);

        assertThat(report.duplicates()).isEmpty();
        assertThat(report.formattingIssues()).isEmpty();
        assertThat(report.outcomes()).hasSize(2);
    }

    @Test
    @DisplayName("Should record a span with run counts")
    void shouldRecordSpan() {
        RuleSet rules = RuleSet.of(FieldRule.of("id", "int", true));
        Dataset dataset = Dataset.fromRows(List.of(Map.of("id", "1"), Map.of("id", "x"), Map.of("id", "1")));

        engine.validate(dataset, rules);

        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).extracting(SpanData::getName).contains("validate-dataset");
        SpanData span = spans.stream().filter(s -> s.getName().equals("validate-dataset")).findFirst().orElseThrow();
        assertThat(span.getAttributes().get(AttributeKey.longKey("recordCount"))).isEqualTo(3L);
        assertThat(span.getAttributes().get(AttributeKey.longKey("invalidRecordCount"))).isEqualTo(1L);
        assertThat(span.getAttributes().get(AttributeKey.longKey("duplicateCount"))).isEqualTo(1L);
    }

    @Test
    @DisplayName("Running twice on the same inputs yields equal reports")
    void shouldBeIdempotent() {
        RuleSet rules = RuleSet.of(FieldRule.of("id", "int", true), FieldRule.of("email", "string", false));
        Dataset dataset = Dataset.fromRows(List.of(Map.of("id", "1", "email", "A@x.com"), Map.of("id", "")));

        assertThat(engine.validate(dataset, rules)).isEqualTo(engine.validate(dataset, rules));
    }

    @Test
    @DisplayName("Misuse should fail fast")
    void preconditions() {
        Dataset dataset = Dataset.fromRows(List.of(Map.of("id", "1")));

        assertThatThrownBy(() -> engine.validate(null, RuleSet.of(FieldRule.of("id", "int", true))))
                .isInstanceOf(PreconditionViolationException.class);
        assertThatThrownBy(() -> engine.validate(dataset, RuleSet.of(List.of())))
                .isInstanceOf(PreconditionViolationException.class);
    }
}
