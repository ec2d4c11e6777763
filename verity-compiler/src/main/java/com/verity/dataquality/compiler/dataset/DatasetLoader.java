package com.verity.dataquality.compiler.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.Dataset;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited file into an immutable {@link Dataset}.
 *
 * <p>Values are kept exactly as written, without trimming. Rows shorter than
 * the header carry {@code null} for the missing columns; cells past the last
 * header are dropped.
 */
public class DatasetLoader {
    private static final Logger logger = LoggerFactory.getLogger(DatasetLoader.class);

    private final CsvMapper csvMapper;
    private final Tracer tracer;

    public DatasetLoader() {
        this(OpenTelemetry.noop().getTracer("verity-compiler"));
    }

    public DatasetLoader(Tracer tracer) {
        this.tracer = tracer;
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    }

    /**
     * Loads {@code path}, detecting the delimiter from its header line.
     */
    public Dataset load(Path path) {
        return load(path, null);
    }

    /**
     * Loads {@code path}.
     *
     * @param delimiter column separator, or {@code null} to detect it
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    public Dataset load(Path path, Character delimiter) {
        Span span = tracer.spanBuilder("load-dataset").startSpan();
        try (Scope scope = span.makeCurrent()) {
            char separator = delimiter != null ? delimiter : DelimiterDetector.detect(path);
            span.setAttribute("datasetPath", path.toString());
            span.setAttribute("delimiter", String.valueOf(separator));

            Dataset dataset = read(path, separator);
            span.setAttribute("columnCount", dataset.headers().size());
            span.setAttribute("recordCount", dataset.size());
            logger.info("Loaded {} records with {} columns from {}",
                dataset.size(), dataset.headers().size(), path);
            return dataset;
        } catch (UncheckedIOException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Dataset read(Path path, char separator) {
        CsvSchema schema = CsvSchema.emptySchema()
            .withHeader()
            .withColumnSeparator(separator);

        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(path.toFile())) {

            List<Map<String, String>> raw = new ArrayList<>();
            while (rows.hasNextValue()) {
                raw.add(rows.nextValue());
            }
            List<String> headers = headersOf(rows);

            List<DataRecord> records = new ArrayList<>(raw.size());
            for (int i = 0; i < raw.size(); i++) {
                records.add(new DataRecord(i + 1, alignToHeaders(headers, raw.get(i))));
            }
            return new Dataset(headers, records);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset " + path, e);
        }
    }

    private static List<String> headersOf(MappingIterator<?> rows) {
        List<String> headers = new ArrayList<>();
        if (rows.getParser() != null && rows.getParser().getSchema() instanceof CsvSchema actual) {
            for (CsvSchema.Column column : actual) {
                headers.add(column.getName());
            }
        }
        return headers;
    }

    private static Map<String, String> alignToHeaders(List<String> headers, Map<String, String> row) {
        if (headers.isEmpty()) {
            return row;
        }
        Map<String, String> aligned = new LinkedHashMap<>();
        for (String header : headers) {
            aligned.put(header, row.get(header));
        }
        return aligned;
    }
}
