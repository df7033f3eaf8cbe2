package com.histora.service.core.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.histora.record.model.MeasurementRecord;
import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes query results as CSV: a {@code time} column followed by one column per metric, sorted by name. Values of
 * different records at the same instant share a row; a metric without a value at that instant is left empty.
 */
@Slf4j
@Component
public class CsvExporter {

    static final String TIME_COLUMN = "time";

    private final QueryEngine queryEngine;
    private final CsvMapper csvMapper =
            CsvMapper.builder().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET).build();

    public CsvExporter(QueryEngine queryEngine) {
        this.queryEngine = queryEngine;
    }

    /**
     * Runs the query before anything is written, so validation and backend errors surface before the first row.
     *
     * @return a writer for the prepared result
     */
    public CsvExport prepare(QueryDescriptor descriptor, CsvPrecision precision) {
        List<MeasurementRecord> records = queryEngine.query(descriptor);
        TreeSet<String> columns = new TreeSet<>();
        TreeMap<Instant, Map<String, Object>> rows = new TreeMap<>();
        for (MeasurementRecord record : records) {
            Map<String, Object> row = rows.computeIfAbsent(record.timestamp(), t -> new HashMap<>());
            record.fields().forEach((field, value) -> {
                String metric = record.metricName(field);
                columns.add(metric);
                row.put(metric, value);
            });
        }
        return new CsvExport(List.copyOf(columns), rows, precision);
    }

    public final class CsvExport {

        private final List<String> columns;
        private final TreeMap<Instant, Map<String, Object>> rows;
        private final CsvPrecision precision;

        private CsvExport(List<String> columns, TreeMap<Instant, Map<String, Object>> rows, CsvPrecision precision) {
            this.columns = columns;
            this.rows = rows;
            this.precision = precision;
        }

        public List<String> columns() {
            return columns;
        }

        public int rowCount() {
            return rows.size();
        }

        /** Leaves {@code out} open. */
        public void writeTo(Writer out) throws IOException {
            CsvSchema.Builder schema = CsvSchema.builder().addColumn(TIME_COLUMN);
            columns.forEach(schema::addColumn);
            try (SequenceWriter writer = csvMapper.writer(schema.build()).writeValues(out)) {
                // written as a row so that an empty result still carries its header
                Object[] header = new Object[columns.size() + 1];
                header[0] = TIME_COLUMN;
                for (int i = 0; i < columns.size(); i++) {
                    header[i + 1] = columns.get(i);
                }
                writer.write(header);
                for (Map.Entry<Instant, Map<String, Object>> entry : rows.entrySet()) {
                    Object[] line = new Object[columns.size() + 1];
                    line[0] = precision.format(entry.getKey());
                    for (int i = 0; i < columns.size(); i++) {
                        line[i + 1] = entry.getValue().get(columns.get(i));
                    }
                    writer.write(line);
                }
            }
            log.debug("Exported {} CSV rows with {} metric columns", rows.size(), columns.size());
        }
    }
}
