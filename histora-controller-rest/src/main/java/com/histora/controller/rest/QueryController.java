package com.histora.controller.rest;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.query.CsvExporter;
import com.histora.service.core.query.CsvPrecision;
import com.histora.service.core.query.MetricValue;
import com.histora.service.core.query.MetricsCache;
import com.histora.service.core.query.QueryDescriptor;
import com.histora.service.core.query.QueryEngine;
import com.histora.service.core.query.TimeframeResolver;
import com.histora.service.core.support.DurationParser;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@RestController
@RequestMapping(path = "/query", produces = MediaType.APPLICATION_JSON_VALUE)
public class QueryController {

    private final QueryEngine queryEngine;
    private final TimeframeResolver timeframeResolver;
    private final MetricsCache metricsCache;
    private final CsvExporter csvExporter;

    public QueryController(
            QueryEngine queryEngine,
            TimeframeResolver timeframeResolver,
            MetricsCache metricsCache,
            CsvExporter csvExporter) {
        this.queryEngine = queryEngine;
        this.timeframeResolver = timeframeResolver;
        this.metricsCache = metricsCache;
        this.csvExporter = csvExporter;
    }

    @GetMapping
    public HistoryResponse query(
            @RequestParam("fields") List<String> fields,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) String duration,
            @RequestParam(required = false) String step) {
        QueryDescriptor descriptor = timeframeResolver.resolve(fields, start, end, duration, step);
        return HistoryResponse.of(descriptor, queryEngine.query(descriptor));
    }

    /** Raw values as CSV; the query runs before the response is committed so its errors keep their status. */
    @GetMapping(path = "/csv", produces = {"text/csv", MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<StreamingResponseBody> csv(
            @RequestParam("fields") List<String> fields,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) String duration,
            @RequestParam(required = false) String precision) {
        CsvPrecision format = CsvPrecision.parse(precision);
        QueryDescriptor descriptor = timeframeResolver.resolve(fields, start, end, duration, null);
        CsvExporter.CsvExport export = csvExporter.prepare(descriptor, format);
        StreamingResponseBody body = out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            export.writeTo(writer);
            writer.flush();
        };
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"history.csv\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(body);
    }

    @GetMapping("/fields")
    public List<String> fields(@RequestParam(defaultValue = "1d") String duration) {
        return queryEngine.fields(DurationParser.parse(duration));
    }

    @GetMapping("/metrics")
    public List<MetricValue> metrics(@RequestParam("fields") List<String> fields) {
        return metricsCache.metrics(fields);
    }

    @GetMapping("/ping")
    public Map<String, String> ping() {
        queryEngine.ping();
        return Map.of("ping", "pong");
    }

    public record HistoryResponse(
            List<String> metrics, Instant start, Instant end, String step, List<MeasurementRecord> records) {

        static HistoryResponse of(QueryDescriptor descriptor, List<MeasurementRecord> records) {
            return new HistoryResponse(
                    List.copyOf(descriptor.metrics()),
                    descriptor.start(),
                    descriptor.end(),
                    descriptor.step() == null ? null : descriptor.step().toString(),
                    records);
        }
    }
}
