package com.histora.service.core.relay;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.histora.record.model.FieldFlattener;
import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.error.RecordDecodeException;
import com.histora.service.core.support.InstantParser;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decodes bus payloads into records. A payload is one history event or a JSON array of them:
 *
 * <pre>
 * {"key": "spark-one", "data": {"sensor": {"value[degC]": 20.5}}, "timestamp": "2024-01-01T00:00:00Z"}
 * </pre>
 *
 * {@code data} is flattened into {@code /}-separated field names. The topic becomes the record source. Without a
 * timestamp the decode time is used. Events whose data flattens to nothing are skipped; any malformed event
 * rejects the whole payload.
 */
@Component
@RequiredArgsConstructor
public class RecordDecoder {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Clock clock;

    public List<MeasurementRecord> decode(String topic, byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new RecordDecodeException(topic, "empty payload");
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException ex) {
            throw new RecordDecodeException(topic, "payload is not valid JSON: " + ex.getMessage(), ex);
        }
        if (root == null || root.isMissingNode()) {
            throw new RecordDecodeException(topic, "empty payload");
        }

        Instant received = clock.instant();
        List<MeasurementRecord> records = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode event : root) {
                decodeEvent(topic, event, received, records);
            }
        } else {
            decodeEvent(topic, root, received, records);
        }
        return records;
    }

    private void decodeEvent(String topic, JsonNode event, Instant received, List<MeasurementRecord> out) {
        if (!event.isObject()) {
            throw new RecordDecodeException(topic, "history event must be a JSON object");
        }
        JsonNode key = event.get("key");
        if (key == null || !key.isTextual() || key.asText().isBlank()) {
            throw new RecordDecodeException(topic, "history event requires a non-empty 'key'");
        }
        JsonNode data = event.get("data");
        if (data == null || !data.isObject()) {
            throw new RecordDecodeException(topic, "history event '" + key.asText() + "' requires a 'data' object");
        }

        Map<String, Object> fields;
        try {
            Map<String, Object> raw = mapper.readerFor(MAP_TYPE).readValue(data);
            fields = FieldFlattener.flatten(raw);
        } catch (IOException ex) {
            throw new RecordDecodeException(topic, "unreadable data for '" + key.asText() + "'", ex);
        }
        if (fields.isEmpty()) {
            return;
        }

        try {
            out.add(new MeasurementRecord(topic, key.asText(), timestampOf(event, received), fields));
        } catch (IllegalArgumentException ex) {
            throw new RecordDecodeException(topic, ex.getMessage(), ex);
        }
    }

    private static Instant timestampOf(JsonNode event, Instant received) {
        JsonNode ts = event.get("timestamp");
        if (ts == null || ts.isNull()) {
            return received;
        }
        if (ts.isNumber()) {
            return InstantParser.fromEpoch(ts.decimalValue());
        }
        if (ts.isTextual()) {
            return InstantParser.parse(ts.asText());
        }
        throw new IllegalArgumentException("unsupported timestamp " + ts);
    }
}
