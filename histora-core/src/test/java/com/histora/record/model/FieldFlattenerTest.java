package com.histora.record.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldFlattenerTest {

    @Test
    void nestedMapsAndListsBecomePaths() {
        Map<String, Object> data = Map.of(
                "block1", Map.of("values", Map.of("temp", 20.5), "ids", List.of(3, 4)),
                "top", "x");

        Map<String, Object> flat = FieldFlattener.flatten(data);

        assertThat(flat).containsExactly(
                Map.entry("block1/ids/0", 3),
                Map.entry("block1/ids/1", 4),
                Map.entry("block1/values/temp", 20.5),
                Map.entry("top", "x"));
    }

    @Test
    void nullLeavesAreSkipped() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("gone", null);
        inner.put("kept", 1);
        Map<String, Object> data = new HashMap<>();
        data.put("block", inner);
        data.put("list", Arrays.asList(null, true));

        assertThat(FieldFlattener.flatten(data)).containsOnly(Map.entry("block/kept", 1), Map.entry("list/1", true));
    }

    @Test
    void emptyStructuresProduceNothing() {
        assertThat(FieldFlattener.flatten(Map.of("a", Map.of(), "b", List.of()))).isEmpty();
    }
}
