package com.webharvest.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void json_line_has_envelope_and_typed_values() throws Exception {
        String line = StructuredLog.get(StructuredLogTest.class)
                .toJson(Level.INFO, "page-done", null, "url", "https://ex.com/\"q\"", "depth", 2, "cached", true);

        JsonNode n = om.readTree(line);
        assertThat(n.get("event").asText()).isEqualTo("page-done");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("url").asText()).isEqualTo("https://ex.com/\"q\"");
        assertThat(n.get("depth").isInt()).isTrue();
        assertThat(n.get("cached").asBoolean()).isTrue();
        assertThat(line).doesNotContain("\n");
    }

    @Test
    void odd_kv_count_is_flagged_and_error_is_attached() throws Exception {
        String line = StructuredLog.get(StructuredLogTest.class)
                .toJson(Level.SEVERE, "task-failed", new IllegalStateException("boom"), "url");

        JsonNode n = om.readTree(line);
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("boom");
    }
}
