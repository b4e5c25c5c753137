package com.prism.service.core.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prism.service.core.query.FreeformQueryRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * Workspace payload documents. A payload is stored as JSON with the schema version it was written in; reading
 * one migrates it forward to {@link #LATEST_SCHEMA_VERSION}. Version 1 is the only schema so far, so migration is
 * a pass-through for it and a rejection for anything else.
 *
 * <p>Version 1 layout: {@code {schemaVersion, name, panels: [{id, title, blocks: [...]}]}} where a block is
 * either a {@code freeform_table} carrying a freeform query or a {@code line_chart}/{@code bar_chart} that plots
 * another block's result.
 */
@Component
public class ProjectPayloads {

    public static final int LATEST_SCHEMA_VERSION = 1;

    private static final String DEFAULT_PRESET = "last_30_days";

    private final ObjectMapper mapper;

    public ProjectPayloads(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Starter workspace: one panel with an events-by-name table and two charts over it. */
    public ObjectNode defaultPayload(String projectName) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("schemaVersion", LATEST_SCHEMA_VERSION);
        payload.put("name", projectName);

        ObjectNode panel = payload.putArray("panels").addObject();
        panel.put("id", "panel_1");
        panel.put("title", "Panel 1");
        ArrayNode blocks = panel.putArray("blocks");

        ObjectNode table = blocks.addObject();
        table.put("id", "table_1");
        table.put("type", "freeform_table");
        ObjectNode query = table.putObject("query");
        query.putArray("rows").add("eventName");
        query.putArray("columns").add("events");
        query.putArray("segments");
        query.putObject("dateRange").put("preset", DEFAULT_PRESET);
        query.put("limit", FreeformQueryRequest.DEFAULT_LIMIT);

        chart(blocks, "line_1", "line_chart");
        chart(blocks, "bar_1", "bar_chart");
        return payload;
    }

    private static void chart(ArrayNode blocks, String id, String type) {
        ObjectNode chart = blocks.addObject();
        chart.put("id", id);
        chart.put("type", type);
        chart.put("sourceBlockId", "table_1");
        ObjectNode config = chart.putObject("config");
        config.put("x", "eventName");
        config.putArray("y").add("events");
    }

    /**
     * Brings a payload written in {@code schemaVersion} up to the latest schema.
     *
     * @throws UnsupportedSchemaVersionException for a schema version with no migration
     * @throws IllegalArgumentException when the payload is not a JSON object
     */
    public JsonNode migrate(JsonNode payload, int schemaVersion) {
        if (schemaVersion != 1) {
            throw new UnsupportedSchemaVersionException(schemaVersion);
        }
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("Project payload must be a JSON object");
        }
        return payload;
    }

    /** Hex SHA-256 of the payload's compact JSON text. */
    public String checksum(JsonNode payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] json = mapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(digest.digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Project payload is not serialisable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
