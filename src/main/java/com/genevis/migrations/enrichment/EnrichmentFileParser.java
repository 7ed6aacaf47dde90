package com.genevis.migrations.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one enrichment JSON array into {@link EnrichmentRecord}s.
 *
 * <p>A file that cannot be read, is not valid JSON or is not an array yields no records; an
 * element without a term id or term description is dropped. Neither case is fatal.</p>
 */
@Component
public class EnrichmentFileParser {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentFileParser.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public List<EnrichmentRecord> parse(EnrichmentFile file) {
        JsonNode root;
        try (Reader reader = Files.newBufferedReader(file.path(), StandardCharsets.UTF_8)) {
            root = mapper.readTree(reader);
        } catch (JsonProcessingException ex) {
            log.error(EnrichmentConstants.MSG_INVALID_JSON, file.path(), ex.getOriginalMessage());
            return List.of();
        } catch (IOException ex) {
            log.error(EnrichmentConstants.MSG_READ_FAILED, file.path(), ex.getMessage());
            return List.of();
        }

        if (root == null || !root.isArray()) {
            log.error(EnrichmentConstants.MSG_NOT_AN_ARRAY, file.path(), root == null ? "empty document" : root.getNodeType());
            return List.of();
        }

        List<EnrichmentRecord> records = new ArrayList<>(root.size());
        for (JsonNode item : root) {
            if (!item.isObject()) {
                log.debug("Skipping non-object element in {}: {}", file.path(), item.getNodeType());
                continue;
            }

            EnrichmentRecord record = toRecord(file, item);
            if (record.termId().isEmpty() || record.termDescription().isEmpty()) {
                log.debug("Skipping record with missing term_id or description in {}", file.path());
                continue;
            }
            records.add(record);
        }
        return records;
    }

    private EnrichmentRecord toRecord(EnrichmentFile file, JsonNode item) {
        return new EnrichmentRecord(
                file.comparison(),
                file.database(),
                text(item, EnrichmentConstants.KEY_TERM_ID),
                text(item, EnrichmentConstants.KEY_TERM_DESCRIPTION),
                integer(item, EnrichmentConstants.KEY_GENES_MAPPED, EnrichmentConstants.DEFAULT_GENES_MAPPED),
                decimal(item, EnrichmentConstants.KEY_ENRICHMENT_SCORE, EnrichmentConstants.DEFAULT_ENRICHMENT_SCORE),
                text(item, EnrichmentConstants.KEY_DIRECTION),
                decimal(item, EnrichmentConstants.KEY_FALSE_DISCOVERY_RATE, EnrichmentConstants.DEFAULT_FALSE_DISCOVERY_RATE),
                text(item, EnrichmentConstants.KEY_METHOD),
                list(item, EnrichmentConstants.KEY_MATCHING_PROTEIN_IDS),
                list(item, EnrichmentConstants.KEY_MATCHING_PROTEIN_LABELS)
        );
    }

    private String text(JsonNode item, String key) {
        JsonNode value = item.get(key);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.asText().trim();
    }

    private int integer(JsonNode item, String key, int defaultValue) {
        JsonNode value = item.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asInt(defaultValue);
    }

    private double decimal(JsonNode item, String key, double defaultValue) {
        JsonNode value = item.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asDouble(defaultValue);
    }

    /**
     * Protein lists are stored comma-separated; arrays are joined, scalars are kept as text.
     */
    private String list(JsonNode item, String key) {
        JsonNode value = item.get(key);
        if (value == null || value.isNull()) {
            return "";
        }
        if (!value.isArray()) {
            return value.asText();
        }
        List<String> entries = new ArrayList<>(value.size());
        for (JsonNode entry : value) {
            entries.add(entry.asText());
        }
        return String.join(EnrichmentConstants.LIST_SEPARATOR, entries);
    }
}
