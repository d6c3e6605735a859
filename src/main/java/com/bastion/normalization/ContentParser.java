package com.bastion.normalization;

import com.bastion.domain.WafEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits the text of an export file into raw records and normalizes each one.
 *
 * The whole content is first read as a single JSON document; a top-level array
 * is treated as one record per element, and so is an array held by a wrapper
 * object such as an API response ({"result": [...]}). Anything else (a syntax
 * error, or a lone object as in a one-line NDJSON file) falls back to line mode
 * where every non-blank line is decoded independently. A leading byte order
 * mark is ignored. A bad record or line is reported in
 * the error list and never aborts the others. Content problems never surface as
 * exceptions; the worst case is a result with zero events.
 */
@Component
public class ContentParser {

    private static final Logger log = LoggerFactory.getLogger(ContentParser.class);

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Fields that hold the record array in API-style responses, in lookup order
     */
    static final String[] WRAPPER_FIELDS = {"result", "results", "events", "records", "data"};

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final WafRecordNormalizer normalizer;

    public ContentParser(ObjectMapper objectMapper, WafRecordNormalizer normalizer) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.normalizer = normalizer;
    }

    /**
     * Parse an export file.
     *
     * @param content full file text
     * @return normalized events, per-record errors and skip count
     */
    public ParsedContent parse(String content) {
        if (content == null || content.isBlank()) {
            return new ParsedContent(ParsedContent.Format.NDJSON, new ArrayList<>(), new ArrayList<>(), 0);
        }

        String text = content.charAt(0) == BYTE_ORDER_MARK ? content.substring(1) : content;

        JsonNode document = readWholeDocument(text);
        if (document != null && document.isArray()) {
            return parseArray(document);
        }
        JsonNode wrapped = wrappedArray(document);
        if (wrapped != null) {
            return parseArray(wrapped);
        }
        return parseLines(text);
    }

    /**
     * The record array of a wrapper object, or null when the document is a
     * record itself (it carries a ray id) or holds no wrapper field.
     */
    private static JsonNode wrappedArray(JsonNode document) {
        if (document == null || !document.isObject()) {
            return null;
        }
        for (String rayIdField : WafRecordNormalizer.RAY_ID) {
            if (document.has(rayIdField)) {
                return null;
            }
        }
        for (String field : WRAPPER_FIELDS) {
            JsonNode value = document.get(field);
            if (value != null && value.isArray()) {
                log.debug("Reading records from wrapper field '{}'", field);
                return value;
            }
        }
        return null;
    }

    private JsonNode readWholeDocument(String content) {
        try {
            return strictReader.readTree(content);
        } catch (JsonProcessingException e) {
            log.debug("Content is not a single JSON document, falling back to NDJSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private ParsedContent parseArray(JsonNode array) {
        List<WafEvent> events = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int skipped = 0;

        int position = 0;
        for (JsonNode element : array) {
            position++;
            try {
                NormalizationResult result = normalizeNode(element, "record " + position);
                if (result.isNormalized()) {
                    events.add(result.getEvent());
                } else {
                    skipped++;
                }
            } catch (ParseException e) {
                errors.add(e.describe());
            }
        }

        log.debug("Parsed JSON array: {} records, {} events, {} skipped, {} errors",
            position, events.size(), skipped, errors.size());
        return new ParsedContent(ParsedContent.Format.JSON_ARRAY, events, errors, skipped);
    }

    private ParsedContent parseLines(String content) {
        List<WafEvent> events = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int skipped = 0;

        String[] lines = content.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }

            String location = "line " + (i + 1);
            try {
                NormalizationResult result = normalizeNode(readLine(line, location), location);
                if (result.isNormalized()) {
                    events.add(result.getEvent());
                } else {
                    skipped++;
                }
            } catch (ParseException e) {
                errors.add(e.describe());
            }
        }

        log.debug("Parsed NDJSON: {} events, {} skipped, {} errors", events.size(), skipped, errors.size());
        return new ParsedContent(ParsedContent.Format.NDJSON, events, errors, skipped);
    }

    private JsonNode readLine(String line, String location) {
        try {
            return strictReader.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ParseException("invalid JSON (" + e.getOriginalMessage() + ")", location, e);
        }
    }

    private NormalizationResult normalizeNode(JsonNode node, String location) {
        if (node == null || !node.isObject()) {
            throw new ParseException("expected a JSON object", location);
        }
        try {
            Map<String, Object> raw = objectMapper.convertValue(node, RECORD_TYPE);
            return normalizer.normalize(raw);
        } catch (RuntimeException e) {
            throw new ParseException("failed to normalize record (" + e.getMessage() + ")", location, e);
        }
    }
}
