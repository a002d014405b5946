package com.qoeguard.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads baseline and candidate documents from disk or text into {@link JsonValue}s.
 */
@Component
public class JsonDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentReader.class);

    private final ObjectMapper objectMapper;

    public JsonDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonValue read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new JsonInputException("File not found: " + file);
        }
        try {
            JsonNode node = objectMapper.readTree(file.toFile());
            log.debug("Read {} ({} bytes)", file, Files.size(file));
            return JsonValues.fromNode(node);
        } catch (JsonProcessingException e) {
            throw new JsonInputException("Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new JsonInputException("Unable to read " + file + ": " + e.getMessage(), e);
        }
    }

    public JsonValue parse(String json) {
        try {
            return JsonValues.fromNode(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new JsonInputException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode readTree(Path file) {
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new JsonInputException("Unable to read " + file + ": " + e.getMessage(), e);
        }
    }
}
