package com.delta.taskmonitor.monitor.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the recipient column of a scheduled task. The column holds either a JSON array of
 * addresses or a plain list separated by commas or semicolons.
 */
@Component
public class RecipientParser {
    private static final Logger log = LoggerFactory.getLogger(RecipientParser.class);

    private final ObjectMapper objectMapper;

    public RecipientParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String trimmed = raw.trim();
        Set<String> recipients = new LinkedHashSet<>();
        if (trimmed.startsWith("[")) {
            try {
                JsonNode node = objectMapper.readTree(trimmed);
                if (node.isArray()) {
                    for (JsonNode item : node) {
                        addIfPresent(recipients, item.asText());
                    }
                    return List.copyOf(recipients);
                }
            } catch (JsonProcessingException e) {
                log.debug("Recipient column is not valid JSON, falling back to delimited parsing: {}", trimmed);
            }
        }
        for (String part : trimmed.split("[,;]")) {
            addIfPresent(recipients, part);
        }
        return List.copyOf(recipients);
    }

    private void addIfPresent(Set<String> recipients, String candidate) {
        if (candidate == null) {
            return;
        }
        String cleaned = candidate.trim();
        if (cleaned.startsWith("[")) {
            cleaned = cleaned.substring(1);
        }
        if (cleaned.endsWith("]")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        cleaned = cleaned.replace("\"", "").trim();
        if (!cleaned.isEmpty()) {
            recipients.add(cleaned);
        }
    }
}
