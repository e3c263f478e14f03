package com.iudex.cograg.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iudex.cograg.exception.ModelOutputParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient extraction of a JSON object from free-form model output.
 */
public final class ModelJson {
    private static final Logger log = LoggerFactory.getLogger(ModelJson.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");
    private static final Pattern OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

    private ModelJson() {
    }

    public static JsonNode parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ModelOutputParseException("Empty model output");
        }
        String text = FENCE.matcher(raw.trim()).replaceAll("").trim();
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.debug("Model output is not bare JSON, searching for an embedded object: {}", e.getOriginalMessage());
        }
        Matcher matcher = OBJECT.matcher(text);
        if (matcher.find()) {
            try {
                JsonNode node = MAPPER.readTree(matcher.group());
                if (node != null && node.isObject()) {
                    return node;
                }
            } catch (JsonProcessingException e) {
                throw new ModelOutputParseException("Model output is not valid JSON", e);
            }
        }
        throw new ModelOutputParseException("No JSON object found in model output");
    }
}
