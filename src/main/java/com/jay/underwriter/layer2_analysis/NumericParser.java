package com.jay.underwriter.layer2_analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.underwriter.model.FieldValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Turns board column values into numbers. Never throws: malformed or missing
 * input reads as 0.0.
 *
 * The structured JSON payload wins when it decodes to a number (it is often a
 * quoted numeric string such as "\"1250000\""); otherwise the display text is
 * used with whitespace and thousands separators stripped.
 */
@Slf4j
@Component
public class NumericParser {

    private static final Pattern DECIMAL =
        Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final ObjectMapper mapper = new ObjectMapper();

    public double parse(FieldValue field) {
        if (field == null) return 0.0;
        OptionalDouble structured = parsePayload(field.getValue());
        if (structured.isPresent()) return structured.getAsDouble();
        return parseText(field.getText());
    }

    public double parseText(String text) {
        return tryParse(text).orElse(0.0);
    }

    private OptionalDouble parsePayload(String payload) {
        if (payload == null || payload.isBlank()) return OptionalDouble.empty();
        try {
            return fromNode(mapper.readTree(payload));
        } catch (Exception e) {
            log.debug("Unreadable column payload '{}': {}", payload, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private OptionalDouble fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return OptionalDouble.empty();
        if (node.isNumber()) return finite(node.asDouble());
        if (node.isTextual()) return tryParse(node.asText());
        // numbers columns sometimes arrive wrapped as {"number": ...}
        if (node.isObject() && node.has("number")) return fromNode(node.get("number"));
        return OptionalDouble.empty();
    }

    private OptionalDouble tryParse(String text) {
        if (text == null) return OptionalDouble.empty();
        String cleaned = text.strip().replace(",", "");
        if (cleaned.isEmpty() || !DECIMAL.matcher(cleaned).matches()) return OptionalDouble.empty();
        try {
            return finite(Double.parseDouble(cleaned));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static OptionalDouble finite(double v) {
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }
}
