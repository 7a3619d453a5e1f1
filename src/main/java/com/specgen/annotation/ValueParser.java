package com.specgen.annotation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts the raw text of {@code default=}, {@code example=} and {@code enum=} flags into typed values.
 */
@Slf4j
final class ValueParser {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+([eE][-+]?\\d+)?");

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ValueParser() {
    }

    /**
     * Parses one value. Booleans, integers, decimals and JSON objects or arrays become their Java counterparts;
     * everything else, including JSON that does not parse, stays a string.
     *
     * @param raw The flag value as written.
     * @return The typed value, or {@code null} for a {@code null} input.
     */
    static Object parse(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.valueOf(text);
        }
        if (INTEGER.matcher(text).matches()) {
            BigInteger value = new BigInteger(text);
            if (value.bitLength() < 32) {
                return value.intValue();
            }
            if (value.bitLength() < 64) {
                return value.longValue();
            }
            return value;
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.valueOf(text);
        }
        if (text.startsWith("{") || text.startsWith("[")) {
            try {
                return objectMapper.readValue(text, Object.class);
            } catch (JsonProcessingException e) {
                log.debug("Value '{}' is not valid JSON, keeping it as a string.", text);
            }
        }
        return text;
    }

    /**
     * Parses an {@code enum=} value: either a JSON array or a comma-separated list.
     */
    static List<Object> parseList(String raw) {
        List<Object> values = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return values;
        }
        Object parsed = raw.trim().startsWith("[") ? parse(raw) : null;
        if (parsed instanceof List<?> list) {
            values.addAll(list);
            return values;
        }
        for (String item : raw.split(",")) {
            if (!item.isBlank()) {
                values.add(parse(item.trim()));
            }
        }
        return values;
    }
}
