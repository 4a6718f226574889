package com.chuntfm.schedule.infrastructure.adapter.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class SchedulePayloadMapper {

    private static final Logger logger = LoggerFactory.getLogger(SchedulePayloadMapper.class);

    public static final String RAW_DATA_KEY = "raw_data";

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SchedulePayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Maps the JSON {@code data} column to a payload map.
     * Text that is not a JSON object is kept verbatim under {@value #RAW_DATA_KEY}.
     */
    public Map<String, Object> toPayload(String data) {
        if (data == null) {
            return Map.of();
        }

        try {
            JsonNode node = objectMapper.readTree(data);
            if (node != null && node.isObject()) {
                return objectMapper.convertValue(node, PAYLOAD_TYPE);
            }
            logger.debug("Schedule data is not a JSON object, keeping it as raw data");
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse schedule data as JSON: {}", e.getOriginalMessage());
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(RAW_DATA_KEY, data);
        return raw;
    }
}
