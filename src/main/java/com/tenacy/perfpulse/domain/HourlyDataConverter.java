package com.tenacy.perfpulse.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

/**
 * 시간(문자열 "0" ~ "23") -> HourlyStat 맵을 JSON 텍스트 컬럼으로 저장한다.
 */
@Converter
public class HourlyDataConverter implements AttributeConverter<Map<String, HourlyStat>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, HourlyStat>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, HourlyStat> attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(sorted(attribute));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("hourly_data 직렬화 실패", e);
        }
    }

    @Override
    public Map<String, HourlyStat> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return sorted(Map.of());
        }
        try {
            return sorted(OBJECT_MAPPER.readValue(dbData, TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("hourly_data 역직렬화 실패: " + dbData, e);
        }
    }

    static Map<String, HourlyStat> sorted(Map<String, HourlyStat> source) {
        Map<String, HourlyStat> result = new TreeMap<>(DailyStat.HOUR_KEY_ORDER);
        result.putAll(source);
        return result;
    }
}
