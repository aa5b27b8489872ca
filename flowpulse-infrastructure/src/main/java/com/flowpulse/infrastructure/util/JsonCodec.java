package com.flowpulse.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.flowpulse.types.enums.ResponseCode;
import com.flowpulse.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * metadata / triggers / security / error_handling 等 JSONB 列的编解码。
 * 空列读为 null，坏数据按 UN_ERROR 上抛，不做静默兜底。
 */
@Component
public class JsonCodec {

    private final ObjectMapper objectMapper;
    private final JavaType objectMapType;
    private final JavaType stringListType;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        TypeFactory typeFactory = objectMapper.getTypeFactory();
        this.objectMapType = typeFactory.constructMapType(LinkedHashMap.class, String.class, Object.class);
        this.stringListType = typeFactory.constructCollectionType(List.class, String.class);
    }

    public Map<String, Object> readMap(String json) {
        return decode(json, objectMapType);
    }

    public List<String> readStringList(String json) {
        return decode(json, stringListType);
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Failed to encode jsonb value of type " + value.getClass().getSimpleName(), ex);
        }
    }

    private <T> T decode(String json, JavaType type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Failed to decode jsonb column as " + type.toCanonical(), ex);
        }
    }
}
