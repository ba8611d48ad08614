package com.streamgate.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamgate.types.enums.ResponseCode;
import com.streamgate.types.exception.AppException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON 编解码工具，推送事件的 data 字段与管理视图的结构转换都经由这里。
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 序列化为紧凑 JSON；失败时抛出 {@link AppException}。
     */
    public String toJson(Object value) {
        if (value == null) {
            return "null";
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write event json", ex);
        }
    }

    /**
     * 将 record / POJO 转为有序 Map。
     */
    public Map<String, Object> toMap(Object value) {
        if (value == null) {
            return null;
        }
        return objectMapper.convertValue(value, MAP_REF);
    }

}
