package com.tripsync.server.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;

/**
 * 行程文件的 JSON 读写约定，磁盘格式与内存对象之间只通过这里创建的 ObjectMapper 转换。
 */
public final class TripJson {

    private TripJson() {
    }

    public static ObjectMapper createObjectMapper() {
        SimpleModule lenientDates = new SimpleModule("tripsync-dates");
        lenientDates.addDeserializer(Instant.class, new FlexibleInstantDeserializer());

        ObjectMapper mapper = new ObjectMapper();
        // 后注册的模块优先，宽松的 Instant 解析覆盖 JavaTimeModule 的默认实现
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(lenientDates);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // 合法 JSON 后面跟着残留内容同样视为损坏，交给恢复流程处理
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }
}
