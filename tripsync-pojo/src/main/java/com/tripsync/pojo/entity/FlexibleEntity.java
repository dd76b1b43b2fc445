package com.tripsync.pojo.entity;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.EqualsAndHashCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 可携带未知字段的实体基类。
 * <p>行程文件里常有本程序不关心的字段（博客、Instagram、天气缓存等），
 * 反序列化时统一收进 extraProperties，写回时原样输出，保证读-改-写不会丢数据。</p>
 */
@EqualsAndHashCode
public abstract class FlexibleEntity {

    private final Map<String, Object> extraProperties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtraProperties() {
        return extraProperties;
    }

    @JsonAnySetter
    public void putExtraProperty(String name, Object value) {
        extraProperties.put(name, value);
    }

    public Object removeExtraProperty(String name) {
        return extraProperties.remove(name);
    }
}
