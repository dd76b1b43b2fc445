package com.tripsync.server.storage;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.pojo.entity.TripDocument;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 损坏行程文件的恢复。
 * <p>
 * 典型损坏是并发写入时旧内容残留在新内容后面（常伴随 NUL 字节）。
 * 恢复过程：定位第一个非法位置（解析器报告的偏移与第一个 NUL 取较小者），
 * 在其之前找到根对象闭合的位置并截断，再重新解析；
 * 截断结果必须是结构完整的文档（有 id 和 schemaVersion）才算恢复成功。
 * </p>
 */
@Slf4j
public class CorruptedJsonRecovery {

    private final ObjectMapper objectMapper;

    public CorruptedJsonRecovery(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<TripDocument> recover(String raw, JsonProcessingException parseError) {
        int limit = firstInvalidOffset(raw, parseError);
        int end = rootObjectEnd(raw, limit);
        if (end < 0) {
            log.warn("未找到完整的根对象，无法恢复, invalidOffset={}", limit);
            return Optional.empty();
        }
        String candidate = raw.substring(0, end + 1);
        try {
            TripDocument doc = objectMapper.readValue(candidate, TripDocument.class);
            if (doc == null || doc.getId() == null || doc.getSchemaVersion() == null) {
                log.warn("截断后的内容缺少 id 或 schemaVersion，放弃恢复");
                return Optional.empty();
            }
            log.info("损坏文件已截断恢复, keptChars={}, droppedChars={}", candidate.length(),
                    raw.length() - candidate.length());
            return Optional.of(doc);
        } catch (JsonProcessingException e) {
            log.warn("截断后的内容仍无法解析: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static int firstInvalidOffset(String raw, JsonProcessingException parseError) {
        int limit = raw.length();
        int nul = raw.indexOf('\u0000');
        if (nul >= 0) {
            limit = nul;
        }
        JsonLocation location = parseError == null ? null : parseError.getLocation();
        if (location != null && location.getCharOffset() >= 0 && location.getCharOffset() < limit) {
            limit = (int) location.getCharOffset();
        }
        return limit;
    }

    /**
     * 在 [0, limit) 内扫描，返回根对象右花括号的下标；根对象没有闭合返回 -1。
     * 字符串内的括号和转义字符不计入深度。
     */
    static int rootObjectEnd(String raw, int limit) {
        int depth = 0;
        boolean started = false;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < limit; i++) {
            char c = raw.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> {
                    depth++;
                    started = true;
                }
                case '}', ']' -> {
                    depth--;
                    if (started && depth == 0) {
                        return c == '}' ? i : -1;
                    }
                    if (depth < 0) {
                        return -1;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }
}
