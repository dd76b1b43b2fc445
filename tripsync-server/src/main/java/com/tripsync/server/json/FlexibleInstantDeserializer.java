package com.tripsync.server.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * 宽松的 Instant 反序列化：历史文件里的日期写法并不统一。
 * <ul>
 *     <li>2024-01-01T08:00:00.000Z / 2024-01-01T08:00:00Z</li>
 *     <li>2024-01-01T08:00:00+08:00</li>
 *     <li>2024-01-01T08:00:00（按 UTC 处理）</li>
 *     <li>2024-01-01（当天 00:00 UTC）</li>
 *     <li>毫秒时间戳</li>
 * </ul>
 */
@Slf4j
public class FlexibleInstantDeserializer extends StdDeserializer<Instant> {

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    public FlexibleInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return Instant.ofEpochMilli(p.getLongValue());
        }
        if (token != JsonToken.VALUE_STRING) {
            return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
        }
        String text = p.getText().trim();
        if (text.isEmpty()) {
            return null;
        }
        Instant parsed = parse(text);
        if (parsed == null) {
            return (Instant) ctxt.handleWeirdStringValue(Instant.class, text, "unsupported date format");
        }
        return parsed;
    }

    static Instant parse(String text) {
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                log.trace("日期格式不匹配, text={}, reason={}", text, e.getMessage());
            }
        }
        return null;
    }
}
