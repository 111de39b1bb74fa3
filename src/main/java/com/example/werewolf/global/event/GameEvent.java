package com.example.werewolf.global.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 게임 상태 변화 알림. 발행 후에는 변경되지 않는다.
 * data 는 입력 순서를 유지하며 null 값을 허용한다.
 */
public record GameEvent(
        EventType type,
        Map<String, Object> data,
        String source,
        Instant timestamp,
        String eventId) {

    public GameEvent {
        Objects.requireNonNull(type, "type");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        source = source == null ? "system" : source;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        eventId = eventId == null ? UUID.randomUUID().toString() : eventId;
    }

    public static GameEvent of(EventType type, String source, Map<String, Object> data) {
        return new GameEvent(type, data, source, null, null);
    }

    public Object get(String key) {
        return data.get(key);
    }

    @Override
    public String toString() {
        return "GameEvent(type=" + type + ", source=" + source + ", timestamp=" + timestamp + ")";
    }
}
