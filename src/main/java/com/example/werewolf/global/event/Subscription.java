package com.example.werewolf.global.event;

import lombok.Getter;

/**
 * subscribe 한 번에 대응하는 등록 토큰.
 * 같은 리스너를 여러 번 등록해도 토큰은 각각 따로 발급된다.
 */
@Getter
public final class Subscription {

    private final long id;
    private final GameEventListener listener;
    /** null 이면 모든 이벤트를 받는다. */
    private final EventType eventType;

    Subscription(long id, GameEventListener listener, EventType eventType) {
        this.id = id;
        this.listener = listener;
        this.eventType = eventType;
    }

    boolean accepts(EventType type) {
        return eventType == null || eventType == type;
    }

    @Override
    public String toString() {
        return "Subscription(id=" + id + ", eventType=" + (eventType == null ? "ALL" : eventType) + ")";
    }
}
