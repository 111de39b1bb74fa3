package com.example.werewolf.global.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 게임 이벤트 발행/구독 채널.
 * - publish 는 호출 스레드에서 구독 순서대로 동기 실행된다.
 * - 리스너 하나가 실패해도 나머지 리스너는 계속 실행되며, 예외는 발행자에게 전파되지 않는다.
 * - 인스턴스끼리는 아무것도 공유하지 않는다. 테스트마다 new EventBus() 로 격리한다.
 */
@Slf4j
public class EventBus {

    public static final int DEFAULT_HISTORY_SIZE = 1000;
    private static final String SOURCE = "event_bus";

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Deque<GameEvent> history = new ArrayDeque<>();
    private final int maxHistorySize;

    public EventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public EventBus(int maxHistorySize) {
        if (maxHistorySize < 0) {
            throw new IllegalArgumentException("maxHistorySize must not be negative: " + maxHistorySize);
        }
        this.maxHistorySize = maxHistorySize;
    }

    // ================= 구독 =================

    /**
     * 모든 이벤트 타입에 대해 리스너를 등록한다.
     * 같은 리스너를 중복 등록하면 등록한 횟수만큼 호출된다.
     */
    public Subscription subscribe(GameEventListener listener) {
        return register(listener, null);
    }

    /**
     * 특정 이벤트 타입에만 리스너를 등록한다.
     */
    public Subscription subscribe(EventType eventType, GameEventListener listener) {
        Objects.requireNonNull(eventType, "eventType");
        return register(listener, eventType);
    }

    private Subscription register(GameEventListener listener, EventType eventType) {
        Objects.requireNonNull(listener, "listener");
        Subscription subscription = new Subscription(sequence.incrementAndGet(), listener, eventType);
        subscriptions.add(subscription);
        log.debug("Subscribed: {}", subscription);
        return subscription;
    }

    /**
     * 토큰에 해당하는 등록 하나를 해제한다. 모르는 토큰이면 아무 일도 하지 않는다.
     *
     * @return 실제로 해제되었으면 true
     */
    public boolean unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return false;
        }
        boolean removed = subscriptions.remove(subscription);
        if (removed) {
            log.debug("Unsubscribed: {}", subscription);
        }
        return removed;
    }

    /**
     * 해당 리스너의 가장 먼저 등록된 항목 하나를 해제한다. 등록된 적 없는 리스너면 no-op.
     */
    public boolean unsubscribe(GameEventListener listener) {
        for (Subscription subscription : subscriptions) {
            if (subscription.getListener() == listener) {
                return unsubscribe(subscription);
            }
        }
        return false;
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    // ================= 발행 =================

    public void publish(GameEvent event) {
        Objects.requireNonNull(event, "event");
        addToHistory(event);
        log.info("Event published: {}", event);
        log.debug("Event details: type={}, data={}", event.type(), event.data());

        // CopyOnWriteArrayList 순회는 시작 시점의 스냅샷 기준
        for (Subscription subscription : subscriptions) {
            if (!subscription.accepts(event.type())) {
                continue;
            }
            try {
                subscription.getListener().onEvent(event);
            } catch (RuntimeException e) {
                log.error("Error in listener {} while handling {}: {}", subscription, event.type(), e.getMessage(), e);
                if (event.type() != EventType.ERROR) {
                    dispatchError(createErrorEvent(e, event, subscription));
                }
            }
        }
    }

    private GameEvent createErrorEvent(RuntimeException error, GameEvent original, Subscription subscription) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("errorType", error.getClass().getSimpleName());
        data.put("errorMessage", error.getMessage());
        data.put("originalEventType", original.type().name());
        data.put("originalEventId", original.eventId());
        data.put("subscriptionId", subscription.getId());
        return GameEvent.of(EventType.ERROR, SOURCE, data);
    }

    /**
     * ERROR 이벤트 전달. 여기서 실패한 리스너는 로그만 남기고 다시 ERROR 를 만들지 않는다.
     */
    private void dispatchError(GameEvent errorEvent) {
        addToHistory(errorEvent);
        for (Subscription subscription : subscriptions) {
            if (!subscription.accepts(EventType.ERROR)) {
                continue;
            }
            try {
                subscription.getListener().onEvent(errorEvent);
            } catch (RuntimeException e) {
                log.error("Error in error-handling listener {}: {}", subscription, e.getMessage(), e);
            }
        }
    }

    // ================= 이력 =================

    private synchronized void addToHistory(GameEvent event) {
        if (maxHistorySize == 0) {
            return;
        }
        history.addLast(event);
        while (history.size() > maxHistorySize) {
            history.removeFirst();
        }
    }

    /**
     * 최근 이벤트를 오래된 순으로 반환한다.
     *
     * @param count     최대 개수, null 이면 전부
     * @param eventType 타입 필터, null 이면 전부
     */
    public synchronized List<GameEvent> getRecentEvents(Integer count, EventType eventType) {
        List<GameEvent> events = new ArrayList<>();
        for (GameEvent event : history) {
            if (eventType == null || event.type() == eventType) {
                events.add(event);
            }
        }
        if (count != null && count >= 0 && events.size() > count) {
            events = events.subList(events.size() - count, events.size());
        }
        return List.copyOf(events);
    }

    public synchronized Map<EventType, Integer> getEventCounts() {
        Map<EventType, Integer> counts = new EnumMap<>(EventType.class);
        for (EventType type : EventType.values()) {
            counts.put(type, 0);
        }
        for (GameEvent event : history) {
            counts.merge(event.type(), 1, Integer::sum);
        }
        return counts;
    }

    public synchronized void clearHistory() {
        history.clear();
        log.info("Event history cleared");
    }
}
