package com.example.werewolf.game.service;

import com.example.werewolf.global.event.EventBus;
import com.example.werewolf.global.event.GameEvent;
import com.example.werewolf.global.event.GameEventListener;
import com.example.werewolf.global.event.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 모든 게임 이벤트를 사람이 읽을 수 있는 진행 기록으로 남긴다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameLogListener implements GameEventListener {

    private static final int MAX_LINES = 1000;

    private final EventBus eventBus;
    private final List<String> lines = new ArrayList<>();
    private Subscription subscription;

    @PostConstruct
    public void init() {
        subscription = eventBus.subscribe(this);
    }

    @PreDestroy
    public void close() {
        eventBus.unsubscribe(subscription);
    }

    @Override
    public void onEvent(GameEvent event) {
        String line = format(event);
        log.info("[game-log] {}", line);
        synchronized (lines) {
            lines.add(line);
            if (lines.size() > MAX_LINES) {
                lines.remove(0);
            }
        }
    }

    public List<String> getLines() {
        synchronized (lines) {
            return List.copyOf(lines);
        }
    }

    public void clear() {
        synchronized (lines) {
            lines.clear();
        }
    }

    String format(GameEvent event) {
        return switch (event.type()) {
            case PLAYER_ADDED -> "Player added: " + event.get("playerName") + " (#" + event.get("number") + ")";
            case PLAYER_REMOVED -> "Player removed: " + event.get("playerName");
            case PLAYER_ROLE_ASSIGNED -> "Role set manually for " + event.get("playerName");
            case PLAYER_DIED -> event.get("playerName") + " died in round " + event.get("round")
                    + " (" + event.get("phase") + ")";
            case REGULATION_UPDATED -> "Regulation updated: " + event.get("roles");
            case REGULATION_CONFIRMED -> "Regulation confirmed: " + event.get("roles");
            case PLAYERS_CONFIRMED -> "Players confirmed: " + event.get("players");
            case REGULATION_SAVED -> "Regulation preset saved: " + event.get("name");
            case GAME_STARTED -> "Game started with " + event.get("playerCount") + " players";
            case PHASE_CHANGED -> "Phase changed: " + event.get("oldPhase") + " -> " + event.get("newPhase")
                    + " (round " + event.get("round") + ")";
            case ROUND_CHANGED -> "Round " + event.get("round") + " begins";
            case GAME_ENDED -> "Game ended: " + event.get("winner") + " (round " + event.get("finalRound") + ")";
            case GAME_STATE_RESET -> "Game reset";
            case GAME_STATE_RESTORED -> "Game restored at round " + event.get("round") + " (" + event.get("phase") + ")";
            case ERROR -> "Listener error: " + event.get("errorType") + " - " + event.get("errorMessage");
        };
    }
}
