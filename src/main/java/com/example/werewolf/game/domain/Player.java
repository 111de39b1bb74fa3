package com.example.werewolf.game.domain;

import com.example.werewolf.global.error.ErrorCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 게임 참가자. 이벤트를 직접 발행하지 않고 GameState 를 통해서만 변경된다.
 * 변경 메서드는 패키지 전용이라 바깥에서는 조회만 할 수 있다.
 */
@Slf4j
@Getter
public class Player {

    private final int number;
    private final String name;
    private PlayerRole role;
    private boolean alive = true;
    private final List<StatusRecord> statusHistory = new ArrayList<>();

    public Player(int number, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Player name must not be blank");
        }
        this.number = number;
        this.name = name;
        statusHistory.add(new StatusRecord(0, GamePhase.SETUP, PlayerStatus.ALIVE, StatusRecord.Reason.REGISTERED));
    }

    /**
     * 스냅샷 복원용. 이력은 그대로 이어받는다.
     */
    Player(int number, String name, PlayerRole role, boolean alive, List<StatusRecord> statusHistory) {
        this.number = number;
        this.name = name;
        this.role = role;
        this.alive = alive;
        this.statusHistory.addAll(statusHistory);
    }

    /**
     * 역할 배정. 한 게임에서 한 번만 가능하다.
     *
     * @throws com.example.werewolf.global.error.InvalidStateException 이미 역할이 있거나 사망한 경우
     */
    void assignRole(PlayerRole role) {
        Objects.requireNonNull(role, "role");
        if (this.role != null) {
            throw ErrorCode.ROLE_ALREADY_ASSIGNED.exception(name + " is " + this.role);
        }
        if (!alive) {
            throw ErrorCode.PLAYER_DEAD.exception(name);
        }
        this.role = role;
        log.debug("Role assigned to player {}: {}", name, role);
    }

    // 역할 재배정(셔플, 리셋) 전에 GameState 가 호출
    void clearRole() {
        this.role = null;
    }

    /**
     * 사망 처리. 이미 사망한 경우 아무 일도 하지 않는다.
     *
     * @return 이번 호출로 사망했으면 true
     */
    boolean kill(int round, GamePhase phase) {
        if (!alive) {
            log.debug("Player {} is already dead", name);
            return false;
        }
        alive = false;
        statusHistory.add(new StatusRecord(round, phase, PlayerStatus.DEAD, StatusRecord.Reason.KILLED));
        log.info("Player {} died", name);
        return true;
    }

    /**
     * 생존 상태로 되돌린다. 테스트 준비용이며 정상 진행에서는 쓰지 않는다.
     */
    boolean resurrect(int round, GamePhase phase) {
        if (alive) {
            log.warn("Player {} is already alive", name);
            return false;
        }
        alive = true;
        statusHistory.add(new StatusRecord(round, phase, PlayerStatus.ALIVE, StatusRecord.Reason.RESURRECTED));
        log.info("Player {} resurrected", name);
        return true;
    }

    public Team getTeam() {
        return role == null ? null : role.getTeam();
    }

    public List<StatusRecord> getStatusHistory() {
        return List.copyOf(statusHistory);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Player other)) {
            return false;
        }
        return number == other.number && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, name);
    }

    @Override
    public String toString() {
        return "Player(number=" + number + ", name=" + name + ", role=" + (role == null ? "UNASSIGNED" : role)
                + ", alive=" + alive + ")";
    }
}
