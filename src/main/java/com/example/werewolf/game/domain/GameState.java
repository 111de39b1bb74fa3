package com.example.werewolf.game.domain;

import com.example.werewolf.game.domain.snapshot.GameSnapshot;
import com.example.werewolf.game.domain.snapshot.PlayerSnapshot;
import com.example.werewolf.game.domain.snapshot.SnapshotReason;
import com.example.werewolf.game.domain.snapshot.StateHistoryEntry;
import com.example.werewolf.game.service.RoleAssigner;
import com.example.werewolf.game.state.GamePhaseFactory;
import com.example.werewolf.game.state.GamePhaseState;
import com.example.werewolf.global.error.ErrorCode;
import com.example.werewolf.global.event.EventBus;
import com.example.werewolf.global.event.EventType;
import com.example.werewolf.global.event.GameEvent;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 한 게임의 권위 있는 상태.
 * 플레이어 명단, 페이즈, 라운드, 레귤레이션을 소유하고 의미 있는 변화마다 EventBus 로 이벤트를 발행한다.
 * 단일 스레드에서 GM 한 명이 순서대로 호출한다고 가정하며 동기화하지 않는다.
 */
@Slf4j
public class GameState {

    private static final String SOURCE = "game_state";
    public static final int DEFAULT_STATE_HISTORY_LIMIT = 100;

    private final EventBus eventBus;
    private final RoleAssigner roleAssigner;
    private final GamePhaseFactory phaseFactory;

    private List<Player> players = new ArrayList<>();
    @Getter
    private GamePhase currentPhase = GamePhase.SETUP;
    @Getter
    private int currentRound = 0;
    @Getter
    private Regulation regulation;
    @Getter
    private boolean gameActive = false;
    private GameResult result;

    @Getter
    private boolean regulationConfirmed = false;
    @Getter
    private boolean playersConfirmed = false;
    /** true 면 레귤레이션과 참가자 확정 없이는 시작할 수 없다 */
    @Getter
    @Setter
    private boolean confirmationRequired = false;

    private final Deque<StateHistoryEntry> stateHistory = new ArrayDeque<>();
    @Getter
    private int stateHistoryLimit = DEFAULT_STATE_HISTORY_LIMIT;

    public GameState(EventBus eventBus) {
        this(eventBus, new RoleAssigner(new SecureRandom()), GamePhaseFactory.defaults());
    }

    public GameState(EventBus eventBus, RoleAssigner roleAssigner, GamePhaseFactory phaseFactory) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.roleAssigner = Objects.requireNonNull(roleAssigner, "roleAssigner");
        this.phaseFactory = Objects.requireNonNull(phaseFactory, "phaseFactory");
        log.info("GameState initialized");
    }

    // ================= 준비 (SETUP) =================

    /**
     * 다음 좌석 번호로 플레이어를 등록한다.
     */
    public Player addPlayer(String name) {
        int nextNumber = players.stream().mapToInt(Player::getNumber).max().orElse(0) + 1;
        return addPlayer(nextNumber, name);
    }

    public Player addPlayer(int number, String name) {
        requireSetup();
        if (findPlayer(name).isPresent()) {
            throw ErrorCode.DUPLICATE_PLAYER_NAME.exception(name);
        }
        if (players.stream().anyMatch(p -> p.getNumber() == number)) {
            throw ErrorCode.DUPLICATE_PLAYER_NUMBER.exception(String.valueOf(number));
        }
        Player player = new Player(number, name);
        players.add(player);
        playersConfirmed = false;
        recordState(SnapshotReason.PLAYER_ADDED);

        publish(EventType.PLAYER_ADDED, payload("number", number, "playerName", name));
        log.info("Added player: {} ({})", name, number);
        return player;
    }

    public void removePlayer(String name) {
        requireSetup();
        Player player = getPlayer(name);
        players.remove(player);
        playersConfirmed = false;
        recordState(SnapshotReason.PLAYER_REMOVED);

        publish(EventType.PLAYER_REMOVED, payload("number", player.getNumber(), "playerName", name));
        log.info("Removed player: {}", name);
    }

    public void setRegulation(Regulation regulation) {
        requireSetup();
        this.regulation = Objects.requireNonNull(regulation, "regulation");
        regulationConfirmed = false;
        recordState(SnapshotReason.REGULATION_SET);

        publish(EventType.REGULATION_UPDATED, payload(
                "roles", regulation.roles(),
                "minPlayers", regulation.minPlayers(),
                "maxPlayers", regulation.maxPlayers()));
        log.info("Regulation set: {}", regulation.roles());
    }

    /**
     * 현재 레귤레이션을 확정한다. 이후 setRegulation 을 다시 부르면 확정이 풀린다.
     *
     * @throws com.example.werewolf.global.error.ConfigurationException 레귤레이션이 없는 경우
     */
    public void confirmRegulation() {
        requireSetup();
        if (regulation == null) {
            throw ErrorCode.REGULATION_NOT_SET.exception("cannot confirm");
        }
        regulationConfirmed = true;
        recordState(SnapshotReason.REGULATION_CONFIRMED);

        publish(EventType.REGULATION_CONFIRMED, payload(
                "roles", regulation.roles(),
                "totalPlayers", regulation.totalPlayers()));
        log.info("Regulation confirmed");
    }

    /**
     * 현재 참가자 명단을 확정한다. 이후 참가자를 추가하거나 삭제하면 확정이 풀린다.
     *
     * @throws com.example.werewolf.global.error.InvalidStateException 참가자가 없는 경우
     */
    public void confirmPlayers() {
        requireSetup();
        if (players.isEmpty()) {
            throw ErrorCode.NO_PLAYERS.exception("cannot confirm");
        }
        playersConfirmed = true;
        recordState(SnapshotReason.PLAYERS_CONFIRMED);

        publish(EventType.PLAYERS_CONFIRMED, payload(
                "players", players.stream().map(Player::getName).toList(),
                "playerCount", players.size()));
        log.info("Players confirmed: {}", players.size());
    }

    /**
     * GM 이 준비 단계에서 역할을 직접 지정한다. 게임 시작 시 셔플로 다시 배정된다.
     */
    public void assignRole(String name, PlayerRole role) {
        if (gameActive || currentPhase != GamePhase.SETUP) {
            throw ErrorCode.ROSTER_LOCKED.exception("cannot assign role to " + name + " after start");
        }
        Player player = getPlayer(name);
        player.assignRole(role);

        publish(EventType.PLAYER_ROLE_ASSIGNED, payload(
                "number", player.getNumber(), "playerName", name, "role", role));
    }

    // ================= 게임 시작 =================

    /**
     * 레귤레이션을 검증하고 역할을 무작위 배정한 뒤 첫 페이즈로 진입한다.
     * 모든 검사를 마친 뒤에만 역할을 바꾸므로 검증에 실패하면 아무것도 바뀌지 않는다.
     *
     * @throws com.example.werewolf.global.error.InvalidStateException  이미 진행 중이거나 종료 후 리셋하지 않은 경우,
     *                                                                  확정이 필요한데 확정되지 않은 경우
     * @throws com.example.werewolf.global.error.ConfigurationException 레귤레이션과 인원이 맞지 않는 경우
     */
    public void startGame() {
        if (gameActive) {
            throw ErrorCode.GAME_ALREADY_ACTIVE.exception();
        }
        if (currentPhase != GamePhase.SETUP) {
            throw ErrorCode.GAME_FINISHED.exception();
        }
        if (regulation == null) {
            throw ErrorCode.REGULATION_NOT_SET.exception();
        }
        if (confirmationRequired && !regulationConfirmed) {
            throw ErrorCode.REGULATION_NOT_CONFIRMED.exception();
        }
        if (confirmationRequired && !playersConfirmed) {
            throw ErrorCode.PLAYERS_NOT_CONFIRMED.exception();
        }
        regulation.validate(players.size());
        for (Player player : players) {
            if (!player.isAlive()) {
                throw ErrorCode.PLAYER_DEAD.exception(player.getName() + " cannot receive a role");
            }
        }

        List<PlayerRole> roles = roleAssigner.shuffledRoles(regulation);
        for (int i = 0; i < players.size(); i++) {
            Player player = players.get(i);
            player.clearRole();
            player.assignRole(roles.get(i));
        }

        GamePhase oldPhase = currentPhase;
        gameActive = true;
        currentRound = 1;
        result = null;
        currentPhase = phaseFactory.getFirstPhase();
        recordState(SnapshotReason.GAME_STARTED);

        publish(EventType.GAME_STARTED, payload(
                "round", currentRound,
                "phase", currentPhase,
                "playerCount", players.size()));
        publishPhaseChanged(oldPhase, currentPhase);
        log.info("Game started with {} players", players.size());
    }

    // ================= 페이즈 / 라운드 =================

    /**
     * 다음 페이즈로 전환한다.
     * 게임이 이미 끝난 뒤의 호출은 경고 로그만 남기고 무시한다.
     *
     * @return 전환되었으면 true, 종료된 게임이라 무시되었으면 false
     * @throws com.example.werewolf.global.error.InvalidStateException      게임 시작 전
     * @throws com.example.werewolf.global.error.InvalidTransitionException 현재 페이즈의 다음 페이즈가 아닌 경우
     */
    public boolean changePhase(GamePhase newPhase) {
        Objects.requireNonNull(newPhase, "newPhase");
        if (!checkActiveForProgress("change phase to " + newPhase)) {
            return false;
        }

        GamePhaseState state = phaseFactory.getState(currentPhase);
        if (!state.canTransitionTo(newPhase)) {
            throw ErrorCode.INVALID_PHASE_TRANSITION.exception(currentPhase + " -> " + newPhase);
        }

        GamePhase oldPhase = currentPhase;
        currentPhase = newPhase;
        if (state.advancesRound()) {
            currentRound++;
        }
        recordState(SnapshotReason.PHASE_CHANGED);

        publishPhaseChanged(oldPhase, newPhase);
        if (state.advancesRound()) {
            publish(EventType.ROUND_CHANGED, payload("round", currentRound, "phase", currentPhase));
            log.info("Advanced to round {}", currentRound);
        }
        return true;
    }

    /**
     * 다음 라운드의 낮 토론까지 페이즈를 차례로 진행한다. 각 전환마다 PHASE_CHANGED 가 발행된다.
     *
     * @return 진행되었으면 true, 종료된 게임이라 무시되었으면 false
     */
    public boolean nextRound() {
        if (!checkActiveForProgress("advance round")) {
            return false;
        }
        do {
            changePhase(phaseFactory.getState(currentPhase).nextPhase());
        } while (gameActive && currentPhase != GamePhase.DAY_DISCUSSION);
        return true;
    }

    public int getCurrentPhaseDurationSeconds() {
        return phaseFactory.getState(currentPhase).getDurationSeconds();
    }

    /**
     * 시작 전이면 예외, 종료 후면 경고 후 false.
     */
    private boolean checkActiveForProgress(String action) {
        if (gameActive) {
            return true;
        }
        if (currentPhase == GamePhase.SETUP) {
            throw ErrorCode.GAME_NOT_STARTED.exception("cannot " + action);
        }
        // 종료 판정 직후 호출자가 그대로 다음 페이즈로 넘기려는 경우
        log.warn("Cannot {}: game is not active (result={}, round={})", action, result, currentRound);
        return false;
    }

    // ================= 사망 / 종료 판정 =================

    /**
     * 플레이어를 사망 처리하고 종료 조건을 확인한다.
     *
     * @return 이번 호출로 사망했으면 true, 이미 사망해 있었으면 false (이벤트 없음)
     * @throws com.example.werewolf.global.error.NotFoundException     플레이어가 없는 경우
     * @throws com.example.werewolf.global.error.InvalidStateException 게임이 진행 중이 아닌 경우
     */
    public boolean killPlayer(String name) {
        Player player = getPlayer(name);
        requireActive("kill " + name);

        if (!player.kill(currentRound, currentPhase)) {
            log.debug("Player {} is already dead", name);
            return false;
        }
        recordState(SnapshotReason.PLAYER_DIED);
        publishDeath(player);
        checkGameEndCondition();
        return true;
    }

    /**
     * 한 번의 처리에서 여러 명이 동시에 사망한다. 종료 조건은 전원 처리 후 한 번만 확인하므로
     * 양 진영이 동시에 전멸하면 DRAW 가 된다. 이름을 모두 확인한 뒤에만 상태를 바꾼다.
     *
     * @return 이번 호출로 실제 사망한 플레이어 이름
     */
    public List<String> killPlayers(Collection<String> names) {
        List<Player> targets = names.stream().map(this::getPlayer).toList();
        requireActive("kill " + names);

        List<Player> died = new ArrayList<>();
        for (Player target : targets) {
            if (target.kill(currentRound, currentPhase)) {
                died.add(target);
            }
        }
        if (died.isEmpty()) {
            return List.of();
        }
        recordState(SnapshotReason.PLAYER_DIED);
        died.forEach(this::publishDeath);
        checkGameEndCondition();
        return died.stream().map(Player::getName).toList();
    }

    /**
     * 진영별 생존자 수. 역할이 없는 플레이어는 세지 않는다.
     */
    public Map<Team, Integer> getTeamCounts() {
        Map<Team, Integer> counts = new EnumMap<>(Team.class);
        for (Team team : Team.values()) {
            counts.put(team, 0);
        }
        for (Player player : players) {
            if (player.isAlive() && player.getTeam() != null) {
                counts.merge(player.getTeam(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private void checkGameEndCondition() {
        if (!gameActive) {
            return;
        }
        Map<Team, Integer> counts = getTeamCounts();
        int village = counts.get(Team.VILLAGE);
        int werewolf = counts.get(Team.WEREWOLF);
        GameResult gameResult = decideResult(village, werewolf);
        if (gameResult != null) {
            endGame(gameResult, village, werewolf);
        }
    }

    /**
     * @return 어느 쪽도 전멸하지 않았으면 null
     */
    private static GameResult decideResult(int village, int werewolf) {
        GameResult gameResult;
        if (village == 0 && werewolf == 0) {
            gameResult = GameResult.DRAW;
        } else if (werewolf == 0) {
            gameResult = GameResult.winnerOf(Team.VILLAGE);
        } else if (village == 0) {
            gameResult = GameResult.winnerOf(Team.WEREWOLF);
        } else {
            gameResult = null;
        }
        return gameResult;
    }

    private void endGame(GameResult gameResult, int villageCount, int werewolfCount) {
        gameActive = false;
        result = gameResult;
        recordState(SnapshotReason.GAME_ENDED);

        publish(EventType.GAME_ENDED, payload(
                "winner", gameResult,
                "finalRound", currentRound,
                "villageCount", villageCount,
                "werewolfCount", werewolfCount));
        log.info("Game ended. Result: {}, round: {}", gameResult, currentRound);
    }

    /**
     * 같은 참가자로 새 게임을 준비한다. 역할, 생사, 이력, 확정 여부는 초기화되고 레귤레이션은 유지된다.
     * 상태 이력은 지우지 않는다.
     */
    public void reset() {
        List<Player> fresh = new ArrayList<>();
        for (Player player : players) {
            fresh.add(new Player(player.getNumber(), player.getName()));
        }
        players = fresh;
        currentPhase = GamePhase.SETUP;
        currentRound = 0;
        gameActive = false;
        result = null;
        regulationConfirmed = false;
        playersConfirmed = false;
        recordState(SnapshotReason.GAME_RESET);

        publish(EventType.GAME_STATE_RESET, payload("playerCount", players.size()));
        log.info("Game state reset");
    }

    // ================= 스냅샷 =================

    public GameSnapshot save() {
        List<PlayerSnapshot> playerSnapshots = players.stream()
                .map(p -> new PlayerSnapshot(p.getNumber(), p.getName(), p.getRole(), p.isAlive(),
                        p.getStatusHistory()))
                .toList();
        return GameSnapshot.builder()
                .phase(currentPhase)
                .round(currentRound)
                .gameActive(gameActive)
                .result(result)
                .regulation(regulation)
                .regulationConfirmed(regulationConfirmed)
                .playersConfirmed(playersConfirmed)
                .players(playerSnapshots)
                .build();
    }

    /**
     * 스냅샷으로 모든 가변 필드를 교체한다. 검증과 객체 생성을 먼저 끝낸 뒤 필드를 바꾸므로
     * 검증 실패 시 현재 상태는 그대로 남는다. 상태 이력은 교체하지 않고 RESTORED 항목을 덧붙인다.
     *
     * @throws com.example.werewolf.global.error.InvalidStateException 스냅샷이 일관되지 않은 경우
     */
    public void restore(GameSnapshot snapshot) {
        validateSnapshot(snapshot);
        List<Player> restored = new ArrayList<>();
        for (PlayerSnapshot ps : snapshot.players()) {
            restored.add(new Player(ps.number(), ps.name(), ps.role(), ps.alive(), ps.statusHistory()));
        }

        players = restored;
        currentPhase = snapshot.phase();
        currentRound = snapshot.round();
        gameActive = snapshot.gameActive();
        result = snapshot.result();
        regulation = snapshot.regulation();
        regulationConfirmed = snapshot.regulationConfirmed();
        playersConfirmed = snapshot.playersConfirmed();
        recordState(SnapshotReason.RESTORED);

        publish(EventType.GAME_STATE_RESTORED, payload(
                "phase", currentPhase,
                "round", currentRound,
                "gameActive", gameActive,
                "playerCount", players.size()));
        log.info("Game state restored: phase={}, round={}, active={}", currentPhase, currentRound, gameActive);
    }

    private void validateSnapshot(GameSnapshot snapshot) {
        if (snapshot == null || snapshot.phase() == null) {
            throw ErrorCode.INVALID_SNAPSHOT.exception("phase is missing");
        }
        if (snapshot.round() < 0) {
            throw ErrorCode.INVALID_SNAPSHOT.exception("negative round " + snapshot.round());
        }
        boolean setup = snapshot.phase() == GamePhase.SETUP;
        if (setup && (snapshot.gameActive() || snapshot.round() != 0)) {
            throw ErrorCode.INVALID_SNAPSHOT.exception("setup snapshot must be inactive at round 0");
        }
        if (snapshot.gameActive() && (snapshot.round() < 1 || snapshot.result() != null)) {
            throw ErrorCode.INVALID_SNAPSHOT.exception("active snapshot must be in round >= 1 without result");
        }
        Set<String> names = new HashSet<>();
        Set<Integer> numbers = new HashSet<>();
        Map<Team, Integer> alive = new EnumMap<>(Team.class);
        for (PlayerSnapshot ps : snapshot.players()) {
            if (ps.name() == null || ps.name().isBlank()) {
                throw ErrorCode.INVALID_SNAPSHOT.exception("blank player name");
            }
            if (!names.add(ps.name())) {
                throw ErrorCode.INVALID_SNAPSHOT.exception("duplicate player name " + ps.name());
            }
            if (!numbers.add(ps.number())) {
                throw ErrorCode.INVALID_SNAPSHOT.exception("duplicate player number " + ps.number());
            }
            if (snapshot.gameActive() && ps.role() == null) {
                throw ErrorCode.INVALID_SNAPSHOT.exception("player " + ps.name() + " has no role");
            }
            if (setup && !ps.alive()) {
                throw ErrorCode.INVALID_SNAPSHOT.exception("player " + ps.name() + " is dead during setup");
            }
            if (ps.alive() && ps.role() != null) {
                alive.merge(ps.role().getTeam(), 1, Integer::sum);
            }
        }
        // 진행 중인 게임인데 이미 한 진영이 전멸했다면 종료 판정이 빠진 스냅샷
        if (snapshot.gameActive() && decideResult(alive.getOrDefault(Team.VILLAGE, 0),
                alive.getOrDefault(Team.WEREWOLF, 0)) != null) {
            throw ErrorCode.INVALID_SNAPSHOT.exception("active snapshot already meets an end condition " + alive);
        }
    }

    // ================= 조회 =================

    public List<Player> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public List<Player> getAlivePlayers() {
        return players.stream().filter(Player::isAlive).toList();
    }

    public Optional<Player> findPlayer(String name) {
        return players.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    /**
     * @throws com.example.werewolf.global.error.NotFoundException 플레이어가 없는 경우
     */
    public Player getPlayer(String name) {
        return findPlayer(name).orElseThrow(() -> ErrorCode.PLAYER_NOT_FOUND.exception(name));
    }

    public Optional<GameResult> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * 상태가 바뀔 때마다 자동으로 남긴 스냅샷. 오래된 것부터.
     */
    public List<StateHistoryEntry> getStateHistory() {
        return List.copyOf(stateHistory);
    }

    public void setStateHistoryLimit(int stateHistoryLimit) {
        if (stateHistoryLimit < 1) {
            throw new IllegalArgumentException("stateHistoryLimit must be positive: " + stateHistoryLimit);
        }
        this.stateHistoryLimit = stateHistoryLimit;
        trimStateHistory();
    }

    // ================= 내부 =================

    private void requireSetup() {
        if (gameActive || currentPhase != GamePhase.SETUP) {
            throw ErrorCode.ROSTER_LOCKED.exception();
        }
    }

    private void requireActive(String action) {
        if (!gameActive) {
            throw ErrorCode.GAME_NOT_ACTIVE.exception("cannot " + action);
        }
    }

    private void publishPhaseChanged(GamePhase oldPhase, GamePhase newPhase) {
        publish(EventType.PHASE_CHANGED, payload(
                "oldPhase", oldPhase,
                "newPhase", newPhase,
                "round", currentRound,
                "durationSeconds", phaseFactory.getState(newPhase).getDurationSeconds()));
        log.info("Phase changed: {} -> {} (round {})", oldPhase, newPhase, currentRound);
    }

    private void publishDeath(Player player) {
        publish(EventType.PLAYER_DIED, payload(
                "playerName", player.getName(),
                "number", player.getNumber(),
                "team", player.getTeam(),
                "role", player.getRole(),
                "phase", currentPhase,
                "round", currentRound));
    }

    private void publish(EventType type, Map<String, Object> data) {
        eventBus.publish(GameEvent.of(type, SOURCE, data));
    }

    /**
     * 키, 값 순서로 받은 인자를 넣은 순서대로 담는다. 값은 null 가능.
     */
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return data;
    }

    private void recordState(SnapshotReason reason) {
        stateHistory.addLast(new StateHistoryEntry(reason, save()));
        trimStateHistory();
        log.debug("State snapshot recorded: {}", reason);
    }

    private void trimStateHistory() {
        while (stateHistory.size() > stateHistoryLimit) {
            stateHistory.removeFirst();
        }
    }
}
