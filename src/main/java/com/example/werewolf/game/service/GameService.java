package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.GameState;
import com.example.werewolf.game.domain.Regulation;
import com.example.werewolf.game.domain.snapshot.GameSnapshot;
import com.example.werewolf.game.repository.RegulationPresetRepository;
import com.example.werewolf.game.repository.SnapshotRepository;
import com.example.werewolf.game.state.GamePhaseFactory;
import com.example.werewolf.global.config.GameProperties;
import com.example.werewolf.global.error.ErrorCode;
import com.example.werewolf.global.event.EventBus;
import com.example.werewolf.global.event.EventType;
import com.example.werewolf.global.event.GameEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 게임 진행자(GM) 측 진입점
 * - 현재 게임 보관 및 새 게임 생성
 * - 스냅샷 저장/불러오기
 * - 레귤레이션 프리셋 저장/적용
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final EventBus eventBus;
    private final RoleAssigner roleAssigner;
    private final GamePhaseFactory gamePhaseFactory;
    private final SnapshotRepository snapshotRepository;
    private final RegulationPresetRepository regulationPresetRepository;
    private final GameProperties gameProperties;

    private GameState currentGame;

    /**
     * 설정 파일의 기본 레귤레이션으로 새 게임을 만든다. 역할 설정이 비어 있으면 레귤레이션 없이 시작한다.
     */
    public GameState newGame() {
        Regulation regulation = gameProperties.getRoles().isEmpty() ? null : gameProperties.defaultRegulation();
        return newGame(regulation);
    }

    public GameState newGame(Regulation regulation) {
        GameState game = new GameState(eventBus, roleAssigner, gamePhaseFactory);
        game.setConfirmationRequired(gameProperties.isRequireConfirmation());
        game.setStateHistoryLimit(gameProperties.getStateHistorySize());
        if (regulation != null) {
            game.setRegulation(regulation);
        }
        currentGame = game;
        log.info("New game created");
        return game;
    }

    public GameState getCurrentGame() {
        if (currentGame == null) {
            return newGame();
        }
        return currentGame;
    }

    public GameSnapshot saveGame() {
        GameSnapshot snapshot = getCurrentGame().save();
        snapshotRepository.save(snapshot);
        log.info("Game saved: phase={}, round={}", snapshot.phase(), snapshot.round());
        return snapshot;
    }

    /**
     * @throws com.example.werewolf.global.error.NotFoundException 저장된 스냅샷이 없는 경우
     */
    public GameState loadGame() {
        GameSnapshot snapshot = snapshotRepository.load()
                .orElseThrow(ErrorCode.SNAPSHOT_NOT_FOUND::exception);
        GameState game = getCurrentGame();
        game.restore(snapshot);
        log.info("Game loaded: phase={}, round={}", snapshot.phase(), snapshot.round());
        return game;
    }

    // ================= 레귤레이션 프리셋 =================

    /**
     * 이름을 붙여 레귤레이션을 저장하고 REGULATION_SAVED 를 발행한다. 같은 이름은 덮어쓴다.
     *
     * @throws com.example.werewolf.global.error.ConfigurationException 이름이 비었거나 역할 인원이 음수인 경우
     */
    public void saveRegulationPreset(String name, Regulation regulation) {
        if (name == null || name.isBlank()) {
            throw ErrorCode.INVALID_PRESET_NAME.exception();
        }
        regulation.validateRoleCounts();
        regulationPresetRepository.save(name, regulation);

        eventBus.publish(GameEvent.of(EventType.REGULATION_SAVED, "game_service", Map.of("name", name)));
        log.info("Regulation preset saved: {}", name);
    }

    public Map<String, Regulation> getRegulationPresets() {
        return regulationPresetRepository.findAll();
    }

    /**
     * 프리셋을 현재 게임의 레귤레이션으로 설정한다. 확정은 다시 해야 한다.
     *
     * @throws com.example.werewolf.global.error.NotFoundException 프리셋이 없는 경우
     */
    public Regulation applyRegulationPreset(String name) {
        Regulation regulation = regulationPresetRepository.findByName(name)
                .orElseThrow(() -> ErrorCode.PRESET_NOT_FOUND.exception(name));
        getCurrentGame().setRegulation(regulation);
        log.info("Regulation preset applied: {}", name);
        return regulation;
    }

    public boolean deleteRegulationPreset(String name) {
        return regulationPresetRepository.delete(name);
    }
}
