package com.example.werewolf;

import com.example.werewolf.game.domain.GamePhase;
import com.example.werewolf.game.domain.GameState;
import com.example.werewolf.game.domain.Player;
import com.example.werewolf.game.domain.PlayerRole;
import com.example.werewolf.game.domain.Regulation;
import com.example.werewolf.game.domain.Team;
import com.example.werewolf.game.repository.RegulationPresetRepository;
import com.example.werewolf.game.repository.SnapshotRepository;
import com.example.werewolf.game.service.GameLogListener;
import com.example.werewolf.game.service.GameService;
import com.example.werewolf.global.error.ConfigurationException;
import com.example.werewolf.global.error.ErrorCode;
import com.example.werewolf.global.error.InvalidStateException;
import com.example.werewolf.global.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class WerewolfGmApplicationTests {

    @Autowired
    private GameService gameService;

    @Autowired
    private GameLogListener gameLogListener;

    @Autowired
    private SnapshotRepository snapshotRepository;

    @Autowired
    private RegulationPresetRepository regulationPresetRepository;

    @BeforeEach
    void setUp() {
        snapshotRepository.delete();
        regulationPresetRepository.findAll().keySet().forEach(regulationPresetRepository::delete);
        gameLogListener.clear();
    }

    private GameState startDefaultGame() {
        GameState game = gameService.newGame();
        for (String name : new String[]{"A", "B", "C", "D", "E"}) {
            game.addPlayer(name);
        }
        game.confirmRegulation();
        game.confirmPlayers();
        game.startGame();
        return game;
    }

    @Test
    @DisplayName("application.yml 의 기본 레귤레이션(인랑1/점쟁이1/마을사람3)으로 게임이 시작된다")
    void defaultRegulationFromConfig() {
        GameState game = startDefaultGame();

        assertThat(game.getPlayers()).extracting(Player::getRole).filteredOn(r -> r == PlayerRole.WEREWOLF).hasSize(1);
        assertThat(game.getPlayers()).extracting(Player::getRole).filteredOn(r -> r == PlayerRole.SEER).hasSize(1);
        assertThat(game.getCurrentPhase()).isEqualTo(GamePhase.DAY_DISCUSSION);
        assertThat(game.getCurrentPhaseDurationSeconds()).isEqualTo(180);
        assertThat(gameLogListener.getLines()).contains("Game started with 5 players");
    }

    @Test
    @DisplayName("저장 후 진행한 내용은 불러오기로 되돌아간다")
    void saveAndLoad() {
        GameState game = startDefaultGame();
        gameService.saveGame();
        String villager = game.getPlayers().stream()
                .filter(p -> p.getTeam() == Team.VILLAGE)
                .findFirst().orElseThrow().getName();
        game.killPlayer(villager);
        game.changePhase(GamePhase.DAY_VOTE);

        GameState loaded = gameService.loadGame();

        assertThat(loaded).isSameAs(gameService.getCurrentGame());
        assertThat(loaded.getPlayer(villager).isAlive()).isTrue();
        assertThat(loaded.getCurrentPhase()).isEqualTo(GamePhase.DAY_DISCUSSION);
        assertThat(loaded.isGameActive()).isTrue();
    }

    @Test
    @DisplayName("저장된 스냅샷이 없으면 NotFoundException")
    void loadWithoutSave() {
        gameService.newGame();

        assertThatThrownBy(() -> gameService.loadGame()).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("기본 설정에서는 확정 없이 시작할 수 없고, 상태 이력 크기는 설정값을 따른다")
    void confirmationRequiredByConfig() {
        GameState game = gameService.newGame();
        for (String name : new String[]{"A", "B", "C", "D", "E"}) {
            game.addPlayer(name);
        }

        assertThat(game.isConfirmationRequired()).isTrue();
        assertThat(game.getStateHistoryLimit()).isEqualTo(100);
        assertThatThrownBy(game::startGame)
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.REGULATION_NOT_CONFIRMED);
    }

    @Test
    @DisplayName("저장한 레귤레이션 프리셋을 새 게임에 적용할 수 있다")
    void regulationPresets() {
        Regulation sixPlayers = Regulation.of(Map.of(PlayerRole.WEREWOLF, 2, PlayerRole.SEER, 1, PlayerRole.VILLAGER, 3));
        gameService.saveRegulationPreset("six", sixPlayers);

        GameState game = gameService.newGame(null);
        Regulation applied = gameService.applyRegulationPreset("six");

        assertThat(applied).isEqualTo(sixPlayers);
        assertThat(game.getRegulation()).isEqualTo(sixPlayers);
        assertThat(game.isRegulationConfirmed()).isFalse();
        assertThat(gameService.getRegulationPresets()).containsOnlyKeys("six");
        assertThat(gameLogListener.getLines()).contains("Regulation preset saved: six");

        assertThat(gameService.deleteRegulationPreset("six")).isTrue();
        assertThatThrownBy(() -> gameService.applyRegulationPreset("six")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("이름이 비었거나 음수 인원이 있는 프리셋은 저장되지 않는다")
    void invalidPresetRejected() {
        assertThatThrownBy(() -> gameService.saveRegulationPreset(" ", Regulation.of(Map.of(PlayerRole.VILLAGER, 3))))
                .isInstanceOf(ConfigurationException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_PRESET_NAME);
        assertThatThrownBy(() -> gameService.saveRegulationPreset("broken",
                Regulation.of(Map.of(PlayerRole.WEREWOLF, -1, PlayerRole.VILLAGER, 4))))
                .isInstanceOf(ConfigurationException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.NEGATIVE_ROLE_COUNT);

        assertThat(gameService.getRegulationPresets()).isEmpty();
    }
}
