package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.PlayerRole;
import com.example.werewolf.game.domain.Regulation;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRegulationPresetRepositoryTest {

    private final InMemoryRegulationPresetRepository repository = new InMemoryRegulationPresetRepository();

    @Test
    void sameNameOverwrites() {
        Regulation small = Regulation.of(Map.of(PlayerRole.WEREWOLF, 1, PlayerRole.VILLAGER, 2));
        Regulation large = Regulation.of(Map.of(PlayerRole.WEREWOLF, 2, PlayerRole.VILLAGER, 6));

        repository.save("classic", small);
        repository.save("classic", large);

        assertThat(repository.findByName("classic")).contains(large);
        assertThat(repository.findAll()).hasSize(1);
    }

    @Test
    void findAll_isSortedByName() {
        Regulation regulation = Regulation.of(Map.of(PlayerRole.VILLAGER, 3));
        repository.save("zeta", regulation);
        repository.save("alpha", regulation);
        repository.save("mid", regulation);

        assertThat(repository.findAll().keySet()).containsExactly("alpha", "mid", "zeta");
    }

    @Test
    void delete_reportsWhetherPresetExisted() {
        repository.save("classic", Regulation.of(Map.of(PlayerRole.VILLAGER, 3)));

        assertThat(repository.delete("classic")).isTrue();
        assertThat(repository.delete("classic")).isFalse();
        assertThat(repository.findByName("classic")).isEmpty();
    }
}
