package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.Regulation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Repository
@ConditionalOnProperty(prefix = "werewolf.persistence", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRegulationPresetRepository implements RegulationPresetRepository {

    private final Map<String, Regulation> presets = new ConcurrentHashMap<>();

    @Override
    public void save(String name, Regulation regulation) {
        presets.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(regulation, "regulation"));
        log.debug("Regulation preset stored in memory: {}", name);
    }

    @Override
    public Optional<Regulation> findByName(String name) {
        return Optional.ofNullable(presets.get(name));
    }

    @Override
    public Map<String, Regulation> findAll() {
        return new TreeMap<>(presets);
    }

    @Override
    public boolean delete(String name) {
        return presets.remove(name) != null;
    }
}
