package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.Regulation;

import java.util.Map;
import java.util.Optional;

/**
 * 이름 붙은 레귤레이션 프리셋 저장소. 같은 이름으로 저장하면 덮어쓴다.
 */
public interface RegulationPresetRepository {

    void save(String name, Regulation regulation);

    Optional<Regulation> findByName(String name);

    /**
     * @return 이름순으로 정렬된 사본
     */
    Map<String, Regulation> findAll();

    /**
     * @return 지운 프리셋이 있었으면 true
     */
    boolean delete(String name);
}
