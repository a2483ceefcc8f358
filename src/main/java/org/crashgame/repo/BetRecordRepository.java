package org.crashgame.repo;

import org.crashgame.model.BetRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BetRecordRepository extends JpaRepository<BetRecord, Long> {
    // id IDENTITY = ordre d'insertion, même à horodatage égal
    List<BetRecord> findByRoundIdOrderByIdAsc(String roundId);
}
