package org.crashgame.repo;

import org.crashgame.model.RoundRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface RoundRecordRepository extends JpaRepository<RoundRecord, String> {

    @Transactional
    @Modifying
    @Query("update RoundRecord r set r.endedAt = :endedAt where r.id = :id")
    int markEnded(@Param("id") String id, @Param("endedAt") Instant endedAt);

    // seules les manches closes : le seed d'une manche en cours ne doit jamais sortir
    List<RoundRecord> findByEndedAtIsNotNullOrderByStartedAtDesc(Pageable pageable);
}
