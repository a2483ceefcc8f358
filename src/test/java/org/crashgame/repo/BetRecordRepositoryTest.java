package org.crashgame.repo;

import org.crashgame.model.BetRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class BetRecordRepositoryTest {

    @Autowired
    private BetRecordRepository bets;

    private BetRecord row(String roundId, String sessionId, BetRecord.Kind kind, Instant at) {
        return BetRecord.builder()
                .roundId(roundId)
                .sessionId(sessionId)
                .kind(kind)
                .amount(new BigDecimal("10.00"))
                .balanceDelta(kind == BetRecord.Kind.BET ? new BigDecimal("-10.00") : new BigDecimal("15.00"))
                .balanceAfter(new BigDecimal("990.00"))
                .createdAt(at)
                .build();
    }

    @Test
    void findByRound_shouldKeepInsertionOrderWhenTimestampsAreEqual() {
        Instant same = Instant.parse("2026-03-01T10:00:00Z");
        bets.save(row("r1", "Guest_C", BetRecord.Kind.BET, same));
        bets.save(row("r1", "Guest_A", BetRecord.Kind.BET, same));
        bets.save(row("r2", "Guest_Z", BetRecord.Kind.BET, same));
        bets.save(row("r1", "Guest_B", BetRecord.Kind.BET, same));
        bets.save(row("r1", "Guest_A", BetRecord.Kind.CASHOUT, same));

        List<BetRecord> out = bets.findByRoundIdOrderByIdAsc("r1");

        assertThat(out).extracting(BetRecord::getSessionId)
                .containsExactly("Guest_C", "Guest_A", "Guest_B", "Guest_A");
        assertThat(out).extracting(BetRecord::getKind)
                .containsExactly(BetRecord.Kind.BET, BetRecord.Kind.BET, BetRecord.Kind.BET, BetRecord.Kind.CASHOUT);
    }
}
