package org.crashgame.service.crash.journal;

import org.crashgame.model.BetRecord;
import org.crashgame.model.RoundRecord;
import org.crashgame.repo.BetRecordRepository;
import org.crashgame.repo.RoundRecordRepository;
import org.crashgame.service.crash.fairness.FairnessCommitment.Commitment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoundJournalTest {

    @Mock RoundRecordRepository rounds;
    @Mock BetRecordRepository bets;

    RoundJournal journal;

    static final Commitment COMMIT = new Commitment("seed", "hash", "demo-client", new BigDecimal("2.01"));

    @BeforeEach
    void setup() {
        // exécution immédiate sur le thread du test
        journal = new RoundJournal(rounds, bets, true, Runnable::run);
    }

    @Test
    void roundOpened_enregistreLaManche() {
        Instant t = Instant.parse("2026-01-01T00:00:00Z");

        journal.roundOpened("r1", COMMIT, t);

        ArgumentCaptor<RoundRecord> cap = ArgumentCaptor.forClass(RoundRecord.class);
        verify(rounds).save(cap.capture());
        RoundRecord r = cap.getValue();
        assertThat(r.getId()).isEqualTo("r1");
        assertThat(r.getServerSeed()).isEqualTo("seed");
        assertThat(r.getServerSeedHash()).isEqualTo("hash");
        assertThat(r.getCrashPoint()).isEqualByComparingTo("2.01");
        assertThat(r.getStartedAt()).isEqualTo(t);
        assertThat(r.getEndedAt()).isNull();
    }

    @Test
    void roundClosed_marqueLaFin() {
        Instant t = Instant.now();
        when(rounds.markEnded("r1", t)).thenReturn(1);

        journal.roundClosed("r1", t);

        verify(rounds).markEnded("r1", t);
        assertThat(journal.failureCount()).isZero();
    }

    @Test
    void roundClosed_mancheAbsente_compteeEnEchec() {
        when(rounds.markEnded(anyString(), any())).thenReturn(0);

        journal.roundClosed("ghost", Instant.now());

        assertThat(journal.failureCount()).isEqualTo(1);
    }

    @Test
    void betPlacedEtCashedOut_lignesSignees() {
        journal.betPlaced("r1", "Guest_A", new BigDecimal("200.00"), new BigDecimal("800.00"));
        journal.cashedOut("r1", "Guest_A", new BigDecimal("200.00"), new BigDecimal("2.50"),
                new BigDecimal("500.00"), new BigDecimal("1300.00"));

        ArgumentCaptor<BetRecord> cap = ArgumentCaptor.forClass(BetRecord.class);
        verify(bets, times(2)).save(cap.capture());
        BetRecord bet = cap.getAllValues().get(0);
        BetRecord out = cap.getAllValues().get(1);

        assertThat(bet.getKind()).isEqualTo(BetRecord.Kind.BET);
        assertThat(bet.getBalanceDelta()).isEqualByComparingTo("-200");
        assertThat(bet.getMultiplier()).isNull();

        assertThat(out.getKind()).isEqualTo(BetRecord.Kind.CASHOUT);
        assertThat(out.getMultiplier()).isEqualByComparingTo("2.50");
        assertThat(out.getBalanceDelta()).isEqualByComparingTo("500");
        assertThat(out.getBalanceAfter()).isEqualByComparingTo("1300");
    }

    @Test
    void baseEnPanne_pasDExceptionPourLAppelant() {
        when(bets.save(any())).thenThrow(new IllegalStateException("connexion refusée"));

        assertThatCode(() -> journal.betPlaced("r1", "Guest_A", BigDecimal.TEN, BigDecimal.ONE))
                .doesNotThrowAnyException();
        assertThat(journal.failureCount()).isEqualTo(1);
    }

    @Test
    void desactive_aucuneEcriture() {
        RoundJournal off = new RoundJournal(rounds, bets, false, Runnable::run);

        off.roundOpened("r1", COMMIT, Instant.now());
        off.betPlaced("r1", "Guest_A", BigDecimal.TEN, BigDecimal.ONE);

        verifyNoInteractions(rounds, bets);
    }

    @Test
    void apresShutdown_ecritureRefuseeEtComptee() throws Exception {
        ExecutorService es = Executors.newSingleThreadExecutor();
        RoundJournal j = new RoundJournal(rounds, bets, true, es);
        j.shutdown();

        j.betPlaced("r1", "Guest_A", BigDecimal.TEN, BigDecimal.ONE);

        assertThat(j.failureCount()).isEqualTo(1);
        verifyNoInteractions(bets);
    }
}
