package org.crashgame.controller;

import org.crashgame.dto.RoundSummaryDto;
import org.crashgame.dto.VerifyRequest;
import org.crashgame.dto.VerifyResponse;
import org.crashgame.model.BetRecord;
import org.crashgame.model.RoundRecord;
import org.crashgame.repo.BetRecordRepository;
import org.crashgame.repo.RoundRecordRepository;
import org.crashgame.service.crash.fairness.FairnessCommitment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoundControllerTest {

    static final String SEED = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    static final String HASH = "cd372fb85148700fa88095e3492d3f9f5beb43e555e5ff26d95f5a6adc36f8e6";

    @Mock
    private RoundRecordRepository rounds;

    @Mock
    private BetRecordRepository bets;

    private RoundController controller;

    @BeforeEach
    void setup() {
        controller = new RoundController(rounds, bets, new FairnessCommitment(new SecureRandom(), new BigDecimal("0.96")));
    }

    private RoundRecord closedRound(String id) {
        return RoundRecord.builder()
                .id(id)
                .serverSeed(SEED)
                .serverSeedHash(HASH)
                .clientSeed("demo-client")
                .crashPoint(new BigDecimal("1.93"))
                .startedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .endedAt(Instant.parse("2026-03-01T10:00:20Z"))
                .build();
    }

    private VerifyRequest request(String seed, String hash, String crashPoint) {
        VerifyRequest req = new VerifyRequest();
        req.setServerSeed(seed);
        req.setServerSeedHash(hash);
        req.setClientSeed("demo-client");
        req.setCrashPoint(new BigDecimal(crashPoint));
        return req;
    }

    @Test
    void recent_shouldMapClosedRounds() {
        when(rounds.findByEndedAtIsNotNullOrderByStartedAtDesc(any())).thenReturn(List.of(closedRound("r1")));

        List<RoundSummaryDto> out = controller.recent(20);

        assertThat(out).hasSize(1);
        assertThat(out.get(0).serverSeed()).isEqualTo(SEED);
        assertThat(out.get(0).crashPoint()).isEqualByComparingTo("1.93");
    }

    @Test
    void recent_shouldClampLimit() {
        when(rounds.findByEndedAtIsNotNullOrderByStartedAtDesc(any())).thenReturn(List.of());
        ArgumentCaptor<Pageable> cap = ArgumentCaptor.forClass(Pageable.class);

        controller.recent(5000);
        controller.recent(-1);

        verify(rounds, times(2)).findByEndedAtIsNotNullOrderByStartedAtDesc(cap.capture());
        assertThat(cap.getAllValues().get(0).getPageSize()).isEqualTo(100);
        assertThat(cap.getAllValues().get(1).getPageSize()).isEqualTo(1);
    }

    @Test
    void betsOf_shouldReturn404ForOpenRound() {
        RoundRecord open = closedRound("r2");
        open.setEndedAt(null);
        when(rounds.findById("r2")).thenReturn(Optional.of(open));

        ResponseEntity<?> res = controller.betsOf("r2");

        assertThat(res.getStatusCode().value()).isEqualTo(404);
        verifyNoInteractions(bets);
    }

    @Test
    void betsOf_shouldReturnRowsOfClosedRound() {
        BetRecord b = BetRecord.builder().roundId("r1").sessionId("Guest_A").kind(BetRecord.Kind.BET)
                .amount(BigDecimal.TEN).balanceDelta(BigDecimal.TEN.negate()).balanceAfter(new BigDecimal("990")).build();
        when(rounds.findById("r1")).thenReturn(Optional.of(closedRound("r1")));
        when(bets.findByRoundIdOrderByIdAsc("r1")).thenReturn(List.of(b));

        ResponseEntity<?> res = controller.betsOf("r1");

        assertThat(res.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(res.getBody()).isEqualTo(List.of(b));
    }

    @Test
    void verify_shouldAcceptPublishedRound() {
        VerifyRequest req = request(SEED, HASH, "1.93");

        ResponseEntity<?> res = controller.verify(req, new BeanPropertyBindingResult(req, "req"));

        VerifyResponse body = (VerifyResponse) res.getBody();
        assertThat(body.valid).isTrue();
        assertThat(body.expectedHash).isEqualTo(HASH);
        assertThat(body.expectedCrashPoint).isEqualByComparingTo("1.93");
    }

    @Test
    void verify_shouldRejectTamperedCrashPoint() {
        VerifyRequest req = request(SEED, HASH, "5.00");

        ResponseEntity<?> res = controller.verify(req, new BeanPropertyBindingResult(req, "req"));

        VerifyResponse body = (VerifyResponse) res.getBody();
        assertThat(body.valid).isFalse();
        assertThat(body.expectedCrashPoint).isEqualByComparingTo("1.93");
    }

    @Test
    void verify_shouldReturn400OnBindingErrors() {
        VerifyRequest req = request(SEED, HASH, "1.93");
        BeanPropertyBindingResult binding = new BeanPropertyBindingResult(req, "req");
        binding.rejectValue("serverSeed", "NotBlank");

        ResponseEntity<?> res = controller.verify(req, binding);

        assertThat(res.getStatusCode().value()).isEqualTo(400);
    }
}
