package org.crashgame.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "crash_bet", indexes = @Index(name = "idx_crash_bet_round", columnList = "roundId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BetRecord {

    public enum Kind { BET, CASHOUT }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String roundId;

    @Column(nullable = false, length = 64)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Kind kind;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(precision = 19, scale = 2)
    private BigDecimal multiplier;

    // -mise sur BET, +gain sur CASHOUT
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal balanceDelta;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal balanceAfter;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
