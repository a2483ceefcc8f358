package org.crashgame.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "crash_round")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoundRecord {
    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 64)
    private String serverSeed;

    @Column(nullable = false, length = 64)
    private String serverSeedHash;

    @Column(nullable = false, length = 128)
    private String clientSeed;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal crashPoint;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant endedAt;
}
