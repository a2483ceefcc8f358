package org.crashgame.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class VerifyRequest {
    @NotBlank
    private String serverSeed;
    @NotBlank
    private String serverSeedHash;
    @NotBlank
    private String clientSeed;
    @NotNull
    private BigDecimal crashPoint;
}
