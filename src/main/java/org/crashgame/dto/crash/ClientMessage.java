package org.crashgame.dto.crash;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.math.BigDecimal;

/** Message client → serveur : PLACE_BET{amount} ou CASHOUT{}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientMessage {
    public static final String PLACE_BET = "PLACE_BET";
    public static final String CASHOUT = "CASHOUT";

    private String type;
    private BigDecimal amount;
}
