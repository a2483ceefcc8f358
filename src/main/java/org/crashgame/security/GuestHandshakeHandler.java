package org.crashgame.security;

import lombok.RequiredArgsConstructor;
import org.crashgame.service.crash.ledger.SessionLedger;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

import java.security.Principal;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;

/**
 * Pas de compte joueur : chaque connexion reçoit une identité d'invité "Guest_XXXXXX",
 * qui sert aussi d'id de session et de destinataire pour /user/queue/crash.
 */
@Component
@RequiredArgsConstructor
public class GuestHandshakeHandler extends DefaultHandshakeHandler {

    public static final String PREFIX = "Guest_";

    public record GuestPrincipal(String name) implements Principal {
        @Override
        public String getName() {
            return name;
        }
    }

    private final SecureRandom random = new SecureRandom();
    private final SessionLedger ledger;

    @Override
    protected Principal determineUser(ServerHttpRequest request, WebSocketHandler wsHandler,
                                      Map<String, Object> attributes) {
        return new GuestPrincipal(newGuestId());
    }

    String newGuestId() {
        byte[] b = new byte[3];
        String id;
        do {
            random.nextBytes(b);
            id = PREFIX + HexFormat.of().withUpperCase().formatHex(b);
        } while (ledger.contains(id));
        return id;
    }
}
