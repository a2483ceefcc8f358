package org.crashgame.events;

import lombok.RequiredArgsConstructor;
import org.crashgame.service.CrashSessionService;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

@Component
@RequiredArgsConstructor
public class WsSessionListener {

    private final CrashSessionService service;

    @EventListener
    public void onConnect(SessionConnectEvent e) {
        StompHeaderAccessor acc = StompHeaderAccessor.wrap(e.getMessage());
        Principal p = acc.getUser();
        if (p != null) service.connect(p.getName());
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent e) {
        Principal p = e.getUser();
        if (p != null) service.disconnect(p.getName());
    }
}
