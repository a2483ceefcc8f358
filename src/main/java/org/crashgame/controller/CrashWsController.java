package org.crashgame.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crashgame.service.CrashSessionService;
import org.crashgame.service.crash.CrashErrorCode;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.security.Principal;

@Slf4j
@Controller
@RequiredArgsConstructor
public class CrashWsController {

    private final CrashSessionService service;

    // ----------------------------------------------------------------
    // JOIN = WELCOME + état courant, à envoyer après l'abonnement à /user/queue/crash
    @MessageMapping("/crash/join")
    public void join(Principal principal) {
        String sessionId = resolveSession(principal);
        try {
            service.join(sessionId);
        } catch (Exception ex) {
            log.error("Join impossible pour {}", sessionId, ex);
            service.replyError(sessionId, CrashErrorCode.UNKNOWN_SESSION, "Join failed");
        }
    }

    // ----------------------------------------------------------------
    // PLACE_BET{amount} / CASHOUT{}
    @MessageMapping("/crash/action")
    public void action(@Payload(required = false) String raw, Principal principal) {
        String sessionId = resolveSession(principal);
        try {
            service.handle(sessionId, raw);
        } catch (Exception ex) {
            log.error("Action de {} en échec", sessionId, ex);
            service.replyError(sessionId, CrashErrorCode.MALFORMED_MESSAGE, "Action failed");
        }
    }

    private String resolveSession(Principal principal) {
        if (principal == null) throw new IllegalStateException("Session sans identité invité");
        return principal.getName();
    }
}
