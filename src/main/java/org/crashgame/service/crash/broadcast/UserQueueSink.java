package org.crashgame.service.crash.broadcast;

import org.crashgame.dto.crash.CrashEvent;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Envoie sur /user/queue/crash de la session STOMP. Le template ne fait que poser le
 * message sur le canal sortant (asynchrone), un client lent ne bloque donc pas l'appelant.
 */
public class UserQueueSink implements EventSink {
    public static final String DESTINATION = "/queue/crash";

    private final SimpMessagingTemplate broker;
    private final String user;

    public UserQueueSink(SimpMessagingTemplate broker, String user) {
        this.broker = broker;
        this.user = user;
    }

    @Override
    public void deliver(CrashEvent event) {
        broker.convertAndSendToUser(user, DESTINATION, event);
    }
}
