package org.crashgame.service.crash.broadcast;

import org.crashgame.dto.crash.CrashEvent;

/** Destination d'une session : ne doit pas bloquer. */
@FunctionalInterface
public interface EventSink {
    void deliver(CrashEvent event);
}
