package org.crashgame.task;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crashgame.config.CrashProperties;
import org.crashgame.service.crash.engine.RoundEngine;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RoundBootstrap {

    private final RoundEngine engine;
    private final CrashProperties props;

    // première manche dès que le serveur écoute
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (props.isAutoStart()) {
            engine.start();
        } else {
            log.info("crash.auto-start=false : boucle non lancée");
        }
    }

    @PreDestroy
    public void onShutdown() {
        engine.stop();
    }
}
