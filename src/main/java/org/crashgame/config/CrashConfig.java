package org.crashgame.config;

import org.crashgame.model.crash.CrashTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CrashConfig {

    /** Une seule table par instance : son moniteur protège tout l'état de jeu. */
    @Bean
    public CrashTable crashTable() {
        return new CrashTable();
    }
}
