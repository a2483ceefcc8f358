package org.crashgame;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan // pour CrashProperties
public class CrashApplication {
    public static void main(String[] args) {
        SpringApplication.run(CrashApplication.class, args);
    }
}
