package de.bycsitsm.calsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CalSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalSyncApplication.class, args);
    }
}
