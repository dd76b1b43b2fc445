package com.tripsync.server;

import com.tripsync.common.properties.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(StorageProperties.class)
@EnableScheduling
@Slf4j
public class TripsyncServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(TripsyncServerApplication.class, args);
        log.info("tripsync server started");
    }
}
