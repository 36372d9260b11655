package net.javahippie.fittracker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class for FitTracker.
 * FitTracker is a local-first habit and fitness tracker: one device, one embedded database,
 * one signed-in user at a time. The presentation layer drives it through
 * {@link net.javahippie.fittracker.service.AccountService}.
 */
@SpringBootApplication
@Slf4j
public class FitTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FitTrackerApplication.class, args);
        log.info("FitTracker data store started");
    }
}
