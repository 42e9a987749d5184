package com.dining.reservation_service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Main application class for Reservation Service
 */
@SpringBootApplication
public class ReservationServiceApplication {

    private static final Logger logger = LoggerFactory.getLogger(ReservationServiceApplication.class);

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ReservationServiceApplication.class, args);

        // An unhandled failure outside a request is fatal: stop the server and exit
        Thread.setDefaultUncaughtExceptionHandler((thread, error) -> {
            logger.error("Unhandled error in thread {}: {}", thread.getName(), error.getMessage(), error);
            int exitCode = SpringApplication.exit(context, () -> 1);
            System.exit(exitCode);
        });
    }
}
