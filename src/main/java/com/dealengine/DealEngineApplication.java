package com.dealengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Deal Engine.
 *
 * Deal Engine decides, for each completed game, which published restaurant deals
 * are triggered by the game's result and activates each (deal, game) pair at most once.
 * Deal discovery, approval and notification delivery are handled by external services.
 */
@SpringBootApplication
@EnableScheduling
public class DealEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealEngineApplication.class, args);
    }
}
