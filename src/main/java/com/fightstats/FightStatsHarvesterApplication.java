package com.fightstats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line application that harvests ufcstats.com into resumable CSV datasets.
 */
@SpringBootApplication
public class FightStatsHarvesterApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FightStatsHarvesterApplication.class, args)));
    }
}
