package dev.harvester;

import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Entry point for the LDES harvester.
 *
 * <p>Runs as a non-web command line application: the single positional argument is the event
 * stream URL, {@code --cache-dir=<dir>} selects the output directory and {@code --no-resume}
 * discards any saved crawl state. The process exit code is reported by {@link
 * dev.harvester.cli.HarvestCommand}.
 */
@SpringBootApplication
public class HarvesterApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HarvesterApplication.class, args)));
    }

    /** Statistics and checkpoint timestamps are recorded in UTC. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
