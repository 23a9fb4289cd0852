package com.raceintel.racedata;

import com.raceintel.racedata.cli.ImportCli;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.util.Arrays;

/**
 * Runs the replay server, or the import CLI when the first argument is {@code import}:
 *
 *   java -jar race-data.jar                       # replay server
 *   java -jar race-data.jar import ./data --force # one-off import
 */
@SpringBootApplication
@EnableConfigurationProperties
public class RaceDataApplication {

    public static void main(String[] args) {
        if (args.length > 0 && args[0].equals("import")) {
            ImportCli.main(Arrays.copyOfRange(args, 1, args.length));
            return;
        }
        SpringApplication.run(RaceDataApplication.class, args);
    }
}
