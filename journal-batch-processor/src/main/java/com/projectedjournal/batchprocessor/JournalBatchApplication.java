package com.projectedjournal.batchprocessor;

import com.projectedjournal.batchprocessor.cli.JournalCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Starts either the REST service or, when launched with {@code --ap-grid=...}, a one-shot
 * command-line run that exits with the job's outcome.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class JournalBatchApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(JournalBatchApplication.class);
        if (JournalCommandLineRunner.isCommandLineMode(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(JournalCommandLineRunner.withCliDefaults(args))));
        }
        application.run(args);
    }
}
