package com.skilldeck.catalog;

import com.skilldeck.catalog.service.CatalogManager;
import com.skilldeck.catalog.sync.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.CompletionException;

@SpringBootApplication
public class SkilldeckApplication {

    private static final Logger log = LoggerFactory.getLogger(SkilldeckApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SkilldeckApplication.class, args);
    }

    /**
     * First reconciliation pass, run once the context (and Flyway) is up.
     *
     * A failure is logged and the application keeps running with the
     * catalog reported DOWN; a later resync can recover it.
     */
    @Bean
    @ConditionalOnProperty(name = "skilldeck.skills.sync-on-startup", havingValue = "true", matchIfMissing = true)
    CommandLineRunner initialSkillSync(CatalogManager catalog) {
        return args -> {
            try {
                SyncReport report = catalog.initialize().join();
                log.info("Skill catalog ready with {} skills", report.total());
            } catch (CompletionException e) {
                log.error("Skill catalog could not be initialised: {}", e.getCause().getMessage(), e.getCause());
            }
        };
    }
}
