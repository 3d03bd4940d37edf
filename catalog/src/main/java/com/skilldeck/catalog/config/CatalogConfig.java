package com.skilldeck.catalog.config;

import com.skilldeck.catalog.service.CatalogManager;
import com.skilldeck.catalog.service.CatalogStore;
import com.skilldeck.catalog.skill.DiscoveryScanner;
import com.skilldeck.catalog.skill.SkillDefinitionParser;
import com.skilldeck.catalog.sync.ReconciliationEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the catalog from {@link SkillCatalogProperties}.
 *
 * The manager is a plain object, not a {@code @Component}; tests build
 * their own over temporary roots.
 */
@Configuration
@EnableConfigurationProperties(SkillCatalogProperties.class)
public class CatalogConfig {

    @Bean
    DiscoveryScanner discoveryScanner(SkillCatalogProperties props) {
        return new DiscoveryScanner(props.getDefinitionFileName());
    }

    @Bean(destroyMethod = "close")
    CatalogManager catalogManager(ReconciliationEngine engine,
                                  CatalogStore store,
                                  SkillDefinitionParser parser,
                                  SkillCatalogProperties props) {
        return new CatalogManager(engine, store, parser,
                props.getBundledPath(), props.getUserPath(), props.getDefinitionFileName());
    }
}
