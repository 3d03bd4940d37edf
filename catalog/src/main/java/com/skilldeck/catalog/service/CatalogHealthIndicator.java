package com.skilldeck.catalog.service;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the catalog DOWN until a sync has succeeded, and again after any
 * sync fails. Shows up as {@code skillCatalog} in the health endpoint.
 */
@Component("skillCatalog")
public class CatalogHealthIndicator implements HealthIndicator {

    private final CatalogManager catalog;

    public CatalogHealthIndicator(CatalogManager catalog) {
        this.catalog = catalog;
    }

    @Override
    public Health health() {
        if (catalog.isReady()) {
            return Health.up()
                    .withDetail("skills", catalog.getAllSkills().size())
                    .build();
        }
        return Health.down()
                .withDetail("reason", catalog.getLastFailure().orElse("catalog not synced yet"))
                .build();
    }
}
