package com.example.renderflow_backend.config;

import org.flywaydb.core.api.output.MigrateResult;
import org.flywaydb.core.api.output.RepairResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Realigns recorded checksums of the batch_job/batch_item migrations with the files on the classpath,
 * then migrates. Edited migrations in dev databases therefore never block startup.
 */
@Configuration
public class FlywayRepairMigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlywayRepairMigrationStrategy.class);

    @Bean
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            RepairResult repaired = flyway.repair();
            if (!repaired.migrationsAligned.isEmpty() || !repaired.migrationsRemoved.isEmpty()) {
                LOGGER.warn("FLYWAY repair aligned={} removed={}", repaired.migrationsAligned.size(),
                        repaired.migrationsRemoved.size());
            }
            MigrateResult migrated = flyway.migrate();
            LOGGER.info("FLYWAY migrate executed={} schemaVersion={}", migrated.migrationsExecuted,
                    migrated.targetSchemaVersion);
        };
    }
}
