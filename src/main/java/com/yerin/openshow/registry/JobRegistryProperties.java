package com.yerin.openshow.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Registry table bound from {@code jobq.registry.types} in application.yml.
 */
@ConfigurationProperties(prefix = "jobq.registry")
public record JobRegistryProperties(List<TypeEntry> types) {

    public JobRegistryProperties {
        types = types == null ? List.of() : types;
    }

    public record TypeEntry(
            String type,
            List<String> requiredFields,
            Map<String, FieldKind> fieldKinds,
            int maxAttempts,
            int leaseDurationSeconds,
            Integer concurrencyLimit
    ) {
        public JobTypeDefinition toDefinition() {
            return new JobTypeDefinition(
                    type,
                    new JobSchema(requiredFields, fieldKinds),
                    new JobPolicy(maxAttempts, leaseDurationSeconds, concurrencyLimit));
        }
    }
}
