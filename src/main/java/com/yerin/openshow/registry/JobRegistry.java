package com.yerin.openshow.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.openshow.global.exception.PayloadValidationException;
import com.yerin.openshow.global.exception.UnknownJobTypeException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup of job types to their payload schema and execution policy.
 * Built once at startup and handed to the queue service; holds no mutable state.
 */
public final class JobRegistry {

    private final Map<String, JobTypeDefinition> definitions;

    private JobRegistry(Map<String, JobTypeDefinition> definitions) {
        this.definitions = definitions;
    }

    public static JobRegistry of(Collection<JobTypeDefinition> definitions) {
        Map<String, JobTypeDefinition> map = new LinkedHashMap<>();
        for (JobTypeDefinition def : definitions) {
            if (def.type() == null || def.type().isBlank()) {
                throw new IllegalStateException("job type name must not be blank");
            }
            if (map.putIfAbsent(def.type(), def) != null) {
                throw new IllegalStateException("duplicate job type: " + def.type());
            }
        }
        return new JobRegistry(Collections.unmodifiableMap(map));
    }

    public static JobRegistry from(JobRegistryProperties properties) {
        return of(properties.types().stream()
                .map(JobRegistryProperties.TypeEntry::toDefinition)
                .toList());
    }

    /**
     * Checks required fields and declared kinds, collecting every violation before failing.
     *
     * @throws UnknownJobTypeException     if {@code type} is not registered
     * @throws PayloadValidationException  if at least one violation was found
     */
    public void validatePayload(String type, JsonNode payload) {
        JobSchema schema = definition(type).schema();
        List<String> errors = new ArrayList<>();

        if (payload == null || !payload.isObject()) {
            errors.add("Payload must be an object, got " + FieldKind.describe(payload));
            throw new PayloadValidationException(type, errors);
        }

        for (String field : schema.requiredFields()) {
            if (!payload.has(field)) {
                errors.add("Missing required field: " + field);
            }
        }

        schema.fieldKinds().forEach((field, kind) -> {
            if (!payload.has(field)) return;
            JsonNode value = payload.get(field);
            if (!kind.matches(value)) {
                errors.add("Invalid type for field " + field + ": expected " + kind.label()
                        + ", got " + FieldKind.describe(value));
            }
        });

        if (!errors.isEmpty()) {
            throw new PayloadValidationException(type, errors);
        }
    }

    public JobPolicy policyFor(String type) {
        return definition(type).policy();
    }

    public boolean isRegistered(String type) {
        return type != null && definitions.containsKey(type);
    }

    public Set<String> types() {
        return definitions.keySet();
    }

    public int maxPolicyAttempts() {
        return definitions.values().stream()
                .mapToInt(d -> d.policy().maxAttempts())
                .max()
                .orElse(0);
    }

    private JobTypeDefinition definition(String type) {
        JobTypeDefinition def = type == null ? null : definitions.get(type);
        if (def == null) {
            throw new UnknownJobTypeException(type);
        }
        return def;
    }
}
