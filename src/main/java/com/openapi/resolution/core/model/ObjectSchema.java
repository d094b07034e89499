package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object schema with ordered properties. Also the result of merging {@code allOf} branches,
 * in which case {@link #allOfSources()} lists the named branches that were merged.
 *
 * @param additionalPropertiesAllowed {@code null} when the document does not say
 * @param additionalPropertiesSchema  schema of extra values, or {@code null}
 * @param discriminator               discriminator declared on the object, or {@code null}
 */
public record ObjectSchema(
        String sourceName,
        Map<String, PropertySchema> properties,
        Boolean additionalPropertiesAllowed,
        ResolvedSchema additionalPropertiesSchema,
        Discriminator discriminator,
        List<String> allOfSources,
        boolean nullable,
        SchemaMetadata metadata,
        Map<String, JsonNode> validationConstraints
) implements ResolvedSchema {

    public ObjectSchema {
        sourceName = ResolvedSchema.nameOrEmpty(sourceName);
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
        allOfSources = allOfSources != null ? List.copyOf(allOfSources) : List.of();
        metadata = metadata != null ? metadata : SchemaMetadata.empty();
        validationConstraints = ResolvedSchema.copyConstraints(validationConstraints);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.OBJECT;
    }

    public boolean isRequired(String propertyName) {
        PropertySchema property = properties.get(propertyName);
        return property != null && property.required();
    }

    public List<String> requiredProperties() {
        return properties.entrySet().stream()
                .filter(e -> e.getValue().required())
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public ObjectSchema withSourceName(String name) {
        return new ObjectSchema(name, properties, additionalPropertiesAllowed, additionalPropertiesSchema,
                discriminator, allOfSources, nullable, metadata, validationConstraints);
    }

    @Override
    public int sizeHint() {
        int size = 1;
        for (PropertySchema property : properties.values()) {
            size += property.schema().sizeHint();
        }
        if (additionalPropertiesSchema != null) {
            size += additionalPropertiesSchema.sizeHint();
        }
        return size;
    }
}
