package com.openapi.resolution.compose;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.core.model.Discriminator;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ReferenceNotFoundException;
import com.openapi.resolution.exception.SchemaCompositionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the value-to-schema mapping of a discriminator.
 *
 * <p>Explicit {@code mapping} entries may name a component by pointer
 * ({@code #/components/schemas/Cat}) or by bare name ({@code Cat}); each must exist.
 * Named variants not covered by the explicit mapping get an implicit entry under their own
 * name. Without an explicit mapping every variant must be a named component, and no two
 * variants may share a name.</p>
 */
public class DiscriminatorMapper {
    private static final Logger log = LoggerFactory.getLogger(DiscriminatorMapper.class);

    /**
     * @return the discriminator, or {@code null} when no {@code propertyName} is declared
     */
    public Discriminator map(OpenApiDocument document, JsonNode discriminator, List<ResolvedSchema> variants,
                             String compositionType, String schemaPath) {
        String propertyName = discriminator.path("propertyName").asText("");
        if (propertyName.isEmpty()) {
            log.debug("discriminator.ignored reason=no-propertyName path={}", schemaPath);
            return null;
        }
        JsonNode mapping = discriminator.get("mapping");
        Map<String, String> values = new LinkedHashMap<>();
        if (mapping != null && mapping.isObject() && mapping.size() > 0) {
            Iterator<Map.Entry<String, JsonNode>> entries = mapping.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                values.put(entry.getKey(), targetName(document, entry.getValue().asText(""), schemaPath));
            }
            Set<String> mappedTargets = new HashSet<>(values.values());
            for (ResolvedSchema variant : variants) {
                String name = variant.sourceName();
                if (!variant.isAnonymous() && !mappedTargets.contains(name) && !values.containsKey(name)) {
                    values.put(name, name);
                }
            }
        } else {
            for (int i = 0; i < variants.size(); i++) {
                ResolvedSchema variant = variants.get(i);
                if (variant.isAnonymous()) {
                    throw new SchemaCompositionException(compositionType,
                            "variant " + i + " is an inline schema and cannot be selected by discriminator '"
                                    + propertyName + "' without an explicit mapping",
                            ErrorCode.AMBIGUOUS_DISCRIMINATOR, schemaPath);
                }
                if (values.putIfAbsent(variant.sourceName(), variant.sourceName()) != null) {
                    throw new SchemaCompositionException(compositionType,
                            "discriminator value '" + variant.sourceName() + "' matches more than one variant",
                            ErrorCode.AMBIGUOUS_DISCRIMINATOR, schemaPath);
                }
            }
        }
        return new Discriminator(propertyName, values);
    }

    private String targetName(OpenApiDocument document, String target, String schemaPath) {
        String name;
        if (target.startsWith(SchemaReference.COMPONENT_SCHEMAS_PREFIX)) {
            Optional<String> component = SchemaReference.of(target).componentName();
            if (component.isEmpty()) {
                throw invalidTarget(target, schemaPath);
            }
            name = component.get();
        } else if (target.isEmpty() || target.contains("/") || target.contains("#")) {
            throw invalidTarget(target, schemaPath);
        } else {
            name = target;
        }
        if (!document.hasComponentSchema(name)) {
            throw new ReferenceNotFoundException(SchemaReference.toComponent(name).pointer(), name, schemaPath);
        }
        return name;
    }

    private static ReferenceNotFoundException invalidTarget(String target, String schemaPath) {
        return new ReferenceNotFoundException("Discriminator mapping must name a component schema: '" + target + "'",
                ErrorCode.INVALID_REFERENCE_FORMAT, target, schemaPath);
    }
}
