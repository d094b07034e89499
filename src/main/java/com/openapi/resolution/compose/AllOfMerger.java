package com.openapi.resolution.compose;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.core.model.ArraySchema;
import com.openapi.resolution.core.model.Discriminator;
import com.openapi.resolution.core.model.ObjectSchema;
import com.openapi.resolution.core.model.PrimitiveSchema;
import com.openapi.resolution.core.model.PrimitiveType;
import com.openapi.resolution.core.model.PropertySchema;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.core.model.SchemaKind;
import com.openapi.resolution.core.model.SchemaLink;
import com.openapi.resolution.core.model.SchemaMetadata;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.SchemaCompositionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges resolved {@code allOf} branches into one schema.
 *
 * <ul>
 *   <li>Objects: properties are united in first-seen order, a later definition replaces an
 *       earlier one, {@code required} is OR'd. Redefining a property with an incompatible
 *       type is an error.</li>
 *   <li>Branches without a type (only constraints or documentation) merge into any base.</li>
 *   <li>Objects, arrays and primitives do not mix; unions cannot be merged.</li>
 *   <li>Constraints: last writer wins per keyword. Metadata: first writer wins.</li>
 * </ul>
 */
public class AllOfMerger {
    private static final Logger log = LoggerFactory.getLogger(AllOfMerger.class);

    static final String ALL_OF = "allOf";

    /**
     * @param branches        resolved branches in merge order, implicit sibling branch first
     * @param extraRequired   names listed in {@code required} of inline branches
     * @param nullableOverride {@code nullable} declared next to {@code allOf}, or {@code null}
     */
    public ResolvedSchema merge(List<ResolvedSchema> branches, Set<String> extraRequired,
                                Boolean nullableOverride, String schemaPath) {
        List<ObjectSchema> objects = new ArrayList<>();
        List<ArraySchema> arrays = new ArrayList<>();
        List<PrimitiveSchema> primitives = new ArrayList<>();
        SchemaMetadata metadata = SchemaMetadata.empty();
        Map<String, JsonNode> constraints = new LinkedHashMap<>();
        boolean anyNullable = false;
        String format = null;

        for (ResolvedSchema branch : branches) {
            if (branch instanceof ObjectSchema object) {
                objects.add(object);
            } else if (branch instanceof ArraySchema array) {
                arrays.add(array);
            } else if (branch instanceof PrimitiveSchema primitive) {
                if (primitive.type() != PrimitiveType.ANY) {
                    primitives.add(primitive);
                }
                if (format == null) {
                    format = primitive.format();
                }
            } else {
                log.debug("allOf.unmergeable kind={} path={}", branch.kind(), schemaPath);
                throw conflict("incompatible base types", schemaPath);
            }
            metadata = metadata.orElse(branch.metadata());
            constraints.putAll(branch.validationConstraints());
            anyNullable |= branch.nullable();
        }
        constraints.remove("required");
        boolean nullable = nullableOverride != null ? nullableOverride : anyNullable;

        int families = (objects.isEmpty() ? 0 : 1) + (arrays.isEmpty() ? 0 : 1) + (primitives.isEmpty() ? 0 : 1);
        if (families > 1) {
            throw conflict("incompatible base types", schemaPath);
        }
        if (!objects.isEmpty()) {
            return mergeObjects(objects, extraRequired, nullable, metadata, constraints, schemaPath);
        }
        if (!arrays.isEmpty()) {
            if (arrays.size() > 1) {
                throw conflict("more than one array branch", schemaPath);
            }
            return new ArraySchema("", arrays.get(0).items(), nullable, metadata, constraints);
        }
        PrimitiveType type = PrimitiveType.ANY;
        for (PrimitiveSchema primitive : primitives) {
            if (type != PrimitiveType.ANY && type != primitive.type()) {
                throw conflict("incompatible primitive types " + type.openApiName()
                        + " and " + primitive.type().openApiName(), schemaPath);
            }
            type = primitive.type();
        }
        return new PrimitiveSchema("", type, format, nullable, metadata, constraints);
    }

    private ObjectSchema mergeObjects(List<ObjectSchema> objects, Set<String> extraRequired, boolean nullable,
                                      SchemaMetadata metadata, Map<String, JsonNode> constraints, String schemaPath) {
        Map<String, PropertySchema> properties = new LinkedHashMap<>();
        Boolean additionalAllowed = null;
        ResolvedSchema additionalSchema = null;
        Discriminator discriminator = null;
        List<String> sources = new ArrayList<>();

        for (ObjectSchema object : objects) {
            if (!object.isAnonymous()) {
                sources.add(object.sourceName());
            }
            for (Map.Entry<String, PropertySchema> entry : object.properties().entrySet()) {
                String name = entry.getKey();
                PropertySchema incoming = entry.getValue();
                PropertySchema existing = properties.get(name);
                if (existing == null) {
                    properties.put(name, incoming);
                    continue;
                }
                if (!compatible(existing.schema(), incoming.schema())) {
                    throw conflict("property '" + name + "' is defined as " + describe(existing.schema())
                            + " and as " + describe(incoming.schema()), schemaPath);
                }
                properties.put(name, new PropertySchema(incoming.schema(), existing.required() || incoming.required()));
            }
            if (object.additionalPropertiesAllowed() != null || object.additionalPropertiesSchema() != null) {
                additionalAllowed = object.additionalPropertiesAllowed();
                additionalSchema = object.additionalPropertiesSchema();
            }
            if (discriminator == null) {
                discriminator = object.discriminator();
            }
        }
        for (String name : extraRequired) {
            PropertySchema property = properties.get(name);
            if (property != null) {
                properties.put(name, property.asRequired());
            } else {
                log.debug("allOf.required.unknown property={} path={}", name, schemaPath);
            }
        }
        return new ObjectSchema("", properties, additionalAllowed, additionalSchema, discriminator,
                sources, nullable, metadata, constraints);
    }

    static boolean compatible(ResolvedSchema a, ResolvedSchema b) {
        if (isAny(a) || isAny(b)) {
            return true;
        }
        if (a.kind() != b.kind()) {
            return false;
        }
        if (a instanceof PrimitiveSchema pa && b instanceof PrimitiveSchema pb) {
            return pa.type() == pb.type();
        }
        if (a instanceof SchemaLink la && b instanceof SchemaLink lb) {
            return la.targetName().equals(lb.targetName());
        }
        if (a instanceof ArraySchema aa && b instanceof ArraySchema ab) {
            return compatible(aa.items(), ab.items());
        }
        return true;
    }

    private static boolean isAny(ResolvedSchema schema) {
        return schema instanceof PrimitiveSchema p && p.type() == PrimitiveType.ANY;
    }

    private static String describe(ResolvedSchema schema) {
        if (schema instanceof PrimitiveSchema p) {
            return p.type() == PrimitiveType.ANY ? "any" : p.type().openApiName();
        }
        if (schema instanceof SchemaLink link) {
            return "link to " + link.targetName();
        }
        if (schema.kind() == SchemaKind.ARRAY) {
            return "array";
        }
        return schema.kind().name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    private static SchemaCompositionException conflict(String reason, String schemaPath) {
        return new SchemaCompositionException(ALL_OF, reason, ErrorCode.ALLOF_MERGE_CONFLICT, schemaPath);
    }
}
