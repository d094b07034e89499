package com.openapi.resolution.compose;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.resolution.core.model.ArraySchema;
import com.openapi.resolution.core.model.Discriminator;
import com.openapi.resolution.core.model.FlexibleUnionSchema;
import com.openapi.resolution.core.model.ObjectSchema;
import com.openapi.resolution.core.model.PrimitiveSchema;
import com.openapi.resolution.core.model.PrimitiveType;
import com.openapi.resolution.core.model.PropertySchema;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.core.model.SchemaLink;
import com.openapi.resolution.core.model.SchemaMetadata;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.core.model.UnionSchema;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ReferenceNotFoundException;
import com.openapi.resolution.exception.UnsupportedSchemaShapeException;
import com.openapi.resolution.reference.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves raw schema nodes into the {@link ResolvedSchema} model.
 *
 * <p>Dispatch is by node shape, in order: {@code $ref}, {@code allOf}, {@code oneOf},
 * {@code anyOf}, plain schema. References in composition position are expanded. References
 * to component schemas at a property, item or additional-properties position become
 * {@link SchemaLink}s, which is how recursive models terminate.</p>
 *
 * <p>Nested schemas are resolved through the {@code recursion} resolver, so a decorator
 * (the cache) sees every nested call. The composer itself keeps no state between calls and
 * is thread-safe.</p>
 */
public class SchemaComposer implements SchemaNodeResolver {
    private static final Logger log = LoggerFactory.getLogger(SchemaComposer.class);

    private static final Set<String> OBJECT_KEYWORDS = Set.of("properties", "required", "additionalProperties");
    private static final Set<String> UNION_IGNORED = Set.of("type", "format", "properties", "required",
            "additionalProperties", "items");

    private final ReferenceResolver references;
    private final AllOfMerger merger;
    private final DiscriminatorMapper discriminators;
    private final SchemaNodeResolver recursion;

    public SchemaComposer(ReferenceResolver references) {
        this(references, null);
    }

    /**
     * @param recursion resolver used for nested schemas; {@code null} means this composer
     */
    public SchemaComposer(ReferenceResolver references, SchemaNodeResolver recursion) {
        this.references = Objects.requireNonNull(references, "references is required");
        this.merger = new AllOfMerger();
        this.discriminators = new DiscriminatorMapper();
        this.recursion = recursion != null ? recursion : this;
    }

    /**
     * Resolves a schema or {@code $ref} node in composition position: references are
     * expanded, never turned into links.
     */
    public ResolvedSchema resolveSchema(OpenApiDocument document, JsonNode schemaOrRef, ResolutionContext ctx) {
        return recursion.resolveNode(document, schemaOrRef, ctx);
    }

    /**
     * Resolves a node sitting at a structural boundary (property value, array items,
     * additional properties, operation schema): component references become links, and so
     * do the component-reference variants of a {@code oneOf} or {@code anyOf} found there.
     */
    public ResolvedSchema resolveBoundary(OpenApiDocument document, JsonNode node, ResolutionContext ctx) {
        Optional<SchemaReference> target = SchemaKeywords.linkTarget(node);
        if (target.isPresent()) {
            return link(document, node, target.get(), ctx.currentPath());
        }
        Optional<String> union = SchemaKeywords.unionKeyword(node);
        if (union.isPresent()) {
            // not cached by shape: the same union expands its variants outside a boundary
            return composeUnion(document, node, union.get(), ctx, true);
        }
        return recursion.resolveNode(document, node, ctx);
    }

    @Override
    public ResolvedSchema resolveNode(OpenApiDocument document, JsonNode node, ResolutionContext ctx) {
        if (node.isBoolean()) {
            if (node.booleanValue()) {
                return PrimitiveSchema.of(PrimitiveType.ANY);
            }
            throw new UnsupportedSchemaShapeException("The schema 'false' accepts no value",
                    ErrorCode.UNSUPPORTED_SCHEMA_TYPE, ctx.currentPath());
        }
        if (!node.isObject()) {
            throw new UnsupportedSchemaShapeException("Schema must be an object, found " + node.getNodeType(),
                    ErrorCode.UNSUPPORTED_SCHEMA_TYPE, ctx.currentPath());
        }
        if (node.has(SchemaKeywords.REF)) {
            return recursion.resolveReference(document, reference(node, ctx), ctx);
        }
        if (node.has(SchemaKeywords.ALL_OF)) {
            return composeAllOf(document, (ObjectNode) node, ctx);
        }
        if (node.has(SchemaKeywords.ONE_OF)) {
            return composeUnion(document, node, SchemaKeywords.ONE_OF, ctx, false);
        }
        if (node.has(SchemaKeywords.ANY_OF)) {
            return composeUnion(document, node, SchemaKeywords.ANY_OF, ctx, false);
        }
        return composePlain(document, node, ctx);
    }

    @Override
    public ResolvedSchema resolveReference(OpenApiDocument document, SchemaReference ref, ResolutionContext ctx) {
        String pointer = ref.canonical();
        JsonNode target = references.resolve(document, ref, ctx);
        ctx.enter(pointer);
        try {
            ctx.descend(pointer);
            try {
                ResolvedSchema resolved = resolveNode(document, target, ctx);
                Optional<String> name = ref.componentName();
                return name.isPresent() ? resolved.withSourceName(name.get()) : resolved;
            } finally {
                ctx.ascend();
            }
        } finally {
            ctx.exit(pointer);
        }
    }

    private ResolvedSchema composeAllOf(OpenApiDocument document, ObjectNode node, ResolutionContext ctx) {
        JsonNode allOf = node.get(SchemaKeywords.ALL_OF);
        if (!allOf.isArray()) {
            throw new UnsupportedSchemaShapeException("allOf must be an array",
                    ErrorCode.UNSUPPORTED_SCHEMA_TYPE, ctx.currentPath());
        }
        List<ResolvedSchema> branches = new ArrayList<>(allOf.size() + 1);
        Set<String> extraRequired = new LinkedHashSet<>();

        ObjectNode siblings = node.deepCopy();
        siblings.remove(SchemaKeywords.ALL_OF);
        Boolean nullableOverride = siblings.has("nullable") ? siblings.get("nullable").asBoolean() : null;
        if (siblings.size() > 0) {
            branches.add(resolveNode(document, siblings, ctx));
            extraRequired.addAll(SchemaKeywords.stringSet(siblings.get("required")));
        }
        for (int i = 0; i < allOf.size(); i++) {
            JsonNode branch = allOf.get(i);
            branches.add(nested(document, branch, ctx, SchemaKeywords.ALL_OF, String.valueOf(i)));
            if (!SchemaKeywords.isReference(branch)) {
                extraRequired.addAll(SchemaKeywords.stringSet(branch.get("required")));
            }
        }
        return merger.merge(branches, extraRequired, nullableOverride, ctx.currentPath());
    }

    private ResolvedSchema composeUnion(OpenApiDocument document, JsonNode node, String keyword,
                                        ResolutionContext ctx, boolean linkVariants) {
        JsonNode variantNodes = node.get(keyword);
        if (!variantNodes.isArray() || variantNodes.isEmpty()) {
            ErrorCode code = SchemaKeywords.ONE_OF.equals(keyword) ? ErrorCode.ONEOF_NO_VARIANTS : ErrorCode.ANYOF_NO_VARIANTS;
            throw new UnsupportedSchemaShapeException(keyword + " must declare at least one variant",
                    code, ctx.currentPath());
        }
        List<ResolvedSchema> variants = new ArrayList<>(variantNodes.size());
        for (int i = 0; i < variantNodes.size(); i++) {
            JsonNode variant = variantNodes.get(i);
            Optional<SchemaReference> target = linkVariants ? SchemaKeywords.linkTarget(variant) : Optional.empty();
            variants.add(target.isPresent()
                    ? link(document, variant, target.get(), ctx.childPath(keyword, String.valueOf(i)))
                    : nested(document, variant, ctx, keyword, String.valueOf(i)));
        }
        Discriminator discriminator = node.has("discriminator")
                ? discriminators.map(document, node.get("discriminator"), variants, keyword, ctx.currentPath())
                : null;
        if (node.has("properties")) {
            log.debug("composition.properties.ignored keyword={} path={}", keyword, ctx.currentPath());
        }
        Map<String, JsonNode> constraints = constraints(node, UNION_IGNORED);
        boolean nullable = node.path("nullable").asBoolean(false);
        if (SchemaKeywords.ONE_OF.equals(keyword)) {
            return new UnionSchema("", variants, discriminator, nullable, metadata(node), constraints);
        }
        return new FlexibleUnionSchema("", variants, discriminator, nullable, metadata(node), constraints);
    }

    private ResolvedSchema composePlain(OpenApiDocument document, JsonNode node, ResolutionContext ctx) {
        List<String> types = new ArrayList<>();
        boolean nullable = node.path("nullable").asBoolean(false);
        JsonNode typeNode = node.get("type");
        if (typeNode != null) {
            if (typeNode.isTextual()) {
                if ("null".equals(typeNode.asText())) {
                    nullable = true;
                } else {
                    types.add(typeNode.asText());
                }
            } else if (typeNode.isArray()) {
                for (JsonNode t : typeNode) {
                    if ("null".equals(t.asText())) {
                        nullable = true;
                    } else {
                        types.add(t.asText());
                    }
                }
            } else {
                throw new UnsupportedSchemaShapeException("Unsupported schema type: " + typeNode,
                        ErrorCode.UNSUPPORTED_SCHEMA_TYPE, ctx.currentPath());
            }
        }
        if (types.size() > 1) {
            return composeMultiType(document, node, types, nullable, ctx);
        }
        String type = types.isEmpty() ? inferType(node) : types.get(0);
        if ("object".equals(type)) {
            return composeObject(document, node, nullable, ctx);
        }
        if ("array".equals(type)) {
            ResolvedSchema items = node.has("items")
                    ? boundary(document, node.get("items"), ctx, "items")
                    : PrimitiveSchema.of(PrimitiveType.ANY);
            return new ArraySchema("", items, nullable, metadata(node), constraints(node, Set.of()));
        }
        PrimitiveType primitive = type == null
                ? PrimitiveType.ANY
                : PrimitiveType.fromOpenApi(type).orElseThrow(() -> new UnsupportedSchemaShapeException(
                        "Unsupported schema type: " + type, ErrorCode.UNSUPPORTED_SCHEMA_TYPE, ctx.currentPath()));
        String format = node.has("format") ? node.get("format").asText() : null;
        return new PrimitiveSchema("", primitive, format, nullable, metadata(node), constraints(node, Set.of("format")));
    }

    private ObjectSchema composeObject(OpenApiDocument document, JsonNode node, boolean nullable,
                                      ResolutionContext ctx) {
        Set<String> required = SchemaKeywords.stringSet(node.get("required"));
        Map<String, PropertySchema> properties = new LinkedHashMap<>();
        JsonNode propertyNodes = node.get("properties");
        if (propertyNodes != null && propertyNodes.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = propertyNodes.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String name = field.getKey();
                ResolvedSchema schema = boundary(document, field.getValue(), ctx, "properties", name);
                properties.put(name, new PropertySchema(schema, required.contains(name)));
            }
        }

        Boolean additionalAllowed = null;
        ResolvedSchema additionalSchema = null;
        JsonNode additional = node.get("additionalProperties");
        if (additional != null) {
            if (additional.isBoolean()) {
                additionalAllowed = additional.booleanValue();
            } else if (additional.isObject()) {
                additionalAllowed = Boolean.TRUE;
                if (additional.size() > 0) {
                    additionalSchema = boundary(document, additional, ctx, "additionalProperties");
                }
            }
        }

        Discriminator discriminator = node.has("discriminator")
                ? discriminators.map(document, node.get("discriminator"), List.of(), "object", ctx.currentPath())
                : null;
        return new ObjectSchema("", properties, additionalAllowed, additionalSchema, discriminator, List.of(),
                nullable, metadata(node), constraints(node, OBJECT_KEYWORDS));
    }

    /**
     * OpenAPI 3.1 {@code type: [string, integer]}: each type becomes a variant built from the
     * shape keywords only, the union keeps documentation and constraints.
     */
    private FlexibleUnionSchema composeMultiType(OpenApiDocument document, JsonNode node, List<String> types,
                                                 boolean nullable, ResolutionContext ctx) {
        List<ResolvedSchema> variants = new ArrayList<>(types.size());
        for (String type : types) {
            ObjectNode variant = JsonNodeFactory.instance.objectNode();
            variant.put("type", type);
            for (String keyword : List.of("format", "properties", "required", "additionalProperties", "items")) {
                if (node.has(keyword)) {
                    variant.set(keyword, node.get(keyword));
                }
            }
            variants.add(composePlain(document, variant, ctx));
        }
        return new FlexibleUnionSchema("", variants, null, nullable, metadata(node),
                constraints(node, Set.of("format")));
    }

    private ResolvedSchema boundary(OpenApiDocument document, JsonNode node, ResolutionContext ctx,
                                    String... segments) {
        Optional<SchemaReference> target = SchemaKeywords.linkTarget(node);
        if (target.isPresent()) {
            return link(document, node, target.get(), ctx.childPath(segments));
        }
        ctx.descend(ctx.childPath(segments));
        try {
            return resolveBoundary(document, node, ctx);
        } finally {
            ctx.ascend();
        }
    }

    private SchemaLink link(OpenApiDocument document, JsonNode node, SchemaReference target, String schemaPath) {
        references.requireExists(document, target, schemaPath);
        boolean nullable = node.path("nullable").asBoolean(false);
        SchemaMetadata metadata = SchemaKeywords.isReference(node) ? SchemaMetadata.empty() : metadata(node);
        return new SchemaLink(target.componentName().orElseThrow(), target.pointer(), nullable, metadata);
    }

    private ResolvedSchema nested(OpenApiDocument document, JsonNode node, ResolutionContext ctx,
                                  String... segments) {
        ctx.descend(ctx.childPath(segments));
        try {
            return recursion.resolveNode(document, node, ctx);
        } finally {
            ctx.ascend();
        }
    }

    private static SchemaReference reference(JsonNode node, ResolutionContext ctx) {
        JsonNode ref = node.get(SchemaKeywords.REF);
        if (!ref.isTextual() || ref.asText().isBlank()) {
            throw new ReferenceNotFoundException("Invalid reference format: " + ref,
                    ErrorCode.INVALID_REFERENCE_FORMAT, ref.toString(), ctx.currentPath());
        }
        return SchemaReference.of(ref.asText());
    }

    private static String inferType(JsonNode node) {
        if (node.has("properties") || node.has("additionalProperties")) {
            return "object";
        }
        if (node.has("items")) {
            return "array";
        }
        return null;
    }

    static SchemaMetadata metadata(JsonNode node) {
        JsonNode title = node.get("title");
        JsonNode description = node.get("description");
        return new SchemaMetadata(
                title != null && title.isTextual() ? title.asText() : null,
                description != null && description.isTextual() ? description.asText() : null,
                node.get("example"),
                node.get("default"),
                node.path("deprecated").asBoolean(false));
    }

    /**
     * Copies every keyword that neither shapes the schema nor documents it, in declaration order.
     */
    private static Map<String, JsonNode> constraints(JsonNode node, Set<String> consumed) {
        Map<String, JsonNode> constraints = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (consumed.contains(key) || SchemaKeywords.METADATA.contains(key)) {
                continue;
            }
            if (SchemaKeywords.SHAPE.contains(key) && !"required".equals(key)) {
                continue;
            }
            constraints.put(key, field.getValue());
        }
        return constraints;
    }
}
