package com.openapi.resolution.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.compose.ResolutionContext;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ExternalReferenceException;
import com.openapi.resolution.exception.ReferenceNotFoundException;
import com.openapi.resolution.exception.SchemaResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@link SchemaReference} into the raw node it designates.
 *
 * <p>Local pointers are walked from the document root; everything else goes to the
 * {@link ExternalReferenceResolver}. This class knows nothing about composition or
 * caching.</p>
 */
public class ReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ExternalReferenceResolver externalResolver;

    public ReferenceResolver() {
        this(UnsupportedExternalReferenceResolver.INSTANCE);
    }

    public ReferenceResolver(ExternalReferenceResolver externalResolver) {
        this.externalResolver = Objects.requireNonNull(externalResolver, "externalResolver is required");
    }

    /**
     * Resolves {@code ref} to its raw node.
     *
     * @throws com.openapi.resolution.exception.CircularReferenceException if the pointer is
     *         already on the context's resolution path
     * @throws ReferenceNotFoundException if a segment of a local pointer does not exist
     * @throws ExternalReferenceException if the external collaborator fails
     */
    public JsonNode resolve(OpenApiDocument document, SchemaReference ref, ResolutionContext ctx) {
        ctx.checkNotVisited(ref.canonical());
        if (ref.isLocal()) {
            return resolveLocal(document, ref, ctx.currentPath());
        }
        if (ref.pointer().startsWith("#")) {
            throw invalidFormat(ref, ctx.currentPath());
        }
        return resolveExternal(document, ref, ctx.currentPath());
    }

    /**
     * Checks that a local pointer designates an existing node.
     */
    public boolean exists(OpenApiDocument document, SchemaReference ref) {
        if (!ref.isLocal()) {
            return false;
        }
        return JsonPointers.walk(document.root(), ref.segments()).found();
    }

    /**
     * Looks up a local pointer without cycle checks, for static analysis of the document.
     */
    public static Optional<JsonNode> findLocal(OpenApiDocument document, SchemaReference ref) {
        if (!ref.isLocal()) {
            return Optional.empty();
        }
        return Optional.ofNullable(JsonPointers.walk(document.root(), ref.segments()).node());
    }

    /**
     * Like {@link #exists}, but throws the same error {@link #resolve} would.
     */
    public void requireExists(OpenApiDocument document, SchemaReference ref, String schemaPath) {
        if (!ref.isLocal()) {
            throw invalidFormat(ref, schemaPath);
        }
        resolveLocal(document, ref, schemaPath);
    }

    private JsonNode resolveLocal(OpenApiDocument document, SchemaReference ref, String schemaPath) {
        JsonPointers.Walk walk = JsonPointers.walk(document.root(), ref.segments());
        if (!walk.found()) {
            log.debug("reference.missing pointer={} segment={}", ref.pointer(), walk.missingSegment());
            throw new ReferenceNotFoundException(ref.pointer(), walk.missingSegment(), schemaPath);
        }
        return walk.node();
    }

    private JsonNode resolveExternal(OpenApiDocument document, SchemaReference ref, String schemaPath) {
        JsonNode node;
        try {
            node = externalResolver.resolveExternal(ref.pointer(), document.baseContext());
        } catch (ExternalReferenceException e) {
            if (!e.getSchemaPath().isEmpty() || schemaPath.isEmpty()) {
                throw e;
            }
            throw new ExternalReferenceException(e.getMessage(), e.getErrorCode(), e.getPointer(), schemaPath, e);
        } catch (SchemaResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExternalReferenceException("Failed to resolve external reference " + ref.pointer()
                    + ": " + e.getMessage(), ErrorCode.EXTERNAL_FILE_LOAD_FAILED, ref.pointer(), schemaPath, e);
        }
        if (node == null || node.isMissingNode()) {
            throw new ExternalReferenceException("External reference resolved to nothing: " + ref.pointer(),
                    ErrorCode.EXTERNAL_FILE_LOAD_FAILED, ref.pointer(), schemaPath, null);
        }
        return node;
    }

    private static ReferenceNotFoundException invalidFormat(SchemaReference ref, String schemaPath) {
        return new ReferenceNotFoundException("Invalid reference format: " + ref.pointer(),
                ErrorCode.INVALID_REFERENCE_FORMAT, ref.pointer(), schemaPath);
    }
}
