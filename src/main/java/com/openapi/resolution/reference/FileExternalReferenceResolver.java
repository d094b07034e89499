package com.openapi.resolution.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.DocumentLoader;
import com.openapi.resolution.exception.DocumentParseException;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ExternalReferenceException;
import com.openapi.resolution.exception.ReferenceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves {@code file.yaml#/json/pointer} references from the local file system.
 *
 * <p>Relative files are resolved against the directory of the referring document. Loaded
 * documents are kept in a bounded Caffeine cache. {@code $ref}s inside the returned fragment
 * are rewritten to absolute {@code file#pointer} form so that they keep designating nodes of
 * the external file once the fragment is embedded in the referring document.</p>
 *
 * <p>HTTP(S) references are rejected.</p>
 */
public class FileExternalReferenceResolver implements ExternalReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(FileExternalReferenceResolver.class);

    public static final int DEFAULT_MAX_CACHED_DOCUMENTS = 100;

    private final DocumentLoader loader = new DocumentLoader(false);
    private final Cache<Path, JsonNode> documents;
    private final Path allowedDirectory;

    public FileExternalReferenceResolver() {
        this(null, DEFAULT_MAX_CACHED_DOCUMENTS);
    }

    /**
     * @param allowedDirectory when non-null, only files below this directory may be read
     */
    public FileExternalReferenceResolver(Path allowedDirectory, int maxCachedDocuments) {
        if (maxCachedDocuments <= 0) {
            throw new IllegalArgumentException("maxCachedDocuments must be positive");
        }
        this.allowedDirectory = allowedDirectory != null ? allowedDirectory.toAbsolutePath().normalize() : null;
        this.documents = Caffeine.newBuilder()
                .maximumSize(maxCachedDocuments)
                .build();
    }

    @Override
    public JsonNode resolveExternal(String pointer, String baseContext) {
        int hash = pointer.indexOf('#');
        if (hash <= 0 || hash == pointer.length() - 1) {
            throw new ExternalReferenceException("Invalid external reference format: " + pointer,
                    ErrorCode.INVALID_REFERENCE_FORMAT, pointer);
        }
        String location = pointer.substring(0, hash);
        String fragment = pointer.substring(hash);
        if (isHttp(location)) {
            throw new ExternalReferenceException("Remote references are not supported: " + pointer,
                    ErrorCode.EXTERNAL_REFERENCE_NOT_SUPPORTED, pointer);
        }

        Path file = resolvePath(location, baseContext);
        checkAllowed(file, pointer);
        JsonNode root = documents.get(file, path -> load(path, pointer));

        SchemaReference local = SchemaReference.of(fragment);
        JsonPointers.Walk walk = JsonPointers.walk(root, local.segments());
        if (!walk.found()) {
            throw new ReferenceNotFoundException(pointer, walk.missingSegment(), "");
        }
        JsonNode fragmentNode = walk.node().deepCopy();
        rewriteReferences(fragmentNode, file);
        log.debug("external.resolved pointer={} file={}", pointer, file);
        return fragmentNode;
    }

    public long cachedDocumentCount() {
        return documents.estimatedSize();
    }

    private JsonNode load(Path file, String pointer) {
        try {
            return loader.load(file).root();
        } catch (DocumentParseException e) {
            throw new ExternalReferenceException("Failed to load external document " + file + ": " + e.getMessage(),
                    ErrorCode.EXTERNAL_FILE_LOAD_FAILED, pointer, "", e);
        }
    }

    private Path resolvePath(String location, String baseContext) {
        Path target = Path.of(location);
        if (target.isAbsolute()) {
            return target.normalize();
        }
        Path base = baseContext == null || baseContext.isEmpty() || isHttp(baseContext)
                ? Path.of("").toAbsolutePath()
                : Path.of(baseContext).toAbsolutePath().getParent();
        return base.resolve(target).normalize();
    }

    private void checkAllowed(Path file, String pointer) {
        if (allowedDirectory != null && !file.startsWith(allowedDirectory)) {
            throw new ExternalReferenceException("External reference outside the allowed directory "
                    + allowedDirectory + ": " + file, ErrorCode.DOMAIN_NOT_ALLOWED, pointer);
        }
    }

    private void rewriteReferences(JsonNode node, Path file) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if ("$ref".equals(field.getKey()) && field.getValue().isTextual()) {
                    field.setValue(TextNode.valueOf(absolutize(field.getValue().asText(), file)));
                } else {
                    rewriteReferences(field.getValue(), file);
                }
            }
        } else if (node.isArray()) {
            node.forEach(child -> rewriteReferences(child, file));
        }
    }

    private String absolutize(String ref, Path file) {
        if (ref.startsWith("#")) {
            return file + ref;
        }
        if (isHttp(ref)) {
            return ref;
        }
        int hash = ref.indexOf('#');
        String location = hash >= 0 ? ref.substring(0, hash) : ref;
        String fragment = hash >= 0 ? ref.substring(hash) : "";
        return file.getParent().resolve(location).normalize() + fragment;
    }

    private static boolean isHttp(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
