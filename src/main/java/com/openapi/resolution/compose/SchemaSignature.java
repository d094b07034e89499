package com.openapi.resolution.compose;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openapi.resolution.document.OpenApiDocument;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 signatures of raw nodes and documents, used as cache keys for anonymous
 * inline schemas. Key order is significant, since it decides property order in the
 * resolved model.
 */
public final class SchemaSignature {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SchemaSignature() {
    }

    public static String of(JsonNode node) {
        try {
            return sha256(MAPPER.writeValueAsBytes(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize schema node", e);
        }
    }

    /**
     * Signature of a document's content and base location.
     */
    public static String ofDocument(OpenApiDocument document) {
        try {
            MessageDigest digest = newDigest();
            digest.update(document.baseContext().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
            digest.update(MAPPER.writeValueAsBytes(document.root()));
            return HexFormat.of().formatHex(digest.digest());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize document", e);
        }
    }

    private static String sha256(byte[] bytes) {
        return HexFormat.of().formatHex(newDigest().digest(bytes));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
