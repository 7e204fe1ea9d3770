package com.ryuqq.guardrail.adapter.yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.function.Supplier;

/**
 * Node access helpers shared by the document readers. Every failure names the JSON pointer.
 */
final class DocumentNodes {

    private DocumentNodes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * YAML is a superset of JSON, so one mapper reads both.
     */
    static ObjectMapper newMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    static JsonNode parse(ObjectMapper mapper, Reader reader) {
        JsonNode root;
        try {
            root = mapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new ContractDocumentException("", "malformed document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read document", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ContractDocumentException("", "document is empty");
        }
        return requireObject(root, "");
    }

    static String child(String pointer, String field) {
        return pointer + "/" + field.replace("~", "~0").replace("/", "~1");
    }

    static String child(String pointer, int index) {
        return pointer + "/" + index;
    }

    static JsonNode require(JsonNode parent, String field, String pointer) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new ContractDocumentException(child(pointer, field), "required field is missing");
        }
        return node;
    }

    static JsonNode requireObject(JsonNode node, String pointer) {
        if (!node.isObject()) {
            throw new ContractDocumentException(pointer, "expected a mapping but found " + node.getNodeType());
        }
        return node;
    }

    static JsonNode requireArray(JsonNode node, String pointer) {
        if (!node.isArray()) {
            throw new ContractDocumentException(pointer, "expected a list but found " + node.getNodeType());
        }
        return node;
    }

    static String requireText(JsonNode parent, String field, String pointer) {
        return text(require(parent, field, pointer), child(pointer, field));
    }

    static String optionalText(JsonNode parent, String field, String pointer, String defaultValue) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        return text(node, child(pointer, field));
    }

    static String text(JsonNode node, String pointer) {
        if (!node.isValueNode() || node.asText().isBlank()) {
            throw new ContractDocumentException(pointer, "expected a non-blank scalar");
        }
        return node.asText().trim();
    }

    /**
     * Converts a model constructor failure into a document error at the given pointer.
     */
    static <T> T at(String pointer, Supplier<T> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            throw new ContractDocumentException(pointer, e.getMessage(), e);
        }
    }
}
