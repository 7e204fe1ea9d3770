package com.ryuqq.guardrail.adapter.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.guardrail.core.architecture.DependencyEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.at;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.child;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.require;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.requireArray;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.requireObject;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.requireText;

/**
 * Reads a dependency snapshot (the module edges of a codebase) for batch architecture validation.
 *
 * <pre>
 * edges:
 *   - {source: api, target: db}
 *   - {source: db, target: api}
 * </pre>
 *
 * <p>Edges keep document order; duplicates are kept, since batch validation reports each
 * offending edge once anyway.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public class DependencySnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(DependencySnapshotReader.class);

    private final ObjectMapper mapper;

    /**
     * Creates a reader backed by a YAML-capable {@link ObjectMapper}.
     */
    public DependencySnapshotReader() {
        this.mapper = DocumentNodes.newMapper();
    }

    /**
     * Reads a snapshot from a file.
     *
     * @param path the snapshot path
     * @return the edges in document order
     * @throws ContractDocumentException if the document is malformed
     * @throws UncheckedIOException if the file cannot be read
     */
    public List<DependencyEdge> read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<DependencyEdge> edges = read(reader);
            log.info("Loaded {} dependency edge(s) from {}", edges.size(), path);
            return edges;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dependency snapshot " + path, e);
        }
    }

    /**
     * Reads a snapshot from a string.
     *
     * @param content the snapshot text
     * @return the edges in document order
     * @throws ContractDocumentException if the document is malformed
     */
    public List<DependencyEdge> readString(String content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        return read(new StringReader(content));
    }

    /**
     * Reads a snapshot from a reader. The reader is not closed.
     *
     * @param reader the snapshot source
     * @return the edges in document order
     * @throws ContractDocumentException if the document is malformed
     */
    public List<DependencyEdge> read(Reader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        JsonNode root = DocumentNodes.parse(mapper, reader);
        String edgesPointer = "/edges";
        JsonNode edgesNode = requireArray(require(root, "edges", ""), edgesPointer);

        List<DependencyEdge> edges = new ArrayList<>();
        for (int i = 0; i < edgesNode.size(); i++) {
            String edgePointer = child(edgesPointer, i);
            JsonNode edge = requireObject(edgesNode.get(i), edgePointer);
            String source = requireText(edge, "source", edgePointer);
            String target = requireText(edge, "target", edgePointer);
            edges.add(at(edgePointer, () -> DependencyEdge.of(source, target)));
        }
        return List.copyOf(edges);
    }
}
