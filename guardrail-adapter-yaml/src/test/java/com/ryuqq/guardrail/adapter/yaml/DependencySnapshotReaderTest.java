package com.ryuqq.guardrail.adapter.yaml;

import com.ryuqq.guardrail.core.architecture.ArchitectureReport;
import com.ryuqq.guardrail.core.architecture.ArchitectureValidator;
import com.ryuqq.guardrail.core.architecture.DependencyEdge;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.testkit.fixture.ContractFixtures;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DependencySnapshotReader}.
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
class DependencySnapshotReaderTest {

    private final DependencySnapshotReader reader = new DependencySnapshotReader();

    @Test
    void read_SnapshotFile_KeepsEdgesInOrderIncludingDuplicates() throws URISyntaxException {
        // When
        List<DependencyEdge> edges = reader.read(
            Path.of(DependencySnapshotReaderTest.class.getResource("/contracts/dependencies.yaml").toURI()));

        // Then
        assertEquals(List.of(
            DependencyEdge.of("api", "db"),
            DependencyEdge.of("db", "api"),
            DependencyEdge.of("db", "api")
        ), edges);
    }

    @Test
    void read_SnapshotFile_FeedsBatchValidation() throws URISyntaxException {
        // Given
        List<DependencyEdge> edges = reader.read(
            Path.of(DependencySnapshotReaderTest.class.getResource("/contracts/dependencies.yaml").toURI()));

        // When
        ArchitectureReport report = ArchitectureReport.of(
            new ArchitectureValidator().validateAll(ContractFixtures.layeringRule(Severity.BLOCK), edges));

        // Then
        assertEquals(1, report.violations().size());
        assertEquals(List.of("Move shared code to a lower layer"), report.suggestions());
    }

    @Test
    void readString_EmptyEdgeList_ReturnsEmptyList() {
        assertTrue(reader.readString("edges: []\n").isEmpty());
    }

    @Test
    void readString_MissingTarget_PointsAtField() {
        ContractDocumentException e = assertThrows(ContractDocumentException.class,
            () -> reader.readString("edges:\n  - source: api\n    target: db\n  - source: db\n"));

        assertEquals("/edges/1/target", e.getPointer());
    }

    @Test
    void readString_MissingEdges_PointsAtField() {
        ContractDocumentException e = assertThrows(ContractDocumentException.class,
            () -> reader.readString("modules: [api]\n"));

        assertEquals("/edges", e.getPointer());
    }

    @Test
    void readString_Null_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> reader.readString(null));
    }
}
