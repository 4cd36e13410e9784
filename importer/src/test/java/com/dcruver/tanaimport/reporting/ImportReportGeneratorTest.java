package com.dcruver.tanaimport.reporting;

import com.dcruver.tanaimport.domain.ConversionResult;
import com.dcruver.tanaimport.domain.Document;
import com.dcruver.tanaimport.io.VaultWriter;
import com.dcruver.tanaimport.io.VaultWriter.WriteSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImportReportGeneratorTest {

    @TempDir
    Path tempDir;

    private final ImportReportGenerator generator =
        new ImportReportGenerator(new VaultWriter(), Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));

    private static ConversionResult result(List<String> notices, List<String> orphans) {
        return ConversionResult.builder()
            .documents(List.of(new Document("A.md", "  * a"), new Document("B.md", "")))
            .notices(notices)
            .orphanIds(orphans)
            .convertedCount(12)
            .build();
    }

    @Test
    void testReportListsCountsNoticesAndOrphans() throws Exception {
        WriteSummary summary = new WriteSummary(List.of(tempDir.resolve("A.md")), List.of("B.md"), Map.of());

        Path report = generator.generateReport(
            result(List.of("Library node not found"), List.of("X1", "X2")), summary, tempDir);

        assertEquals(tempDir.resolve("Import report 2025-03-01.md"), report);
        String content = Files.readString(report);
        assertTrue(content.startsWith("# Tana Import Report - 2025-03-01\n"));
        assertTrue(content.contains("- Documents: 2\n"));
        assertTrue(content.contains("- Written: 1\n"));
        assertTrue(content.contains("- Failed: 1\n"));
        assertTrue(content.contains("- Nodes converted: 12\n"));
        assertTrue(content.contains("- Library node not found\n"));
        assertTrue(content.contains("## Failed Writes\n\n- B.md\n"));
        assertTrue(content.contains("- X1\n- X2\n"));
    }

    @Test
    void testCleanRun() {
        String content = generator.buildReport(result(List.of(), List.of()), null, "2025-03-01");

        assertTrue(content.contains("No notices."));
        assertTrue(content.contains("Every node was converted."));
        assertFalse(content.contains("Failed Writes"));
        assertFalse(content.contains("Renamed Documents"));
    }

    @Test
    void testEarlierReportIsNotOverwritten() throws Exception {
        Path earlier = tempDir.resolve("Import report 2025-03-01.md");
        Files.writeString(earlier, "earlier run");

        Path report = generator.generateReport(result(List.of(), List.of()), null, tempDir);

        assertEquals(tempDir.resolve("Import report 2025-03-01 1.md"), report);
        assertEquals("earlier run", Files.readString(earlier));
        assertTrue(Files.readString(report).startsWith("# Tana Import Report - 2025-03-01\n"));
    }

    @Test
    void testRenamedDocumentsAreListed() {
        WriteSummary summary = new WriteSummary(
            List.of(tempDir.resolve("A 1.md")), List.of(), Map.of("A.md", tempDir.resolve("A 1.md")));

        String content = generator.buildReport(result(List.of(), List.of()), summary, "2025-03-01");

        assertTrue(content.contains("## Renamed Documents\n"));
        assertTrue(content.contains("- A.md -> A 1.md\n"));
    }
}
