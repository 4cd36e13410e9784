package com.dcruver.tanaimport.app;

import com.dcruver.tanaimport.config.ImporterProperties;
import com.dcruver.tanaimport.io.VaultWriter;
import com.dcruver.tanaimport.reporting.ImportReportGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImportShellCommandsTest {

    @TempDir
    Path tempDir;

    private ImportShellCommands commands;
    private Path export;

    @BeforeEach
    void setUp() throws Exception {
        ImporterProperties properties = new ImporterProperties();
        VaultWriter writer = new VaultWriter();
        ImportService service =
            new ImportService(properties, writer, new ImportReportGenerator(writer), new ObjectMapper());
        commands = new ImportShellCommands(service, properties);

        export = tempDir.resolve("export.json");
        Files.writeString(export, """
            {"formatVersion": 1, "docs": [
              {"id": "R", "props": {"name": "Root node for ws"}, "children": ["WS"]},
              {"id": "WS", "props": {"name": "Home", "_ownerId": "R"}, "children": ["C", "GONE"]},
              {"id": "C", "props": {"name": "Hello", "_ownerId": "WS"}, "children": []}
            ]}
            """);
    }

    @Test
    void testImportPrintsSummaryAndNotices() {
        Path vault = tempDir.resolve("vault");

        String output = commands.importTana(export.toString(), vault.toString(), false);

        assertTrue(output.startsWith("Import completed."), output);
        assertTrue(output.contains("- Documents written: 1\n"));
        assertTrue(output.contains("- Node with id GONE (parent Home) not found\n"));
        assertTrue(Files.exists(vault.resolve("Home.md")));
    }

    @Test
    void testImportReportsMissingFile() {
        String output = commands.importTana(tempDir.resolve("nope.json").toString(), tempDir.toString(), false);

        assertTrue(output.startsWith("Import failed: "), output);
    }

    @Test
    void testEmptyFileListIsRejected() {
        assertEquals("Please pick at least one file to import.", commands.importTana(" , ", null, false));
    }

    @Test
    void testPreviewListsDocuments() {
        String output = commands.preview(export.toString());

        assertTrue(output.startsWith("1 documents:\n- Home.md\n"), output);
    }
}
