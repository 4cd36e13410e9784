package com.dcruver.tanaimport.app;

import com.dcruver.tanaimport.config.ImporterProperties;
import com.dcruver.tanaimport.domain.ConversionResult;
import com.dcruver.tanaimport.domain.Document;
import com.dcruver.tanaimport.io.VaultWriter.WriteSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Spring Shell commands for importing Tana exports.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class ImportShellCommands {

    private final ImportService importService;
    private final ImporterProperties properties;

    @ShellMethod(key = {"import", "import-tana"}, value = "Convert Tana JSON exports and write Markdown documents")
    public String importTana(
            @ShellOption(help = "Export files (.json), comma separated") String files,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Output directory") String output,
            @ShellOption(defaultValue = "false", help = "Also write an import report") boolean report) {
        List<Path> exports = toPaths(files);
        if (exports.isEmpty()) {
            return "Please pick at least one file to import.";
        }
        Path outputDir = Path.of(output != null ? output : properties.getOutputPath()).toAbsolutePath().normalize();
        log.info("Importing {} file(s) into {}", exports.size(), outputDir);

        try {
            ImportService.ImportOutcome outcome =
                importService.importFiles(exports, outputDir, report || properties.isWriteReport());
            ConversionResult result = outcome.getResult();
            if (result.isFatal()) {
                return "Import failed: " + result.getFatalError();
            }

            WriteSummary summary = outcome.getWriteSummary();
            StringBuilder sb = new StringBuilder();
            sb.append("Import completed.\n\n");
            sb.append(String.format("- Documents written: %d\n", summary.getWritten().size()));
            sb.append(String.format("- Write failures: %d\n", summary.getFailed().size()));
            sb.append(String.format("- Nodes converted: %d\n", result.getConvertedCount()));
            sb.append(String.format("- Unconverted nodes: %d\n", result.getOrphanIds().size()));
            for (String failed : summary.getFailed()) {
                sb.append("  failed: ").append(failed).append("\n");
            }
            summary.getRenamed().forEach((filename, path) ->
                sb.append("  renamed: ").append(filename).append(" -> ").append(path.getFileName()).append("\n"));
            if (outcome.getReportPath() != null) {
                sb.append("\nReport: ").append(outcome.getReportPath()).append("\n");
            }
            appendNotices(sb, result);
            return sb.toString();

        } catch (Exception e) {
            log.error("Import failed", e);
            return "Import failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "preview", value = "Convert Tana JSON exports without writing anything")
    public String preview(@ShellOption(help = "Export files (.json), comma separated") String files) {
        try {
            ConversionResult result = importService.preview(toPaths(files));
            if (result.isFatal()) {
                return "Preview failed: " + result.getFatalError();
            }

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%d documents:\n", result.getDocuments().size()));
            for (Document document : result.getDocuments()) {
                sb.append("- ").append(document.getFilename()).append("\n");
            }
            appendNotices(sb, result);
            return sb.toString();

        } catch (Exception e) {
            log.error("Preview failed", e);
            return "Preview failed: " + e.getMessage();
        }
    }

    private static void appendNotices(StringBuilder sb, ConversionResult result) {
        if (result.getNotices().isEmpty()) {
            return;
        }
        sb.append("\nNotices:\n");
        for (String notice : result.getNotices()) {
            sb.append("- ").append(notice).append("\n");
        }
    }

    private static List<Path> toPaths(String files) {
        return Arrays.stream(files.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .map(Path::of)
            .toList();
    }
}
