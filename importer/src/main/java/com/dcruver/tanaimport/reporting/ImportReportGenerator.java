package com.dcruver.tanaimport.reporting;

import com.dcruver.tanaimport.domain.ConversionResult;
import com.dcruver.tanaimport.domain.Document;
import com.dcruver.tanaimport.io.VaultWriter;
import com.dcruver.tanaimport.io.VaultWriter.WriteSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Generates a Markdown report of an import run.
 */
@Component
@Slf4j
public class ImportReportGenerator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final VaultWriter vaultWriter;
    private final Clock clock;

    @Autowired
    public ImportReportGenerator(VaultWriter vaultWriter) {
        this(vaultWriter, Clock.systemDefaultZone());
    }

    ImportReportGenerator(VaultWriter vaultWriter, Clock clock) {
        this.vaultWriter = vaultWriter;
        this.clock = clock;
    }

    /**
     * Generate and save the report next to the imported documents.
     * An existing file of the same name is left alone.
     */
    public Path generateReport(ConversionResult result, WriteSummary summary, Path outputDir) throws IOException {
        String date = LocalDate.now(clock).format(DATE_FORMAT);
        Document report = new Document(String.format("Import report %s.md", date), buildReport(result, summary, date));

        Path reportPath = vaultWriter.write(report, outputDir);
        log.info("Generated import report: {}", reportPath);

        return reportPath;
    }

    /**
     * Build Markdown report content
     */
    public String buildReport(ConversionResult result, WriteSummary summary, String date) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Tana Import Report - ").append(date).append("\n\n");

        sb.append("## Summary\n\n");
        sb.append(String.format("- Documents: %d\n", result.getDocuments().size()));
        if (summary != null) {
            sb.append(String.format("- Written: %d\n", summary.getWritten().size()));
            sb.append(String.format("- Failed: %d\n", summary.getFailed().size()));
        }
        sb.append(String.format("- Nodes converted: %d\n", result.getConvertedCount()));
        sb.append(String.format("- Unconverted nodes: %d\n\n", result.getOrphanIds().size()));

        sb.append("## Notices\n\n");
        if (result.getNotices().isEmpty()) {
            sb.append("No notices.\n\n");
        } else {
            for (String notice : result.getNotices()) {
                sb.append("- ").append(notice).append("\n");
            }
            sb.append("\n");
        }

        if (summary != null && !summary.getRenamed().isEmpty()) {
            sb.append("## Renamed Documents\n\n");
            sb.append("These filenames were already taken. Links to them point at the existing file.\n\n");
            summary.getRenamed().forEach((filename, path) ->
                    sb.append("- ").append(filename).append(" -> ").append(path.getFileName()).append("\n"));
            sb.append("\n");
        }

        if (summary != null && !summary.getFailed().isEmpty()) {
            sb.append("## Failed Writes\n\n");
            for (String filename : summary.getFailed()) {
                sb.append("- ").append(filename).append("\n");
            }
            sb.append("\n");
        }

        sb.append("## Unconverted Node Ids\n\n");
        if (result.getOrphanIds().isEmpty()) {
            sb.append("Every node was converted.\n");
        } else {
            for (String id : result.getOrphanIds()) {
                sb.append("- ").append(id).append("\n");
            }
        }
        return sb.toString();
    }
}
