package com.dcruver.tanaimport.app;

import com.dcruver.tanaimport.config.ImporterProperties;
import com.dcruver.tanaimport.convert.GraphConverter;
import com.dcruver.tanaimport.domain.ConversionResult;
import com.dcruver.tanaimport.io.GraphExportReader;
import com.dcruver.tanaimport.io.VaultWriter;
import com.dcruver.tanaimport.io.VaultWriter.WriteSummary;
import com.dcruver.tanaimport.reporting.ImportReportGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads export files, converts them as one graph and writes the resulting documents.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImportService {

    private final ImporterProperties properties;
    private final VaultWriter vaultWriter;
    private final ImportReportGenerator reportGenerator;
    private final ObjectMapper objectMapper;

    /**
     * Convert without writing anything.
     */
    public ConversionResult preview(List<Path> files) throws IOException {
        return newConverter().convert(readAll(files));
    }

    /**
     * Convert and write. Nothing is written when the conversion reports a fatal error.
     */
    public ImportOutcome importFiles(List<Path> files, Path outputDir, boolean writeReport) throws IOException {
        ConversionResult result = newConverter().convert(readAll(files));
        if (result.isFatal()) {
            log.error("Import aborted: {}", result.getFatalError());
            return ImportOutcome.builder().result(result).build();
        }

        WriteSummary summary = vaultWriter.writeAll(result.getDocuments(), outputDir);
        Path reportPath = null;
        if (writeReport) {
            reportPath = reportGenerator.generateReport(result, summary, outputDir);
        }
        return ImportOutcome.builder()
            .result(result)
            .writeSummary(summary)
            .reportPath(reportPath)
            .build();
    }

    private GraphConverter newConverter() {
        return new GraphConverter(
            new GraphExportReader(objectMapper),
            properties.getRootNamePrefix(),
            properties.getOrphanReportLimit(),
            properties.getFileExtension());
    }

    private List<String> readAll(List<Path> files) throws IOException {
        List<String> blobs = new ArrayList<>(files.size());
        for (Path file : files) {
            log.info("Reading export: {}", file);
            blobs.add(Files.readString(file, StandardCharsets.UTF_8));
        }
        return blobs;
    }

    /**
     * Result of an import; writeSummary is null when the conversion failed.
     */
    @Data
    @Builder
    public static class ImportOutcome {
        private final ConversionResult result;
        private final WriteSummary writeSummary;
        private final Path reportPath;
    }
}
