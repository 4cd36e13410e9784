package com.dcruver.tanaimport.io;

import com.dcruver.tanaimport.domain.Document;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes converted documents into an output directory, verbatim.
 * Existing files are never overwritten.
 */
@Component
@Slf4j
public class VaultWriter {

    /**
     * Write every document; a failed write is logged and the rest still get written.
     */
    public WriteSummary writeAll(List<Document> documents, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);

        List<Path> written = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        Map<String, Path> renamed = new LinkedHashMap<>();
        for (Document document : documents) {
            try {
                Path target = write(document, outputDir);
                written.add(target);
                if (!target.getFileName().toString().equals(document.getFilename())) {
                    log.warn("{} already exists, wrote {} instead; links to it now resolve to the existing file",
                            document.getFilename(), target.getFileName());
                    renamed.put(document.getFilename(), target);
                }
            } catch (IOException e) {
                log.error("Error saving Markdown to file: {}", document.getFilename(), e);
                failed.add(document.getFilename());
            }
        }
        log.info("Wrote {} documents to {} ({} failed)", written.size(), outputDir, failed.size());
        return new WriteSummary(written, failed, renamed);
    }

    public Path write(Document document, Path outputDir) throws IOException {
        Path target = uniquePath(outputDir, document.getFilename());
        Files.writeString(target, document.getContent(), StandardCharsets.UTF_8);
        log.debug("Wrote document to: {}", target);
        return target;
    }

    /**
     * First free path of the form {@code name.ext}, {@code name 1.ext}, {@code name 2.ext}, ...
     */
    Path uniquePath(Path outputDir, String filename) {
        Path candidate = outputDir.resolve(filename);
        int dot = filename.lastIndexOf('.');
        String base = dot > 0 ? filename.substring(0, dot) : filename;
        String extension = dot > 0 ? filename.substring(dot) : "";
        for (int counter = 1; Files.exists(candidate); counter++) {
            candidate = outputDir.resolve(base + " " + counter + extension);
        }
        return candidate;
    }

    /**
     * Paths written, filenames that failed, and documents written under another name
     * because their filename was taken.
     */
    @Value
    public static class WriteSummary {
        List<Path> written;
        List<String> failed;
        Map<String, Path> renamed;
    }
}
