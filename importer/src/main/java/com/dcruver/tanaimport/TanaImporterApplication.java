package com.dcruver.tanaimport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Tana importer.
 *
 * Converts Tana JSON graph exports into a folder of Markdown documents with
 * wiki links, block anchors and property front matter.
 *
 * The conversion never modifies its input and never overwrites existing files.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class TanaImporterApplication {

    public static void main(String[] args) {
        log.info("Starting Tana Importer...");
        SpringApplication.run(TanaImporterApplication.class, args);
    }
}
