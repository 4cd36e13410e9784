package com.dcruver.tanaimport.config;

import com.dcruver.tanaimport.convert.GraphConverter;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the importer.
 */
@ConfigurationProperties(prefix = "importer")
@Data
public class ImporterProperties {
    private String rootNamePrefix = GraphConverter.DEFAULT_ROOT_NAME_PREFIX;
    private int orphanReportLimit = GraphConverter.DEFAULT_ORPHAN_REPORT_LIMIT;
    private String fileExtension = GraphConverter.DEFAULT_FILE_EXTENSION;
    private String outputPath = "./vault";
    private boolean writeReport = false;
}
