package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.ConversionResult;
import com.dcruver.tanaimport.domain.Document;
import com.dcruver.tanaimport.domain.GraphExport;
import com.dcruver.tanaimport.domain.GraphNode;
import com.dcruver.tanaimport.domain.NodeStore;
import com.dcruver.tanaimport.domain.Notices;
import com.dcruver.tanaimport.domain.TopLevelEntry;
import com.dcruver.tanaimport.io.GraphExportReader;
import com.dcruver.tanaimport.io.GraphFormatException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one or more Tana exports into Markdown documents.
 *
 * Pipeline: node store, anchor prepass, structural classification, rendering of every
 * top-level node, orphan diagnostics. A converter holds no state between calls;
 * everything is built per run and discarded.
 */
@Slf4j
public class GraphConverter {

    public static final String DEFAULT_ROOT_NAME_PREFIX = "Root node for";
    public static final int DEFAULT_ORPHAN_REPORT_LIMIT = 50;
    public static final String DEFAULT_FILE_EXTENSION = ".md";

    private final GraphExportReader reader;
    private final String rootNamePrefix;
    private final int orphanReportLimit;
    private final String fileExtension;

    public GraphConverter() {
        this(new GraphExportReader(), DEFAULT_ROOT_NAME_PREFIX, DEFAULT_ORPHAN_REPORT_LIMIT, DEFAULT_FILE_EXTENSION);
    }

    public GraphConverter(GraphExportReader reader, String rootNamePrefix, int orphanReportLimit,
                          String fileExtension) {
        this.reader = reader;
        this.rootNamePrefix = rootNamePrefix;
        this.orphanReportLimit = orphanReportLimit;
        this.fileExtension = fileExtension;
    }

    public ConversionResult convert(String data) {
        return convert(List.of(data));
    }

    /**
     * Convert all blobs as one graph. A parse failure or a missing root node is fatal
     * and yields no documents; every other anomaly becomes a notice.
     */
    public ConversionResult convert(List<String> blobs) {
        Notices notices = new Notices();

        List<GraphExport> exports = new ArrayList<>(blobs.size());
        try {
            for (String blob : blobs) {
                GraphExport export = reader.parse(blob);
                log.debug("Parsed export with format version {} and {} nodes",
                    export.getFormatVersion(), export.getNodes().size());
                exports.add(export);
            }
        } catch (GraphFormatException e) {
            log.error("Failed to parse export", e);
            return ConversionResult.fatal(e.getMessage(), notices.asList());
        }

        NodeStore store = NodeStore.of(exports, notices);
        List<GraphNode> roots = StructuralClassifier.findRoots(store, rootNamePrefix);
        if (roots.isEmpty()) {
            log.warn("No node named '{}...' in export", rootNamePrefix);
            return ConversionResult.fatal("Root node not found", notices.asList());
        }

        ConversionState state = new ConversionState(store, notices);
        new AnchorPrepass(state).run(roots);

        StructuralClassifier classifier = new StructuralClassifier(state);
        roots.forEach(classifier::classify);

        LinkResolver linkResolver = new LinkResolver(state);
        OutlineRenderer renderer = new OutlineRenderer(state, linkResolver, fileExtension);
        List<Document> documents = new ArrayList<>();
        for (TopLevelEntry entry : List.copyOf(state.topLevelEntries())) {
            documents.add(renderer.render(entry));
        }
        if (linkResolver.getUnresolvedCount() > 0) {
            notices.add("Could not resolve " + linkResolver.getUnresolvedCount() + " links");
        }

        List<String> orphans = new ReachabilityDiagnostics(state, orphanReportLimit).reportOrphans(roots);
        log.info("Converted {} of {} nodes into {} documents", state.convertedCount(), store.size(), documents.size());

        return ConversionResult.builder()
            .documents(List.copyOf(documents))
            .notices(notices.asList())
            .orphanIds(List.copyOf(orphans))
            .convertedCount(state.convertedCount())
            .build();
    }
}
