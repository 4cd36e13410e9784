package com.dcruver.tanaimport.domain;

import lombok.Value;

import java.util.List;

/**
 * Parsed content of one export file.
 */
@Value
public class GraphExport {
    Integer formatVersion;
    List<GraphNode> nodes;
}
