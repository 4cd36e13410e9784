package com.dcruver.tanaimport.domain;

import lombok.Value;

/**
 * A node chosen to become its own document, with the title its file and links use.
 */
@Value
public class TopLevelEntry {
    GraphNode node;
    String title;
}
