package com.dcruver.tanaimport.domain;

import lombok.Value;

/**
 * A rendered output file: name plus verbatim content.
 */
@Value
public class Document {
    String filename;
    String content;
}
