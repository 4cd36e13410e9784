package com.dcruver.tanaimport.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one conversion run.
 * When fatalError is set the document list is empty and nothing should be written.
 */
@Value
@Builder
public class ConversionResult {
    List<Document> documents;
    List<String> notices;
    List<String> orphanIds;
    int convertedCount;
    String fatalError;

    public static ConversionResult fatal(String error, List<String> notices) {
        return ConversionResult.builder()
            .documents(List.of())
            .notices(List.copyOf(notices))
            .orphanIds(List.of())
            .fatalError(error)
            .build();
    }

    public boolean isFatal() {
        return fatalError != null;
    }
}
