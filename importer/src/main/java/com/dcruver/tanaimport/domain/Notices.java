package com.dcruver.tanaimport.domain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, human-readable notices collected during a run.
 */
public class Notices {

    private final List<String> messages = new ArrayList<>();
    private final Set<String> reported = new HashSet<>();

    public void add(String message) {
        messages.add(message);
    }

    /**
     * Add a notice unless one with the same text was already recorded.
     */
    public void addOnce(String message) {
        if (reported.add(message)) {
            messages.add(message);
        }
    }

    public List<String> asList() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }
}
