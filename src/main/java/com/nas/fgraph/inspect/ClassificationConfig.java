package com.nas.fgraph.inspect;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * POJO form of an allow-list file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ClassificationConfig {
    private List<Entry> entries = new ArrayList<>();
    private List<String> untouchable = new ArrayList<>();

    /** One allow-list row: which operation, on what key, in which category. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Entry {
        private String op, target, category;
    }
}
