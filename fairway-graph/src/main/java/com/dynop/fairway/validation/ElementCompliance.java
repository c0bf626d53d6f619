package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema findings for one element type (nodes or edges).
 */
public final class ElementCompliance {

    private final List<String> nonStandardAttributes;
    private final Map<String, Integer> attributeCounts;
    private final Map<String, Integer> missingCounts;
    private final List<String> expectedAttributes;
    private final Map<String, String> attributeDocs;

    @JsonCreator
    public ElementCompliance(
            @JsonProperty("non_standard_attributes_detected") List<String> nonStandardAttributes,
            @JsonProperty("attribute_counts") Map<String, Integer> attributeCounts,
            @JsonProperty("missing_counts") Map<String, Integer> missingCounts,
            @JsonProperty("expected_attributes") List<String> expectedAttributes,
            @JsonProperty("attribute_docs") Map<String, String> attributeDocs) {
        this.nonStandardAttributes = List.copyOf(nonStandardAttributes);
        this.attributeCounts = Collections.unmodifiableMap(new LinkedHashMap<>(attributeCounts));
        this.missingCounts = Collections.unmodifiableMap(new LinkedHashMap<>(missingCounts));
        this.expectedAttributes = List.copyOf(expectedAttributes);
        this.attributeDocs = Collections.unmodifiableMap(new LinkedHashMap<>(attributeDocs));
    }

    /**
     * @return Unmapped, non-canonical keys that look like legacy names (contain an uppercase letter)
     */
    @JsonProperty("non_standard_attributes_detected")
    public List<String> getNonStandardAttributes() {
        return nonStandardAttributes;
    }

    /**
     * @return Occurrences per non-standard key
     */
    @JsonProperty("attribute_counts")
    public Map<String, Integer> getAttributeCounts() {
        return attributeCounts;
    }

    /**
     * @return Elements lacking each canonical attribute (absent, null or empty string)
     */
    @JsonProperty("missing_counts")
    public Map<String, Integer> getMissingCounts() {
        return missingCounts;
    }

    @JsonProperty("expected_attributes")
    public List<String> getExpectedAttributes() {
        return expectedAttributes;
    }

    @JsonProperty("attribute_docs")
    public Map<String, String> getAttributeDocs() {
        return attributeDocs;
    }
}
