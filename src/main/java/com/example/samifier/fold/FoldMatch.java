package com.example.samifier.fold;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One occurrence of a rule's pattern.
 */
@Value
@Builder
public class FoldMatch {
    String rule;

    String anchorId;

    /**
     * Resources the fold claims. A resource is claimed by at most one applied fold
     */
    @Singular("consumed")
    Set<String> consumedIds;

    /**
     * Resources that receive something (e.g. an event) without being claimed
     */
    @Singular("host")
    List<String> hostIds;

    /**
     * Rule specific facts computed while matching
     */
    @Singular
    Map<String, Object> attributes;

    /**
     * Consumed and host IDs together
     */
    public Set<String> group() {
        Set<String> group = new LinkedHashSet<>(consumedIds);
        group.addAll(hostIds);
        return group;
    }

    @SuppressWarnings("unchecked")
    public <T> T attribute(String name) {
        return (T) attributes.get(name);
    }
}
