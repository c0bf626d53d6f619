package com.dynop.fairway.integrate;

import com.dynop.fairway.table.Identifiers;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Manual corrections applied when merging the primary network.
 *
 * <p>Some primary nodes and edges extend across the border where the secondary network
 * represents the fairway better; they are listed here and left out of the merged graph.
 * Edges touching an excluded node are left out as well.
 *
 * <ul>
 *   <li>{@code prunedNodeIds} - primary node ids (un-namespaced)</li>
 *   <li>{@code prunedEdgeIds} - values of the primary edge {@code Id} attribute</li>
 * </ul>
 */
public final class MergeExclusions {

    private final Set<String> prunedNodeIds;
    private final Set<String> prunedEdgeIds;

    @JsonCreator
    public MergeExclusions(
            @JsonProperty("prunedNodeIds") Collection<String> prunedNodeIds,
            @JsonProperty("prunedEdgeIds") Collection<String> prunedEdgeIds) {
        this.prunedNodeIds = normalize(prunedNodeIds);
        this.prunedEdgeIds = normalize(prunedEdgeIds);
    }

    /**
     * @return exclusions that exclude nothing
     */
    public static MergeExclusions none() {
        return new MergeExclusions(null, null);
    }

    /**
     * @param nodeId Primary node id
     * @return true if the node is left out of the merge
     */
    public boolean isNodeExcluded(String nodeId) {
        return prunedNodeIds.contains(nodeId);
    }

    /**
     * @param edgeId Value of the edge {@code Id} attribute, any type
     * @return true if the edge is left out of the merge
     */
    public boolean isEdgeExcluded(Object edgeId) {
        String id = Identifiers.normalize(edgeId);
        return id != null && prunedEdgeIds.contains(id);
    }

    public Set<String> getPrunedNodeIds() {
        return prunedNodeIds;
    }

    public Set<String> getPrunedEdgeIds() {
        return prunedEdgeIds;
    }

    public boolean hasExclusions() {
        return !prunedNodeIds.isEmpty() || !prunedEdgeIds.isEmpty();
    }

    private static Set<String> normalize(Collection<String> ids) {
        if (ids == null) {
            return Collections.emptySet();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String id : ids) {
            String value = Identifiers.normalize(id);
            if (value != null) {
                normalized.add(value);
            }
        }
        return Collections.unmodifiableSet(normalized);
    }

    @Override
    public String toString() {
        return String.format("MergeExclusions{prunedNodeIds=%s, prunedEdgeIds=%s}", prunedNodeIds, prunedEdgeIds);
    }
}
