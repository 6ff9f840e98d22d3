package com.e2eq.atlas.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary counters of one traversal.
 *
 * @param nodesVisited           distinct entities marked visited, the start included
 * @param nodesReturned          nodes that passed the type and property filters
 * @param maxDepthReached        deepest level among returned nodes, 0 when none
 * @param relationshipsTraversed edges recorded in the result
 */
public record TraversalStatistics(int nodesVisited, int nodesReturned, int maxDepthReached, int relationshipsTraversed) {

    public static final TraversalStatistics EMPTY = new TraversalStatistics(0, 0, 0, 0);

    public Map<String, Integer> toMap() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("nodes_visited", nodesVisited);
        m.put("nodes_returned", nodesReturned);
        m.put("max_depth_reached", maxDepthReached);
        m.put("relationships_traversed", relationshipsTraversed);
        return m;
    }
}
