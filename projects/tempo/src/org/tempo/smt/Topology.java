package org.tempo.smt;

import com.fasterxml.jackson.core.type.TypeReference;
import org.tempo.common.TempoException;
import org.tempo.common.util.TempoObjectMapper;

import java.io.IOException;
import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * <p>The network topology: each node is mapped to the ordered list of
 * its predecessors, the nodes whose routes it merges.</p>
 *
 * <p>A topology cannot be changed once it is built.</p>
 */
public class Topology {

    private final Map<String, List<String>> _neighbors;

    private final List<String> _nodes;

    private final List<Edge> _edges;

    public Topology(Map<String, List<String>> neighbors) {
        if (neighbors == null) {
            throw new TempoException("Expected a non-null predecessor mapping");
        }
        _neighbors = new LinkedHashMap<>();
        _nodes = Collections.unmodifiableList(new ArrayList<>(neighbors.keySet()));
        List<Edge> edges = new ArrayList<>();

        neighbors.forEach((node, preds) -> {
            if (node == null) {
                throw new TempoException("Topology declares a null node");
            }
            List<String> copy = new ArrayList<>();
            if (preds != null) {
                for (String pred : preds) {
                    if (!neighbors.containsKey(pred)) {
                        throw new TempoException("Node \"" + node + "\" has undeclared predecessor \""
                                + pred + "\"");
                    }
                    if (copy.contains(pred)) {
                        throw new TempoException("Node \"" + node + "\" lists predecessor \""
                                + pred + "\" more than once");
                    }
                    copy.add(pred);
                    edges.add(new Edge(pred, node));
                }
            }
            _neighbors.put(node, Collections.unmodifiableList(copy));
        });

        _edges = Collections.unmodifiableList(edges);
    }

    /**
     * Build a topology from a JSON object mapping every node to an array
     * of its predecessors.
     */
    public static Topology fromJson(String json) {
        Map<String, List<String>> neighbors;
        try {
            neighbors = new TempoObjectMapper().readValue(json,
                    new TypeReference<LinkedHashMap<String, List<String>>>() {});
        } catch (IOException e) {
            throw new TempoException("Could not parse topology JSON", e);
        }
        return new Topology(neighbors);
    }

    public boolean hasNode(String node) {
        return _neighbors.containsKey(node);
    }

    /**
     * Return the predecessors of the given node.
     */
    public List<String> getNeighbors(String node) {
        List<String> preds = _neighbors.get(node);
        if (preds == null) {
            throw new TempoException("Unknown node \"" + node + "\"");
        }
        return preds;
    }

    public List<String> getNodes() {
        return _nodes;
    }

    public List<Edge> getEdges() {
        return _edges;
    }

    public int getNodeCount() {
        return _nodes.size();
    }

    public int getEdgeCount() {
        return _edges.size();
    }

    public <T> Map<String, T> mapNodes(Function<String, T> f) {
        Map<String, T> result = new LinkedHashMap<>();
        for (String node : _nodes) {
            result.put(node, f.apply(node));
        }
        return result;
    }

    public <A> A foldNodes(A initial, BiFunction<A, String, A> f) {
        A acc = initial;
        for (String node : _nodes) {
            acc = f.apply(acc, node);
        }
        return acc;
    }

    public <T> Map<Edge, T> mapEdges(Function<Edge, T> f) {
        Map<Edge, T> result = new LinkedHashMap<>();
        for (Edge edge : _edges) {
            result.put(edge, f.apply(edge));
        }
        return result;
    }

    public <A> A foldEdges(A initial, BiFunction<A, Edge, A> f) {
        A acc = initial;
        for (Edge edge : _edges) {
            acc = f.apply(acc, edge);
        }
        return acc;
    }

    public List<Edge> filterEdges(Predicate<Edge> p) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : _edges) {
            if (p.test(edge)) {
                result.add(edge);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("=======================================================\n");
        sb.append("Predecessors\n");
        sb.append("=======================================================\n");
        _neighbors.forEach((node, preds) -> {
            sb.append(node).append(" <-- ").append(preds).append("\n");
        });
        sb.append("=======================================================\n");
        return sb.toString();
    }

}
