package org.tempo.smt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generators for common symmetric topologies. Nodes are named like
 * spreadsheet columns: A, B, ..., Z, AA, AB, ...
 */
public class Topologies {

    private Topologies() {}

    static String nodeName(int i) {
        // i is 1-based
        StringBuilder sb = new StringBuilder();
        int n = i;
        while (n > 0) {
            n--;
            sb.insert(0, (char) ('A' + n % 26));
            n = n / 26;
        }
        return sb.toString();
    }

    private static Map<String, List<String>> emptyNodes(int numNodes) {
        Map<String, List<String>> neighbors = new LinkedHashMap<>();
        for (int i = 1; i <= numNodes; i++) {
            neighbors.put(nodeName(i), new ArrayList<>());
        }
        return neighbors;
    }

    /**
     * A path A - B - C - ... with edges in both directions.
     */
    public static Topology path(int numNodes) {
        Map<String, List<String>> neighbors = emptyNodes(numNodes);
        List<String> nodes = new ArrayList<>(neighbors.keySet());
        for (int i = 1; i < numNodes; i++) {
            neighbors.get(nodes.get(i - 1)).add(nodes.get(i));
            neighbors.get(nodes.get(i)).add(nodes.get(i - 1));
        }
        return new Topology(neighbors);
    }

    /**
     * Every node is a predecessor of every other node.
     */
    public static Topology complete(int numNodes) {
        Map<String, List<String>> neighbors = emptyNodes(numNodes);
        neighbors.forEach((node, preds) -> {
            for (String other : neighbors.keySet()) {
                if (!other.equals(node)) {
                    preds.add(other);
                }
            }
        });
        return new Topology(neighbors);
    }

    /**
     * A hub A connected in both directions to every other node.
     */
    public static Topology star(int numNodes) {
        Map<String, List<String>> neighbors = emptyNodes(numNodes);
        List<String> nodes = new ArrayList<>(neighbors.keySet());
        for (int i = 1; i < numNodes; i++) {
            neighbors.get(nodes.get(0)).add(nodes.get(i));
            neighbors.get(nodes.get(i)).add(nodes.get(0));
        }
        return new Topology(neighbors);
    }

}
