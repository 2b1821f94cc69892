package org.tempo.smt;


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Timing of a verification run, in milliseconds.
 */
public class VerificationStats {

    private static final String NUM_NODES_VAR = "numNodes";

    private static final String NUM_EDGES_VAR = "numEdges";

    private static final String TOTAL_TIME_VAR = "totalTime";

    private static final String MIN_TIME_VAR = "minTime";

    private static final String MAX_TIME_VAR = "maxTime";

    private static final String MEAN_TIME_VAR = "meanTime";

    private static final String MEDIAN_TIME_VAR = "medianTime";

    private int _numNodes;

    private int _numEdges;

    private long _totalTime;

    private long _minTime;

    private long _maxTime;

    private double _meanTime;

    private double _medianTime;

    @JsonCreator
    public VerificationStats(
            @JsonProperty(NUM_NODES_VAR) int n,
            @JsonProperty(NUM_EDGES_VAR) int e,
            @JsonProperty(TOTAL_TIME_VAR) long total,
            @JsonProperty(MIN_TIME_VAR) long min,
            @JsonProperty(MAX_TIME_VAR) long max,
            @JsonProperty(MEAN_TIME_VAR) double mean,
            @JsonProperty(MEDIAN_TIME_VAR) double median) {
        _numNodes = n;
        _numEdges = e;
        _totalTime = total;
        _minTime = min;
        _maxTime = max;
        _meanTime = mean;
        _medianTime = median;
    }

    /**
     * Summarize the times of individual checks.
     * @param n  The number of nodes
     * @param e  The number of edges
     * @param times  The time of every check; the total is their sum
     */
    public static VerificationStats fromTimes(int n, int e, List<Long> times) {
        if (times.isEmpty()) {
            return new VerificationStats(n, e, 0, 0, 0, 0.0, 0.0);
        }
        List<Long> sorted = new ArrayList<>(times);
        Collections.sort(sorted);
        long total = 0;
        for (long t : sorted) {
            total += t;
        }
        int size = sorted.size();
        double median;
        if (size % 2 == 1) {
            median = sorted.get(size / 2);
        } else {
            median = (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
        }
        return new VerificationStats(n, e, total, sorted.get(0), sorted.get(size - 1),
                (double) total / size, median);
    }

    @JsonProperty(NUM_NODES_VAR)
    public int getNumNodes() {
        return _numNodes;
    }

    @JsonProperty(NUM_EDGES_VAR)
    public int getNumEdges() {
        return _numEdges;
    }

    @JsonProperty(TOTAL_TIME_VAR)
    public long getTotalTime() {
        return _totalTime;
    }

    @JsonProperty(MIN_TIME_VAR)
    public long getMinTime() {
        return _minTime;
    }

    @JsonProperty(MAX_TIME_VAR)
    public long getMaxTime() {
        return _maxTime;
    }

    @JsonProperty(MEAN_TIME_VAR)
    public double getMeanTime() {
        return _meanTime;
    }

    @JsonProperty(MEDIAN_TIME_VAR)
    public double getMedianTime() {
        return _medianTime;
    }

    @Override
    public String toString() {
        return "nodes: " + _numNodes + ", edges: " + _numEdges + ", total: " + _totalTime
                + "ms, min: " + _minTime + "ms, max: " + _maxTime + "ms, mean: "
                + String.format(Locale.ROOT, "%.2f", _meanTime) + "ms, median: "
                + String.format(Locale.ROOT, "%.2f", _medianTime) + "ms";
    }
}
