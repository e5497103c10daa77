/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.search;

/**
 * Counters collected during one run of {@link BacktrackingSearch}.
 */
public class SearchStatistics {

    private int nNodes = 0;
    private int nFailures = 0;
    private int nSolutions = 0;
    private long nPrunings = 0;
    private boolean completed = false;
    private long timeMillis = 0;

    void incrNodes() {
        nNodes++;
    }

    void incrFailures() {
        nFailures++;
    }

    void incrSolutions() {
        nSolutions++;
    }

    void addPrunings(int n) {
        nPrunings += n;
    }

    void setCompleted() {
        completed = true;
    }

    void setTimeMillis(long timeMillis) {
        this.timeMillis = timeMillis;
    }

    /**
     * @return the number of assignments tried
     */
    public int numberOfNodes() {
        return nNodes;
    }

    /**
     * @return the number of propagation calls that reported a dead end
     */
    public int numberOfFailures() {
        return nFailures;
    }

    public int numberOfSolutions() {
        return nSolutions;
    }

    /**
     * @return the total number of values pruned by the propagator
     */
    public long numberOfPrunings() {
        return nPrunings;
    }

    /**
     * @return true if the whole search tree was explored
     */
    public boolean isCompleted() {
        return completed;
    }

    public long timeMillis() {
        return timeMillis;
    }

    @Override
    public String toString() {
        return "\n\t#choice: " + nNodes +
                "\n\t#fail: " + nFailures +
                "\n\t#sols : " + nSolutions +
                "\n\t#pruned: " + nPrunings +
                "\n\tcompleted : " + completed +
                "\n\ttime (ms): " + timeMillis + "\n";
    }
}
