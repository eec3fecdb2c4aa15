package com.xilinx.rapidwright.rapidflowmap.flow;

/**
 * Residual edge. Every edge added to a {@link FlowGraph} is stored together with a reverse edge
 * of zero capacity; {@code rev} is the index of that partner in the adjacency list of {@code to}.
 */
public class FlowEdge {
    public final int to;
    public final int rev;
    public final long origCap;
    public long cap; // residual capacity
    public long flow;

    public FlowEdge(int to, int rev, long cap, long origCap) {
        this.to = to;
        this.rev = rev;
        this.cap = cap;
        this.origCap = origCap;
        this.flow = 0L;
    }

    public boolean isSaturated() {
        return origCap > 0 && cap == 0;
    }
}
