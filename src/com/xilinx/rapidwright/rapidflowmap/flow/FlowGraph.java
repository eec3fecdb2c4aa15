package com.xilinx.rapidwright.rapidflowmap.flow;

import java.util.ArrayList;
import java.util.List;

/**
 * Directed residual network over vertices {@code 0..n-1} stored as adjacency lists.
 */
public class FlowGraph {
    public static final long INF_CAPACITY = Long.MAX_VALUE / 4;

    private final int vertexNum;
    private final List<List<FlowEdge>> adj;

    public FlowGraph(int vertexNum) {
        this.vertexNum = vertexNum;
        this.adj = new ArrayList<>(vertexNum);
        for (int i = 0; i < vertexNum; i++) {
            adj.add(new ArrayList<>());
        }
    }

    public int size() {
        return vertexNum;
    }

    public List<FlowEdge> adj(int u) {
        return adj.get(u);
    }

    public void addEdge(int u, int v, long cap) {
        assert u != v;
        FlowEdge fwd = new FlowEdge(v, adj.get(v).size(), cap, cap);
        FlowEdge rev = new FlowEdge(u, adj.get(u).size(), 0L, 0L);
        adj.get(u).add(fwd);
        adj.get(v).add(rev);
    }

    public FlowEdge reverseOf(FlowEdge edge) {
        return adj.get(edge.to).get(edge.rev);
    }

    public int getEdgeNum() {
        int edgeNum = 0;
        for (List<FlowEdge> edges : adj) {
            for (FlowEdge edge : edges) {
                if (edge.origCap > 0) {
                    edgeNum++;
                }
            }
        }
        return edgeNum;
    }
}
