package com.xilinx.rapidwright.rapidflowmap.flow;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Queue;

/**
 * Shortest-augmenting-path max-flow (Edmonds-Karp) on a {@link FlowGraph}.
 *
 * <p>Min-cut queries only need to know whether the flow exceeds a small bound,
 * so {@link #maxFlow(FlowGraph, int, int, long)} stops as soon as the flow is larger than {@code limit}.
 * The residual graph is updated in place, and the reachability helpers read the final residual state.
 */
public class MaxFlowSolver {

    public long maxFlow(FlowGraph g, int s, int t) {
        return maxFlow(g, s, t, FlowGraph.INF_CAPACITY);
    }

    /**
     * @return the maximum flow, or some value larger than {@code limit} if the maximum flow exceeds it
     */
    public long maxFlow(FlowGraph g, int s, int t, long limit) {
        if (s == t) return 0L;

        final int n = g.size();
        int[] prevNode = new int[n];
        int[] prevEdge = new int[n];
        long flow = 0L;

        while (flow <= limit) {
            Arrays.fill(prevNode, -1);
            prevNode[s] = s;

            Queue<Integer> q = new ArrayDeque<>();
            q.add(s);

            boolean reachedT = false;
            bfs:
            while (!q.isEmpty()) {
                int u = q.poll();
                for (int i = 0; i < g.adj(u).size(); i++) {
                    FlowEdge e = g.adj(u).get(i);
                    if (e.cap <= 0 || prevNode[e.to] != -1) continue;

                    prevNode[e.to] = u;
                    prevEdge[e.to] = i;
                    if (e.to == t) {
                        reachedT = true;
                        break bfs;
                    }
                    q.add(e.to);
                }
            }

            if (!reachedT) break;

            long bottleneck = FlowGraph.INF_CAPACITY;
            for (int v = t; v != s; v = prevNode[v]) {
                FlowEdge e = g.adj(prevNode[v]).get(prevEdge[v]);
                bottleneck = Math.min(bottleneck, e.cap);
            }

            for (int v = t; v != s; v = prevNode[v]) {
                FlowEdge e = g.adj(prevNode[v]).get(prevEdge[v]);
                FlowEdge rev = g.reverseOf(e);
                e.cap -= bottleneck;
                e.flow += bottleneck;
                rev.cap += bottleneck;
                rev.flow -= bottleneck;
            }

            flow += bottleneck;
        }

        return flow;
    }

    /**
     * Vertices reachable from {@code s} through edges with positive residual capacity.
     * They form the source side of the min-cut closest to the source.
     */
    public static boolean[] reachableFromSource(FlowGraph g, int s) {
        boolean[] visited = new boolean[g.size()];
        Queue<Integer> q = new ArrayDeque<>();
        visited[s] = true;
        q.add(s);

        while (!q.isEmpty()) {
            int u = q.poll();
            for (FlowEdge e : g.adj(u)) {
                if (e.cap > 0 && !visited[e.to]) {
                    visited[e.to] = true;
                    q.add(e.to);
                }
            }
        }
        return visited;
    }

    /**
     * Vertices that can still reach {@code t} through edges with positive residual capacity.
     * Their complement is the source side of the min-cut closest to the sink.
     */
    public static boolean[] reachingSink(FlowGraph g, int t) {
        boolean[] visited = new boolean[g.size()];
        Queue<Integer> q = new ArrayDeque<>();
        visited[t] = true;
        q.add(t);

        while (!q.isEmpty()) {
            int v = q.poll();
            for (FlowEdge e : g.adj(v)) {
                // e.to -> v has residual capacity iff the partner of e does
                if (!visited[e.to] && g.reverseOf(e).cap > 0) {
                    visited[e.to] = true;
                    q.add(e.to);
                }
            }
        }
        return visited;
    }
}
