package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import com.xilinx.rapidwright.rapidflowmap.flow.FlowGraph;
import com.xilinx.rapidwright.rapidflowmap.flow.MaxFlowSolver;
import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.network.Node;

/**
 * Turns a saturated node-split flow network into the leaf set of a LUT.
 *
 * <p>Split node {@code i} owns vertices {@link #inVertex(int)} and {@link #outVertex(int)} joined by a
 * unit-capacity edge; a node is a cut leaf when that edge crosses the min-cut. Two min-cuts are
 * examined: the one closest to the source (largest LUT volume) and the one closest to the sink.
 * The cut with more reused leaves (primary inputs or multi-fanout nodes, which are LUT outputs
 * anyway) wins; ties keep the source-side cut.
 */
public class CutSelector {
    public static final int SOURCE_VERTEX = 0;
    public static final int SINK_VERTEX = 1;

    public static int inVertex(int splitIdx) {
        return 2 + 2 * splitIdx;
    }

    public static int outVertex(int splitIdx) {
        return 3 + 2 * splitIdx;
    }

    public static int getVertexNum(int splitNodeNum) {
        return 2 + 2 * splitNodeNum;
    }

    public Cut selectMinCut(Network network, int rootId, List<Integer> splitNodes, FlowGraph flowGraph) {
        boolean[] sourceSide = MaxFlowSolver.reachableFromSource(flowGraph, SOURCE_VERTEX);
        boolean[] sinkSide = MaxFlowSolver.reachingSink(flowGraph, SINK_VERTEX);

        List<Integer> nearSourceLeaves = new ArrayList<>();
        List<Integer> nearSinkLeaves = new ArrayList<>();
        for (int i = 0; i < splitNodes.size(); i++) {
            if (sourceSide[inVertex(i)] && !sourceSide[outVertex(i)]) {
                nearSourceLeaves.add(splitNodes.get(i));
            }
            if (!sinkSide[inVertex(i)] && sinkSide[outVertex(i)]) {
                nearSinkLeaves.add(splitNodes.get(i));
            }
        }
        assert nearSourceLeaves.size() == nearSinkLeaves.size();

        if (countReusedLeaves(network, nearSinkLeaves) > countReusedLeaves(network, nearSourceLeaves)) {
            return new Cut(rootId, nearSinkLeaves);
        }
        return new Cut(rootId, nearSourceLeaves);
    }

    // the trivial cut made of the distinct fan-ins of a gate
    public Cut selectFaninCut(Network network, int rootId) {
        return new Cut(rootId, new LinkedHashSet<>(network.getFanins(rootId)));
    }

    private static int countReusedLeaves(Network network, List<Integer> leaves) {
        int reusedNum = 0;
        for (int leaf : leaves) {
            Node node = network.getNode(leaf);
            if (node.isPrimaryInput() || node.getFanouts().size() > 1) {
                reusedNum++;
            }
        }
        return reusedNum;
    }
}
