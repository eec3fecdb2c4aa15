package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.xilinx.rapidwright.rapidflowmap.network.Network;

/**
 * Per-run labels and depth-optimal cuts of every node, stored as write-once cells indexed by node id.
 * Only the labeling pass writes them; every later pass reads.
 */
public class MappingState {
    private final Network network;
    private final int lutSize;
    private final List<WriteOnce<Integer>> node2Label;
    private final List<WriteOnce<Cut>> node2Cut;

    public MappingState(Network network, int lutSize) {
        this.network = network;
        this.lutSize = lutSize;
        node2Label = new ArrayList<>(network.getNodeNum());
        node2Cut = new ArrayList<>(network.getNodeNum());
        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            node2Label.add(new WriteOnce<>());
            node2Cut.add(new WriteOnce<>());
        }
    }

    public Network getNetwork() {
        return network;
    }

    public int getLutSize() {
        return lutSize;
    }

    public int getLabel(int nodeId) {
        return node2Label.get(nodeId).get();
    }

    public Cut getCut(int nodeId) {
        return node2Cut.get(nodeId).get();
    }

    void assign(int nodeId, int label, Cut cut) {
        assert cut.getRoot() == nodeId;
        node2Cut.get(nodeId).set(cut);
        node2Label.get(nodeId).set(label);
    }

    // minimum LUT depth of the whole network
    public int getDepth() {
        return getLabel(network.getPrimaryOutput());
    }

    // LUT level reached at the root when its LUT is bounded by this cut
    public int getCutDepth(Cut cut) {
        int maxLabel = 0;
        for (int leaf : cut.getLeaves()) {
            maxLabel = Math.max(maxLabel, getLabel(leaf));
        }
        return maxLabel + 1;
    }

    public Map<Integer, Integer> getLabelHistogram() {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            if (network.getNode(nodeId).isGate()) {
                histogram.merge(getLabel(nodeId), 1, Integer::sum);
            }
        }
        return histogram;
    }
}
