package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.xilinx.rapidwright.rapidflowmap.InvalidParameterException;
import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.network.Node;

/**
 * Bottom-up enumeration of set-minimal K-feasible cuts. The cuts of a gate are the unions of one
 * cut (or the trivial single-node cut) from each fan-in, and at most {@code maxCutsPerNode}
 * of them are kept, smallest first.
 */
public class CutEnumerator {
    private static final Comparator<Cut> cutOrder = Comparator.comparingInt(Cut::size).thenComparing(Cut::compareLeaves);

    private final int lutSize;
    private final int maxCutsPerNode;

    public CutEnumerator(int lutSize, int maxCutsPerNode) {
        if (lutSize < 1) {
            throw new InvalidParameterException("LUT size must be at least 1, got " + lutSize);
        }
        if (maxCutsPerNode < 1) {
            throw new InvalidParameterException("Cut limit per node must be at least 1, got " + maxCutsPerNode);
        }
        this.lutSize = lutSize;
        this.maxCutsPerNode = maxCutsPerNode;
    }

    /**
     * @return cuts indexed by node id; empty for primary inputs and the primary output
     */
    public List<List<Cut>> enumerate(Network network) {
        List<List<Cut>> node2Cuts = new ArrayList<>();
        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            node2Cuts.add(List.of());
        }

        for (int nodeId : network.getTopologicalOrder()) {
            Node node = network.getNode(nodeId);
            if (!node.isGate()) continue;

            List<Integer> fanins = node.getFanins();
            List<List<Integer>> leafSets0 = getLeafSetsOf(fanins.get(0), node2Cuts);
            List<List<Integer>> leafSets1 = getLeafSetsOf(fanins.get(1), node2Cuts);

            Set<List<Integer>> candidates = new LinkedHashSet<>();
            for (List<Integer> leaves0 : leafSets0) {
                for (List<Integer> leaves1 : leafSets1) {
                    List<Integer> merged = Cut.mergeLeaves(leaves0, leaves1);
                    if (merged.size() <= lutSize) {
                        candidates.add(merged);
                    }
                }
            }

            List<Cut> cuts = new ArrayList<>();
            for (List<Integer> leaves : candidates) {
                cuts.add(new Cut(nodeId, leaves));
            }
            cuts = removeDominatedCuts(cuts);
            cuts.sort(cutOrder);
            if (cuts.size() > maxCutsPerNode) {
                cuts = new ArrayList<>(cuts.subList(0, maxCutsPerNode));
            }
            node2Cuts.set(nodeId, cuts);
        }
        return node2Cuts;
    }

    private static List<List<Integer>> getLeafSetsOf(int nodeId, List<List<Cut>> node2Cuts) {
        List<List<Integer>> leafSets = new ArrayList<>();
        leafSets.add(List.of(nodeId));
        for (Cut cut : node2Cuts.get(nodeId)) {
            leafSets.add(cut.getLeaves());
        }
        return leafSets;
    }

    // drop every cut that is a strict superset of another one
    static List<Cut> removeDominatedCuts(List<Cut> cuts) {
        List<Cut> minimalCuts = new ArrayList<>();
        for (Cut cut : cuts) {
            boolean dominated = false;
            for (Cut other : cuts) {
                if (other != cut && other.size() < cut.size() && other.isSubsetOf(cut)) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated) {
                minimalCuts.add(cut);
            }
        }
        return minimalCuts;
    }
}
