package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.network.Node;
import com.xilinx.rapidwright.rapidflowmap.utils.HierarchicalLogger;

/**
 * Covers the network with LUTs, walking from the primary output towards the inputs.
 * Each reached gate gets exactly one LUT bounded by its selected cut; shared leaves are
 * emitted once and referenced by every consumer.
 */
public class MappingEmitter {
    private final HierarchicalLogger logger;

    public MappingEmitter(HierarchicalLogger logger) {
        this.logger = logger;
    }

    // depth-optimal cover using the cuts found by labeling
    public MappedNetwork emit(MappingState state) {
        MappedNetwork mappedNetwork = emit(state, state::getCut);
        if (mappedNetwork.getDepth() != state.getDepth()) {
            throw new IllegalStateException(String.format("Mapped depth %d differs from the labeled depth %d",
                mappedNetwork.getDepth(), state.getDepth()));
        }
        return mappedNetwork;
    }

    public MappedNetwork emit(MappingState state, IntFunction<Cut> node2Cut) {
        Network network = state.getNetwork();
        int lutSize = state.getLutSize();

        List<WriteOnce<Boolean>> node2Mapped = new ArrayList<>(network.getNodeNum());
        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            node2Mapped.add(new WriteOnce<>());
        }

        Map<Integer, Cut> root2Cut = new HashMap<>();
        Deque<Integer> worklist = new ArrayDeque<>();
        worklist.push(network.getOutputDriver());

        while (!worklist.isEmpty()) {
            int nodeId = worklist.pop();
            Node node = network.getNode(nodeId);
            if (node.isPrimaryInput()) continue;
            if (!node2Mapped.get(nodeId).trySet(true)) continue;

            Cut cut = node2Cut.apply(nodeId);
            if (cut == null) {
                throw new IllegalStateException("No cut selected for node " + node.getName());
            }
            if (cut.size() > lutSize) {
                throw new IllegalStateException(String.format("Cut of %s has %d leaves, LUT size is %d",
                    node.getName(), cut.size(), lutSize));
            }
            root2Cut.put(nodeId, cut);

            for (int leaf : cut.getLeaves()) {
                if (!node2Mapped.get(leaf).isSet()) {
                    worklist.push(leaf);
                }
            }
        }

        List<Integer> roots = new ArrayList<>(root2Cut.keySet());
        roots.sort((n1, n2) -> Integer.compare(network.getTopoIndex(n1), network.getTopoIndex(n2)));

        int[] node2LutLevel = new int[network.getNodeNum()];
        List<LutCell> lutCells = new ArrayList<>();
        for (int root : roots) {
            Cut cut = root2Cut.get(root);
            int level = 0;
            for (int leaf : cut.getLeaves()) {
                level = Math.max(level, node2LutLevel[leaf]);
            }
            node2LutLevel[root] = level + 1;

            BitSet truthTable = TruthTableSynthesizer.synthesize(network, root, cut.getLeaves());
            lutCells.add(new LutCell(root, network.getNode(root).getName(), cut.getLeaves(), truthTable, level + 1));
        }

        MappedNetwork mappedNetwork = new MappedNetwork(network, lutSize, lutCells);
        if (mappedNetwork.getDepth() > state.getDepth()) {
            throw new IllegalStateException(String.format("Mapped depth %d exceeds the minimum depth %d",
                mappedNetwork.getDepth(), state.getDepth()));
        }
        logger.fine(String.format("Emitted %d LUTs with depth %d", mappedNetwork.getLutNum(), mappedNetwork.getDepth()));
        return mappedNetwork;
    }
}
