package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.xilinx.rapidwright.rapidflowmap.InfeasibleMappingException;
import com.xilinx.rapidwright.rapidflowmap.InvalidParameterException;
import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.network.NetworkBuilder;
import com.xilinx.rapidwright.rapidflowmap.network.NetworkGenerator;
import com.xilinx.rapidwright.rapidflowmap.network.RandomNetworkFactory;
import com.xilinx.rapidwright.rapidflowmap.utils.HierarchicalLogger;

public class TestLabelingEngine {
    private static final HierarchicalLogger logger = HierarchicalLogger.createPseduoLogger("TestLabelingEngine");

    // true if every path from a primary input to root passes through leaves
    static boolean separates(Network network, int root, Set<Integer> leaves) {
        Deque<Integer> stack = new ArrayDeque<>();
        Set<Integer> visited = new HashSet<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            int nodeId = stack.pop();
            if (!visited.add(nodeId)) continue;
            if (nodeId != root && leaves.contains(nodeId)) continue;
            if (network.getNode(nodeId).isPrimaryInput()) return false;
            for (int faninId : network.getFanins(nodeId)) {
                stack.push(faninId);
            }
        }
        return true;
    }

    // minimum LUT depth of every node by trying every node set of size <= K in its fan-in cone
    static int[] bruteForceLabels(Network network, int lutSize) {
        int[] labels = new int[network.getNodeNum()];
        for (int nodeId : network.getTopologicalOrder()) {
            if (!network.getNode(nodeId).isGate()) {
                if (network.getNode(nodeId).isPrimaryOutput()) {
                    labels[nodeId] = labels[network.getOutputDriver()];
                }
                continue;
            }
            List<Integer> candidates = new ArrayList<>(network.getTransitiveFanin(nodeId));
            candidates.remove(Integer.valueOf(nodeId));

            int[] best = {Integer.MAX_VALUE};
            searchSubsets(network, nodeId, candidates, 0, new ArrayList<>(), lutSize, labels, best);
            labels[nodeId] = best[0];
        }
        return labels;
    }

    private static void searchSubsets(Network network, int root, List<Integer> candidates, int start, List<Integer> chosen,
                                      int lutSize, int[] labels, int[] best) {
        if (!chosen.isEmpty()) {
            int maxLabel = 0;
            for (int leaf : chosen) {
                maxLabel = Math.max(maxLabel, labels[leaf]);
            }
            if (maxLabel + 1 < best[0] && separates(network, root, new HashSet<>(chosen))) {
                best[0] = maxLabel + 1;
            }
        }
        if (chosen.size() == lutSize) return;
        for (int i = start; i < candidates.size(); i++) {
            chosen.add(candidates.get(i));
            searchSubsets(network, root, candidates, i + 1, chosen, lutSize, labels, best);
            chosen.remove(chosen.size() - 1);
        }
    }

    @ParameterizedTest
    @CsvSource({
        "1, 3, 6, 2", "2, 4, 8, 2", "3, 4, 8, 3", "4, 3, 9, 3", "5, 5, 7, 3",
        "6, 4, 9, 4", "7, 5, 8, 4", "8, 3, 10, 2", "9, 4, 10, 3", "10, 5, 9, 4"
    })
    public void testLabelsMatchBruteForce(long seed, int inputNum, int gateNum, int lutSize) {
        Network network = RandomNetworkFactory.build(seed, inputNum, gateNum);
        MappingState state = new LabelingEngine(logger, lutSize, 1).run(network);
        int[] expected = bruteForceLabels(network, lutSize);

        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            Assertions.assertEquals(expected[nodeId], state.getLabel(nodeId),
                "label of " + network.getNode(nodeId).getName());
        }
        Assertions.assertEquals(expected[network.getPrimaryOutput()], state.getDepth());
    }

    @ParameterizedTest
    @CsvSource({"11, 4, 12, 3", "12, 6, 14, 4", "13, 5, 12, 5"})
    public void testCutsAreFeasible(long seed, int inputNum, int gateNum, int lutSize) {
        Network network = RandomNetworkFactory.build(seed, inputNum, gateNum);
        MappingState state = new LabelingEngine(logger, lutSize, 1).run(network);

        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            if (!network.getNode(nodeId).isGate()) continue;
            Cut cut = state.getCut(nodeId);
            Assertions.assertEquals(nodeId, cut.getRoot());
            Assertions.assertTrue(cut.size() <= lutSize);
            Assertions.assertFalse(cut.contains(nodeId));
            Assertions.assertTrue(separates(network, nodeId, new HashSet<>(cut.getLeaves())));
            Assertions.assertEquals(state.getLabel(nodeId), state.getCutDepth(cut));
        }
    }

    @Test
    public void testMuxLabels() {
        Network network = NetworkGenerator.buildMux(4);
        MappingState state = new LabelingEngine(logger, 3, 1).run(network);

        Assertions.assertEquals(0, state.getLabel(network.getNodeId("S0")));
        for (int i = 0; i < 4; i++) {
            int andId = network.getNodeId("and" + i);
            Assertions.assertEquals(1, state.getLabel(andId));
            Assertions.assertEquals(List.of(network.getNodeId("D" + i), network.getNodeId("S0"), network.getNodeId("S1")),
                state.getCut(andId).getLeaves());
        }
        Assertions.assertEquals(2, state.getLabel(network.getNodeId("or1")));
        Assertions.assertEquals(2, state.getLabel(network.getNodeId("or2")));
        Assertions.assertEquals(3, state.getLabel(network.getNodeId("or3")));
        Assertions.assertEquals(3, state.getDepth());
    }

    @Test
    public void testParallelMatchesSequential() {
        Network network = RandomNetworkFactory.build(42, 6, 40);
        MappingState sequential = new LabelingEngine(logger, 4, 1).run(network);
        MappingState parallel = new LabelingEngine(logger, 4, 4).run(network);
        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            Assertions.assertEquals(sequential.getLabel(nodeId), parallel.getLabel(nodeId));
            Assertions.assertEquals(sequential.getCut(nodeId), parallel.getCut(nodeId));
        }
    }

    @Test
    public void testSameNetworkMappedTwice() {
        Network network = NetworkGenerator.buildMux(4);
        MappingState k3 = new LabelingEngine(logger, 3, 1).run(network);
        MappingState k6 = new LabelingEngine(logger, 6, 1).run(network);
        Assertions.assertEquals(3, k3.getDepth());
        Assertions.assertEquals(1, k6.getDepth());
    }

    @Test
    public void testLabelIsWrittenOnce() {
        Network network = NetworkGenerator.buildMux(2);
        LabelingEngine engine = new LabelingEngine(logger, 3, 1);
        MappingState state = engine.run(network);
        Assertions.assertThrows(IllegalStateException.class, () -> engine.labelNode(state, network.getOutputDriver()));
    }

    @Test
    public void testInvalidParameters() {
        Assertions.assertThrows(InvalidParameterException.class, () -> new LabelingEngine(logger, 0, 1));
        Assertions.assertThrows(InvalidParameterException.class, () -> new LabelingEngine(logger, -2, 1));
        Assertions.assertThrows(InvalidParameterException.class, () -> new LabelingEngine(logger, 4, 0));
    }

    @Test
    public void testSingleInputLuts() {
        Network andNetwork = new NetworkBuilder("and2")
            .addPrimaryInput("A")
            .addPrimaryInput("B")
            .addGate("g", "AND", "A", "B")
            .setPrimaryOutput("Y", "g")
            .build();
        Assertions.assertThrows(InfeasibleMappingException.class, () -> new LabelingEngine(logger, 1, 1).run(andNetwork));
        Assertions.assertThrows(InfeasibleMappingException.class, () -> new LabelingEngine(logger, 1, 2).run(andNetwork));

        // a chain of inverters only ever needs one input per LUT
        Network chain = new NetworkBuilder("chain")
            .addPrimaryInput("A")
            .addGate("n1", "NOT", "A", "A")
            .addGate("n2", "NOT", "n1", "n1")
            .addGate("n3", "NOT", "n2", "n2")
            .setPrimaryOutput("Y", "n3")
            .build();
        MappingState state = new LabelingEngine(logger, 1, 1).run(chain);
        Assertions.assertEquals(1, state.getDepth());
    }
}
