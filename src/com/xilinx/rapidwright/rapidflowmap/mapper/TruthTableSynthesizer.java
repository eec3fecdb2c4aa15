package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.rapidwright.rapidflowmap.network.GateFunction;
import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.network.Node;

public class TruthTableSynthesizer {

    /**
     * Evaluates the sub-network bounded by {@code leaves} for every leaf assignment.
     * @throws IllegalStateException if the leaves do not separate the root from the primary inputs
     */
    public static BitSet synthesize(Network network, int rootId, List<Integer> leaves) {
        Map<Integer, Integer> node2Local = new HashMap<>();
        for (int i = 0; i < leaves.size(); i++) {
            node2Local.put(leaves.get(i), i);
        }

        // collect the gates strictly inside the cut
        List<Integer> innerNodes = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(rootId);
        node2Local.put(rootId, -1);
        while (!stack.isEmpty()) {
            int nodeId = stack.pop();
            Node node = network.getNode(nodeId);
            if (!node.isGate()) {
                throw new IllegalStateException(String.format("Cut %s of %s does not separate it from %s",
                    leaves, network.getNode(rootId).getName(), node.getName()));
            }
            innerNodes.add(nodeId);
            for (int faninId : node.getFanins()) {
                if (!node2Local.containsKey(faninId)) {
                    node2Local.put(faninId, -1);
                    stack.push(faninId);
                }
            }
        }
        innerNodes.sort((n1, n2) -> Integer.compare(network.getTopoIndex(n1), network.getTopoIndex(n2)));
        for (int i = 0; i < innerNodes.size(); i++) {
            node2Local.put(innerNodes.get(i), leaves.size() + i);
        }

        int[][] innerFanins = new int[innerNodes.size()][2];
        int[] innerTruthTables = new int[innerNodes.size()];
        for (int i = 0; i < innerNodes.size(); i++) {
            Node node = network.getNode(innerNodes.get(i));
            innerFanins[i][0] = node2Local.get(node.getFanins().get(0));
            innerFanins[i][1] = node2Local.get(node.getFanins().get(1));
            innerTruthTables[i] = node.getTruthTable();
        }

        int rootLocal = node2Local.get(rootId);
        boolean[] values = new boolean[leaves.size() + innerNodes.size()];
        BitSet truthTable = new BitSet(1 << leaves.size());
        for (int minterm = 0; minterm < (1 << leaves.size()); minterm++) {
            for (int i = 0; i < leaves.size(); i++) {
                values[i] = ((minterm >> i) & 1) == 1;
            }
            for (int i = 0; i < innerNodes.size(); i++) {
                values[leaves.size() + i] = GateFunction.evaluate(innerTruthTables[i],
                    values[innerFanins[i][0]], values[innerFanins[i][1]]);
            }
            truthTable.set(minterm, values[rootLocal]);
        }
        return truthTable;
    }
}
