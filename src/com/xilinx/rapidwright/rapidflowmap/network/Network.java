package com.xilinx.rapidwright.rapidflowmap.network;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.xilinx.rapidwright.rapidflowmap.utils.HierarchicalLogger;
import com.xilinx.rapidwright.rapidflowmap.utils.StatisticsUtils;

/**
 * Combinational Boolean network stored as an arena of {@link Node}s addressed by integer id.
 * A network is read-only once built by {@link NetworkBuilder}, so it can be shared by concurrent readers.
 */
public class Network {
    private final String name;
    private final List<Node> nodes;
    private final Map<String, Integer> name2NodeId;
    private final List<Integer> primaryInputs;
    private final int primaryOutput;

    private final List<Integer> topoOrder;
    private final int[] node2TopoIndex;
    private final int[] node2Level;

    Network(String name, List<Node> nodes, Map<String, Integer> name2NodeId, List<Integer> primaryInputs,
            int primaryOutput, List<Integer> topoOrder) {
        this.name = name;
        this.nodes = Collections.unmodifiableList(nodes);
        this.name2NodeId = Collections.unmodifiableMap(name2NodeId);
        this.primaryInputs = Collections.unmodifiableList(primaryInputs);
        this.primaryOutput = primaryOutput;
        this.topoOrder = Collections.unmodifiableList(topoOrder);

        node2TopoIndex = new int[nodes.size()];
        for (int i = 0; i < topoOrder.size(); i++) {
            node2TopoIndex[topoOrder.get(i)] = i;
        }

        // number of gates on the longest path from a primary input
        node2Level = new int[nodes.size()];
        for (int nodeId : topoOrder) {
            Node node = nodes.get(nodeId);
            int level = 0;
            for (int faninId : node.getFanins()) {
                level = Math.max(level, node2Level[faninId]);
            }
            node2Level[nodeId] = node.isGate() ? level + 1 : level;
        }
    }

    public String getName() {
        return name;
    }

    public int getNodeNum() {
        return nodes.size();
    }

    public Node getNode(int nodeId) {
        return nodes.get(nodeId);
    }

    public Integer getNodeId(String nodeName) {
        return name2NodeId.get(nodeName);
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<Integer> getFanins(int nodeId) {
        return nodes.get(nodeId).getFanins();
    }

    public List<Integer> getFanouts(int nodeId) {
        return nodes.get(nodeId).getFanouts();
    }

    public List<Integer> getPrimaryInputs() {
        return primaryInputs;
    }

    public int getPrimaryInputNum() {
        return primaryInputs.size();
    }

    public int getPrimaryOutput() {
        return primaryOutput;
    }

    public int getOutputDriver() {
        return nodes.get(primaryOutput).getFanins().get(0);
    }

    public int getGateNum() {
        return nodes.size() - primaryInputs.size() - 1;
    }

    public List<Integer> getTopologicalOrder() {
        return topoOrder;
    }

    public int getTopoIndex(int nodeId) {
        return node2TopoIndex[nodeId];
    }

    public int getLevel(int nodeId) {
        return node2Level[nodeId];
    }

    // depth of the unmapped network counted in 2-input gates
    public int getGateDepth() {
        return node2Level[primaryOutput];
    }

    /**
     * Groups primary inputs and gates by level. Nodes in one group never depend on each other.
     * The primary output is not part of any group.
     */
    public List<List<Integer>> getNodesByLevel() {
        List<List<Integer>> level2Nodes = new ArrayList<>();
        for (int nodeId : topoOrder) {
            if (nodeId == primaryOutput) continue;
            int level = node2Level[nodeId];
            while (level2Nodes.size() <= level) {
                level2Nodes.add(new ArrayList<>());
            }
            level2Nodes.get(level).add(nodeId);
        }
        return level2Nodes;
    }

    /**
     * Returns the transitive fan-in cone of a node (the node itself included) in topological order.
     */
    public List<Integer> getTransitiveFanin(int rootId) {
        boolean[] visited = new boolean[nodes.size()];
        List<Integer> cone = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();

        stack.push(rootId);
        visited[rootId] = true;
        while (!stack.isEmpty()) {
            int nodeId = stack.pop();
            cone.add(nodeId);
            for (int faninId : nodes.get(nodeId).getFanins()) {
                if (!visited[faninId]) {
                    visited[faninId] = true;
                    stack.push(faninId);
                }
            }
        }

        cone.sort((n1, n2) -> Integer.compare(node2TopoIndex[n1], node2TopoIndex[n2]));
        return cone;
    }

    /**
     * Simulates the network. {@code piValues[i]} is the value of the i-th primary input.
     * @return value of every node indexed by node id
     */
    public boolean[] simulate(boolean[] piValues) {
        assert piValues.length == primaryInputs.size();
        boolean[] values = new boolean[nodes.size()];
        for (int i = 0; i < primaryInputs.size(); i++) {
            values[primaryInputs.get(i)] = piValues[i];
        }

        for (int nodeId : topoOrder) {
            Node node = nodes.get(nodeId);
            List<Integer> fanins = node.getFanins();
            switch (node.getKind()) {
                case GATE:
                    values[nodeId] = GateFunction.evaluate(node.getTruthTable(), values[fanins.get(0)], values[fanins.get(1)]);
                    break;
                case PRIMARY_OUTPUT:
                    values[nodeId] = values[fanins.get(0)];
                    break;
                default:
                    break;
            }
        }
        return values;
    }

    public boolean evaluate(boolean[] piValues) {
        return simulate(piValues)[primaryOutput];
    }

    public void printNetworkInfo(HierarchicalLogger logger) {
        logger.info("Network Information: " + name);
        logger.newSubStep();
        logger.info("Number of primary inputs: " + primaryInputs.size());
        logger.info("Number of gates: " + getGateNum());
        logger.info("Primary output: " + nodes.get(primaryOutput).getName() + " <= " + nodes.get(getOutputDriver()).getName());
        logger.info("Gate depth: " + getGateDepth());

        List<Integer> fanoutNums = new ArrayList<>();
        for (Node node : nodes) {
            if (!node.isPrimaryOutput()) {
                fanoutNums.add(node.getFanouts().size());
            }
        }
        logger.info(String.format("Fanout: max=%d mean=%.2f", StatisticsUtils.getMax(fanoutNums), StatisticsUtils.getMean(fanoutNums)));
        logger.endSubStep();
    }
}
