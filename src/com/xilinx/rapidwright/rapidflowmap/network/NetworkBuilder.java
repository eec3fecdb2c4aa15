package com.xilinx.rapidwright.rapidflowmap.network;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;

import com.xilinx.rapidwright.rapidflowmap.CyclicNetworkException;
import com.xilinx.rapidwright.rapidflowmap.MalformedNodeException;

/**
 * Collects a gate-list description and turns it into a validated {@link Network}.
 * Gates may reference nodes declared after them; names are resolved in {@link #build()}.
 */
public class NetworkBuilder {
    private static class GateDesc {
        final String name;
        final int truthTable;
        final List<String> fanins;

        GateDesc(String name, int truthTable, List<String> fanins) {
            this.name = name;
            this.truthTable = truthTable;
            this.fanins = fanins;
        }
    }

    private final String name;
    private final List<String> primaryInputNames = new ArrayList<>();
    private final List<GateDesc> gateDescs = new ArrayList<>();
    private String outputName;
    private String outputDriverName;

    public NetworkBuilder(String name) {
        this.name = name;
    }

    public NetworkBuilder addPrimaryInput(String inputName) {
        primaryInputNames.add(inputName);
        return this;
    }

    public NetworkBuilder addGate(String gateName, int truthTable, List<String> fanins) {
        gateDescs.add(new GateDesc(gateName, truthTable, new ArrayList<>(fanins)));
        return this;
    }

    public NetworkBuilder addGate(String gateName, String function, String... fanins) {
        return addGate(gateName, GateFunction.fromName(function), Arrays.asList(fanins));
    }

    public NetworkBuilder setPrimaryOutput(String outputName, String driverName) {
        this.outputName = outputName;
        this.outputDriverName = driverName;
        return this;
    }

    public Network build() {
        if (outputName == null || outputDriverName == null) {
            throw new MalformedNodeException("Network " + name + " has no primary output");
        }

        // assign ids: primary inputs, gates, primary output
        List<String> nodeNames = new ArrayList<>(primaryInputNames);
        gateDescs.forEach(gate -> nodeNames.add(gate.name));
        nodeNames.add(outputName);

        Map<String, Integer> name2NodeId = new HashMap<>();
        for (int nodeId = 0; nodeId < nodeNames.size(); nodeId++) {
            String nodeName = nodeNames.get(nodeId);
            if (nodeName == null || nodeName.isEmpty()) {
                throw new MalformedNodeException("Node " + nodeId + " has no name");
            }
            if (name2NodeId.put(nodeName, nodeId) != null) {
                throw new MalformedNodeException("Duplicate node name: " + nodeName);
            }
        }

        int nodeNum = nodeNames.size();
        int primaryOutput = nodeNum - 1;
        List<List<Integer>> node2Fanins = new ArrayList<>();
        List<Integer> node2TruthTable = new ArrayList<>();
        List<NodeKind> node2Kind = new ArrayList<>();

        for (int i = 0; i < primaryInputNames.size(); i++) {
            node2Fanins.add(new ArrayList<>());
            node2TruthTable.add(-1);
            node2Kind.add(NodeKind.PRIMARY_INPUT);
        }

        for (GateDesc gate : gateDescs) {
            if (gate.fanins.size() != NodeKind.GATE.getFaninArity()) {
                throw new MalformedNodeException(String.format("Gate %s has %d fan-ins, expected %d",
                    gate.name, gate.fanins.size(), NodeKind.GATE.getFaninArity()));
            }
            if (!GateFunction.isValidTruthTable(gate.truthTable)) {
                throw new MalformedNodeException("Gate " + gate.name + " has invalid truth table " + gate.truthTable);
            }
            List<Integer> fanins = new ArrayList<>();
            for (String faninName : gate.fanins) {
                fanins.add(resolveFanin(name2NodeId, gate.name, faninName, primaryOutput));
            }
            node2Fanins.add(fanins);
            node2TruthTable.add(gate.truthTable);
            node2Kind.add(NodeKind.GATE);
        }

        node2Fanins.add(List.of(resolveFanin(name2NodeId, outputName, outputDriverName, primaryOutput)));
        node2TruthTable.add(-1);
        node2Kind.add(NodeKind.PRIMARY_OUTPUT);

        List<Integer> topoOrder = sortTopologically(nodeNames, node2Fanins);

        // derive fanouts, each consumer listed once
        List<Set<Integer>> node2Fanouts = new ArrayList<>();
        for (int nodeId = 0; nodeId < nodeNum; nodeId++) {
            node2Fanouts.add(new LinkedHashSet<>());
        }
        for (int nodeId = 0; nodeId < nodeNum; nodeId++) {
            for (int faninId : node2Fanins.get(nodeId)) {
                node2Fanouts.get(faninId).add(nodeId);
            }
        }

        for (int nodeId = 0; nodeId < nodeNum; nodeId++) {
            if (nodeId != primaryOutput && node2Fanouts.get(nodeId).isEmpty()) {
                throw new MalformedNodeException("Node " + nodeNames.get(nodeId) + " does not drive any node");
            }
        }

        List<Node> nodes = new ArrayList<>();
        for (int nodeId = 0; nodeId < nodeNum; nodeId++) {
            nodes.add(new Node(nodeId, nodeNames.get(nodeId), node2Kind.get(nodeId), node2TruthTable.get(nodeId),
                node2Fanins.get(nodeId), new ArrayList<>(node2Fanouts.get(nodeId))));
        }

        List<Integer> primaryInputs = new ArrayList<>();
        for (int i = 0; i < primaryInputNames.size(); i++) {
            primaryInputs.add(i);
        }

        return new Network(name, nodes, name2NodeId, primaryInputs, primaryOutput, topoOrder);
    }

    private int resolveFanin(Map<String, Integer> name2NodeId, String nodeName, String faninName, int primaryOutput) {
        Integer faninId = name2NodeId.get(faninName);
        if (faninId == null) {
            throw new MalformedNodeException("Node " + nodeName + " references unknown node " + faninName);
        }
        if (faninId == primaryOutput) {
            throw new MalformedNodeException("Node " + nodeName + " is driven by the primary output " + faninName);
        }
        return faninId;
    }

    private List<Integer> sortTopologically(List<String> nodeNames, List<List<Integer>> node2Fanins) {
        DefaultDirectedGraph<Integer, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (int nodeId = 0; nodeId < nodeNames.size(); nodeId++) {
            graph.addVertex(nodeId);
        }
        for (int nodeId = 0; nodeId < nodeNames.size(); nodeId++) {
            for (int faninId : node2Fanins.get(nodeId)) {
                if (faninId == nodeId) {
                    throw new CyclicNetworkException("Node " + nodeNames.get(nodeId) + " drives itself");
                }
                graph.addEdge(faninId, nodeId);
            }
        }

        CycleDetector<Integer, DefaultEdge> cycleDetector = new CycleDetector<>(graph);
        if (cycleDetector.detectCycles()) {
            Set<Integer> cycleNodes = new TreeSet<>(cycleDetector.findCycles());
            String cycleNames = cycleNodes.stream().map(nodeNames::get).collect(Collectors.joining(", "));
            throw new CyclicNetworkException("Network " + name + " contains a cycle through: " + cycleNames);
        }

        // smallest id first among ready nodes keeps the order deterministic
        TopologicalOrderIterator<Integer, DefaultEdge> iterator = new TopologicalOrderIterator<>(graph, Integer::compare);
        List<Integer> topoOrder = new ArrayList<>();
        iterator.forEachRemaining(topoOrder::add);
        return topoOrder;
    }
}
