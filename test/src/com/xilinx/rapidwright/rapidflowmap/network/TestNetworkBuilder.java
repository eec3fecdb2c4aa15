package com.xilinx.rapidwright.rapidflowmap.network;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.rapidwright.rapidflowmap.CyclicNetworkException;
import com.xilinx.rapidwright.rapidflowmap.MalformedNodeException;

public class TestNetworkBuilder {

    private static NetworkBuilder carryBuilder() {
        return new NetworkBuilder("carry")
            .addPrimaryInput("A")
            .addPrimaryInput("B")
            .addPrimaryInput("C")
            .addGate("cout", "OR", "ab", "cx")
            .addGate("ab", "AND", "A", "B")
            .addGate("x", "XOR", "A", "B")
            .addGate("cx", "AND", "C", "x")
            .setPrimaryOutput("Cout", "cout");
    }

    @Test
    public void testTopologyOfCarryNetwork() {
        Network network = carryBuilder().build();

        Assertions.assertEquals(8, network.getNodeNum());
        Assertions.assertEquals(3, network.getPrimaryInputNum());
        Assertions.assertEquals(4, network.getGateNum());
        Assertions.assertEquals(network.getNodeId("cout"), network.getOutputDriver());
        Assertions.assertTrue(network.getNode(network.getPrimaryOutput()).isPrimaryOutput());
        Assertions.assertEquals(3, network.getGateDepth());

        // every fan-in precedes its consumer
        List<Integer> topoOrder = network.getTopologicalOrder();
        Assertions.assertEquals(network.getNodeNum(), topoOrder.size());
        for (int nodeId : topoOrder) {
            for (int faninId : network.getFanins(nodeId)) {
                Assertions.assertTrue(network.getTopoIndex(faninId) < network.getTopoIndex(nodeId));
            }
        }

        int a = network.getNodeId("A");
        Assertions.assertEquals(List.of(network.getNodeId("ab"), network.getNodeId("x")), network.getFanouts(a));
        Assertions.assertNull(network.getNodeId("missing"));
    }

    @Test
    public void testSimulateCarry() {
        Network network = carryBuilder().build();
        for (int m = 0; m < 8; m++) {
            boolean a = (m & 1) != 0;
            boolean b = (m & 2) != 0;
            boolean c = (m & 4) != 0;
            boolean expected = (a && b) || (c && (a ^ b));
            Assertions.assertEquals(expected, network.evaluate(new boolean[] {a, b, c}));
        }
    }

    @Test
    public void testNodesByLevelAreIndependent() {
        Network network = NetworkGenerator.buildMux(4);
        List<List<Integer>> level2Nodes = network.getNodesByLevel();
        Assertions.assertEquals(network.getPrimaryInputNum(), level2Nodes.get(0).size());
        int nodeNum = 0;
        for (int level = 0; level < level2Nodes.size(); level++) {
            for (int nodeId : level2Nodes.get(level)) {
                Assertions.assertEquals(level, network.getLevel(nodeId));
                for (int faninId : network.getFanins(nodeId)) {
                    Assertions.assertTrue(network.getLevel(faninId) < level);
                }
            }
            nodeNum += level2Nodes.get(level).size();
        }
        Assertions.assertEquals(network.getNodeNum() - 1, nodeNum);
    }

    @Test
    public void testTransitiveFanin() {
        Network network = carryBuilder().build();
        List<Integer> cone = network.getTransitiveFanin(network.getNodeId("cx"));
        Assertions.assertEquals(5, cone.size());
        Assertions.assertEquals(network.getNodeId("cx"), cone.get(cone.size() - 1));
        Assertions.assertFalse(cone.contains(network.getNodeId("ab")));
    }

    @Test
    public void testWrongArity() {
        NetworkBuilder builder = new NetworkBuilder("arity")
            .addPrimaryInput("A")
            .addGate("g", GateFunction.NOT, List.of("A"))
            .setPrimaryOutput("Y", "g");
        Assertions.assertThrows(MalformedNodeException.class, builder::build);
    }

    @Test
    public void testUnknownFanin() {
        NetworkBuilder builder = new NetworkBuilder("unknown")
            .addPrimaryInput("A")
            .addGate("g", "AND", "A", "B")
            .setPrimaryOutput("Y", "g");
        Assertions.assertThrows(MalformedNodeException.class, builder::build);
    }

    @Test
    public void testDuplicateName() {
        NetworkBuilder builder = new NetworkBuilder("duplicate")
            .addPrimaryInput("A")
            .addPrimaryInput("B")
            .addGate("A", "AND", "A", "B")
            .setPrimaryOutput("Y", "A");
        Assertions.assertThrows(MalformedNodeException.class, builder::build);
    }

    @Test
    public void testInvalidTruthTable() {
        NetworkBuilder builder = new NetworkBuilder("tt")
            .addPrimaryInput("A")
            .addPrimaryInput("B")
            .addGate("g", 0x1F, List.of("A", "B"))
            .setPrimaryOutput("Y", "g");
        Assertions.assertThrows(MalformedNodeException.class, builder::build);
    }

    @Test
    public void testMissingPrimaryOutput() {
        NetworkBuilder builder = new NetworkBuilder("nooutput")
            .addPrimaryInput("A")
            .addPrimaryInput("B")
            .addGate("g", "AND", "A", "B");
        Assertions.assertThrows(MalformedNodeException.class, builder::build);
    }

    @Test
    public void testDanglingGate() {
        NetworkBuilder builder = new NetworkBuilder("dangling")
            .addPrimaryInput("A")
            .addPrimaryInput("B")
            .addGate("g1", "AND", "A", "B")
            .addGate("g2", "OR", "A", "B")
            .setPrimaryOutput("Y", "g1");
        Assertions.assertThrows(MalformedNodeException.class, builder::build);
    }

    @Test
    public void testPrimaryOutputAsFanin() {
        NetworkBuilder builder = new NetworkBuilder("outputfanin")
            .addPrimaryInput("A")
            .addPrimaryInput("B")
            .addGate("g", "AND", "A", "Y")
            .setPrimaryOutput("Y", "g");
        Assertions.assertThrows(MalformedNodeException.class, builder::build);
    }

    @Test
    public void testCycle() {
        NetworkBuilder builder = new NetworkBuilder("cycle")
            .addPrimaryInput("A")
            .addPrimaryInput("B")
            .addGate("g1", "AND", "A", "g2")
            .addGate("g2", "OR", "g1", "B")
            .setPrimaryOutput("Y", "g2");
        Assertions.assertThrows(CyclicNetworkException.class, builder::build);
    }

    @Test
    public void testSelfLoop() {
        NetworkBuilder builder = new NetworkBuilder("selfloop")
            .addPrimaryInput("A")
            .addGate("g", "AND", "A", "g")
            .setPrimaryOutput("Y", "g");
        Assertions.assertThrows(CyclicNetworkException.class, builder::build);
    }
}
