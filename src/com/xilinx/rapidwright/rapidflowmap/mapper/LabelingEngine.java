package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.xilinx.rapidwright.rapidflowmap.DisconnectedNetworkException;
import com.xilinx.rapidwright.rapidflowmap.FlowMapException;
import com.xilinx.rapidwright.rapidflowmap.InfeasibleMappingException;
import com.xilinx.rapidwright.rapidflowmap.InvalidParameterException;
import com.xilinx.rapidwright.rapidflowmap.flow.FlowGraph;
import com.xilinx.rapidwright.rapidflowmap.flow.MaxFlowSolver;
import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.network.Node;
import com.xilinx.rapidwright.rapidflowmap.utils.HierarchicalLogger;
import com.xilinx.rapidwright.rapidflowmap.utils.StatisticsUtils;

/**
 * FlowMap labeling: computes for every node the minimum LUT depth of the sub-network rooted at it,
 * together with a K-feasible cut achieving that depth.
 *
 * <p>For a gate {@code t} whose fan-ins have maximum label {@code p}, all nodes of its fan-in cone
 * with label {@code p} are collapsed into the sink, every other cone node is split into a
 * unit-capacity edge and primary inputs hang off the source. If the max-flow is at most K, the
 * min-cut gives a cut whose leaves all have label below {@code p}, so {@code label(t) = p}.
 * Otherwise {@code label(t) = p + 1} with the fan-in cut.
 *
 * <p>Nodes of the same {@link Network#getNodesByLevel() level} never depend on each other, so with
 * more than one thread each level is labeled in parallel after the previous one completes.
 */
public class LabelingEngine {
    private final HierarchicalLogger logger;
    private final int lutSize;
    private final int threadNum;
    private final CutSelector cutSelector;

    public LabelingEngine(HierarchicalLogger logger, int lutSize, int threadNum) {
        if (lutSize < 1) {
            throw new InvalidParameterException("LUT size must be at least 1, got " + lutSize);
        }
        if (threadNum < 1) {
            throw new InvalidParameterException("Thread number must be at least 1, got " + threadNum);
        }
        this.logger = logger;
        this.lutSize = lutSize;
        this.threadNum = threadNum;
        this.cutSelector = new CutSelector();
    }

    public MappingState run(Network network) {
        logger.info(String.format("Start labeling %d nodes with K=%d threads=%d", network.getNodeNum(), lutSize, threadNum));
        MappingState state = new MappingState(network, lutSize);
        List<List<Integer>> level2Nodes = network.getNodesByLevel();

        if (threadNum == 1) {
            for (List<Integer> levelNodes : level2Nodes) {
                for (int nodeId : levelNodes) {
                    labelNode(state, nodeId);
                }
            }
        } else {
            runInParallel(state, level2Nodes);
        }
        labelNode(state, network.getPrimaryOutput());

        logger.newSubStep();
        logger.info("Label histogram of gates: " + StatisticsUtils.histogramToString(state.getLabelHistogram(), "L"));
        logger.info("Minimum LUT depth: " + state.getDepth());
        logger.endSubStep();
        logger.info("Complete labeling");
        return state;
    }

    private void runInParallel(MappingState state, List<List<Integer>> level2Nodes) {
        ExecutorService executor = Executors.newFixedThreadPool(threadNum);
        try {
            for (List<Integer> levelNodes : level2Nodes) {
                List<Callable<Void>> tasks = new ArrayList<>();
                for (int nodeId : levelNodes) {
                    tasks.add(() -> {
                        labelNode(state, nodeId);
                        return null;
                    });
                }

                for (Future<Void> future : executor.invokeAll(tasks)) {
                    future.get();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Labeling interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FlowMapException) {
                throw (FlowMapException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Labeling failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    void labelNode(MappingState state, int nodeId) {
        Network network = state.getNetwork();
        Node node = network.getNode(nodeId);
        switch (node.getKind()) {
            case PRIMARY_INPUT:
                state.assign(nodeId, 0, new Cut(nodeId, List.of()));
                break;
            case PRIMARY_OUTPUT:
                int driver = node.getFanins().get(0);
                state.assign(nodeId, state.getLabel(driver), new Cut(nodeId, List.of(driver)));
                break;
            case GATE:
                labelGate(state, node);
                break;
            default:
                throw new IllegalStateException("Unknown node kind: " + node.getKind());
        }
    }

    private void labelGate(MappingState state, Node node) {
        Network network = state.getNetwork();
        int nodeId = node.getId();

        int maxLabel = 0;
        for (int faninId : node.getFanins()) {
            maxLabel = Math.max(maxLabel, state.getLabel(faninId));
        }

        // every fan-in is a primary input
        if (maxLabel == 0) {
            assignFaninCut(state, node, 1);
            return;
        }

        List<Integer> cone = network.getTransitiveFanin(nodeId);
        List<Integer> splitNodes = new ArrayList<>();
        Map<Integer, Integer> node2SplitIdx = new HashMap<>();
        for (int coneNodeId : cone) {
            if (coneNodeId != nodeId && state.getLabel(coneNodeId) < maxLabel) {
                node2SplitIdx.put(coneNodeId, splitNodes.size());
                splitNodes.add(coneNodeId);
            }
        }

        FlowGraph flowGraph = new FlowGraph(CutSelector.getVertexNum(splitNodes.size()));
        boolean hasPrimaryInput = false;
        for (int i = 0; i < splitNodes.size(); i++) {
            flowGraph.addEdge(CutSelector.inVertex(i), CutSelector.outVertex(i), 1);
            if (network.getNode(splitNodes.get(i)).isPrimaryInput()) {
                flowGraph.addEdge(CutSelector.SOURCE_VERTEX, CutSelector.inVertex(i), FlowGraph.INF_CAPACITY);
                hasPrimaryInput = true;
            }
        }
        if (!hasPrimaryInput) {
            throw new DisconnectedNetworkException("No primary input reaches node " + node.getName());
        }

        for (int coneNodeId : cone) {
            Integer consumerIdx = node2SplitIdx.get(coneNodeId);
            int consumerVertex = consumerIdx == null ? CutSelector.SINK_VERTEX : CutSelector.inVertex(consumerIdx);
            for (int faninId : new LinkedHashSet<>(network.getFanins(coneNodeId))) {
                Integer faninIdx = node2SplitIdx.get(faninId);
                if (faninIdx == null) {
                    // edges between collapsed nodes stay inside the sink
                    assert consumerIdx == null;
                    continue;
                }
                flowGraph.addEdge(CutSelector.outVertex(faninIdx), consumerVertex, FlowGraph.INF_CAPACITY);
            }
        }

        long flow = new MaxFlowSolver().maxFlow(flowGraph, CutSelector.SOURCE_VERTEX, CutSelector.SINK_VERTEX, lutSize);
        if (flow <= lutSize) {
            Cut cut = cutSelector.selectMinCut(network, nodeId, splitNodes, flowGraph);
            assert cut.size() == flow;
            state.assign(nodeId, maxLabel, cut);
            logger.fine(String.format("Node %s: p=%d flow=%d label=%d cut=%s", node.getName(), maxLabel, flow, maxLabel, cut.getLeaves()));
        } else {
            assignFaninCut(state, node, maxLabel + 1);
            logger.fine(String.format("Node %s: p=%d flow>%d label=%d", node.getName(), maxLabel, lutSize, maxLabel + 1));
        }
    }

    private void assignFaninCut(MappingState state, Node node, int label) {
        Cut cut = cutSelector.selectFaninCut(state.getNetwork(), node.getId());
        if (cut.size() > lutSize) {
            throw new InfeasibleMappingException(String.format("Gate %s has %d distinct fan-ins but LUTs only have %d inputs",
                node.getName(), cut.size(), lutSize));
        }
        state.assign(node.getId(), label, cut);
    }
}
