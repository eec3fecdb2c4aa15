package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.rapidwright.rapidflowmap.InvalidParameterException;
import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.network.Node;
import com.xilinx.rapidwright.rapidflowmap.utils.HierarchicalLogger;

/**
 * FlowMap-r: depth-preserving LUT count reduction.
 *
 * <p>Each iteration starts from the current cover. Area flow of every gate is computed bottom-up
 * using reference counts of that cover, then cuts are reselected from the output towards the inputs.
 * A node with required level {@code r} may only use a cut whose leaves all have labels below
 * {@code r}; its leaves then inherit required level {@code r - 1}. Because the labeling cut of a
 * node always satisfies this bound, a cover exists in every iteration and its depth never exceeds
 * the labeled depth. A new cover replaces the current one only if it has strictly fewer LUTs.
 */
public class AreaRecovery {
    private static final int UNREQUIRED = Integer.MAX_VALUE;

    private final HierarchicalLogger logger;
    private final int maxIterations;
    private final int maxCutsPerNode;
    private final MappingEmitter emitter;

    public AreaRecovery(HierarchicalLogger logger, int maxIterations, int maxCutsPerNode) {
        if (maxIterations < 1) {
            throw new InvalidParameterException("Area recovery needs at least one iteration, got " + maxIterations);
        }
        this.logger = logger;
        this.maxIterations = maxIterations;
        this.maxCutsPerNode = maxCutsPerNode;
        this.emitter = new MappingEmitter(logger);
    }

    public MappedNetwork run(MappingState state, MappedNetwork initialCover) {
        Network network = state.getNetwork();
        logger.info(String.format("Start area recovery from %d LUTs at depth %d", initialCover.getLutNum(), initialCover.getDepth()));

        List<List<Cut>> node2Candidates = collectCandidateCuts(state);

        MappedNetwork bestCover = initialCover;
        logger.newSubStep();
        for (int iter = 0; iter < maxIterations; iter++) {
            int[] node2Refs = computeReferences(network, bestCover);
            int[] prevRequired = computeRequiredLevels(network, bestCover, state.getDepth());
            double[] node2AreaFlow = computeAreaFlow(state, node2Candidates, node2Refs, prevRequired);
            Map<Integer, Cut> root2Cut = selectCover(state, node2Candidates, node2AreaFlow, node2Refs);

            MappedNetwork cover = emitter.emit(state, root2Cut::get);
            logger.info(String.format("Iteration %d: LUTs=%d depth=%d", iter, cover.getLutNum(), cover.getDepth()));
            if (cover.getLutNum() >= bestCover.getLutNum()) {
                break;
            }
            bestCover = cover;
        }
        logger.endSubStep();

        logger.info(String.format("Complete area recovery: %d -> %d LUTs", initialCover.getLutNum(), bestCover.getLutNum()));
        return bestCover;
    }

    private List<List<Cut>> collectCandidateCuts(MappingState state) {
        Network network = state.getNetwork();
        CutEnumerator enumerator = new CutEnumerator(state.getLutSize(), maxCutsPerNode);
        List<List<Cut>> node2Candidates = new ArrayList<>();
        for (List<Cut> cuts : enumerator.enumerate(network)) {
            node2Candidates.add(new ArrayList<>(cuts));
        }

        // the labeling cut keeps every node implementable at its minimum depth
        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            if (!network.getNode(nodeId).isGate()) continue;
            Cut depthCut = state.getCut(nodeId);
            if (!node2Candidates.get(nodeId).contains(depthCut)) {
                node2Candidates.get(nodeId).add(depthCut);
            }
        }
        return node2Candidates;
    }

    // LUT references in the cover; gates that are not LUT outputs fall back to their structural fanout
    static int[] computeReferences(Network network, MappedNetwork cover) {
        int[] node2Refs = new int[network.getNodeNum()];
        for (LutCell cell : cover.getLutCells()) {
            for (int input : cell.getInputs()) {
                node2Refs[input]++;
            }
        }
        for (int nodeId = 0; nodeId < network.getNodeNum(); nodeId++) {
            if (network.getNode(nodeId).isGate() && !cover.isLutRoot(nodeId)) {
                node2Refs[nodeId] = network.getFanouts(nodeId).size();
            }
            node2Refs[nodeId] = Math.max(1, node2Refs[nodeId]);
        }
        return node2Refs;
    }

    static int[] computeRequiredLevels(Network network, MappedNetwork cover, int depth) {
        int[] node2Required = new int[network.getNodeNum()];
        Arrays.fill(node2Required, UNREQUIRED);
        node2Required[network.getOutputDriver()] = depth;

        List<LutCell> cells = cover.getLutCells();
        for (int i = cells.size() - 1; i >= 0; i--) {
            LutCell cell = cells.get(i);
            int required = node2Required[cell.getRoot()];
            assert required != UNREQUIRED;
            for (int input : cell.getInputs()) {
                node2Required[input] = Math.min(node2Required[input], required - 1);
            }
        }
        return node2Required;
    }

    private double[] computeAreaFlow(MappingState state, List<List<Cut>> node2Candidates, int[] node2Refs, int[] prevRequired) {
        Network network = state.getNetwork();
        double[] node2AreaFlow = new double[network.getNodeNum()];

        for (int nodeId : network.getTopologicalOrder()) {
            if (!network.getNode(nodeId).isGate()) continue;

            double bestAreaFlow = Double.MAX_VALUE;
            for (Cut cut : node2Candidates.get(nodeId)) {
                if (state.getCutDepth(cut) > prevRequired[nodeId]) continue;
                bestAreaFlow = Math.min(bestAreaFlow, getAreaFlowOf(network, cut, node2AreaFlow, node2Refs));
            }
            assert bestAreaFlow != Double.MAX_VALUE;
            node2AreaFlow[nodeId] = bestAreaFlow;
        }
        return node2AreaFlow;
    }

    private static double getAreaFlowOf(Network network, Cut cut, double[] node2AreaFlow, int[] node2Refs) {
        double areaFlow = 1.0;
        for (int leaf : cut.getLeaves()) {
            if (network.getNode(leaf).isGate()) {
                areaFlow += node2AreaFlow[leaf] / node2Refs[leaf];
            }
        }
        return areaFlow;
    }

    private Map<Integer, Cut> selectCover(MappingState state, List<List<Cut>> node2Candidates, double[] node2AreaFlow, int[] node2Refs) {
        Network network = state.getNetwork();
        int[] node2Required = new int[network.getNodeNum()];
        Arrays.fill(node2Required, UNREQUIRED);
        node2Required[network.getOutputDriver()] = state.getDepth();

        Map<Integer, Cut> root2Cut = new HashMap<>();
        List<Integer> topoOrder = network.getTopologicalOrder();
        for (int i = topoOrder.size() - 1; i >= 0; i--) {
            int nodeId = topoOrder.get(i);
            Node node = network.getNode(nodeId);
            if (!node.isGate() || node2Required[nodeId] == UNREQUIRED) continue;

            int required = node2Required[nodeId];
            Cut bestCut = null;
            double bestAreaFlow = 0.0;
            int bestNewLutNum = 0;
            for (Cut cut : node2Candidates.get(nodeId)) {
                int cutDepth = state.getCutDepth(cut);
                if (cutDepth > required) continue;

                double areaFlow = getAreaFlowOf(network, cut, node2AreaFlow, node2Refs);
                int newLutNum = 0;
                for (int leaf : cut.getLeaves()) {
                    if (network.getNode(leaf).isGate() && node2Required[leaf] == UNREQUIRED) {
                        newLutNum++;
                    }
                }

                if (bestCut == null || isBetter(areaFlow, newLutNum, cutDepth, cut, bestAreaFlow, bestNewLutNum, state.getCutDepth(bestCut), bestCut)) {
                    bestCut = cut;
                    bestAreaFlow = areaFlow;
                    bestNewLutNum = newLutNum;
                }
            }
            if (bestCut == null) {
                throw new IllegalStateException("No cut of " + node.getName() + " meets required level " + required);
            }

            root2Cut.put(nodeId, bestCut);
            for (int leaf : bestCut.getLeaves()) {
                node2Required[leaf] = Math.min(node2Required[leaf], required - 1);
            }
        }
        return root2Cut;
    }

    private static boolean isBetter(double areaFlow, int newLutNum, int cutDepth, Cut cut,
                                    double bestAreaFlow, int bestNewLutNum, int bestCutDepth, Cut bestCut) {
        final double eps = 1e-9;
        if (areaFlow < bestAreaFlow - eps) return true;
        if (areaFlow > bestAreaFlow + eps) return false;
        if (newLutNum != bestNewLutNum) return newLutNum < bestNewLutNum;
        if (cutDepth != bestCutDepth) return cutDepth < bestCutDepth;
        if (cut.size() != bestCut.size()) return cut.size() < bestCut.size();
        return Cut.compareLeaves(cut, bestCut) < 0;
    }
}
