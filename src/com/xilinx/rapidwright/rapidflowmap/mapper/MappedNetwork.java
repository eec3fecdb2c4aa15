package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.rapidwright.rapidflowmap.InvalidParameterException;
import com.xilinx.rapidwright.rapidflowmap.network.Network;
import com.xilinx.rapidwright.rapidflowmap.utils.HierarchicalLogger;
import com.xilinx.rapidwright.rapidflowmap.utils.StatisticsUtils;

/**
 * LUT netlist produced by the mapper. Cells are in topological order and every LUT input is either
 * a primary input or the root of another cell.
 */
public class MappedNetwork {
    private final Network network;
    private final int lutSize;
    private final List<LutCell> lutCells;
    private final Map<Integer, LutCell> root2LutCell;
    private final int depth;

    public MappedNetwork(Network network, int lutSize, List<LutCell> lutCells) {
        this.network = network;
        this.lutSize = lutSize;
        this.lutCells = Collections.unmodifiableList(new ArrayList<>(lutCells));

        root2LutCell = new HashMap<>();
        int maxLevel = 0;
        for (LutCell cell : lutCells) {
            root2LutCell.put(cell.getRoot(), cell);
            maxLevel = Math.max(maxLevel, cell.getLevel());
        }
        this.depth = maxLevel;
    }

    public Network getNetwork() {
        return network;
    }

    public int getLutSize() {
        return lutSize;
    }

    public List<LutCell> getLutCells() {
        return lutCells;
    }

    public int getLutNum() {
        return lutCells.size();
    }

    public int getDepth() {
        return depth;
    }

    public boolean isLutRoot(int nodeId) {
        return root2LutCell.containsKey(nodeId);
    }

    public LutCell getLutCell(int rootId) {
        return root2LutCell.get(rootId);
    }

    public Cut getCutOf(int rootId) {
        LutCell cell = root2LutCell.get(rootId);
        return cell == null ? null : new Cut(rootId, cell.getInputs());
    }

    public boolean evaluate(boolean[] piValues) {
        assert piValues.length == network.getPrimaryInputNum();
        boolean[] node2Value = new boolean[network.getNodeNum()];
        List<Integer> primaryInputs = network.getPrimaryInputs();
        for (int i = 0; i < primaryInputs.size(); i++) {
            node2Value[primaryInputs.get(i)] = piValues[i];
        }
        for (LutCell cell : lutCells) {
            node2Value[cell.getRoot()] = cell.evaluate(node2Value);
        }
        return node2Value[network.getOutputDriver()];
    }

    /**
     * Compares this netlist with the source network over every primary input assignment.
     */
    public boolean isEquivalentToNetwork() {
        int inputNum = network.getPrimaryInputNum();
        if (inputNum > 30) {
            throw new InvalidParameterException("Exhaustive equivalence check supports at most 30 inputs, got " + inputNum);
        }
        boolean[] piValues = new boolean[inputNum];
        for (long assignment = 0; assignment < (1L << inputNum); assignment++) {
            for (int i = 0; i < inputNum; i++) {
                piValues[i] = ((assignment >> i) & 1) == 1;
            }
            if (evaluate(piValues) != network.evaluate(piValues)) {
                return false;
            }
        }
        return true;
    }

    public Map<Integer, Integer> getLutInputHistogram() {
        List<Integer> inputNums = new ArrayList<>();
        lutCells.forEach(cell -> inputNums.add(cell.getInputNum()));
        return StatisticsUtils.getHistogram(inputNums);
    }

    public void printMappedNetworkInfo(HierarchicalLogger logger) {
        logger.info("Mapped Network Information:");
        logger.newSubStep();
        logger.info("LUT size: " + lutSize);
        logger.info("Number of LUTs: " + lutCells.size());
        logger.info("LUT depth: " + depth);

        List<Integer> inputNums = new ArrayList<>();
        lutCells.forEach(cell -> inputNums.add(cell.getInputNum()));
        logger.info("LUT input histogram: " + StatisticsUtils.histogramToString(getLutInputHistogram(), "LUT"));
        logger.info(String.format("Mean inputs per LUT: %.2f", StatisticsUtils.getMean(inputNums)));
        logger.endSubStep();
    }
}
