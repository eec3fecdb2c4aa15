package com.xilinx.rapidwright.rapidflowmap.network;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.xilinx.rapidwright.rapidflowmap.InvalidParameterException;

/**
 * Builders for reference networks made of 2-input gates.
 */
public class NetworkGenerator {

    public static int getSelectBitNum(int dataInputNum) {
        int selectBitNum = 0;
        while ((1 << selectBitNum) < dataInputNum) {
            selectBitNum++;
        }
        return selectBitNum;
    }

    /**
     * Builds a k:1 multiplexer from AND/OR/NOT gates.
     * Data inputs are D0..D(k-1) and select inputs S0..S(m-1) with S0 as the most significant select bit.
     * Each data input is gated by a chain of 2-input ANDs over the select literals, then all paths
     * are combined by a balanced tree of 2-input ORs.
     */
    public static Network buildMux(int dataInputNum) {
        if (dataInputNum < 2) {
            throw new InvalidParameterException("A multiplexer needs at least 2 data inputs, got " + dataInputNum);
        }
        int selectBitNum = getSelectBitNum(dataInputNum);
        NetworkBuilder builder = new NetworkBuilder("mux" + dataInputNum);

        for (int i = 0; i < dataInputNum; i++) {
            builder.addPrimaryInput("D" + i);
        }
        for (int j = 0; j < selectBitNum; j++) {
            builder.addPrimaryInput("S" + j);
        }

        Set<String> invertedSelects = new HashSet<>();
        List<String> pathOutputs = new ArrayList<>();
        for (int i = 0; i < dataInputNum; i++) {
            List<String> literals = new ArrayList<>();
            for (int j = 0; j < selectBitNum; j++) {
                boolean bit = ((i >> (selectBitNum - 1 - j)) & 1) == 1;
                if (bit) {
                    literals.add("S" + j);
                } else {
                    String notName = "nS" + j;
                    if (invertedSelects.add(notName)) {
                        builder.addGate(notName, "NOT", "S" + j, "S" + j);
                    }
                    literals.add(notName);
                }
            }

            String decoded = literals.get(0);
            for (int j = 1; j < literals.size(); j++) {
                String andName = String.format("sel%d_%d", i, j);
                builder.addGate(andName, "AND", decoded, literals.get(j));
                decoded = andName;
            }

            String pathName = "and" + i;
            builder.addGate(pathName, "AND", decoded, "D" + i);
            pathOutputs.add(pathName);
        }

        List<String> currentLayer = pathOutputs;
        int orCount = 1;
        while (currentLayer.size() > 1) {
            List<String> nextLayer = new ArrayList<>();
            for (int i = 0; i < currentLayer.size(); i += 2) {
                if (i + 1 == currentLayer.size()) {
                    nextLayer.add(currentLayer.get(i));
                } else {
                    String orName = "or" + orCount++;
                    builder.addGate(orName, "OR", currentLayer.get(i), currentLayer.get(i + 1));
                    nextLayer.add(orName);
                }
            }
            currentLayer = nextLayer;
        }

        builder.setPrimaryOutput("Y", currentLayer.get(0));
        return builder.build();
    }
}
