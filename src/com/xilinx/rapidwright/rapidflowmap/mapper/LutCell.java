package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * A K-input LUT replacing the sub-network between {@code inputs} and the node {@code root}.
 * Bit {@code m} of the truth table is the output when input {@code i} carries bit {@code i} of {@code m}.
 */
public final class LutCell {
    private final int root;
    private final String name;
    private final List<Integer> inputs;
    private final BitSet truthTable;
    private final int level;

    public LutCell(int root, String name, List<Integer> inputs, BitSet truthTable, int level) {
        this.root = root;
        this.name = name;
        this.inputs = Collections.unmodifiableList(inputs);
        this.truthTable = (BitSet) truthTable.clone();
        this.level = level;
    }

    public int getRoot() {
        return root;
    }

    public String getName() {
        return name;
    }

    public List<Integer> getInputs() {
        return inputs;
    }

    public int getInputNum() {
        return inputs.size();
    }

    public int getLevel() {
        return level;
    }

    public BitSet getTruthTable() {
        return (BitSet) truthTable.clone();
    }

    public boolean evaluate(boolean[] node2Value) {
        int minterm = 0;
        for (int i = 0; i < inputs.size(); i++) {
            if (node2Value[inputs.get(i)]) {
                minterm |= 1 << i;
            }
        }
        return truthTable.get(minterm);
    }

    // highest minterm first, as in an HDL INIT literal
    public String getTruthTableString() {
        int mintermNum = 1 << inputs.size();
        StringBuilder builder = new StringBuilder(mintermNum);
        for (int minterm = mintermNum - 1; minterm >= 0; minterm--) {
            builder.append(truthTable.get(minterm) ? '1' : '0');
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return String.format("LUT%d %s L%d", inputs.size(), name, level);
    }
}
