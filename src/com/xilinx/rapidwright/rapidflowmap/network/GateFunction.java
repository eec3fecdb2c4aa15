package com.xilinx.rapidwright.rapidflowmap.network;

import java.util.Map;

import com.xilinx.rapidwright.rapidflowmap.MalformedNodeException;

/**
 * 2-input Boolean functions encoded as 4-bit truth tables.
 * Bit {@code in0 + 2 * in1} of the table holds the output for that input combination.
 */
public final class GateFunction {
    public static final int CONST0 = 0x0;
    public static final int NOR = 0x1;
    public static final int ANDN = 0x2; // in0 & !in1
    public static final int NOT = 0x5; // !in0
    public static final int XOR = 0x6;
    public static final int NAND = 0x7;
    public static final int AND = 0x8;
    public static final int XNOR = 0x9;
    public static final int BUF = 0xA; // in0
    public static final int ORN = 0xB; // in0 | !in1
    public static final int OR = 0xE;
    public static final int CONST1 = 0xF;

    private static final Map<String, Integer> name2TruthTable = Map.ofEntries(
        Map.entry("CONST0", CONST0),
        Map.entry("NOR", NOR),
        Map.entry("ANDN", ANDN),
        Map.entry("NOT", NOT),
        Map.entry("XOR", XOR),
        Map.entry("NAND", NAND),
        Map.entry("AND", AND),
        Map.entry("XNOR", XNOR),
        Map.entry("BUF", BUF),
        Map.entry("ORN", ORN),
        Map.entry("OR", OR),
        Map.entry("CONST1", CONST1)
    );

    private GateFunction() {
    }

    public static boolean isValidTruthTable(int truthTable) {
        return truthTable >= 0 && truthTable <= 0xF;
    }

    public static boolean evaluate(int truthTable, boolean in0, boolean in1) {
        int index = (in0 ? 1 : 0) | (in1 ? 2 : 0);
        return ((truthTable >> index) & 1) == 1;
    }

    public static int fromName(String name) {
        Integer truthTable = name2TruthTable.get(name.toUpperCase());
        if (truthTable == null) {
            throw new MalformedNodeException("Unknown gate function: " + name);
        }
        return truthTable;
    }

    public static boolean hasName(int truthTable) {
        return name2TruthTable.containsValue(truthTable);
    }

    public static String toName(int truthTable) {
        for (Map.Entry<String, Integer> entry : name2TruthTable.entrySet()) {
            if (entry.getValue() == truthTable) {
                return entry.getKey();
            }
        }
        return String.format("TT%X", truthTable);
    }
}
