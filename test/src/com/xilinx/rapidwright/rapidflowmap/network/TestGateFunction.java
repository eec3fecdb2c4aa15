package com.xilinx.rapidwright.rapidflowmap.network;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.xilinx.rapidwright.rapidflowmap.MalformedNodeException;

public class TestGateFunction {

    @ParameterizedTest
    @CsvSource({
        "AND,  false, false, false", "AND,  true,  true,  true",  "AND,  true,  false, false",
        "OR,   false, false, false", "OR,   false, true,  true",
        "XOR,  true,  true,  false", "XOR,  true,  false, true",
        "NAND, true,  true,  false", "NOR,  false, false, true",
        "XNOR, true,  true,  true",  "ANDN, true,  false, true",  "ANDN, true,  true,  false",
        "ORN,  false, false, true",  "ORN,  false, true,  false",
        "NOT,  true,  false, false", "NOT,  false, true,  true",
        "BUF,  true,  false, true",  "BUF,  false, true,  false",
        "CONST0, true, true, false", "CONST1, false, false, true"
    })
    public void testEvaluateNamedFunction(String name, boolean in0, boolean in1, boolean expected) {
        Assertions.assertEquals(expected, GateFunction.evaluate(GateFunction.fromName(name), in0, in1));
    }

    @Test
    public void testNameLookup() {
        Assertions.assertEquals(GateFunction.AND, GateFunction.fromName("and"));
        Assertions.assertEquals("XOR", GateFunction.toName(6));
        Assertions.assertTrue(GateFunction.hasName(GateFunction.ORN));
        Assertions.assertFalse(GateFunction.hasName(0x4));
        Assertions.assertEquals("TT4", GateFunction.toName(0x4));
        Assertions.assertThrows(MalformedNodeException.class, () -> GateFunction.fromName("MUX"));
    }

    @Test
    public void testTruthTableRange() {
        Assertions.assertTrue(GateFunction.isValidTruthTable(0));
        Assertions.assertTrue(GateFunction.isValidTruthTable(15));
        Assertions.assertFalse(GateFunction.isValidTruthTable(16));
        Assertions.assertFalse(GateFunction.isValidTruthTable(-1));
    }
}
