package com.xilinx.rapidwright.rapidflowmap.network;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.rapidwright.rapidflowmap.InvalidParameterException;

public class TestNetworkGenerator {

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 8})
    public void testMuxSelectsDataInput(int dataInputNum) {
        Network network = NetworkGenerator.buildMux(dataInputNum);
        int selectBitNum = NetworkGenerator.getSelectBitNum(dataInputNum);
        Assertions.assertEquals(dataInputNum + selectBitNum, network.getPrimaryInputNum());

        int inputNum = network.getPrimaryInputNum();
        boolean[] piValues = new boolean[inputNum];
        for (int m = 0; m < (1 << inputNum); m++) {
            for (int i = 0; i < inputNum; i++) {
                piValues[i] = ((m >> i) & 1) == 1;
            }
            // S0 is the most significant select bit
            int select = 0;
            for (int j = 0; j < selectBitNum; j++) {
                select = (select << 1) | (piValues[dataInputNum + j] ? 1 : 0);
            }
            boolean expected = select < dataInputNum && piValues[select];
            Assertions.assertEquals(expected, network.evaluate(piValues));
        }
    }

    @Test
    public void testMux4Structure() {
        Network network = NetworkGenerator.buildMux(4);
        // 2 inverters, 4 decoders, 4 data gates, 3 ORs
        Assertions.assertEquals(13, network.getGateNum());
        Assertions.assertEquals(5, network.getGateDepth());
    }

    @Test
    public void testInvalidMux() {
        Assertions.assertThrows(InvalidParameterException.class, () -> NetworkGenerator.buildMux(1));
    }
}
