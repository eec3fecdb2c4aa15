package com.xilinx.rapidwright.rapidflowmap;

/**
 * The fan-in relation of the network contains a cycle.
 */
public class CyclicNetworkException extends FlowMapException {
    public CyclicNetworkException(String message) {
        super(message);
    }
}
