package com.xilinx.rapidwright.rapidflowmap;

/**
 * The primary output has no primary input in its transitive fan-in.
 */
public class DisconnectedNetworkException extends FlowMapException {
    public DisconnectedNetworkException(String message) {
        super(message);
    }
}
