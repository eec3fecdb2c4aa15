package com.xilinx.rapidwright.rapidflowmap;

/**
 * Base class of all structural and parameter errors raised while building or mapping a network.
 * Mapping never returns a partial result once one of these is thrown.
 */
public class FlowMapException extends RuntimeException {
    public FlowMapException(String message) {
        super(message);
    }

    public FlowMapException(String message, Throwable cause) {
        super(message, cause);
    }
}
