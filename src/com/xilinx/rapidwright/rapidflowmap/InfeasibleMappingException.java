package com.xilinx.rapidwright.rapidflowmap;

/**
 * A node cannot be covered by any LUT with the requested number of inputs.
 */
public class InfeasibleMappingException extends FlowMapException {
    public InfeasibleMappingException(String message) {
        super(message);
    }
}
