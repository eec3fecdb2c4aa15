package com.xilinx.rapidwright.rapidflowmap;

/**
 * A mapping parameter is out of range, e.g. a LUT size below one.
 */
public class InvalidParameterException extends FlowMapException {
    public InvalidParameterException(String message) {
        super(message);
    }
}
