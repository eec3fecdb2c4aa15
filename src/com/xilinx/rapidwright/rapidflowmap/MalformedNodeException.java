package com.xilinx.rapidwright.rapidflowmap;

/**
 * A node has the wrong fan-in arity, a duplicate name, a dangling output or references an unknown node.
 */
public class MalformedNodeException extends FlowMapException {
    public MalformedNodeException(String message) {
        super(message);
    }
}
