package com.xilinx.rapidwright.rapidflowmap.network;

public enum NodeKind {
    PRIMARY_INPUT(0),
    PRIMARY_OUTPUT(1),
    GATE(2);

    private final int faninArity;

    NodeKind(int faninArity) {
        this.faninArity = faninArity;
    }

    public int getFaninArity() {
        return faninArity;
    }
}
