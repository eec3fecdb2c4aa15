package com.xilinx.rapidwright.rapidflowmap;

public enum FlowMapStep {
    READ_NETWORK,
    LABELING,
    DEPTH_MAPPING,
    AREA_RECOVERY,
    VERIFICATION,
    WRITE_NETLIST;

    public static FlowMapStep[] getOrderedSteps() {
        return new FlowMapStep[] {
            READ_NETWORK, LABELING, DEPTH_MAPPING, AREA_RECOVERY, VERIFICATION, WRITE_NETLIST
        };
    }

    public static FlowMapStep getLastStep() {
        return WRITE_NETLIST;
    }
}
