package com.xilinx.rapidwright.rapidflowmap.network;

import java.util.Collections;
import java.util.List;

/**
 * Immutable vertex of a {@link Network}. Neighbours are referenced by integer id only.
 */
public final class Node {
    private final int id;
    private final String name;
    private final NodeKind kind;
    private final int truthTable;
    private final List<Integer> fanins;
    private final List<Integer> fanouts;

    Node(int id, String name, NodeKind kind, int truthTable, List<Integer> fanins, List<Integer> fanouts) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.truthTable = truthTable;
        this.fanins = Collections.unmodifiableList(fanins);
        this.fanouts = Collections.unmodifiableList(fanouts);
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean isPrimaryInput() {
        return kind == NodeKind.PRIMARY_INPUT;
    }

    public boolean isPrimaryOutput() {
        return kind == NodeKind.PRIMARY_OUTPUT;
    }

    public boolean isGate() {
        return kind == NodeKind.GATE;
    }

    // only meaningful for gates
    public int getTruthTable() {
        assert isGate();
        return truthTable;
    }

    public List<Integer> getFanins() {
        return fanins;
    }

    public List<Integer> getFanouts() {
        return fanouts;
    }

    @Override
    public String toString() {
        return name;
    }
}
