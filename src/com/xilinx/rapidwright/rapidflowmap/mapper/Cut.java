package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Set of leaf nodes bounding the LUT that implements {@code root}. Leaves are kept sorted by id.
 */
public final class Cut {
    private final int root;
    private final List<Integer> leaves;

    public Cut(int root, Collection<Integer> leaves) {
        this.root = root;
        this.leaves = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(leaves)));
        assert !this.leaves.contains(root);
    }

    public int getRoot() {
        return root;
    }

    public List<Integer> getLeaves() {
        return leaves;
    }

    public int size() {
        return leaves.size();
    }

    public boolean contains(int nodeId) {
        return Collections.binarySearch(leaves, nodeId) >= 0;
    }

    // true if every leaf of this cut is also a leaf of other
    public boolean isSubsetOf(Cut other) {
        return size() <= other.size() && other.leaves.containsAll(leaves);
    }

    public static List<Integer> mergeLeaves(List<Integer> leaves1, List<Integer> leaves2) {
        List<Integer> merged = new ArrayList<>(leaves1.size() + leaves2.size());
        int i = 0;
        int j = 0;
        while (i < leaves1.size() || j < leaves2.size()) {
            if (j == leaves2.size() || (i < leaves1.size() && leaves1.get(i) < leaves2.get(j))) {
                merged.add(leaves1.get(i++));
            } else if (i == leaves1.size() || leaves2.get(j) < leaves1.get(i)) {
                merged.add(leaves2.get(j++));
            } else {
                merged.add(leaves1.get(i++));
                j++;
            }
        }
        return merged;
    }

    public static int compareLeaves(Cut cut1, Cut cut2) {
        for (int i = 0; i < Math.min(cut1.size(), cut2.size()); i++) {
            int cmp = Integer.compare(cut1.leaves.get(i), cut2.leaves.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(cut1.size(), cut2.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cut)) return false;
        Cut other = (Cut) o;
        return root == other.root && leaves.equals(other.leaves);
    }

    @Override
    public int hashCode() {
        return 31 * root + leaves.hashCode();
    }

    @Override
    public String toString() {
        return root + "<=" + leaves;
    }
}
