package com.sommerph.zkinbox.model.merkle;

import com.sommerph.zkinbox.model.field.FieldElement;

import java.util.List;

/**
 * Immutable binary hash tree. Level 0 holds the leaves padded with
 * {@link FieldElement#ZERO} to a power of two, the last level holds only the root.
 */
public final class MerkleTree {

    private final List<List<FieldElement>> levels;
    private final int leafCount;

    public MerkleTree(List<List<FieldElement>> levels, int leafCount) {
        if (levels.isEmpty() || levels.get(levels.size() - 1).size() != 1) {
            throw new IllegalArgumentException("Tree must end in a single root node");
        }
        this.levels = levels.stream().map(List::copyOf).toList();
        this.leafCount = leafCount;
    }

    public FieldElement getRoot() {
        return levels.get(levels.size() - 1).get(0);
    }

    public int getDepth() {
        return levels.size() - 1;
    }

    /** Number of leaves supplied before padding. */
    public int getLeafCount() {
        return leafCount;
    }

    public List<FieldElement> getLevel(int level) {
        return levels.get(level);
    }

    public List<FieldElement> getLeaves() {
        return levels.get(0).subList(0, leafCount);
    }

    public int indexOf(FieldElement leaf) {
        return getLeaves().indexOf(leaf);
    }

}
