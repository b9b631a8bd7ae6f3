package com.sommerph.zkinbox.service.merkle;

import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.merkle.MerkleProof;
import com.sommerph.zkinbox.model.merkle.MerkleTree;
import com.sommerph.zkinbox.service.hash.FieldHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MerkleTreeService {

    // Largest padded size that still fits an int.
    public static final int MAX_DEPTH = 30;
    public static final int MAX_LEAVES = 1 << MAX_DEPTH;

    private final FieldHasher hasher;

    /**
     * Pads the leaves with zero up to the next power of two (at least two leaves, so
     * every tree has depth one or more) and folds pairs until one root remains.
     */
    public MerkleTree build(List<FieldElement> leaves) {
        int depth = depthFor(leaves.size());
        int paddedSize = 1 << depth;
        log.debug("Build Merkle tree over {} leaves, depth {}", leaves.size(), depth);

        List<FieldElement> padded = new ArrayList<>(paddedSize);
        padded.addAll(leaves);
        while (padded.size() < paddedSize) {
            padded.add(FieldElement.ZERO);
        }

        List<List<FieldElement>> levels = new ArrayList<>(depth + 1);
        levels.add(padded);
        for (int level = 0; level < depth; level++) {
            List<FieldElement> current = levels.get(level);
            List<FieldElement> next = new ArrayList<>(current.size() / 2);
            for (int i = 0; i < current.size(); i += 2) {
                next.add(hasher.hash(current.get(i), current.get(i + 1)));
            }
            levels.add(next);
        }
        return new MerkleTree(levels, leaves.size());
    }

    public MerkleProof proveMembership(MerkleTree tree, int leafIndex) {
        if (leafIndex < 0 || leafIndex >= tree.getLeafCount()) {
            throw new IndexOutOfBoundsException("Leaf index " + leafIndex + " outside [0, " + tree.getLeafCount() + ")");
        }
        List<FieldElement> pathElements = new ArrayList<>(tree.getDepth());
        List<Integer> pathIndices = new ArrayList<>(tree.getDepth());

        int index = leafIndex;
        for (int level = 0; level < tree.getDepth(); level++) {
            boolean isRight = (index & 1) == 1;
            int siblingIndex = isRight ? index - 1 : index + 1;
            // Levels are always even-sized after padding, so the sibling exists.
            pathElements.add(tree.getLevel(level).get(siblingIndex));
            pathIndices.add(isRight ? 1 : 0);
            index >>= 1;
        }
        return new MerkleProof(tree.getRoot(), pathElements, pathIndices);
    }

    /**
     * Recomputes the root from the leaf and the path. Malformed proofs return false.
     */
    public boolean verifyMembership(FieldElement leaf, MerkleProof proof) {
        if (leaf == null || proof == null || proof.getRoot() == null
                || proof.getPathElements() == null || proof.getPathIndices() == null
                || proof.getPathElements().size() != proof.getPathIndices().size()) {
            return false;
        }
        FieldElement node = leaf;
        for (int i = 0; i < proof.getPathElements().size(); i++) {
            FieldElement sibling = proof.getPathElements().get(i);
            Integer direction = proof.getPathIndices().get(i);
            if (sibling == null || direction == null) {
                return false;
            }
            if (direction == 0) {
                node = hasher.hash(node, sibling);
            } else if (direction == 1) {
                node = hasher.hash(sibling, node);
            } else {
                return false;
            }
        }
        return node.equals(proof.getRoot());
    }

    static int depthFor(int leafCount) {
        if (leafCount < 0 || leafCount > MAX_LEAVES) {
            throw new IllegalArgumentException("Leaf count " + leafCount + " outside [0, " + MAX_LEAVES + "]");
        }
        int depth = 1;
        while ((1 << depth) < leafCount) {
            depth++;
        }
        return depth;
    }

}
