package com.sommerph.zkinbox.service.group;

import com.sommerph.zkinbox.config.InboxProperties;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.merkle.MerkleProof;
import com.sommerph.zkinbox.model.merkle.MerkleTree;
import com.sommerph.zkinbox.service.merkle.MerkleTreeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

@Slf4j
@Service
public class InMemoryGroupMembershipService implements GroupMembershipProvider {

    private final MerkleTreeService merkleTreeService;
    private final int rootHistory;

    private final List<FieldElement> members = new ArrayList<>();
    private final Deque<FieldElement> recentRoots = new ArrayDeque<>();
    private MerkleTree tree;

    public InMemoryGroupMembershipService(MerkleTreeService merkleTreeService, InboxProperties properties) {
        this.merkleTreeService = merkleTreeService;
        this.rootHistory = Math.max(1, properties.getGroup().getRootHistory());
        rebuild();
    }

    /**
     * Adds a commitment as the next leaf; adding an existing member is a no-op.
     *
     * @return the root after the change
     */
    public synchronized FieldElement addMember(FieldElement commitment) {
        if (members.contains(commitment)) {
            log.info("Commitment already in group, root unchanged");
            return tree.getRoot();
        }
        members.add(commitment);
        rebuild();
        log.info("Add group member #{}, new root {}", members.size(), tree.getRoot());
        return tree.getRoot();
    }

    public synchronized int size() {
        return members.size();
    }

    @Override
    public synchronized FieldElement currentMerkleRoot() {
        return tree.getRoot();
    }

    @Override
    public synchronized MerkleProof proveMembership(FieldElement identityCommitment) {
        int index = tree.indexOf(identityCommitment);
        if (index < 0) {
            throw new NoSuchElementException("Commitment is not a group member");
        }
        return merkleTreeService.proveMembership(tree, index);
    }

    @Override
    public synchronized boolean isAcceptedRoot(FieldElement root) {
        return recentRoots.contains(root);
    }

    private void rebuild() {
        tree = merkleTreeService.build(members);
        recentRoots.addFirst(tree.getRoot());
        while (recentRoots.size() > rootHistory) {
            recentRoots.removeLast();
        }
    }

}
