package com.sommerph.zkinbox.service.group;

import com.sommerph.zkinbox.config.InboxProperties;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.merkle.MerkleProof;
import com.sommerph.zkinbox.service.hash.MixingFieldHasher;
import com.sommerph.zkinbox.service.merkle.MerkleTreeService;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryGroupMembershipServiceTest {

    private final MerkleTreeService merkleTreeService = new MerkleTreeService(new MixingFieldHasher());

    private InMemoryGroupMembershipService group(int rootHistory) {
        InboxProperties properties = new InboxProperties();
        properties.getGroup().setRootHistory(rootHistory);
        return new InMemoryGroupMembershipService(merkleTreeService, properties);
    }

    @Test
    void membershipProofsVerifyAgainstCurrentRoot() {
        InMemoryGroupMembershipService group = group(16);
        for (int i = 1; i <= 5; i++) {
            group.addMember(FieldElement.of(i));
        }
        MerkleProof proof = group.proveMembership(FieldElement.of(4));
        assertEquals(group.currentMerkleRoot(), proof.getRoot());
        assertTrue(merkleTreeService.verifyMembership(FieldElement.of(4), proof));
        assertThrows(NoSuchElementException.class, () -> group.proveMembership(FieldElement.of(99)));
    }

    @Test
    void addingExistingMemberKeepsRoot() {
        InMemoryGroupMembershipService group = group(16);
        FieldElement root = group.addMember(FieldElement.of(1));
        assertEquals(root, group.addMember(FieldElement.of(1)));
        assertEquals(1, group.size());
    }

    @Test
    void onlyRecentRootsAreAccepted() {
        InMemoryGroupMembershipService group = group(2);
        FieldElement first = group.addMember(FieldElement.of(1));
        FieldElement second = group.addMember(FieldElement.of(2));
        assertTrue(group.isAcceptedRoot(first));
        assertTrue(group.isAcceptedRoot(second));

        FieldElement third = group.addMember(FieldElement.of(3));
        assertFalse(group.isAcceptedRoot(first));
        assertTrue(group.isAcceptedRoot(third));
    }

}
