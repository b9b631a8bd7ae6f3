package com.sommerph.zkinbox.service.group;

import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.merkle.MerkleProof;

/**
 * Party maintaining the membership set. The submission core only reads roots and
 * inclusion paths from it and never persists the tree itself.
 */
public interface GroupMembershipProvider {

    FieldElement currentMerkleRoot();

    /**
     * @throws java.util.NoSuchElementException if the commitment is not a member
     */
    MerkleProof proveMembership(FieldElement identityCommitment);

    /** True for the current root and a bounded number of roots it replaced. */
    boolean isAcceptedRoot(FieldElement root);

}
