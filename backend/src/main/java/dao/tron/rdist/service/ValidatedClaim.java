package dao.tron.rdist.service;

import dao.tron.rdist.model.ClaimProof;
import dao.tron.rdist.model.ClaimRecord;
import dao.tron.rdist.model.SealedEpoch;
import dao.tron.rdist.model.SealedParticipant;

import java.util.Optional;

/**
 * Outcome of a successful validation: the self-verified proof plus the rows it was derived from.
 */
public record ValidatedClaim(
        SealedEpoch epoch,
        SealedParticipant participant,
        ClaimProof proof,
        Optional<ClaimRecord> pending
) {
    public boolean isReissue() {
        return pending.isPresent();
    }
}
