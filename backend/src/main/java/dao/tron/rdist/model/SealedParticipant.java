package dao.tron.rdist.model;

import java.math.BigInteger;

/**
 * Frozen position of a participant in a sealed epoch. {@code index} never changes once assigned.
 */
public record SealedParticipant(
        long epoch,
        String channel,
        int index,
        String participantId,
        BigInteger amount
) {}
