package dao.tron.rdist.model;

import java.math.BigInteger;
import java.util.List;

/**
 * What a participant needs to redeem one epoch: root, leaf position, amount and the
 * hex-encoded bytes32 proof in bottom-up order.
 */
public record ClaimProof(
        long epoch,
        String channel,
        String rootHex,
        int index,
        BigInteger amount,
        List<String> proof,
        boolean reissued
) {}
