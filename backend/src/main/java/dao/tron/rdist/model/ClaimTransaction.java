package dao.tron.rdist.model;

/**
 * Unsigned claim transaction for the caller to sign and broadcast.
 *
 * @param callDataHex ABI-encoded call (selector + arguments), 0x-prefixed
 */
public record ClaimTransaction(
        String contractAddress,
        String ownerAddress,
        String functionSignature,
        String callDataHex,
        long feeLimit,
        ClaimProof claim
) {}
