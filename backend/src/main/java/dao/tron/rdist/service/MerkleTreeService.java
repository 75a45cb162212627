package dao.tron.rdist.service;

import dao.tron.rdist.model.SealedParticipant;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static dao.tron.rdist.util.CryptoUtil.HASH_BYTES;
import static dao.tron.rdist.util.CryptoUtil.compareBytes;
import static dao.tron.rdist.util.CryptoUtil.concat;
import static dao.tron.rdist.util.CryptoUtil.keccak256;

/**
 * Keccak-256 Merkle tree over sealed participants.
 * <p>
 * Pairs are hashed sorted (smaller child first, unsigned byte order), so proofs carry no direction
 * flags. An unpaired trailing node is paired with itself rather than promoted. The on-ledger
 * verifier folds a proof the same way, see {@link #verify(byte[], List, byte[])}.
 */
@Service
public class MerkleTreeService {

    /** Domain separation prefix for claim leaves. */
    public static final byte[] LEAF_DOMAIN = "RDIST:CLAIM_LEAF:V1".getBytes(StandardCharsets.US_ASCII);

    /** Root of an epoch nobody participated in: keccak256("RDIST:EMPTY_EPOCH:V1"). */
    public static final byte[] EMPTY_ROOT = keccak256("RDIST:EMPTY_EPOCH:V1".getBytes(StandardCharsets.US_ASCII));

    /**
     * leaf = keccak256(domain || keccak256(channel) || uint64 epoch || uint32 index
     * || keccak256(participantId) || uint256 amount), all big-endian.
     */
    public byte[] leafHash(SealedParticipant p) {
        return leafHash(p.channel(), p.epoch(), p.index(), p.participantId(), p.amount());
    }

    public byte[] leafHash(String channel, long epoch, int index, String participantId, BigInteger amount) {
        if (index < 0) {
            throw new IllegalArgumentException("index cannot be negative");
        }
        byte[] packed = concat(
                LEAF_DOMAIN,
                channelId(channel),
                uint64ToBytes(epoch),
                uint32ToBytes(index),
                keccak256(participantId),
                uint256ToBytes(amount)
        );
        return keccak256(packed);
    }

    /**
     * 32-byte channel identifier as used in leaves and contract calls.
     */
    public static byte[] channelId(String channel) {
        return keccak256(channel);
    }

    public List<byte[]> leafHashes(List<SealedParticipant> participants) {
        List<byte[]> leaves = new ArrayList<>(participants.size());
        for (SealedParticipant p : participants) {
            leaves.add(leafHash(p));
        }
        return leaves;
    }

    /**
     * All levels bottom-up; {@code levels.get(0)} are the leaves, the last level holds the root.
     * Empty input yields no levels.
     */
    public List<List<byte[]>> buildLevels(List<byte[]> leaves) {
        if (leaves == null) {
            throw new IllegalArgumentException("No leaves");
        }
        if (leaves.isEmpty()) {
            return Collections.emptyList();
        }

        List<List<byte[]>> levels = new ArrayList<>();
        List<byte[]> current = new ArrayList<>(leaves.size());
        for (byte[] leaf : leaves) {
            if (leaf == null || leaf.length != HASH_BYTES) {
                throw new IllegalArgumentException("Each leaf must be 32 bytes");
            }
            current.add(leaf.clone());
        }
        levels.add(current);

        while (current.size() > 1) {
            List<byte[]> next = new ArrayList<>((current.size() + 1) / 2);
            for (int i = 0; i < current.size(); i += 2) {
                byte[] left = current.get(i);
                // Odd node pairs with itself
                byte[] right = i + 1 < current.size() ? current.get(i + 1) : left;
                next.add(hashPair(left, right));
            }
            levels.add(next);
            current = next;
        }
        return levels;
    }

    public byte[] computeRoot(List<byte[]> leaves) {
        return rootOf(buildLevels(leaves));
    }

    public byte[] computeRootForParticipants(List<SealedParticipant> participants) {
        return computeRoot(leafHashes(participants));
    }

    public byte[] rootOf(List<List<byte[]>> levels) {
        if (levels.isEmpty()) {
            return EMPTY_ROOT.clone();
        }
        return levels.get(levels.size() - 1).get(0).clone();
    }

    public List<byte[]> buildProof(List<byte[]> leaves, int index) {
        return buildProofFromLevels(buildLevels(leaves), index);
    }

    /**
     * Sibling hashes leaf-to-root. Where a node has no sibling the node itself is recorded,
     * matching the duplicated pairing used to build the level above.
     */
    public List<byte[]> buildProofFromLevels(List<List<byte[]>> levels, int index) {
        if (levels.isEmpty()) {
            throw new IllegalArgumentException("No leaves");
        }
        int leafCount = levels.get(0).size();
        if (index < 0 || index >= leafCount) {
            throw new IndexOutOfBoundsException("Invalid leaf index: " + index);
        }

        List<byte[]> proof = new ArrayList<>(levels.size() - 1);
        int idx = index;
        for (int d = 0; d < levels.size() - 1; d++) {
            List<byte[]> level = levels.get(d);
            int sibling = idx ^ 1;
            byte[] node = sibling < level.size() ? level.get(sibling) : level.get(idx);
            proof.add(node.clone());
            idx = idx / 2;
        }
        return proof;
    }

    public boolean verify(byte[] leaf, List<byte[]> proof, byte[] root) {
        if (leaf == null || root == null || leaf.length != HASH_BYTES || root.length != HASH_BYTES) {
            return false;
        }
        byte[] hash = leaf;
        for (byte[] sibling : proof) {
            if (sibling == null || sibling.length != HASH_BYTES) {
                return false;
            }
            hash = hashPair(hash, sibling);
        }
        return compareBytes(hash, root) == 0;
    }

    /**
     * Hash a pair of 32-byte nodes with sorted-pair keccak.
     */
    public byte[] hashPair(byte[] a, byte[] b) {
        if (a == null || b == null || a.length != HASH_BYTES || b.length != HASH_BYTES) {
            throw new IllegalArgumentException("hashPair requires two 32-byte inputs");
        }
        return compareBytes(a, b) <= 0 ? keccak256(concat(a, b)) : keccak256(concat(b, a));
    }

    private static byte[] uint256ToBytes(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("uint256 value is null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint256 cannot be negative");
        }
        byte[] raw = value.toByteArray();
        // toByteArray may carry a leading sign byte
        int offset = raw.length > 1 && raw[0] == 0 ? 1 : 0;
        int len = raw.length - offset;
        if (len > 32) {
            throw new IllegalArgumentException("uint256 value too large");
        }
        byte[] out = new byte[32];
        System.arraycopy(raw, offset, out, 32 - len, len);
        return out;
    }

    private static byte[] uint32ToBytes(int v) {
        return new byte[]{
            (byte)(v >>> 24),
            (byte)(v >>> 16),
            (byte)(v >>> 8),
            (byte)v
        };
    }

    private static byte[] uint64ToBytes(long v) {
        return new byte[]{
            (byte)(v >>> 56),
            (byte)(v >>> 48),
            (byte)(v >>> 40),
            (byte)(v >>> 32),
            (byte)(v >>> 24),
            (byte)(v >>> 16),
            (byte)(v >>> 8),
            (byte)v
        };
    }
}
