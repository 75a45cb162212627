package dao.tron.rdist.ledger;

import dao.tron.rdist.service.MerkleTreeService;
import dao.tron.rdist.util.CryptoUtil;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Bool;
import org.tron.trident.abi.datatypes.DynamicArray;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.generated.Bytes32;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.abi.datatypes.generated.Uint32;
import org.tron.trident.abi.datatypes.generated.Uint64;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Function definitions of the reward ring contract.
 * <p>
 * Channels are addressed on-chain by {@code keccak256(channel)}, the same digest that goes into
 * each leaf.
 */
public final class RingContractAbi {

    public static final String PUBLISH_ROOT = "publishRoot(bytes32,uint64,bytes32,uint32)";
    public static final String CLAIM = "claim(bytes32,uint64,uint32,bytes32,uint256,bytes32[])";
    public static final String COMPOUND = "compound(bytes32)";

    private RingContractAbi() {}

    public static Function publishRoot(String channel, long epoch, String rootHex, int claimCount) {
        return new Function(
                "publishRoot",
                Arrays.asList(
                        channelId(channel),
                        new Uint64(BigInteger.valueOf(epoch)),
                        new Bytes32(CryptoUtil.fromHex32(rootHex)),
                        new Uint32(BigInteger.valueOf(claimCount))
                ),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
    }

    /**
     * {@code slotOf(channelId, epoch) returns (bool present, bytes32 root, uint32 claimCount, uint32 slot)}
     */
    public static Function slotOf(String channel, long epoch) {
        return new Function(
                "slotOf",
                Arrays.asList(channelId(channel), new Uint64(BigInteger.valueOf(epoch))),
                Arrays.asList(
                        new TypeReference<Bool>() {},
                        new TypeReference<Bytes32>() {},
                        new TypeReference<Uint32>() {},
                        new TypeReference<Uint32>() {}
                )
        );
    }

    public static Function isClaimed(String channel, long epoch, int index) {
        return new Function(
                "isClaimed",
                Arrays.asList(
                        channelId(channel),
                        new Uint64(BigInteger.valueOf(epoch)),
                        new Uint32(BigInteger.valueOf(index))
                ),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
    }

    /**
     * {@code positionOf(channelId) returns (bool paused, uint256 pendingDeposits,
     * uint256 pendingWithdrawals, bool active, uint64 lockEnd)}
     */
    public static Function positionOf(String channel) {
        return new Function(
                "positionOf",
                Collections.singletonList(channelId(channel)),
                Arrays.asList(
                        new TypeReference<Bool>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Bool>() {},
                        new TypeReference<Uint64>() {}
                )
        );
    }

    public static Function compound(String channel) {
        return new Function(
                "compound",
                Collections.singletonList(channelId(channel)),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
    }

    public static Function claim(String channel, long epoch, int index, String participantId,
                                 BigInteger amount, List<String> proofHex) {
        List<Bytes32> proof = new ArrayList<>(proofHex.size());
        for (String hex : proofHex) {
            proof.add(new Bytes32(CryptoUtil.fromHex32(hex)));
        }
        return new Function(
                "claim",
                Arrays.asList(
                        channelId(channel),
                        new Uint64(BigInteger.valueOf(epoch)),
                        new Uint32(BigInteger.valueOf(index)),
                        new Bytes32(CryptoUtil.keccak256(participantId)),
                        new Uint256(amount),
                        new DynamicArray<>(Bytes32.class, proof)
                ),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
    }

    private static Bytes32 channelId(String channel) {
        return new Bytes32(MerkleTreeService.channelId(channel));
    }
}
