package dao.tron.rdist.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the RootPublished event in a TRON transaction receipt.
 * <p>
 * - topic0 == keccak256("RootPublished(bytes32,uint64,bytes32,uint32,uint32)")
 * - indexed channelId and epoch come from topics[1], topics[2]
 * - root, claimCount and slot come from log.data
 */
@Slf4j
@Component
public class RootPublishedEventReader {

    public static final String EVENT_SIGNATURE = "RootPublished(bytes32,uint64,bytes32,uint32,uint32)";

    private static final String TOPIC0 = normalize32(Hash.sha3String(EVENT_SIGNATURE)).toLowerCase(Locale.ROOT);

    public Optional<RootPublishedEvent> findEvent(Response.TransactionInfo info) {
        if (info == null || info.getLogCount() == 0) return Optional.empty();

        for (int i = 0; i < info.getLogCount(); i++) {
            Response.TransactionInfo.Log l = info.getLog(i);
            if (l.getTopicsCount() < 3) continue;

            String topic0 = Numeric.toHexString(l.getTopics(0).toByteArray());
            if (!normalize32(topic0).equalsIgnoreCase(TOPIC0)) continue;

            try {
                return Optional.of(decodeIndexedLog(
                        Numeric.toHexString(l.getTopics(1).toByteArray()),
                        Numeric.toHexString(l.getTopics(2).toByteArray()),
                        Numeric.toHexString(l.getData().toByteArray())));
            } catch (RuntimeException e) {
                log.warn("Failed to decode RootPublished log for tx {}: {}",
                        Numeric.toHexString(info.getId().toByteArray()), e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * topics[1] = bytes32 channelId, topics[2] = uint64 epoch (left padded),
     * data = abi.encode(bytes32 root, uint32 claimCount, uint32 slot)
     */
    public static RootPublishedEvent decodeIndexedLog(String topicChannelIdHex, String topicEpochHex, String dataHex) {
        BigInteger epoch = Numeric.toBigInt(topicEpochHex);

        List<Type<?>> decoded = decode(
                dataHex,
                new TypeReference<Bytes32>() {},
                new TypeReference<Uint32>() {},
                new TypeReference<Uint32>() {}
        );
        if (decoded.size() != 3) {
            throw new IllegalStateException("Unexpected decoded outputs=" + decoded.size() + ", expected=3");
        }

        Bytes32 root = (Bytes32) decoded.get(0);
        Uint32 claimCount = (Uint32) decoded.get(1);
        Uint32 slot = (Uint32) decoded.get(2);

        return new RootPublishedEvent(
                normalize32(topicChannelIdHex),
                epoch.longValueExact(),
                "0x" + Numeric.toHexStringNoPrefix(root.getValue()),
                claimCount.getValue().intValueExact(),
                slot.getValue().intValueExact()
        );
    }

    /**
     * Same event emitted without indexed params: all five values in log.data.
     */
    public static RootPublishedEvent decodeLogData(String dataHex) {
        List<Type<?>> decoded = decode(
                dataHex,
                new TypeReference<Bytes32>() {},
                new TypeReference<Uint64>() {},
                new TypeReference<Bytes32>() {},
                new TypeReference<Uint32>() {},
                new TypeReference<Uint32>() {}
        );
        if (decoded.size() != 5) {
            throw new IllegalStateException("Unexpected decoded outputs=" + decoded.size() + ", expected=5");
        }
        Bytes32 channelId = (Bytes32) decoded.get(0);
        Uint64 epoch = (Uint64) decoded.get(1);
        Bytes32 root = (Bytes32) decoded.get(2);
        Uint32 claimCount = (Uint32) decoded.get(3);
        Uint32 slot = (Uint32) decoded.get(4);

        return new RootPublishedEvent(
                "0x" + Numeric.toHexStringNoPrefix(channelId.getValue()),
                epoch.getValue().longValueExact(),
                "0x" + Numeric.toHexStringNoPrefix(root.getValue()),
                claimCount.getValue().intValueExact(),
                slot.getValue().intValueExact()
        );
    }

    private static String normalize32(String hex) {
        String c = hex == null ? "" : hex;
        if (c.startsWith("0x") || c.startsWith("0X")) c = c.substring(2);
        int n = 64;
        if (c.length() < n) {
            c = "0".repeat(n - c.length()) + c;
        } else if (c.length() > n) {
            c = c.substring(c.length() - n);
        }
        return "0x" + c;
    }

    private static List<Type<?>> decode(String dataHex, TypeReference<?>... outputs) {
        String hex = dataHex.startsWith("0x") || dataHex.startsWith("0X") ? dataHex : "0x" + dataHex;

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<TypeReference<Type>> typed = (List) Arrays.asList(outputs);

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<Type<?>> decoded = (List) FunctionReturnDecoder.decode(hex, typed);
        return decoded;
    }
}
