package dao.tron.rdist.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;

@Configuration
@Validated
@ConfigurationProperties(prefix = "epoch")
@Data
public class EpochProperties {

    /**
     * Unix seconds at which epoch 0 starts.
     */
    @Min(0)
    private long genesisSeconds = 0;

    /**
     * Epoch window length in seconds.
     */
    @Min(1)
    private long lengthSeconds = 3600;

    /**
     * Extra seconds after a window closes before it is eligible for sealing.
     */
    @Min(0)
    private long sealDelaySeconds = 60;

    /**
     * Reward per participant in token base units (string decimal).
     */
    @NotBlank
    private String amountPerParticipant = "1000000000";

    public BigInteger amountPerParticipantValue() {
        return new BigInteger(amountPerParticipant);
    }

    /**
     * Unix second at which the window of {@code epoch} closes.
     */
    public long windowEnd(long epoch) {
        return genesisSeconds + (epoch + 1) * lengthSeconds;
    }

    /**
     * Epoch whose window contains {@code unixSeconds}, or -1 before genesis.
     */
    public long epochAt(long unixSeconds) {
        if (unixSeconds < genesisSeconds) return -1;
        return (unixSeconds - genesisSeconds) / lengthSeconds;
    }

    public boolean isSealable(long epoch, long nowSeconds) {
        return nowSeconds >= windowEnd(epoch) + sealDelaySeconds;
    }

    /**
     * Latest epoch that is sealable at {@code nowSeconds}, or -1 if none is.
     */
    public long latestSealableEpoch(long nowSeconds) {
        return epochAt(nowSeconds - sealDelaySeconds) - 1;
    }
}
