package dao.tron.rdist.config;

import dao.tron.rdist.ring.SlotPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Shape of the on-ledger ring buffer. These values must match the deployed contract, so slots
 * and max-claims have no defaults and startup fails when they are unset.
 */
@Configuration
@Validated
@ConfigurationProperties(prefix = "ring")
@Data
public class RingProperties {

    /**
     * Ring slots per channel (K).
     */
    @NotNull
    @Min(1)
    private Integer slots;

    /**
     * Claimable indices per slot (C). Must be a power of two.
     */
    @NotNull
    @Min(1)
    private Integer maxClaims;

    /**
     * How a newly published epoch picks its slot.
     */
    @NotNull
    private SlotPolicy slotPolicy = SlotPolicy.FIFO;

    /**
     * Slots this many evictions away (or closer) from losing unclaimed leaves are reported.
     */
    @Min(1)
    private int evictionWarningDistance = 2;

    @AssertTrue(message = "ring.max-claims must be a power of two")
    public boolean isMaxClaimsPowerOfTwo() {
        return maxClaims == null || (maxClaims > 0 && Integer.bitCount(maxClaims) == 1);
    }
}
