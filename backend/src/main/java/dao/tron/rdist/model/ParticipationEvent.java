package dao.tron.rdist.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Raw participation event as delivered by the stream integration. Converted to a
 * {@link ParticipationRecord} at the ingestion boundary.
 */
@Data
public class ParticipationEvent {

    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_.:-]{1,64}")
    private String channel;

    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_.:@-]{1,128}")
    private String participantId;

    /** unix seconds */
    @NotNull
    @PositiveOrZero
    private Long observedAt;

    /** explicit epoch; derived from observedAt when absent */
    @PositiveOrZero
    private Long epoch;
}
