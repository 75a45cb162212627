package dao.tron.rdist.keeper;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * What one keeper tick did. Logged as a single structured line and kept in {@link TickHistory}.
 */
@Data
public class TickReport {

    private long tickId;
    private long startedAt;  // unix seconds
    private long finishedAt; // unix seconds
    private boolean dryRun;
    private List<String> channels = new ArrayList<>();
    private int sealed;
    private int rejected;
    private int published;
    private int adopted;
    private int skippedEmpty;
    private int simulated;
    private int compounded;
    private int reconciled;
    private int retries;
    private List<String> errors = new ArrayList<>();
    private boolean retriesExhausted;
    private boolean success;

    public void addError(String channel, String code, String message) {
        errors.add(channel + ": [" + code + "] " + message);
    }

    public String toLogLine() {
        return "keeper.tick id=" + tickId
                + " success=" + success
                + " dryRun=" + dryRun
                + " channels=" + channels.size()
                + " sealed=" + sealed
                + " rejected=" + rejected
                + " published=" + published
                + " adopted=" + adopted
                + " skippedEmpty=" + skippedEmpty
                + " simulated=" + simulated
                + " compounded=" + compounded
                + " reconciled=" + reconciled
                + " retries=" + retries
                + " retriesExhausted=" + retriesExhausted
                + " errors=" + errors.size()
                + " durationSec=" + (finishedAt - startedAt);
    }
}
