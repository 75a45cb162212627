package dao.tron.rdist.model;

import lombok.Data;

@Data
public class SealedEpoch {

    private long epoch;
    private String channel;
    private String rootHex;
    private int participantCount;
    private long sealedAt; // unix seconds
    /** Flips false -> true exactly once, when the root is on-ledger. */
    private boolean published;
    /** TRON transaction id of publishRoot; null when nothing was broadcast. */
    private String publishTxId;
    private long publishedAt; // unix seconds

    public EpochKey key() {
        return new EpochKey(epoch, channel);
    }

    public boolean isEmpty() {
        return participantCount == 0;
    }

    public SealedEpoch copy() {
        SealedEpoch c = new SealedEpoch();
        c.setEpoch(epoch);
        c.setChannel(channel);
        c.setRootHex(rootHex);
        c.setParticipantCount(participantCount);
        c.setSealedAt(sealedAt);
        c.setPublished(published);
        c.setPublishTxId(publishTxId);
        c.setPublishedAt(publishedAt);
        return c;
    }
}
