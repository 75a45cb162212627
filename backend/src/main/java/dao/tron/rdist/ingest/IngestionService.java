package dao.tron.rdist.ingest;

import dao.tron.rdist.config.EpochProperties;
import dao.tron.rdist.config.IngestionProperties;
import dao.tron.rdist.exception.InvalidInputException;
import dao.tron.rdist.model.EpochKey;
import dao.tron.rdist.model.ParticipationEvent;
import dao.tron.rdist.model.ParticipationRecord;
import dao.tron.rdist.repository.InMemoryParticipationStore;
import dao.tron.rdist.repository.SealedEpochRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Entry point for raw participation events. Validates them, converts them to
 * {@link ParticipationRecord}s and appends them to the store.
 */
@Slf4j
@Service
public class IngestionService {

    private final Validator validator;
    private final InMemoryParticipationStore store;
    private final SealedEpochRepository sealedRepository;
    private final EpochProperties epochProps;
    private final LateEventPolicy lateEventPolicy;
    private final int flaggedRetention;
    private final Clock clock;

    private final Deque<LateEvent> flagged = new ArrayDeque<>();
    private final AtomicLong droppedCount = new AtomicLong();

    public IngestionService(Validator validator,
                            InMemoryParticipationStore store,
                            SealedEpochRepository sealedRepository,
                            EpochProperties epochProps,
                            IngestionProperties ingestionProps,
                            Clock clock) {
        this.validator = validator;
        this.store = store;
        this.sealedRepository = sealedRepository;
        this.epochProps = epochProps;
        this.lateEventPolicy = ingestionProps.getLateEventPolicy();
        this.flaggedRetention = Math.max(1, ingestionProps.getFlaggedRetention());
        this.clock = clock;
        log.info("IngestionService initialized: lateEventPolicy={}", lateEventPolicy);
    }

    public IngestionOutcome accept(ParticipationEvent event) {
        ParticipationRecord record = toRecord(event);
        long now = clock.instant().getEpochSecond();

        if (!isLate(record, now)) {
            store.append(record);
            return IngestionOutcome.ACCEPTED;
        }

        switch (lateEventPolicy) {
            case DROP -> {
                droppedCount.incrementAndGet();
                log.debug("Dropping late participation: {} participant={}", record.key(), record.participantId());
                return IngestionOutcome.DROPPED;
            }
            case NEXT_EPOCH -> {
                long open = epochProps.epochAt(now);
                EpochKey target = new EpochKey(open, record.channel());
                if (open < 0 || sealedRepository.find(target).isPresent()) {
                    droppedCount.incrementAndGet();
                    log.warn("No open epoch for late participation {} participant={}, dropping",
                            record.key(), record.participantId());
                    return IngestionOutcome.DROPPED;
                }
                store.append(new ParticipationRecord(open, record.channel(), record.participantId(), now));
                log.debug("Late participation moved {} -> {}", record.key(), target);
                return IngestionOutcome.REASSIGNED;
            }
            case FLAG -> {
                synchronized (flagged) {
                    if (flagged.size() >= flaggedRetention) flagged.removeFirst();
                    flagged.addLast(new LateEvent(record, now));
                }
                log.info("Flagged late participation: {} participant={}", record.key(), record.participantId());
                return IngestionOutcome.FLAGGED;
            }
            default -> throw new IllegalStateException("Unhandled policy " + lateEventPolicy);
        }
    }

    /**
     * Late once the epoch has passed its seal point, whether or not the keeper has sealed it yet.
     * The sealer never seals before that point, so nothing accepted here can miss a snapshot.
     */
    boolean isLate(ParticipationRecord record, long now) {
        return epochProps.isSealable(record.epoch(), now) || sealedRepository.find(record.key()).isPresent();
    }

    public List<LateEvent> getFlagged() {
        synchronized (flagged) {
            return new ArrayList<>(flagged);
        }
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    /**
     * Boundary conversion; nothing past this point sees a {@link ParticipationEvent}.
     */
    ParticipationRecord toRecord(ParticipationEvent event) {
        if (event == null) {
            throw new InvalidInputException("event is null");
        }
        Set<ConstraintViolation<ParticipationEvent>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidInputException("Invalid participation event: " + details);
        }

        long observedAt = event.getObservedAt();
        long derived = epochProps.epochAt(observedAt);
        long epoch = event.getEpoch() != null ? event.getEpoch() : derived;
        if (epoch < 0) {
            throw new InvalidInputException("observedAt " + observedAt + " is before genesis");
        }
        long current = epochProps.epochAt(clock.instant().getEpochSecond());
        if (epoch > current) {
            throw new InvalidInputException("epoch " + epoch + " is in the future (current " + current + ")");
        }
        return new ParticipationRecord(epoch, event.getChannel(), event.getParticipantId(), observedAt);
    }
}
