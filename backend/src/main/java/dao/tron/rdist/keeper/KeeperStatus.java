package dao.tron.rdist.keeper;

/**
 * Immutable keeper position. {@link #next} is a pure transition function:
 * <pre>
 * IDLE --START--> SEALING --PHASE_COMPLETE--> PUBLISHING --PHASE_COMPLETE--> MAINTAINING --PHASE_COMPLETE--> IDLE
 * SEALING|PUBLISHING|MAINTAINING --TRANSIENT_FAILURE--> BACKOFF --RETRY--> (interrupted phase)
 * BACKOFF --GIVE_UP--> IDLE
 * any --ABORT--> IDLE
 * </pre>
 *
 * @param resumeTo phase to return to from {@link KeeperState#BACKOFF}, null otherwise
 */
public record KeeperStatus(KeeperState state, KeeperState resumeTo) {

    public static final KeeperStatus IDLE = new KeeperStatus(KeeperState.IDLE, null);

    public KeeperStatus next(KeeperEvent event) {
        if (event == KeeperEvent.ABORT) {
            return IDLE;
        }
        switch (state) {
            case IDLE:
                if (event == KeeperEvent.START) return of(KeeperState.SEALING);
                break;
            case SEALING:
                if (event == KeeperEvent.PHASE_COMPLETE) return of(KeeperState.PUBLISHING);
                if (event == KeeperEvent.TRANSIENT_FAILURE) return backoff(state);
                break;
            case PUBLISHING:
                if (event == KeeperEvent.PHASE_COMPLETE) return of(KeeperState.MAINTAINING);
                if (event == KeeperEvent.TRANSIENT_FAILURE) return backoff(state);
                break;
            case MAINTAINING:
                if (event == KeeperEvent.PHASE_COMPLETE) return IDLE;
                if (event == KeeperEvent.TRANSIENT_FAILURE) return backoff(state);
                break;
            case BACKOFF:
                if (event == KeeperEvent.RETRY) return of(resumeTo);
                if (event == KeeperEvent.GIVE_UP) return IDLE;
                if (event == KeeperEvent.TRANSIENT_FAILURE) return this;
                break;
            default:
                break;
        }
        throw new IllegalStateException("No transition from " + state + " on " + event);
    }

    private static KeeperStatus of(KeeperState state) {
        return new KeeperStatus(state, null);
    }

    private static KeeperStatus backoff(KeeperState interrupted) {
        return new KeeperStatus(KeeperState.BACKOFF, interrupted);
    }
}
