package dao.tron.rdist.keeper;

public record RetryDecision(boolean retry, long delayMs) {

    public static final RetryDecision STOP = new RetryDecision(false, 0L);

    public static RetryDecision after(long delayMs) {
        return new RetryDecision(true, delayMs);
    }
}
