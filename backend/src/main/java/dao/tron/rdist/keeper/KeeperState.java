package dao.tron.rdist.keeper;

public enum KeeperState {
    IDLE,
    SEALING,
    PUBLISHING,
    MAINTAINING,
    BACKOFF
}
