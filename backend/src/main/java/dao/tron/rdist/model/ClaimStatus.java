package dao.tron.rdist.model;

public enum ClaimStatus {
    PENDING,
    CONFIRMED,
    FAILED
}
