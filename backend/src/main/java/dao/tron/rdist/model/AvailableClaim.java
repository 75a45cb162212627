package dao.tron.rdist.model;

public record AvailableClaim(long epoch, String channel, int index) {}
