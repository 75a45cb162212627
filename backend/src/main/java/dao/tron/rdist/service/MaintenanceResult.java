package dao.tron.rdist.service;

/**
 * @param action  {@code compound} or {@code reconcile}
 * @param outcome {@code DONE}, {@code SIMULATED}, {@code SKIPPED} or {@code FAILED}
 * @param count   claims reconciled, or 1 for a compound that ran
 */
public record MaintenanceResult(
        String channel,
        String action,
        String outcome,
        int count,
        String detail
) {}
