package com.agriguard.audit;

import com.agriguard.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Running counters for both engines, updated synchronously by every mutating
 * operation. Counters are never recomputed from the event log; the two are
 * independent writes inside the same operation.
 */
public class StatsAggregator {

    private volatile InsuranceStatistics insurance = InsuranceStatistics.empty();
    private volatile DisputeStatistics disputes = DisputeStatistics.empty();

    /**
     * Fails with {@link ValidationException} when recording a policy of this coverage
     * and fee would overflow the running totals.
     */
    public synchronized void ensureCanRecordPolicy(long coverage, long fee) {
        InsuranceStatistics i = insurance;
        if (coverage > Long.MAX_VALUE - i.totalCoverage()) {
            throw new ValidationException("cap " + coverage + " would overflow total coverage");
        }
        if (fee > Long.MAX_VALUE - i.totalFeesCollected()) {
            throw new ValidationException("fee " + fee + " would overflow total fees collected");
        }
    }

    public void update(StatsAction action) {
        update(action, 0L, 0L);
    }

    /**
     * @param action which counters move
     * @param amount coverage for {@code POLICY_CREATED}, payout for {@code POLICY_SETTLED}
     * @param fee fee for {@code POLICY_CREATED}, ignored otherwise
     */
    public synchronized void update(StatsAction action, long amount, long fee) {
        InsuranceStatistics i = insurance;
        DisputeStatistics d = disputes;
        switch (action) {
            case POLICY_CREATED -> insurance = new InsuranceStatistics(
                i.totalPolicies() + 1, Math.addExact(i.totalCoverage(), amount), i.totalPayouts(),
                i.activePolicies() + 1, Math.addExact(i.totalFeesCollected(), fee));
            case POLICY_SETTLED -> insurance = new InsuranceStatistics(
                i.totalPolicies(), i.totalCoverage(), Math.addExact(i.totalPayouts(), amount),
                Math.max(0, i.activePolicies() - 1), i.totalFeesCollected());
            case POLICY_DELETED -> insurance = new InsuranceStatistics(
                i.totalPolicies(), i.totalCoverage(), i.totalPayouts(),
                Math.max(0, i.activePolicies() - 1), i.totalFeesCollected());
            case DISPUTE_CREATED -> disputes = new DisputeStatistics(
                d.totalDisputes() + 1, d.resolvedDisputes(), d.rejectedDisputes(),
                d.totalVotesCast(), d.activeJurors());
            case DISPUTE_RESOLVED -> disputes = new DisputeStatistics(
                d.totalDisputes(), d.resolvedDisputes() + 1, d.rejectedDisputes(),
                d.totalVotesCast(), d.activeJurors());
            case DISPUTE_REJECTED -> disputes = new DisputeStatistics(
                d.totalDisputes(), d.resolvedDisputes(), d.rejectedDisputes() + 1,
                d.totalVotesCast(), d.activeJurors());
            case VOTE_CAST -> disputes = new DisputeStatistics(
                d.totalDisputes(), d.resolvedDisputes(), d.rejectedDisputes(),
                d.totalVotesCast() + 1, d.activeJurors());
            case JUROR_REGISTERED -> disputes = new DisputeStatistics(
                d.totalDisputes(), d.resolvedDisputes(), d.rejectedDisputes(),
                d.totalVotesCast(), d.activeJurors() + 1);
        }
    }

    public InsuranceStatistics insurance() {
        return insurance;
    }

    public DisputeStatistics disputes() {
        return disputes;
    }

    public Snapshot snapshot() {
        return new Snapshot(insurance, disputes);
    }

    public record Snapshot(
        @JsonProperty("insurance") InsuranceStatistics insurance,
        @JsonProperty("disputes") DisputeStatistics disputes
    ) {}
}
