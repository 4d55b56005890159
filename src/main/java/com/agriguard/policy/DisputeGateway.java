package com.agriguard.policy;

/**
 * Where {@link PolicyEngine#fileDispute} hands a dispute over. The policy side only
 * knows this interface, so the two engines reference each other by id, never by
 * record.
 */
public interface DisputeGateway {

    /**
     * Opens a dispute on behalf of {@code claimant}.
     *
     * @param caller the address of the insurance engine making the call
     */
    DisputeRef openDispute(long policyId, String claimant, String reason, String caller);
}
