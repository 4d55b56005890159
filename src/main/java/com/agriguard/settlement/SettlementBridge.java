package com.agriguard.settlement;

import java.util.List;
import java.util.Optional;

/**
 * Forwards a resolved dispute's decision to the policy side as a nested atomic
 * sub-operation.
 *
 * A failed forward does not undo the dispute's resolution. The failure is kept as a
 * {@link SettlementOutcome} so monitoring can see it and {@link #retry(long)} can
 * re-attempt it. The dispute id is the idempotency key: once an outcome is
 * {@link SettlementOutcome.Status#DELIVERED}, neither trigger nor retry calls the
 * policy engine again for that dispute.
 */
public interface SettlementBridge {

    SettlementOutcome triggerSettlement(long disputeId, long policyId, boolean approved);

    SettlementOutcome retry(long disputeId);

    Optional<SettlementOutcome> findOutcome(long disputeId);

    List<SettlementOutcome> failedOutcomes();
}
