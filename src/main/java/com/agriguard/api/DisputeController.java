package com.agriguard.api;

import com.agriguard.dispute.ActiveDisputes;
import com.agriguard.dispute.Dispute;
import com.agriguard.dispute.DisputeEngine;
import com.agriguard.dispute.DisputeStatus;
import com.agriguard.error.ValidationException;
import com.agriguard.settlement.SettlementBridge;
import com.agriguard.settlement.SettlementOutcome;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/disputes")
public class DisputeController {

    private final DisputeEngine disputeEngine;
    private final SettlementBridge settlementBridge;

    public DisputeController(DisputeEngine disputeEngine, SettlementBridge settlementBridge) {
        this.disputeEngine = disputeEngine;
        this.settlementBridge = settlementBridge;
    }

    /**
     * Expected request body: {@code {"policy_id": 1}}. The caller must be a juror.
     */
    @PostMapping
    public Map<String, Object> create(@RequestHeader(Headers.CALLER) String caller,
                                      @RequestBody Map<String, Object> request) {
        if (!(request.get("policy_id") instanceof Number policyId)) {
            throw new ValidationException("policy_id is required");
        }
        long disputeId = disputeEngine.createDispute(policyId.longValue(), caller);
        return Map.of("status", "created", "dispute_id", disputeId);
    }

    @GetMapping("/{disputeId}")
    public ResponseEntity<Dispute> get(@PathVariable long disputeId) {
        return disputeEngine.getDispute(disputeId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{disputeId}/status")
    public Map<String, Object> status(@PathVariable long disputeId) {
        DisputeStatus status = disputeEngine.getDisputeStatus(disputeId);
        return Map.of("dispute_id", disputeId, "status", status.getValue(), "code", status.getCode());
    }

    @GetMapping("/{disputeId}/jurors")
    public List<String> jurors(@PathVariable long disputeId) {
        return disputeEngine.getDisputeJurors(disputeId);
    }

    @GetMapping("/active")
    public ActiveDisputes active() {
        return disputeEngine.getActiveDisputes();
    }

    /**
     * Expected request body: {@code {"vote": true}}.
     */
    @PostMapping("/{disputeId}/votes")
    public Dispute vote(@RequestHeader(Headers.CALLER) String caller,
                        @PathVariable long disputeId,
                        @RequestBody Map<String, Object> request) {
        if (!(request.get("vote") instanceof Boolean vote)) {
            throw new ValidationException("vote must be true or false");
        }
        return disputeEngine.vote(disputeId, vote, caller);
    }

    @GetMapping("/{disputeId}/settlement")
    public ResponseEntity<SettlementOutcome> settlement(@PathVariable long disputeId) {
        return settlementBridge.findOutcome(disputeId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{disputeId}/settlement/retry")
    public SettlementOutcome retrySettlement(@PathVariable long disputeId) {
        return settlementBridge.retry(disputeId);
    }

    @GetMapping("/settlements/failed")
    public List<SettlementOutcome> failedSettlements() {
        return settlementBridge.failedOutcomes();
    }
}
