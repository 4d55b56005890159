package com.agriguard.api;

import com.agriguard.policy.PolicyEngine;
import com.agriguard.policy.SettlementDecision;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for the weather/risk oracle's settlement decisions.
 *
 * POST /v1/oracle/settlements
 * {
 *   "policy_id": 1,
 *   "decision": 1,
 *   "settlement_amount": 1000000,
 *   "confidence": 0.92,
 *   "reasoning": "..."
 * }
 */
@RestController
@RequestMapping("/v1/oracle")
public class OracleController {

    private final PolicyEngine policyEngine;

    public OracleController(PolicyEngine policyEngine) {
        this.policyEngine = policyEngine;
    }

    @PostMapping("/settlements")
    public Map<String, Object> settle(@RequestHeader(Headers.CALLER) String caller,
                                      @RequestBody SettlementDecision decision) {
        long payout = policyEngine.settleDecision(decision, caller);
        return Map.of(
            "status", "settled",
            "policy_id", decision.policyId(),
            "payout", payout
        );
    }

    @GetMapping
    public Map<String, Object> oracle() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("oracle", policyEngine.getOracle().orElse(null));
        return body;
    }
}
