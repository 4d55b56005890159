package com.agriguard.api;

import com.agriguard.policy.DisputeRef;
import com.agriguard.policy.Policy;
import com.agriguard.policy.PolicyEngine;
import com.agriguard.policy.PolicyParams;
import com.agriguard.policy.PolicyTiming;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/policies")
public class PolicyController {

    private final PolicyEngine policyEngine;

    public PolicyController(PolicyEngine policyEngine) {
        this.policyEngine = policyEngine;
    }

    @PostMapping
    public Map<String, Object> create(@RequestHeader(Headers.CALLER) String caller,
                                      @RequestBody PolicyParams params) {
        long policyId = policyEngine.createPolicy(params, caller);
        return Map.of("status", "created", "policy_id", policyId);
    }

    @GetMapping("/{policyId}")
    public ResponseEntity<Policy> get(@PathVariable long policyId) {
        return policyEngine.getPolicy(policyId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<Policy> byOwner(@RequestParam String owner) {
        return policyEngine.getPoliciesByOwner(owner);
    }

    @GetMapping("/count")
    public Map<String, Object> count() {
        return Map.of("policy_count", policyEngine.getPolicyCount());
    }

    @GetMapping("/{policyId}/timing")
    public Map<String, Object> timing(@PathVariable long policyId) {
        PolicyTiming timing = policyEngine.validatePolicyTiming(policyId);
        return Map.of("policy_id", policyId, "timing", timing.name(), "code", timing.getCode());
    }

    @GetMapping("/fee")
    public Map<String, Object> fee(@RequestParam long cap,
                                   @RequestParam(name = "risk_score") long riskScore,
                                   @RequestParam long uncertainty,
                                   @RequestParam(name = "duration_days") long durationDays) {
        return Map.of("fee", policyEngine.calculateFee(cap, riskScore, uncertainty, durationDays));
    }

    @DeleteMapping("/{policyId}")
    public Map<String, Object> delete(@RequestHeader(Headers.CALLER) String caller,
                                      @PathVariable long policyId) {
        policyEngine.deletePolicy(policyId, caller);
        return Map.of("status", "deleted", "policy_id", policyId);
    }

    /**
     * Expected request body: {@code {"reason": "..."}}.
     */
    @PostMapping("/{policyId}/disputes")
    public DisputeRef fileDispute(@RequestHeader(Headers.CALLER) String caller,
                                  @PathVariable long policyId,
                                  @RequestBody Map<String, Object> request) {
        String reason = request.get("reason") instanceof String s ? s : null;
        return policyEngine.fileDispute(policyId, reason, caller);
    }
}
