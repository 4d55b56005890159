package com.agriguard.api;

import com.agriguard.dispute.Dispute;
import com.agriguard.dispute.DisputeEngine;
import com.agriguard.error.AuthorizationException;
import com.agriguard.error.ErrorCode;
import com.agriguard.error.ValidationException;
import com.agriguard.config.AgriGuardProperties;
import com.agriguard.ledger.ManualLogicalClock;
import com.agriguard.policy.PolicyEngine;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admin-only operations: binding the oracle, cross-linking the engines, archiving
 * disputes and advancing the logical clock. The engines enforce the admin check;
 * the clock is guarded here.
 */
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final PolicyEngine policyEngine;
    private final DisputeEngine disputeEngine;
    private final ManualLogicalClock clock;
    private final String admin;

    public AdminController(PolicyEngine policyEngine,
                           DisputeEngine disputeEngine,
                           ManualLogicalClock clock,
                           AgriGuardProperties properties) {
        this.policyEngine = policyEngine;
        this.disputeEngine = disputeEngine;
        this.clock = clock;
        this.admin = properties.admin();
    }

    @PutMapping("/oracle")
    public Map<String, Object> setOracle(@RequestHeader(Headers.CALLER) String caller,
                                         @RequestBody Map<String, Object> request) {
        String address = requireAddress(request);
        policyEngine.setOracle(address, caller);
        return Map.of("status", "ok", "oracle", address);
    }

    @PutMapping("/dispute-link")
    public Map<String, Object> setDisputeLink(@RequestHeader(Headers.CALLER) String caller,
                                              @RequestBody Map<String, Object> request) {
        String address = requireAddress(request);
        policyEngine.setDisputeLink(address, caller);
        return Map.of("status", "ok", "dispute_link", address);
    }

    @PutMapping("/insurance-link")
    public Map<String, Object> setInsuranceLink(@RequestHeader(Headers.CALLER) String caller,
                                                @RequestBody Map<String, Object> request) {
        String address = requireAddress(request);
        disputeEngine.setInsuranceLink(address, caller);
        return Map.of("status", "ok", "insurance_link", address);
    }

    @PostMapping("/disputes/{disputeId}/archive")
    public Dispute archive(@RequestHeader(Headers.CALLER) String caller,
                           @PathVariable long disputeId) {
        return disputeEngine.archiveDispute(disputeId, caller);
    }

    /**
     * Expected request body: {@code {"rounds": 10}}.
     */
    @PostMapping("/clock/advance")
    public Map<String, Object> advanceClock(@RequestHeader(Headers.CALLER) String caller,
                                            @RequestBody Map<String, Object> request) {
        if (!admin.equals(caller)) {
            throw new AuthorizationException(ErrorCode.NOT_ADMIN, "only admin can advance the clock");
        }
        if (!(request.get("rounds") instanceof Number rounds)) {
            throw new ValidationException("rounds is required");
        }
        return Map.of("round", clock.advance(rounds.longValue()));
    }

    @GetMapping("/links")
    public Map<String, Object> links() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("oracle", policyEngine.getOracle().orElse(null));
        body.put("dispute_link", policyEngine.getDisputeLink().orElse(null));
        body.put("insurance_link", disputeEngine.getInsuranceLink().orElse(null));
        return body;
    }

    @GetMapping("/clock")
    public Map<String, Object> clock() {
        return Map.of("round", clock.currentRound());
    }

    private String requireAddress(Map<String, Object> request) {
        if (!(request.get("address") instanceof String address) || address.isBlank()) {
            throw new ValidationException("address is required");
        }
        return address;
    }
}
