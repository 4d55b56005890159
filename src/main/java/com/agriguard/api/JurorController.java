package com.agriguard.api;

import com.agriguard.dispute.DisputeEngine;
import com.agriguard.dispute.Juror;
import com.agriguard.dispute.JurorEligibility;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/v1/jurors")
public class JurorController {

    private final DisputeEngine disputeEngine;

    public JurorController(DisputeEngine disputeEngine) {
        this.disputeEngine = disputeEngine;
    }

    @PostMapping
    public Juror register(@RequestHeader(Headers.CALLER) String caller) {
        return disputeEngine.registerJuror(caller);
    }

    @GetMapping("/count")
    public Map<String, Object> count() {
        return Map.of("total_jurors", disputeEngine.getTotalJurors());
    }

    @GetMapping("/{address}")
    public ResponseEntity<Juror> get(@PathVariable String address) {
        return disputeEngine.getJurorInfo(address)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{address}/eligibility")
    public Map<String, Object> eligibility(@PathVariable String address) {
        JurorEligibility eligibility = disputeEngine.validateJurorEligibility(address);
        return Map.of("address", address, "eligibility", eligibility.name(), "code", eligibility.getCode());
    }
}
