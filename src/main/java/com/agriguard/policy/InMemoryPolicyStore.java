package com.agriguard.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryPolicyStore implements PolicyStore {

    private final ConcurrentSkipListMap<Long, Policy> policies = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public long nextPolicyId() {
        return sequence.incrementAndGet();
    }

    @Override
    public Policy save(Policy policy) {
        policies.put(policy.policyId(), policy);
        return policy;
    }

    @Override
    public Optional<Policy> findById(long policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }

    @Override
    public boolean delete(long policyId) {
        return policies.remove(policyId) != null;
    }

    @Override
    public List<Policy> findByOwner(String owner) {
        return policies.values().stream()
            .filter(p -> p.isOwnedBy(owner))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public long issuedCount() {
        return sequence.get();
    }
}
