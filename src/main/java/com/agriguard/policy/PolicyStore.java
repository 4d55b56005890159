package com.agriguard.policy;

import java.util.List;
import java.util.Optional;

public interface PolicyStore {
    long nextPolicyId();

    Policy save(Policy policy);

    Optional<Policy> findById(long policyId);

    boolean delete(long policyId);

    List<Policy> findByOwner(String owner);

    /** Number of ids handed out so far, deleted policies included. */
    long issuedCount();
}
