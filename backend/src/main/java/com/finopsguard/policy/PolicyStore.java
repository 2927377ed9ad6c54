package com.finopsguard.policy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory policy registry. Insertion order is evaluation order.
 *
 * All access is synchronized; readers receive immutable copies, so a request
 * evaluating a {@link #snapshot()} never sees later edits.
 */
@Component
@Slf4j
public class PolicyStore {

    private final Map<String, Policy> policies = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if the id is blank or already registered
     */
    public synchronized Policy add(Policy policy) {
        String id = requireId(policy);
        if (policies.containsKey(id)) {
            throw new IllegalArgumentException("Policy already exists: " + id);
        }
        policies.put(id, policy);
        log.info("Registered policy '{}' ({})", id, policy.getOnViolation().getValue());
        return policy;
    }

    /**
     * Replace a policy in place, keeping its id and position.
     *
     * @throws PolicyNotFoundException if no policy has this id
     */
    public synchronized Policy update(String policyId, Policy policy) {
        if (!policies.containsKey(policyId)) {
            throw new PolicyNotFoundException(policyId);
        }
        Policy updated = policyId.equals(policy.getId()) ? policy : policy.toBuilder().id(policyId).build();
        policies.put(policyId, updated);
        log.info("Updated policy '{}'", policyId);
        return updated;
    }

    /**
     * @throws PolicyNotFoundException if no policy has this id
     */
    public synchronized void remove(String policyId) {
        if (policies.remove(policyId) == null) {
            throw new PolicyNotFoundException(policyId);
        }
        log.info("Removed policy '{}'", policyId);
    }

    public synchronized Optional<Policy> get(String policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }

    public synchronized boolean contains(String policyId) {
        return policies.containsKey(policyId);
    }

    public synchronized List<Policy> list() {
        return List.copyOf(policies.values());
    }

    public synchronized List<Policy> listEnabled() {
        return policies.values().stream().filter(Policy::isEnabled).toList();
    }

    /**
     * Read-only view of the enabled policies for one request.
     */
    public List<Policy> snapshot() {
        return listEnabled();
    }

    private static String requireId(Policy policy) {
        if (policy == null || policy.getId() == null || policy.getId().isBlank()) {
            throw new IllegalArgumentException("Policy id must not be blank");
        }
        return policy.getId();
    }
}
