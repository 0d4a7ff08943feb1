package com.compliancescan.store;

import com.compliancescan.model.Violation;
import com.compliancescan.model.ViolationKey;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存违规记录存储，读写均为副本
 */
@Component
public class InMemoryViolationStore implements ViolationStore {

    private final Map<ViolationKey, Violation> violations = new ConcurrentHashMap<>();

    @Override
    public Map<ViolationKey, Violation> snapshot() {
        Map<ViolationKey, Violation> copy = new LinkedHashMap<>();
        violations.forEach((key, violation) -> copy.put(key, violation.toBuilder().build()));
        return copy;
    }

    @Override
    public void saveAll(Collection<Violation> updates) {
        for (Violation violation : updates) {
            violations.put(violation.getKey(), violation.toBuilder().build());
        }
    }

    @Override
    public List<Violation> find(Violation.Status status, String ruleId) {
        return violations.values().stream()
                .filter(v -> status == null || v.getStatus() == status)
                .filter(v -> ruleId == null || ruleId.equals(v.getRuleId()))
                .sorted(Comparator.comparing(Violation::getFirstDetectedAt)
                        .thenComparing(Violation::getRecordIdentifier))
                .map(v -> v.toBuilder().build())
                .toList();
    }

    @Override
    public Optional<Violation> findById(String id) {
        return violations.values().stream()
                .filter(v -> v.getId().equals(id))
                .findFirst()
                .map(v -> v.toBuilder().build());
    }
}
