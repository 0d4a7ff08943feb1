package com.compliancescan.service;

import com.compliancescan.model.ComplianceRule.Severity;
import com.compliancescan.model.Detection;
import com.compliancescan.model.Violation;
import com.compliancescan.model.Violation.Status;
import com.compliancescan.model.ViolationKey;
import com.compliancescan.service.ViolationDiffEngine.DiffResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ViolationDiffEngineTest {

    private static final Instant T1 = Instant.parse("2026-03-01T00:00:00Z");
    private static final Instant T2 = Instant.parse("2026-03-01T06:00:00Z");

    private final ViolationDiffEngine engine = new ViolationDiffEngine();

    private static Detection detection(String ruleId, String record, Severity severity) {
        return new Detection(new ViolationKey(ruleId, record), "CODE-" + ruleId, severity,
                Map.of("id", record), "说明", "建议");
    }

    private static Map<ViolationKey, Violation> index(List<Violation> violations) {
        Map<ViolationKey, Violation> map = new HashMap<>();
        violations.forEach(v -> map.put(v.getKey(), v));
        return map;
    }

    @Test
    void shouldCreateViolationsForFirstDetections() {
        DiffResult result = engine.diff(Map.of(),
                List.of(detection("r1", "1", Severity.HIGH), detection("r1", "2", Severity.HIGH)),
                Set.of("r1"), Set.of(), T1);

        assertEquals(2, result.created().size());
        assertEquals(2, result.newCount());
        Violation created = result.created().get(0);
        assertEquals(Status.OPEN, created.getStatus());
        assertEquals(T1, created.getFirstDetectedAt());
        assertEquals(T1, created.getLastSeenAt());
        assertNotNull(created.getId());
    }

    @Test
    void shouldPartitionIntoNewPersistingAndResolved() {
        Map<ViolationKey, Violation> existing = index(engine.diff(Map.of(),
                List.of(detection("r1", "1", Severity.HIGH), detection("r1", "2", Severity.HIGH)),
                Set.of("r1"), Set.of(), T1).created());

        DiffResult result = engine.diff(existing,
                List.of(detection("r1", "2", Severity.HIGH), detection("r1", "3", Severity.HIGH)),
                Set.of("r1"), Set.of(), T2);

        assertEquals(List.of("3"), result.created().stream().map(Violation::getRecordIdentifier).toList());
        assertEquals(List.of("2"), result.persisting().stream().map(Violation::getRecordIdentifier).toList());
        assertEquals(List.of("1"), result.resolved().stream().map(Violation::getRecordIdentifier).toList());

        Violation persisting = result.persisting().get(0);
        assertEquals(T1, persisting.getFirstDetectedAt());
        assertEquals(T2, persisting.getLastSeenAt());
        assertEquals(T2, result.resolved().get(0).getResolvedAt());
        assertEquals(Status.RESOLVED, result.resolved().get(0).getStatus());
    }

    @Test
    void shouldBeIdempotentForUnchangedData() {
        List<Detection> detections = List.of(detection("r1", "1", Severity.HIGH));
        Map<ViolationKey, Violation> existing = index(
                engine.diff(Map.of(), detections, Set.of("r1"), Set.of(), T1).created());

        DiffResult result = engine.diff(existing, detections, Set.of("r1"), Set.of(), T2);

        assertEquals(0, result.newCount());
        assertTrue(result.resolved().isEmpty());
        assertEquals(1, result.persisting().size());
        assertEquals(existing.values().iterator().next().getId(), result.persisting().get(0).getId());
    }

    @Test
    void shouldLeaveViolationsOfUnevaluatedRulesUntouched() {
        Map<ViolationKey, Violation> existing = index(engine.diff(Map.of(),
                List.of(detection("r1", "1", Severity.HIGH), detection("r2", "9", Severity.LOW)),
                Set.of("r1", "r2"), Set.of(), T1).created());

        // r2 本次被拒绝或出错，没有求值
        DiffResult result = engine.diff(existing, List.of(), Set.of("r1"), Set.of(), T2);

        assertEquals(List.of("r1"), result.resolved().stream().map(Violation::getRuleId).toList());
        assertTrue(result.changes().stream().noneMatch(v -> v.getRuleId().equals("r2")));
    }

    @Test
    void shouldNotResolveViolationsOfTruncatedRule() {
        Map<ViolationKey, Violation> existing = index(engine.diff(Map.of(),
                List.of(detection("r1", "1", Severity.HIGH), detection("r1", "2", Severity.HIGH)),
                Set.of("r1"), Set.of(), T1).created());

        DiffResult result = engine.diff(existing, List.of(detection("r1", "2", Severity.HIGH)),
                Set.of("r1"), Set.of("r1"), T2);

        assertTrue(result.resolved().isEmpty());
        assertEquals(1, result.persisting().size());
    }

    @Test
    void shouldKeepSeverityCapturedAtDetection() {
        Map<ViolationKey, Violation> existing = index(engine.diff(Map.of(),
                List.of(detection("r1", "1", Severity.MEDIUM)), Set.of("r1"), Set.of(), T1).created());

        DiffResult result = engine.diff(existing, List.of(detection("r1", "1", Severity.CRITICAL)),
                Set.of("r1"), Set.of(), T2);

        assertEquals(Severity.MEDIUM, result.persisting().get(0).getSeverity());
    }

    @Test
    void shouldReopenResolvedViolationUnderSameKey() {
        Map<ViolationKey, Violation> existing = index(engine.diff(Map.of(),
                List.of(detection("r1", "1", Severity.HIGH)), Set.of("r1"), Set.of(), T1).created());
        Violation original = existing.values().iterator().next();
        existing = index(engine.diff(existing, List.of(), Set.of("r1"), Set.of(), T2).resolved());

        Instant t3 = T2.plusSeconds(3600);
        DiffResult result = engine.diff(existing, List.of(detection("r1", "1", Severity.LOW)),
                Set.of("r1"), Set.of(), t3);

        assertTrue(result.created().isEmpty());
        assertEquals(1, result.newCount());
        Violation reopened = result.reopened().get(0);
        assertEquals(original.getId(), reopened.getId());
        assertEquals(Status.OPEN, reopened.getStatus());
        assertNull(reopened.getResolvedAt());
        assertEquals(T1, reopened.getFirstDetectedAt());
        assertEquals(t3, reopened.getLastSeenAt());
        assertEquals(Severity.HIGH, reopened.getSeverity());
    }

    @Test
    void shouldIgnoreDuplicateDetections() {
        DiffResult result = engine.diff(Map.of(),
                List.of(detection("r1", "1", Severity.HIGH), detection("r1", "1", Severity.HIGH)),
                Set.of("r1"), Set.of(), T1);

        assertEquals(1, result.created().size());
    }
}
