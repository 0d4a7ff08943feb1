package com.compliancescan.store;

import com.compliancescan.exception.ResourceNotFoundException;
import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ComplianceRule.Severity;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRuleCatalogTest {

    private final InMemoryRuleCatalog catalog = new InMemoryRuleCatalog();

    private static ComplianceRule rule(String code, boolean active) {
        return ComplianceRule.builder()
                .ruleCode(code)
                .description("描述 " + code)
                .evaluationCriteria("条件 " + code)
                .active(active)
                .build();
    }

    @Test
    void shouldAssignIdAndDefaultSeverity() {
        ComplianceRule registered = catalog.register(rule("KYC-001", true)).orElseThrow();

        assertNotNull(registered.getId());
        assertEquals(Severity.MEDIUM, registered.getSeverity());
        assertEquals(1, catalog.findAll().size());
    }

    @Test
    void shouldSkipDuplicateRuleCode() {
        catalog.register(rule("KYC-001", true));

        Optional<ComplianceRule> duplicate = catalog.register(rule("kyc-001", true));

        assertTrue(duplicate.isEmpty());
        assertEquals(1, catalog.findAll().size());
    }

    @Test
    void shouldRejectBlankRuleCode() {
        assertThrows(IllegalArgumentException.class, () -> catalog.register(rule(" ", true)));
    }

    @Test
    void shouldListOnlyActiveRules() {
        catalog.register(rule("KYC-001", true));
        ComplianceRule inactive = catalog.register(rule("KYC-002", false)).orElseThrow();

        assertEquals(1, catalog.activeRules().size());

        catalog.updateActive(inactive.getId(), true);
        assertEquals(2, catalog.activeRules().size());
    }

    @Test
    void shouldUpdateSeverityOnly() {
        ComplianceRule registered = catalog.register(rule("KYC-001", true)).orElseThrow();

        ComplianceRule updated = catalog.updateSeverity(registered.getId(), Severity.HIGH);

        assertEquals(Severity.HIGH, updated.getSeverity());
        assertEquals(registered.getEvaluationCriteria(), updated.getEvaluationCriteria());
    }

    @Test
    void shouldNotExposeStoredInstances() {
        ComplianceRule registered = catalog.register(rule("KYC-001", true)).orElseThrow();

        registered.setActive(false);
        catalog.findAll().get(0).setSeverity(Severity.LOW);

        ComplianceRule stored = catalog.findById(registered.getId()).orElseThrow();
        assertTrue(stored.isActive());
        assertEquals(Severity.MEDIUM, stored.getSeverity());
    }

    @Test
    void shouldReportUnknownRule() {
        assertThrows(ResourceNotFoundException.class, () -> catalog.updateActive("missing", false));
    }
}
