package com.compliancescan.service;

import com.compliancescan.model.CandidateQuery;
import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.RuleOutcome.Kind;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.service.QuerySynthesizer.Candidate;
import com.compliancescan.service.QuerySynthesizer.Synthesis;
import com.compliancescan.service.QuerySynthesizer.Untranslatable;
import com.compliancescan.store.ReviewQueue;
import com.compliancescan.translator.RuleTranslator;
import com.compliancescan.translator.TranslationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class QuerySynthesizerTest {

    private final SchemaSnapshot snapshot = new SchemaSnapshot("H2", List.of(), Instant.parse("2026-01-01T00:00:00Z"));
    private final ReviewQueue reviewQueue = new ReviewQueue();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private QuerySynthesizer synthesizer(RuleTranslator translator, Duration timeout) {
        return new QuerySynthesizer(translator, executor, timeout, reviewQueue, Clock.systemUTC());
    }

    private static ComplianceRule rule(String criteria, String presetQuery) {
        return ComplianceRule.builder()
                .id("r1")
                .ruleCode("KYC-001")
                .description("客户必须完成实名认证")
                .evaluationCriteria(criteria)
                .presetQuery(presetQuery)
                .active(true)
                .build();
    }

    @Test
    void shouldUsePresetQueryWithoutCallingTranslator() {
        QuerySynthesizer synthesizer = synthesizer((request, s) -> {
            throw new AssertionError("不应调用翻译服务");
        }, Duration.ofSeconds(1));

        Synthesis synthesis = synthesizer.synthesize(rule("kyc_level = 0", "SELECT id FROM customers"), snapshot);

        CandidateQuery query = assertInstanceOf(Candidate.class, synthesis).query();
        assertEquals(CandidateQuery.Source.PRESET, query.source());
        assertEquals(snapshot.getVersion(), query.snapshotVersion());
    }

    @Test
    void shouldPassRuleContentToTranslator() {
        QuerySynthesizer synthesizer = synthesizer((request, s) -> {
            assertEquals("KYC-001", request.ruleCode());
            assertEquals("kyc_level = 0", request.evaluationCriteria());
            return TranslationResult.ok("SELECT id FROM customers WHERE kyc_level = 0");
        }, Duration.ofSeconds(1));

        Synthesis synthesis = synthesizer.synthesize(rule("kyc_level = 0", null), snapshot);

        CandidateQuery query = assertInstanceOf(Candidate.class, synthesis).query();
        assertEquals(CandidateQuery.Source.TRANSLATOR, query.source());
        assertEquals("SELECT id FROM customers WHERE kyc_level = 0", query.sql());
        assertTrue(reviewQueue.list().isEmpty());
    }

    @Test
    void shouldFlagRuleWithoutCriteria() {
        Synthesis synthesis = synthesizer((request, s) -> TranslationResult.ok("SELECT 1"), Duration.ofSeconds(1))
                .synthesize(rule(" ", null), snapshot);

        assertEquals("规则缺少判定条件", assertInstanceOf(Untranslatable.class, synthesis).reason());
        assertEquals(Kind.UNTRANSLATABLE, reviewQueue.list().get(0).kind());
    }

    @Test
    void shouldTreatTranslatorExceptionAsUntranslatable() {
        Synthesis synthesis = synthesizer((request, s) -> {
            throw new IllegalStateException("模型不可用");
        }, Duration.ofSeconds(1)).synthesize(rule("kyc_level = 0", null), snapshot);

        assertTrue(assertInstanceOf(Untranslatable.class, synthesis).reason().contains("模型不可用"));
    }

    @Test
    void shouldTreatEmptyAnswerAsUntranslatable() {
        Synthesis synthesis = synthesizer((request, s) -> TranslationResult.ok("  "), Duration.ofSeconds(1))
                .synthesize(rule("kyc_level = 0", null), snapshot);

        assertEquals("翻译服务返回为空", assertInstanceOf(Untranslatable.class, synthesis).reason());
    }

    @Test
    void shouldGiveUpWhenTranslatorTimesOut() {
        CountDownLatch release = new CountDownLatch(1);
        Synthesis synthesis = synthesizer((request, s) -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TranslationResult.ok("SELECT 1");
        }, Duration.ofMillis(100)).synthesize(rule("kyc_level = 0", null), snapshot);

        release.countDown();
        assertTrue(assertInstanceOf(Untranslatable.class, synthesis).reason().startsWith("翻译服务超时"));
        assertEquals(1, reviewQueue.list().size());
    }
}
