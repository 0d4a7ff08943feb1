package com.compliancescan.service;

import com.compliancescan.model.CandidateQuery;
import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ReviewItem;
import com.compliancescan.model.RuleOutcome;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.store.ReviewQueue;
import com.compliancescan.translator.RuleTranslator;
import com.compliancescan.translator.TranslationRequest;
import com.compliancescan.translator.TranslationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 候选查询生成
 * <p>
 * 有预置查询的规则直接使用预置查询；否则把规则内容与结构快照交给 {@link RuleTranslator}。
 * 翻译超时、异常或返回为空时，规则记为无法翻译并进入人工复核队列，不影响本次扫描的其余规则。
 */
public class QuerySynthesizer {

    private static final Logger log = LoggerFactory.getLogger(QuerySynthesizer.class);

    private final RuleTranslator translator;
    private final ExecutorService translatorExecutor;
    private final Duration timeout;
    private final ReviewQueue reviewQueue;
    private final Clock clock;

    public QuerySynthesizer(RuleTranslator translator, ExecutorService translatorExecutor, Duration timeout,
                            ReviewQueue reviewQueue, Clock clock) {
        this.translator = translator;
        this.translatorExecutor = translatorExecutor;
        this.timeout = timeout;
        this.reviewQueue = reviewQueue;
        this.clock = clock;
    }

    /**
     * 生成结果：候选查询，或无法翻译的原因
     */
    public sealed interface Synthesis permits Candidate, Untranslatable {
    }

    public record Candidate(CandidateQuery query) implements Synthesis {
    }

    public record Untranslatable(String reason) implements Synthesis {
    }

    public Synthesis synthesize(ComplianceRule rule, SchemaSnapshot snapshot) {
        if (rule.getPresetQuery() != null && !rule.getPresetQuery().isBlank()) {
            return new Candidate(new CandidateQuery(rule.getId(), rule.getPresetQuery(), snapshot.getVersion(),
                    CandidateQuery.Source.PRESET));
        }
        if (rule.getEvaluationCriteria() == null || rule.getEvaluationCriteria().isBlank()) {
            return untranslatable(rule, "规则缺少判定条件");
        }

        TranslationRequest request = new TranslationRequest(rule.getRuleCode(), rule.getDescription(),
                rule.getEvaluationCriteria(), rule.getTargetTable());
        TranslationResult result;
        Future<TranslationResult> future = null;
        try {
            future = translatorExecutor.submit(() -> translator.translate(request, snapshot));
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return untranslatable(rule, "翻译服务超时（" + timeout.toSeconds() + " 秒）");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("规则 {} 翻译异常", rule.getRuleCode(), cause);
            return untranslatable(rule, "翻译服务异常: " + cause.getMessage());
        } catch (RejectedExecutionException e) {
            return untranslatable(rule, "翻译任务队列已满");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return untranslatable(rule, "翻译被中断");
        }

        if (result instanceof TranslationResult.Ok ok) {
            if (ok.sql() == null || ok.sql().isBlank()) {
                return untranslatable(rule, "翻译服务返回为空");
            }
            return new Candidate(new CandidateQuery(rule.getId(), ok.sql(), snapshot.getVersion(),
                    CandidateQuery.Source.TRANSLATOR));
        }
        String reason = result instanceof TranslationResult.Failure failure ? failure.reason() : "翻译服务返回为空";
        return untranslatable(rule, reason);
    }

    private Synthesis untranslatable(ComplianceRule rule, String reason) {
        log.warn("规则 {} 无法翻译: {}", rule.getRuleCode(), reason);
        reviewQueue.flag(new ReviewItem(rule.getId(), rule.getRuleCode(), RuleOutcome.Kind.UNTRANSLATABLE,
                reason, clock.instant()));
        return new Untranslatable(reason);
    }
}
