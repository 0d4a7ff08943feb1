package com.compliancescan.service;

import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.Violation;
import com.compliancescan.translator.TranslationRequest;
import com.compliancescan.translator.ViolationExplainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 为新增违规生成说明与整改建议
 * <p>
 * 只处理本次新增的违规，每次扫描最多处理 maxPerRun 条，全部请求共用一个超时。
 * 说明服务不可用、超时或返回为空时保留检出时写入的模板文本。
 */
public class ViolationExplanationService {

    private static final Logger log = LoggerFactory.getLogger(ViolationExplanationService.class);

    private final ViolationExplainer explainer;
    private final ExecutorService executor;
    private final Duration timeout;
    private final int maxPerRun;

    public ViolationExplanationService(ViolationExplainer explainer, ExecutorService executor, Duration timeout,
                                       int maxPerRun) {
        this.explainer = explainer;
        this.executor = executor;
        this.timeout = timeout;
        this.maxPerRun = maxPerRun;
    }

    /**
     * @param created   本次新增的违规
     * @param rulesById 本次执行的规则
     * @return 与输入顺序一致的违规列表
     */
    public List<Violation> explain(List<Violation> created, Map<String, ComplianceRule> rulesById) {
        if (created.isEmpty() || maxPerRun <= 0 || !explainer.isAvailable()) {
            return created;
        }

        int limit = Math.min(maxPerRun, created.size());
        if (limit < created.size()) {
            log.info("本次新增 {} 条违规，只为前 {} 条生成说明，其余使用模板", created.size(), limit);
        }

        List<Future<Violation>> futures = new ArrayList<>();
        for (int i = 0; i < limit; i++) {
            Violation violation = created.get(i);
            ComplianceRule rule = rulesById.get(violation.getRuleId());
            if (rule == null) {
                futures.add(null);
                continue;
            }
            try {
                futures.add(executor.submit(() -> explainOne(violation, rule)));
            } catch (RejectedExecutionException e) {
                log.warn("说明任务队列已满，违规 {} 使用模板", violation.getRecordIdentifier());
                futures.add(null);
            }
        }

        List<Violation> result = new ArrayList<>(created);
        long deadline = System.nanoTime() + timeout.toNanos();
        for (int i = 0; i < futures.size(); i++) {
            Future<Violation> future = futures.get(i);
            if (future == null) {
                continue;
            }
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                result.set(i, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("为违规 {} 生成说明超时，使用模板", created.get(i).getRecordIdentifier());
            } catch (ExecutionException e) {
                log.warn("为违规 {} 生成说明失败，使用模板", created.get(i).getRecordIdentifier(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(f -> {
                    if (f != null) {
                        f.cancel(true);
                    }
                });
                break;
            }
        }
        return result;
    }

    private Violation explainOne(Violation violation, ComplianceRule rule) {
        TranslationRequest request = new TranslationRequest(rule.getRuleCode(), rule.getDescription(),
                rule.getEvaluationCriteria(), rule.getTargetTable());
        Optional<String> justification = explainer.explainViolation(request, violation.getRecordData());
        String explained = justification.orElse(violation.getJustification());
        String remediation = explainer.suggestRemediation(request, explained, violation.getRecordData())
                .orElse(violation.getRemediation());
        return violation.toBuilder()
                .justification(explained)
                .remediation(remediation)
                .build();
    }
}
