package com.compliancescan.service;

import com.compliancescan.model.Detection;
import com.compliancescan.model.Violation;
import com.compliancescan.model.Violation.Status;
import com.compliancescan.model.ViolationKey;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 违规差异计算
 * <p>
 * 纯函数：只依赖传入的已有违规、本次检出与规则求值情况，不读写任何存储。
 * <ul>
 *   <li>检出但不在已打开违规中：新增（已解除的同键记录会被重新打开，同样计为新增）</li>
 *   <li>检出且已打开：持续存在，只更新 lastSeenAt</li>
 *   <li>已打开、所属规则本次完整求值、但未检出：解除</li>
 *   <li>所属规则未完整求值（拒绝、出错、跳过、结果被截断、未参与本次扫描）：保持不变</li>
 * </ul>
 */
@Service
public class ViolationDiffEngine {

    /**
     * @param created    新增的违规
     * @param reopened   重新打开的违规
     * @param persisting 持续存在的违规
     * @param resolved   已解除的违规
     */
    public record DiffResult(List<Violation> created,
                             List<Violation> reopened,
                             List<Violation> persisting,
                             List<Violation> resolved) {

        /** 替换新增的违规，例如补充说明之后 */
        public DiffResult withCreated(List<Violation> explained) {
            return new DiffResult(explained, reopened, persisting, resolved);
        }

        public int newCount() {
            return created.size() + reopened.size();
        }

        /** 需要写回存储的全部记录 */
        public List<Violation> changes() {
            List<Violation> all = new ArrayList<>(created);
            all.addAll(reopened);
            all.addAll(persisting);
            all.addAll(resolved);
            return all;
        }
    }

    /**
     * @param existing                  已有违规（含已解除），按键索引
     * @param detections                本次检出
     * @param evaluatedRuleIds          本次成功执行的规则
     * @param partiallyEvaluatedRuleIds 成功执行但结果达到行数上限的规则，不参与解除
     * @param now                       本次扫描的时间
     */
    public DiffResult diff(Map<ViolationKey, Violation> existing,
                           List<Detection> detections,
                           Set<String> evaluatedRuleIds,
                           Set<String> partiallyEvaluatedRuleIds,
                           Instant now) {
        List<Violation> created = new ArrayList<>();
        List<Violation> reopened = new ArrayList<>();
        List<Violation> persisting = new ArrayList<>();
        List<Violation> resolved = new ArrayList<>();

        Set<ViolationKey> detected = new HashSet<>();
        for (Detection detection : detections) {
            if (!detected.add(detection.key())) {
                continue;
            }
            Violation current = existing.get(detection.key());
            if (current == null) {
                created.add(newViolation(detection, now));
            } else if (current.getStatus() == Status.OPEN) {
                persisting.add(current.toBuilder().lastSeenAt(now).build());
            } else {
                reopened.add(current.toBuilder()
                        .status(Status.OPEN)
                        .resolvedAt(null)
                        .lastSeenAt(now)
                        .build());
            }
        }

        for (Violation violation : existing.values()) {
            if (violation.getStatus() != Status.OPEN || detected.contains(violation.getKey())) {
                continue;
            }
            String ruleId = violation.getRuleId();
            if (evaluatedRuleIds.contains(ruleId) && !partiallyEvaluatedRuleIds.contains(ruleId)) {
                resolved.add(violation.toBuilder()
                        .status(Status.RESOLVED)
                        .resolvedAt(now)
                        .build());
            }
        }
        return new DiffResult(created, reopened, persisting, resolved);
    }

    private static Violation newViolation(Detection detection, Instant now) {
        return Violation.builder()
                .id(UUID.randomUUID().toString())
                .ruleId(detection.key().ruleId())
                .ruleCode(detection.ruleCode())
                .recordIdentifier(detection.key().recordIdentifier())
                .severity(detection.severity())
                .recordData(detection.recordData())
                .justification(detection.justification())
                .remediation(detection.remediation())
                .firstDetectedAt(now)
                .lastSeenAt(now)
                .status(Status.OPEN)
                .build();
    }
}
