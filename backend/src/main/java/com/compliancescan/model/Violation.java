package com.compliancescan.model;

import com.compliancescan.model.ComplianceRule.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 单条违规记录
 * <p>
 * 严重等级与记录数据均为检出时刻的快照，之后不再随规则或源数据变化。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Violation {

    /** 违规记录 ID */
    private String id;

    /** 违反的规则 ID */
    private String ruleId;

    /** 违反的规则编号 */
    private String ruleCode;

    /** 记录标识（取自主键列） */
    private String recordIdentifier;

    /** 检出时的严重等级 */
    private Severity severity;

    /** 检出时的记录字段值 */
    private Map<String, Object> recordData;

    /** 违规说明 */
    private String justification;

    /** 修复建议 */
    private String remediation;

    /** 首次检出时间 */
    private Instant firstDetectedAt;

    /** 最近一次仍被检出的时间 */
    private Instant lastSeenAt;

    /** 解除时间 */
    private Instant resolvedAt;

    /** 生命周期状态 */
    private Status status;

    @JsonIgnore
    public ViolationKey getKey() {
        return new ViolationKey(ruleId, recordIdentifier);
    }

    public enum Status {
        OPEN, RESOLVED
    }
}
