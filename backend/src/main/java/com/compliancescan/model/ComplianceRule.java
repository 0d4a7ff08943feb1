package com.compliancescan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 合规规则模型
 * <p>
 * 创建后仅允许运维人员修改启用状态与严重等级，其余字段不可变。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceRule {

    /** 规则唯一标识 */
    private String id;

    /** 规则编号（如 "FIN-002"） */
    private String ruleCode;

    /** 规则描述 */
    private String description;

    /** 判定条件（自然语言） */
    private String evaluationCriteria;

    /** 目标表提示，可为空 */
    private String targetTable;

    /** 严重等级 */
    private Severity severity;

    /** 是否启用 */
    private boolean active;

    /** 预置查询（运维人员提供），存在时不再调用规则翻译服务，但仍需通过校验 */
    private String presetQuery;

    /**
     * 严重等级，按声明顺序由低到高
     */
    public enum Severity {
        LOW, MEDIUM, HIGH, CRITICAL;

        public boolean isAtLeast(Severity other) {
            return compareTo(other) >= 0;
        }
    }
}
