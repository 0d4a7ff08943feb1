package com.compliancescan.translator;

/**
 * 发送给规则翻译服务的规则内容
 *
 * @param ruleCode           规则编号
 * @param description        规则描述
 * @param evaluationCriteria 判定条件
 * @param targetTableHint    目标表提示，可为空
 */
public record TranslationRequest(String ruleCode, String description, String evaluationCriteria,
                                 String targetTableHint) {
}
