package com.compliancescan.translator;

import com.compliancescan.model.SchemaSnapshot;

import java.util.Map;
import java.util.Optional;

/**
 * 未配置翻译服务时使用：所有未预置查询的规则都标记为无法翻译，违规说明使用模板
 */
public class UnavailableRuleTranslator implements RuleTranslator, ViolationExplainer {

    @Override
    public TranslationResult translate(TranslationRequest request, SchemaSnapshot snapshot) {
        return TranslationResult.failure("未配置规则翻译服务");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public Optional<String> explainViolation(TranslationRequest rule, Map<String, Object> record) {
        return Optional.empty();
    }

    @Override
    public Optional<String> suggestRemediation(TranslationRequest rule, String justification,
                                               Map<String, Object> record) {
        return Optional.empty();
    }
}
