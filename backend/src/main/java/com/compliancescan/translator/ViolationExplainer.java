package com.compliancescan.translator;

import java.util.Map;
import java.util.Optional;

/**
 * 违规说明服务：为新检出的违规记录生成说明与整改建议
 * <p>
 * 返回空表示无法生成，调用方保留模板文本。实现会接触违规记录的字段值。
 */
public interface ViolationExplainer {

    /**
     * 是否真正接入了说明服务
     */
    default boolean isAvailable() {
        return true;
    }

    Optional<String> explainViolation(TranslationRequest rule, Map<String, Object> record);

    Optional<String> suggestRemediation(TranslationRequest rule, String justification, Map<String, Object> record);
}
