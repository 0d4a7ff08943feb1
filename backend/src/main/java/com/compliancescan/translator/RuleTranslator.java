package com.compliancescan.translator;

import com.compliancescan.model.SchemaSnapshot;

/**
 * 规则翻译服务：把自然语言判定条件翻译为查询违规记录的 SQL
 * <p>
 * 实现方只会拿到规则内容与结构快照，不会接触业务数据。返回的 SQL 不可信，必须经过校验。
 * 实现可以抛出运行时异常，调用方会将其视为翻译失败。
 */
public interface RuleTranslator {

    TranslationResult translate(TranslationRequest request, SchemaSnapshot snapshot);
}
