package com.compliancescan.translator;

/**
 * 规则翻译结果：成功时给出 SQL 文本，失败时给出原因
 */
public sealed interface TranslationResult permits TranslationResult.Ok, TranslationResult.Failure {

    record Ok(String sql) implements TranslationResult {
    }

    record Failure(String reason) implements TranslationResult {
    }

    static TranslationResult ok(String sql) {
        return new Ok(sql);
    }

    static TranslationResult failure(String reason) {
        return new Failure(reason);
    }
}
