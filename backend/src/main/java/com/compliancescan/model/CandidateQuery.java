package com.compliancescan.model;

/**
 * 规则翻译服务产出的候选查询，未通过校验前不可信
 *
 * @param ruleId          来源规则
 * @param sql             原始 SQL 文本
 * @param snapshotVersion 生成时所依据的结构快照版本
 * @param source          来源
 */
public record CandidateQuery(String ruleId, String sql, String snapshotVersion, Source source) {

    public enum Source {
        TRANSLATOR, PRESET
    }
}
