package com.compliancescan.model;

import java.util.List;

/**
 * 通过校验、可执行的查询
 *
 * @param ruleId            来源规则
 * @param sql               已强制行数上限的 SQL
 * @param snapshotVersion   校验时使用的结构快照版本
 * @param referencedTables  引用到的表（限定名）
 * @param identifierColumns 驱动表主键列，用于提取记录标识
 * @param rowLimit          生效的行数上限
 */
public record ValidatedQuery(String ruleId,
                             String sql,
                             String snapshotVersion,
                             List<String> referencedTables,
                             List<String> identifierColumns,
                             int rowLimit) {

    public ValidatedQuery {
        referencedTables = List.copyOf(referencedTables);
        identifierColumns = List.copyOf(identifierColumns);
    }
}
