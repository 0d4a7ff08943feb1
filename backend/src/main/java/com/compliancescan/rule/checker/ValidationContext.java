package com.compliancescan.rule.checker;

import com.compliancescan.model.CandidateQuery;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.parser.SelectQuery;
import com.compliancescan.parser.SelectStatementParser;
import com.compliancescan.parser.Token;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 单次校验的上下文：候选查询、词法单元、结构快照，以及检查器之间传递的中间结果
 * <p>
 * 语法树在第一次访问时才解析，解析失败抛出 {@link com.compliancescan.parser.SqlParseException}。
 */
public class ValidationContext {

    private final CandidateQuery candidate;
    private final List<Token> tokens;
    private final SchemaSnapshot snapshot;
    private final ValidationLimits limits;

    private SelectQuery query;
    private final Set<String> referencedTables = new LinkedHashSet<>();
    private final List<String> identifierColumns = new ArrayList<>();
    private String executableSql;
    private int rowLimit;

    public ValidationContext(CandidateQuery candidate, List<Token> tokens, SchemaSnapshot snapshot,
                             ValidationLimits limits) {
        this.candidate = candidate;
        this.tokens = List.copyOf(tokens);
        this.snapshot = snapshot;
        this.limits = limits;
        this.executableSql = candidate.sql();
        this.rowLimit = limits.maxRows();
    }

    public CandidateQuery getCandidate() {
        return candidate;
    }

    public String getSql() {
        return candidate.sql();
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public SchemaSnapshot getSnapshot() {
        return snapshot;
    }

    public ValidationLimits getLimits() {
        return limits;
    }

    public SelectQuery query() {
        if (query == null) {
            query = SelectStatementParser.parse(tokens);
        }
        return query;
    }

    public Set<String> getReferencedTables() {
        return referencedTables;
    }

    public List<String> getIdentifierColumns() {
        return identifierColumns;
    }

    public String getExecutableSql() {
        return executableSql;
    }

    public void setExecutableSql(String executableSql) {
        this.executableSql = executableSql;
    }

    public int getRowLimit() {
        return rowLimit;
    }

    public void setRowLimit(int rowLimit) {
        this.rowLimit = rowLimit;
    }
}
