package com.compliancescan.service;

import com.compliancescan.model.CandidateQuery;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.model.ValidatedQuery;
import com.compliancescan.parser.SqlParseException;
import com.compliancescan.parser.SqlTokenizer;
import com.compliancescan.parser.Token;
import com.compliancescan.rule.checker.QueryChecker;
import com.compliancescan.rule.checker.QueryChecker.CheckResult;
import com.compliancescan.rule.checker.ValidationContext;
import com.compliancescan.rule.checker.ValidationLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 候选查询校验
 * <p>
 * 依次执行各检查器，任何一项拒绝即返回拒绝原因；全部通过后产出强制了行数上限的可执行查询。
 */
public class QueryValidator {

    private static final Logger log = LoggerFactory.getLogger(QueryValidator.class);

    private final List<QueryChecker> checkers;
    private final ValidationLimits limits;
    private final SqlTokenizer tokenizer = new SqlTokenizer();

    /**
     * @param checkers 按执行顺序排列的检查器
     */
    public QueryValidator(List<QueryChecker> checkers, ValidationLimits limits) {
        this.checkers = List.copyOf(checkers);
        this.limits = limits;
    }

    /**
     * 校验结果：可执行查询，或拒绝原因
     */
    public sealed interface Validation permits Accepted, Rejected {
    }

    public record Accepted(ValidatedQuery query) implements Validation {
    }

    public record Rejected(String checker, String reason) implements Validation {
        public String describe() {
            return checker + ": " + reason;
        }
    }

    public Validation validate(CandidateQuery candidate, SchemaSnapshot snapshot) {
        if (!snapshot.getVersion().equals(candidate.snapshotVersion())) {
            return reject(candidate, "STALE_SCHEMA",
                    "查询基于结构版本 " + candidate.snapshotVersion() + "，当前为 " + snapshot.getVersion());
        }

        List<Token> tokens;
        try {
            tokens = tokenizer.tokenize(candidate.sql());
        } catch (SqlParseException e) {
            return reject(candidate, "SYNTAX", e.getMessage());
        }

        ValidationContext context = new ValidationContext(candidate, tokens, snapshot, limits);
        for (QueryChecker checker : checkers) {
            CheckResult result;
            try {
                result = checker.check(context);
            } catch (SqlParseException e) {
                result = CheckResult.reject("不是受支持的只读查询：" + e.getMessage());
            }
            if (!result.passed()) {
                return reject(candidate, checker.name(), result.reason());
            }
        }

        return new Accepted(new ValidatedQuery(
                candidate.ruleId(),
                context.getExecutableSql(),
                snapshot.getVersion(),
                new ArrayList<>(context.getReferencedTables()),
                context.getIdentifierColumns(),
                context.getRowLimit()));
    }

    private Validation reject(CandidateQuery candidate, String checker, String reason) {
        log.warn("规则 {} 的查询被拒绝 [{}]: {}", candidate.ruleId(), checker, reason);
        return new Rejected(checker, reason);
    }
}
