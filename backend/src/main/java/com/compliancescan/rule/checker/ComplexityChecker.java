package com.compliancescan.rule.checker;

import com.compliancescan.parser.QueryWalker;
import com.compliancescan.parser.RowBound;
import com.compliancescan.parser.SelectQuery;
import com.compliancescan.parser.Token;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 复杂度与行数上限
 * <p>
 * 子查询深度、连接次数与词法单元数超过阈值时拒绝；通过后对最外层查询强制行数上限：
 * 无上限时追加 {@code LIMIT}，上限过大时改写为阈值。
 */
@Component
@Order(4)
public class ComplexityChecker implements QueryChecker {

    @Override
    public String name() {
        return "COMPLEXITY";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        ValidationLimits limits = context.getLimits();

        int tokenCount = context.getTokens().size() - 1;
        if (tokenCount > limits.maxTokens()) {
            return CheckResult.reject("查询过长：" + tokenCount + " 个词法单元，上限为 " + limits.maxTokens());
        }

        SelectQuery query = context.query();
        int depth = QueryWalker.subqueryDepth(query);
        if (depth > limits.maxSubqueryDepth()) {
            return CheckResult.reject("子查询嵌套深度为 " + depth + " 层，超过上限 " + limits.maxSubqueryDepth(),
                    depth + "-level nested subqueries");
        }

        int joins = QueryWalker.joinCount(query);
        if (joins > limits.maxJoins()) {
            return CheckResult.reject("连接次数为 " + joins + "，超过上限 " + limits.maxJoins());
        }

        enforceRowLimit(context, query.rowBound());
        return CheckResult.pass();
    }

    private void enforceRowLimit(ValidationContext context, RowBound bound) {
        int maxRows = context.getLimits().maxRows();
        String statement = context.getSql().substring(0, statementEnd(context.getTokens()));

        if (bound == null) {
            context.setExecutableSql(statement + " LIMIT " + maxRows);
            context.setRowLimit(maxRows);
            return;
        }
        if (bound.isUnbounded() || bound.value() > maxRows) {
            if (bound.valueStart() < 0) {
                context.setExecutableSql(statement + " LIMIT " + maxRows);
            } else {
                context.setExecutableSql(statement.substring(0, bound.valueStart()) + maxRows
                        + statement.substring(bound.valueEnd()));
            }
            context.setRowLimit(maxRows);
            return;
        }
        context.setExecutableSql(statement);
        context.setRowLimit((int) Math.max(bound.value(), 0L));
    }

    /**
     * 最后一个有效词法单元的结束位置，去掉结尾的分号与注释
     */
    private int statementEnd(List<Token> tokens) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            Token token = tokens.get(i);
            if (token.type() != Token.Type.EOF && token.type() != Token.Type.SEMICOLON) {
                return token.end();
            }
        }
        return 0;
    }
}
