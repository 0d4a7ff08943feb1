package com.compliancescan.rule.checker;

import com.compliancescan.parser.FunctionCall;
import com.compliancescan.parser.QueryWalker;
import com.compliancescan.parser.SqlParseException;
import com.compliancescan.parser.Token;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * 只读白名单检查
 * <p>
 * 语句必须是 SELECT 或 WITH ... SELECT；写入与 DDL 关键字直接拒绝；其余结构由解析器的白名单语法约束，
 * 函数调用只允许出现在 {@link #ALLOWED_FUNCTIONS} 中的函数。
 */
@Component
@Order(2)
public class ReadOnlyChecker implements QueryChecker {

    private static final Set<String> FORBIDDEN_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "MERGE", "UPSERT", "DROP", "CREATE", "ALTER", "TRUNCATE",
            "GRANT", "REVOKE", "COPY", "EXEC", "EXECUTE", "CALL", "VACUUM", "REINDEX", "INTO");

    static final Set<String> ALLOWED_FUNCTIONS = Set.of(
            // 聚合
            "COUNT", "SUM", "AVG", "MIN", "MAX", "BOOL_AND", "BOOL_OR", "EVERY", "STRING_AGG",
            // 空值与比较
            "COALESCE", "NULLIF", "GREATEST", "LEAST",
            // 字符串
            "LOWER", "UPPER", "LENGTH", "CHAR_LENGTH", "CHARACTER_LENGTH", "TRIM", "LTRIM", "RTRIM", "BTRIM",
            "SUBSTRING", "SUBSTR", "POSITION", "STRPOS", "REPLACE", "CONCAT", "CONCAT_WS", "LEFT", "RIGHT",
            "LPAD", "RPAD", "SPLIT_PART", "REGEXP_REPLACE", "REGEXP_LIKE", "INITCAP", "REVERSE",
            // 数值
            "ABS", "ROUND", "CEIL", "CEILING", "FLOOR", "MOD", "POWER", "SQRT", "SIGN", "TRUNC",
            // 日期时间
            "NOW", "DATE_TRUNC", "DATE_PART", "EXTRACT", "AGE", "TO_CHAR", "TO_DATE", "TO_TIMESTAMP",
            "TO_NUMBER", "DATEADD", "DATEDIFF", "MAKE_DATE", "YEAR", "MONTH", "DAY",
            // 类型转换
            "CAST",
            // 窗口
            "ROW_NUMBER", "RANK", "DENSE_RANK", "LAG", "LEAD", "FIRST_VALUE", "LAST_VALUE", "NTILE");

    @Override
    public String name() {
        return "READ_ONLY";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        Token first = context.getTokens().get(0);
        if (!first.isWord("SELECT") && !first.isWord("WITH") && first.type() != Token.Type.LPAREN) {
            return CheckResult.reject("只允许 SELECT 查询，语句以 '" + first.text() + "' 开头", first.text());
        }

        for (Token token : context.getTokens()) {
            if (token.type() == Token.Type.WORD && FORBIDDEN_KEYWORDS.contains(token.upper())) {
                return CheckResult.reject("查询中包含禁止的关键字 " + token.upper(), token.text());
            }
        }

        try {
            context.query();
        } catch (SqlParseException e) {
            return CheckResult.reject("不是受支持的只读查询：" + e.getMessage());
        }

        for (FunctionCall function : QueryWalker.functions(context.query())) {
            String name = function.name().toUpperCase(Locale.ROOT);
            if (!ALLOWED_FUNCTIONS.contains(name)) {
                return CheckResult.reject("函数 " + function.name() + " 不在允许列表中", function.name());
            }
        }
        return CheckResult.pass();
    }
}
