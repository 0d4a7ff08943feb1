package com.compliancescan.parser;

import com.compliancescan.parser.FromItem.DerivedTable;
import com.compliancescan.parser.FromItem.TableRef;
import com.compliancescan.parser.RowBound.Style;
import com.compliancescan.parser.Token.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 只读查询解析器
 * <p>
 * 采用白名单语法：仅接受 SELECT / WITH ... SELECT 及其子句，任何不在语法内的写法都会抛出
 * {@link SqlParseException}。表达式只保留列引用、函数调用与子查询，足够用于结构校验。
 */
public class SelectStatementParser {

    private static final Set<String> CLAUSE_KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "HAVING", "ORDER", "LIMIT", "OFFSET", "FETCH",
            "UNION", "INTERSECT", "EXCEPT", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS",
            "NATURAL", "ON", "USING", "WINDOW", "FOR", "INTO", "AS", "WITH", "LATERAL", "RETURNING");

    /** 出现在两个操作数之间（或操作数之后）的关键字 */
    private static final Set<String> INFIX_KEYWORDS = Set.of(
            "AND", "OR", "NOT", "LIKE", "ILIKE", "IN", "BETWEEN", "ESCAPE", "WHEN", "THEN", "ELSE");

    /** 出现在操作数位置之前的关键字 */
    private static final Set<String> PREFIX_KEYWORDS = Set.of(
            "NOT", "EXISTS", "CASE", "WHEN", "ANY", "SOME", "ALL");

    private static final Set<String> VALUE_KEYWORDS = Set.of(
            "NULL", "TRUE", "FALSE", "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP",
            "LOCALTIME", "LOCALTIMESTAMP");

    private static final Set<String> TYPED_LITERALS = Set.of("DATE", "TIME", "TIMESTAMP", "INTERVAL");

    private static final Set<String> INTERVAL_UNITS = Set.of(
            "YEAR", "YEARS", "MONTH", "MONTHS", "WEEK", "WEEKS", "DAY", "DAYS",
            "HOUR", "HOURS", "MINUTE", "MINUTES", "SECOND", "SECONDS", "TO");

    private static final Set<String> ARGUMENT_SEPARATORS = Set.of("FROM", "FOR", "IN");

    private static final Set<String> JOIN_STARTERS = Set.of("JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "NATURAL");

    private final List<Token> tokens;
    private int pos;

    private SelectStatementParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * 解析单条查询语句，允许末尾有一个分号
     *
     * @param tokens {@link SqlTokenizer} 的输出，以 EOF 结尾
     */
    public static SelectQuery parse(List<Token> tokens) {
        return new SelectStatementParser(tokens).parseStatement();
    }

    private SelectQuery parseStatement() {
        if (!startsQuery()) {
            throw error("语句必须以 SELECT 或 WITH 开头");
        }
        SelectQuery query = parseQuery();
        if (peek().type() == Type.SEMICOLON) {
            advance();
        }
        if (peek().type() != Type.EOF) {
            throw error("语句结尾存在多余内容 '" + peek().text() + "'");
        }
        return query;
    }

    // ---------------------------------------------------------------- query

    private SelectQuery parseQuery() {
        List<CommonTableExpression> ctes = new ArrayList<>();
        if (peek().isWord("WITH")) {
            advance();
            if (peek().isWord("RECURSIVE")) {
                throw error("不支持 WITH RECURSIVE");
            }
            do {
                ctes.add(parseCommonTableExpression());
            } while (acceptComma());
        }

        List<QueryBlock> blocks = new ArrayList<>();
        blocks.add(parseQueryTerm());
        while (peek().isWord("UNION") || peek().isWord("INTERSECT") || peek().isWord("EXCEPT")) {
            advance();
            if (peek().isWord("ALL") || peek().isWord("DISTINCT")) {
                advance();
            }
            blocks.add(parseQueryTerm());
        }

        List<Expression> orderBy = new ArrayList<>();
        if (peek().isWord("ORDER")) {
            advance();
            expectWord("BY");
            parseOrderList(orderBy);
        }

        RowBound rowBound = parseRowBound();

        if (peek().isWord("FOR")) {
            throw error("不允许使用 FOR UPDATE / FOR SHARE 加锁子句");
        }
        return new SelectQuery(ctes, blocks, orderBy, rowBound);
    }

    private CommonTableExpression parseCommonTableExpression() {
        String name = expectIdentifier("WITH 子句名称");
        List<String> columns = new ArrayList<>();
        if (peek().type() == Type.LPAREN) {
            advance();
            do {
                columns.add(expectIdentifier("WITH 子句列名"));
            } while (acceptComma());
            expect(Type.RPAREN);
        }
        expectWord("AS");
        if (peek().isWord("NOT")) {
            advance();
            expectWord("MATERIALIZED");
        } else if (peek().isWord("MATERIALIZED")) {
            advance();
        }
        expect(Type.LPAREN);
        SelectQuery query = parseQuery();
        expect(Type.RPAREN);
        return new CommonTableExpression(name, columns, query);
    }

    private QueryBlock parseQueryTerm() {
        if (peek().type() == Type.LPAREN && startsQueryAt(pos + 1)) {
            advance();
            SelectQuery nested = parseQuery();
            expect(Type.RPAREN);
            return QueryBlock.wrapping(nested);
        }
        expectWord("SELECT");

        List<Expression> distinctOn = new ArrayList<>();
        if (peek().isWord("DISTINCT")) {
            advance();
            if (peek().isWord("ON")) {
                advance();
                expect(Type.LPAREN);
                do {
                    distinctOn.add(parseExpression(false));
                } while (acceptComma());
                expect(Type.RPAREN);
            }
        } else if (peek().isWord("ALL")) {
            advance();
        }

        List<SelectItem> items = new ArrayList<>();
        do {
            items.add(parseSelectItem());
        } while (acceptComma());

        if (peek().isWord("INTO")) {
            throw error("不允许 SELECT INTO（会写入数据）");
        }

        List<FromItem> from = new ArrayList<>();
        List<Expression> joinConditions = new ArrayList<>();
        List<String> usingColumns = new ArrayList<>();
        if (peek().isWord("FROM")) {
            advance();
            parseFromClause(from, joinConditions, usingColumns);
        }

        Expression where = null;
        if (peek().isWord("WHERE")) {
            advance();
            where = parseExpression(false);
        }

        List<Expression> groupBy = new ArrayList<>();
        if (peek().isWord("GROUP")) {
            advance();
            expectWord("BY");
            do {
                groupBy.add(parseExpression(false));
            } while (acceptComma());
        }

        Expression having = null;
        if (peek().isWord("HAVING")) {
            advance();
            having = parseExpression(false);
        }

        if (peek().isWord("WINDOW")) {
            throw error("不支持 WINDOW 子句");
        }
        return new QueryBlock(items, from, joinConditions, usingColumns, where, groupBy, having, distinctOn, null);
    }

    private SelectItem parseSelectItem() {
        if (peek().isOperator("*")) {
            advance();
            return SelectItem.star(null);
        }
        // t.* 或 s.t.*
        if (peek().isIdentifier() && peekAt(pos + 1).type() == Type.DOT && peekAt(pos + 2).isOperator("*")) {
            String qualifier = advance().text();
            advance();
            advance();
            return SelectItem.star(qualifier);
        }
        if (peek().isIdentifier() && peekAt(pos + 1).type() == Type.DOT && peekAt(pos + 2).isIdentifier()
                && peekAt(pos + 3).type() == Type.DOT && peekAt(pos + 4).isOperator("*")) {
            advance();
            advance();
            String qualifier = advance().text();
            advance();
            advance();
            return SelectItem.star(qualifier);
        }

        Expression expression = parseExpression(false);
        String alias = parseOptionalAlias();
        return new SelectItem(expression, alias, false, null);
    }

    private void parseOrderList(List<Expression> target) {
        do {
            target.add(parseExpression(false));
            if (peek().isWord("ASC") || peek().isWord("DESC")) {
                advance();
            }
            if (peek().isWord("NULLS")) {
                advance();
                if (peek().isWord("FIRST") || peek().isWord("LAST")) {
                    advance();
                } else {
                    throw error("NULLS 之后应为 FIRST 或 LAST");
                }
            }
        } while (acceptComma());
    }

    private RowBound parseRowBound() {
        RowBound bound = null;
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            if (peek().isWord("LIMIT")) {
                advance();
                Token value = advance();
                if (value.isWord("ALL")) {
                    bound = new RowBound(Style.LIMIT, null, value.start(), value.end());
                } else if (value.type() == Type.NUMBER && isInteger(value.text())) {
                    bound = new RowBound(Style.LIMIT, Long.parseLong(value.text()), value.start(), value.end());
                } else {
                    throw error("LIMIT 之后应为整数");
                }
                progressed = true;
            } else if (peek().isWord("OFFSET")) {
                advance();
                Token value = advance();
                if (value.type() != Type.NUMBER || !isInteger(value.text())) {
                    throw error("OFFSET 之后应为整数");
                }
                if (peek().isWord("ROW") || peek().isWord("ROWS")) {
                    advance();
                }
                progressed = true;
            } else if (peek().isWord("FETCH")) {
                advance();
                if (!peek().isWord("FIRST") && !peek().isWord("NEXT")) {
                    throw error("FETCH 之后应为 FIRST 或 NEXT");
                }
                advance();
                if (peek().type() == Type.NUMBER) {
                    Token value = advance();
                    if (!isInteger(value.text())) {
                        throw error("FETCH 行数应为整数");
                    }
                    bound = new RowBound(Style.FETCH, Long.parseLong(value.text()), value.start(), value.end());
                } else {
                    bound = new RowBound(Style.FETCH, 1L, -1, -1);
                }
                if (!peek().isWord("ROW") && !peek().isWord("ROWS")) {
                    throw error("FETCH 子句缺少 ROWS");
                }
                advance();
                expectWord("ONLY");
                progressed = true;
            }
        }
        return bound;
    }

    // ---------------------------------------------------------------- from

    private void parseFromClause(List<FromItem> from, List<Expression> joinConditions, List<String> usingColumns) {
        from.add(parseFromItem());
        while (true) {
            if (acceptComma()) {
                from.add(parseFromItem());
                continue;
            }
            Token t = peek();
            if (t.type() != Type.WORD || !JOIN_STARTERS.contains(t.upper())) {
                return;
            }
            boolean requiresCondition = true;
            if (t.isWord("NATURAL")) {
                advance();
                requiresCondition = false;
            }
            if (peek().isWord("CROSS")) {
                advance();
                requiresCondition = false;
            } else if (peek().isWord("INNER")) {
                advance();
            } else if (peek().isWord("LEFT") || peek().isWord("RIGHT") || peek().isWord("FULL")) {
                advance();
                if (peek().isWord("OUTER")) {
                    advance();
                }
            }
            expectWord("JOIN");
            from.add(parseFromItem());

            if (!requiresCondition) {
                continue;
            }
            if (peek().isWord("ON")) {
                advance();
                joinConditions.add(parseExpression(false));
            } else if (peek().isWord("USING")) {
                advance();
                expect(Type.LPAREN);
                do {
                    usingColumns.add(expectIdentifier("USING 列名"));
                } while (acceptComma());
                expect(Type.RPAREN);
            } else {
                throw error("JOIN 缺少 ON 或 USING 条件");
            }
        }
    }

    private FromItem parseFromItem() {
        if (peek().type() == Type.LPAREN) {
            if (!startsQueryAt(pos + 1)) {
                throw error("不支持括号包裹的 JOIN 写法");
            }
            advance();
            SelectQuery query = parseQuery();
            expect(Type.RPAREN);
            String alias = parseOptionalAlias();
            List<String> columnAliases = new ArrayList<>();
            if (alias != null && peek().type() == Type.LPAREN) {
                advance();
                do {
                    columnAliases.add(expectIdentifier("派生表列名"));
                } while (acceptComma());
                expect(Type.RPAREN);
            }
            if (alias == null) {
                throw error("派生表必须指定别名");
            }
            return new DerivedTable(query, alias, columnAliases);
        }
        if (peek().isWord("LATERAL") || peek().isWord("ONLY")) {
            throw error("不支持 " + peek().upper() + " 写法");
        }

        Token first = peek();
        List<String> parts = new ArrayList<>();
        parts.add(expectIdentifier("表名"));
        while (peek().type() == Type.DOT) {
            advance();
            parts.add(expectIdentifier("表名"));
        }
        if (parts.size() > 3) {
            throw error("表名层级过多");
        }
        if (peek().type() == Type.LPAREN) {
            throw error("不允许在 FROM 中调用表函数 " + String.join(".", parts));
        }
        String name = parts.get(parts.size() - 1);
        String schema = parts.size() >= 2 ? parts.get(parts.size() - 2) : null;
        String alias = parseOptionalAlias();
        return new TableRef(schema, name, alias, first.start());
    }

    private String parseOptionalAlias() {
        if (peek().isWord("AS")) {
            advance();
            return expectIdentifier("别名");
        }
        Token t = peek();
        if (t.type() == Type.QUOTED_IDENTIFIER) {
            return advance().text();
        }
        if (t.type() == Type.WORD && !CLAUSE_KEYWORDS.contains(t.upper())) {
            return advance().text();
        }
        return null;
    }

    // ---------------------------------------------------------------- expressions

    private Expression parseExpression(boolean insideFunction) {
        int startIndex = pos;
        Collector collector = new Collector();
        parseExpressionInto(collector, insideFunction);
        if (pos == startIndex) {
            throw error("缺少表达式，遇到 '" + peek().text() + "'");
        }
        return collector.toExpression(isSoleColumn(startIndex, pos));
    }

    private void parseExpressionInto(Collector collector, boolean insideFunction) {
        boolean expectOperand = true;
        while (true) {
            Token t = peek();
            switch (t.type()) {
                case EOF, SEMICOLON, COMMA, RPAREN -> {
                    requireOperandComplete(expectOperand);
                    return;
                }
                case LPAREN -> {
                    if (!expectOperand) {
                        throw error("意外的左括号");
                    }
                    advance();
                    if (startsQuery()) {
                        collector.subqueries.add(parseQuery());
                    } else {
                        do {
                            parseExpressionInto(collector, false);
                        } while (acceptComma());
                    }
                    expect(Type.RPAREN);
                    expectOperand = false;
                }
                case STRING, NUMBER -> {
                    if (!expectOperand) {
                        throw error("意外的常量 '" + t.text() + "'");
                    }
                    advance();
                    expectOperand = false;
                }
                case QUOTED_IDENTIFIER -> {
                    if (!expectOperand) {
                        return;
                    }
                    parseIdentifierOperand(collector);
                    expectOperand = false;
                }
                case OPERATOR -> {
                    if (t.isOperator("::")) {
                        if (expectOperand) {
                            throw error("类型转换缺少操作数");
                        }
                        advance();
                        parseTypeName();
                    } else if (t.isOperator("*") && expectOperand) {
                        if (!insideFunction || peekAt(pos + 1).type() != Type.RPAREN) {
                            throw error("意外的 '*'");
                        }
                        advance();
                        expectOperand = false;
                    } else {
                        advance();
                        expectOperand = true;
                    }
                }
                case DOT -> throw error("意外的 '.'");
                case WORD -> {
                    String word = t.upper();
                    if (!expectOperand) {
                        Infix infix = consumeInfixKeyword(word);
                        if (infix == Infix.NONE) {
                            // 别名或子句关键字，表达式结束
                            return;
                        }
                        expectOperand = infix == Infix.EXPECT_OPERAND;
                    } else if (VALUE_KEYWORDS.contains(word)) {
                        advance();
                        expectOperand = false;
                    } else if (PREFIX_KEYWORDS.contains(word)) {
                        advance();
                    } else if (TYPED_LITERALS.contains(word) && peekAt(pos + 1).type() == Type.STRING) {
                        advance();
                        advance();
                        if ("INTERVAL".equals(word)) {
                            while (peek().type() == Type.WORD && INTERVAL_UNITS.contains(peek().upper())) {
                                advance();
                            }
                        }
                        expectOperand = false;
                    } else if ((CLAUSE_KEYWORDS.contains(word) || INFIX_KEYWORDS.contains(word))
                            && peekAt(pos + 1).type() != Type.LPAREN) {
                        throw error("缺少表达式，遇到关键字 " + word);
                    } else {
                        parseIdentifierOperand(collector);
                        expectOperand = false;
                    }
                }
                default -> throw error("无法识别的内容 '" + t.text() + "'");
            }
        }
    }

    private enum Infix {
        NONE, EXPECT_OPERAND, OPERAND_COMPLETE
    }

    /**
     * 消费操作数之后出现的关键字；返回 NONE 表示该单词不属于表达式
     */
    private Infix consumeInfixKeyword(String word) {
        switch (word) {
            case "END", "ISNULL", "NOTNULL" -> {
                advance();
                return Infix.OPERAND_COMPLETE;
            }
            case "NOT" -> {
                // a NOT IN / NOT LIKE / NOT BETWEEN / NOT SIMILAR TO
                advance();
                if (peek().isWord("SIMILAR")) {
                    advance();
                    expectWord("TO");
                } else if (peek().isWord("IN") || peek().isWord("LIKE") || peek().isWord("ILIKE")
                        || peek().isWord("BETWEEN")) {
                    advance();
                } else {
                    throw error("NOT 之后应为 IN、LIKE、ILIKE、BETWEEN 或 SIMILAR TO");
                }
                return Infix.EXPECT_OPERAND;
            }
            case "IS" -> {
                advance();
                if (peek().isWord("NOT")) {
                    advance();
                }
                if (peek().isWord("DISTINCT")) {
                    advance();
                    expectWord("FROM");
                    return Infix.EXPECT_OPERAND;
                }
                if (peek().isWord("NULL") || peek().isWord("TRUE") || peek().isWord("FALSE")
                        || peek().isWord("UNKNOWN")) {
                    advance();
                    return Infix.OPERAND_COMPLETE;
                }
                throw error("IS 之后应为 NULL、TRUE、FALSE 或 DISTINCT FROM");
            }
            case "SIMILAR" -> {
                advance();
                expectWord("TO");
                return Infix.EXPECT_OPERAND;
            }
            case "AT" -> {
                advance();
                expectWord("TIME");
                expectWord("ZONE");
                return Infix.EXPECT_OPERAND;
            }
            default -> {
                if (INFIX_KEYWORDS.contains(word)) {
                    advance();
                    return Infix.EXPECT_OPERAND;
                }
                return Infix.NONE;
            }
        }
    }

    private void parseIdentifierOperand(Collector collector) {
        Token first = peek();
        List<String> parts = new ArrayList<>();
        parts.add(advance().text());
        while (peek().type() == Type.DOT) {
            advance();
            parts.add(expectIdentifier("标识符"));
        }

        if (peek().type() == Type.LPAREN) {
            String name = String.join(".", parts);
            collector.functions.add(new FunctionCall(name, first.start()));
            parseFunctionArguments(collector, first.type() == Type.WORD && parts.size() == 1 ? first.upper() : name);
            return;
        }
        if (parts.size() > 3) {
            throw error("列引用层级过多");
        }
        String column = parts.get(parts.size() - 1);
        String qualifier = parts.size() >= 2 ? parts.get(parts.size() - 2) : null;
        collector.columns.add(new ColumnRef(qualifier, column, first.start()));
    }

    private void parseFunctionArguments(Collector collector, String functionName) {
        expect(Type.LPAREN);
        if (peek().type() == Type.RPAREN) {
            advance();
            parseFunctionSuffix(collector);
            return;
        }

        switch (functionName) {
            case "EXTRACT" -> {
                if (peek().type() != Type.WORD && peek().type() != Type.STRING) {
                    throw error("EXTRACT 缺少时间字段");
                }
                advance();
                expectWord("FROM");
                parseExpressionInto(collector, true);
                expect(Type.RPAREN);
                return;
            }
            case "CAST" -> {
                parseExpressionInto(collector, true);
                expectWord("AS");
                parseTypeName();
                expect(Type.RPAREN);
                return;
            }
            case "TRIM" -> {
                if (peek().isWord("LEADING") || peek().isWord("TRAILING") || peek().isWord("BOTH")) {
                    advance();
                }
                if (peek().isWord("FROM")) {
                    advance();
                }
            }
            default -> {
            }
        }

        if (peek().isWord("DISTINCT") || peek().isWord("ALL")) {
            advance();
        }
        while (true) {
            parseExpressionInto(collector, true);
            if (acceptComma()) {
                continue;
            }
            Token t = peek();
            if (t.type() == Type.WORD && ARGUMENT_SEPARATORS.contains(t.upper())) {
                advance();
                continue;
            }
            if (t.isWord("ORDER")) {
                advance();
                expectWord("BY");
                List<Expression> ignored = new ArrayList<>();
                parseOrderList(ignored);
                ignored.forEach(collector::absorb);
            }
            break;
        }
        expect(Type.RPAREN);
        parseFunctionSuffix(collector);
    }

    private void parseFunctionSuffix(Collector collector) {
        if (peek().isWord("FILTER")) {
            advance();
            expect(Type.LPAREN);
            expectWord("WHERE");
            parseExpressionInto(collector, false);
            expect(Type.RPAREN);
        }
        if (peek().isWord("OVER")) {
            advance();
            expect(Type.LPAREN);
            if (peek().isWord("PARTITION")) {
                advance();
                expectWord("BY");
                do {
                    parseExpressionInto(collector, false);
                } while (acceptComma());
            }
            if (peek().isWord("ORDER")) {
                advance();
                expectWord("BY");
                List<Expression> order = new ArrayList<>();
                parseOrderList(order);
                order.forEach(collector::absorb);
            }
            if (peek().isWord("ROWS") || peek().isWord("RANGE")) {
                advance();
                parseFrameClause();
            }
            expect(Type.RPAREN);
        }
    }

    private void parseFrameClause() {
        Set<String> frameWords = Set.of("BETWEEN", "AND", "UNBOUNDED", "PRECEDING", "FOLLOWING", "CURRENT", "ROW");
        while (peek().type() != Type.RPAREN) {
            Token t = advance();
            boolean allowed = (t.type() == Type.WORD && frameWords.contains(t.upper())) || t.type() == Type.NUMBER;
            if (!allowed) {
                throw error("窗口范围子句中出现不支持的内容 '" + t.text() + "'");
            }
        }
    }

    private void parseTypeName() {
        if (peek().type() != Type.WORD && peek().type() != Type.QUOTED_IDENTIFIER) {
            throw error("缺少类型名");
        }
        advance();
        // DOUBLE PRECISION、CHARACTER VARYING 等多词类型
        while (peek().isWord("PRECISION") || peek().isWord("VARYING")) {
            advance();
        }
        if (peek().type() == Type.LPAREN) {
            advance();
            do {
                Token size = advance();
                if (size.type() != Type.NUMBER) {
                    throw error("类型长度应为数字");
                }
            } while (acceptComma());
            expect(Type.RPAREN);
        }
        if (peek().isWord("WITH") || peek().isWord("WITHOUT")) {
            advance();
            expectWord("TIME");
            expectWord("ZONE");
        }
    }

    private void requireOperandComplete(boolean expectOperand) {
        if (expectOperand) {
            throw error("表达式不完整，遇到 '" + peek().text() + "'");
        }
    }

    private boolean isSoleColumn(int from, int to) {
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            boolean identifierPart = t.isIdentifier() && ((i - from) % 2 == 0);
            boolean dotPart = t.type() == Type.DOT && ((i - from) % 2 == 1);
            if (!identifierPart && !dotPart) {
                return false;
            }
        }
        return to > from && tokens.get(to - 1).isIdentifier();
    }

    // ---------------------------------------------------------------- token helpers

    private boolean startsQuery() {
        return startsQueryAt(pos);
    }

    private boolean startsQueryAt(int index) {
        Token t = peekAt(index);
        if (t.isWord("SELECT") || t.isWord("WITH")) {
            return true;
        }
        return t.type() == Type.LPAREN && startsQueryAt(index + 1);
    }

    private Token peek() {
        return peekAt(pos);
    }

    private Token peekAt(int index) {
        if (index >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    private Token advance() {
        Token t = peek();
        if (t.type() != Type.EOF) {
            pos++;
        }
        return t;
    }

    private boolean acceptComma() {
        if (peek().type() == Type.COMMA) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(Type type) {
        if (peek().type() != type) {
            throw error("应为 " + type + "，实际为 '" + peek().text() + "'");
        }
        advance();
    }

    private void expectWord(String keyword) {
        if (!peek().isWord(keyword)) {
            throw error("应为 " + keyword + "，实际为 '" + peek().text() + "'");
        }
        advance();
    }

    private String expectIdentifier(String what) {
        Token t = peek();
        if (t.type() == Type.QUOTED_IDENTIFIER || (t.type() == Type.WORD && !CLAUSE_KEYWORDS.contains(t.upper()))) {
            advance();
            return t.text();
        }
        throw error("缺少" + what + "，实际为 '" + t.text() + "'");
    }

    private SqlParseException error(String message) {
        return new SqlParseException(message, peek().start());
    }

    private static boolean isInteger(String text) {
        return !text.isEmpty() && text.length() <= 18 && text.chars().allMatch(Character::isDigit);
    }

    /** 表达式解析过程中的累积器 */
    private static final class Collector {
        private final List<ColumnRef> columns = new ArrayList<>();
        private final List<FunctionCall> functions = new ArrayList<>();
        private final List<SelectQuery> subqueries = new ArrayList<>();

        void absorb(Expression expression) {
            columns.addAll(expression.columns());
            functions.addAll(expression.functions());
            subqueries.addAll(expression.subqueries());
        }

        Expression toExpression(boolean soleColumn) {
            ColumnRef sole = soleColumn && columns.size() == 1 && functions.isEmpty() && subqueries.isEmpty()
                    ? columns.get(0)
                    : null;
            return new Expression(columns, functions, subqueries, sole);
        }
    }
}
