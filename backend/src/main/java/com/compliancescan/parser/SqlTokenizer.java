package com.compliancescan.parser;

import com.compliancescan.parser.Token.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * SQL 词法分析器
 * <p>
 * 跳过行注释与块注释，识别字符串、带引号标识符、数字与运算符。
 * 不支持的写法（参数占位符、美元符号字符串等）直接报错，而不是猜测其含义。
 */
public class SqlTokenizer {

    private static final Set<String> OPERATORS = Set.of(
            "<>", "!=", "<=", ">=", "||", "::", "->>", "->", "!~*", "!~", "~*",
            "=", "<", ">", "+", "-", "*", "/", "%", "~");

    public List<Token> tokenize(String sql) {
        if (sql == null) {
            throw new SqlParseException("SQL 为空", -1);
        }
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = sql.length();

        while (i < length) {
            char c = sql.charAt(i);
            char next = (i + 1 < length) ? sql.charAt(i + 1) : 0;

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            // 行注释
            if (c == '-' && next == '-') {
                while (i < length && sql.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }

            // 块注释
            if (c == '/' && next == '*') {
                int close = sql.indexOf("*/", i + 2);
                if (close < 0) {
                    throw new SqlParseException("块注释未闭合", i);
                }
                i = close + 2;
                continue;
            }

            if (c == '\'') {
                i = readQuoted(sql, i, '\'', Type.STRING, tokens);
                continue;
            }
            if (c == '"') {
                i = readQuoted(sql, i, '"', Type.QUOTED_IDENTIFIER, tokens);
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_')) {
                    i++;
                }
                if (i < length && sql.charAt(i) == '$') {
                    throw new SqlParseException("不支持的标识符", start);
                }
                tokens.add(new Token(Type.WORD, sql.substring(start, i), start, i));
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && Character.isDigit(next))) {
                i = readNumber(sql, i, tokens);
                continue;
            }

            switch (c) {
                case '(' -> tokens.add(new Token(Type.LPAREN, "(", i, i + 1));
                case ')' -> tokens.add(new Token(Type.RPAREN, ")", i, i + 1));
                case ',' -> tokens.add(new Token(Type.COMMA, ",", i, i + 1));
                case '.' -> tokens.add(new Token(Type.DOT, ".", i, i + 1));
                case ';' -> tokens.add(new Token(Type.SEMICOLON, ";", i, i + 1));
                default -> {
                    String operator = matchOperator(sql, i);
                    if (operator == null) {
                        throw new SqlParseException("无法识别的字符 '" + c + "'", i);
                    }
                    tokens.add(new Token(Type.OPERATOR, operator, i, i + operator.length()));
                    i += operator.length();
                    continue;
                }
            }
            i++;
        }

        tokens.add(new Token(Type.EOF, "", length, length));
        return tokens;
    }

    private int readQuoted(String sql, int start, char quote, Type type, List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == quote) {
                // 连续两个引号表示转义
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    sb.append(quote);
                    i += 2;
                    continue;
                }
                tokens.add(new Token(type, sb.toString(), start, i + 1));
                return i + 1;
            }
            sb.append(c);
            i++;
        }
        throw new SqlParseException(type == Type.STRING ? "字符串未闭合" : "标识符引号未闭合", start);
    }

    private int readNumber(String sql, int start, List<Token> tokens) {
        int i = start;
        boolean seenDot = false;
        boolean seenExponent = false;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (Character.isDigit(c)) {
                i++;
            } else if (c == '.' && !seenDot && !seenExponent) {
                seenDot = true;
                i++;
            } else if ((c == 'e' || c == 'E') && !seenExponent && i + 1 < sql.length()
                    && (Character.isDigit(sql.charAt(i + 1)) || sql.charAt(i + 1) == '-' || sql.charAt(i + 1) == '+')) {
                seenExponent = true;
                i += 2;
            } else {
                break;
            }
        }
        if (i < sql.length() && (Character.isLetter(sql.charAt(i)) || sql.charAt(i) == '_')) {
            throw new SqlParseException("数字后紧跟非法字符", i);
        }
        tokens.add(new Token(Type.NUMBER, sql.substring(start, i), start, i));
        return i;
    }

    private String matchOperator(String sql, int start) {
        for (int len = 3; len >= 1; len--) {
            if (start + len <= sql.length()) {
                String candidate = sql.substring(start, start + len);
                if (OPERATORS.contains(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }
}
