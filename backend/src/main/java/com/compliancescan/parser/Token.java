package com.compliancescan.parser;

import java.util.Locale;

/**
 * 词法单元
 *
 * @param type  类型
 * @param text  原始文本（带引号的标识符与字符串已去掉引号）
 * @param start 在原 SQL 中的起始偏移
 * @param end   在原 SQL 中的结束偏移（不含）
 */
public record Token(Type type, String text, int start, int end) {

    public enum Type {
        WORD, QUOTED_IDENTIFIER, STRING, NUMBER, OPERATOR,
        LPAREN, RPAREN, COMMA, DOT, SEMICOLON, EOF
    }

    /** 未加引号的单词是否为指定关键字（忽略大小写） */
    public boolean isWord(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isOperator(String operator) {
        return type == Type.OPERATOR && text.equals(operator);
    }

    public boolean isIdentifier() {
        return type == Type.WORD || type == Type.QUOTED_IDENTIFIER;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }
}
