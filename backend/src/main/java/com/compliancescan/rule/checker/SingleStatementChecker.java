package com.compliancescan.rule.checker;

import com.compliancescan.parser.Token;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 只允许单条语句，结尾可带一个分号
 */
@Component
@Order(1)
public class SingleStatementChecker implements QueryChecker {

    @Override
    public String name() {
        return "SINGLE_STATEMENT";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        List<Token> tokens = context.getTokens();
        if (tokens.size() <= 1) {
            return CheckResult.reject("语句为空");
        }
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).type() == Token.Type.SEMICOLON
                    && tokens.get(i + 1).type() != Token.Type.EOF) {
                Token next = tokens.get(i + 1);
                return CheckResult.reject("检测到多条语句，分号之后仍有内容", next.text());
            }
        }
        return CheckResult.pass();
    }
}
