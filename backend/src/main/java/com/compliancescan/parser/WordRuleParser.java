package com.compliancescan.parser;

import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ComplianceRule.Severity;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Word 文档规则表解析器
 * <p>
 * 从 .docx 文件的表格中读取合规规则，表头决定列含义：
 * | 规则编号 | 规则描述 | 判定条件 | 目标表 | 严重等级 | 预置 SQL |
 * 其中编号与描述必填，其余列可省略。正文段落不做解析。
 */
@Component
public class WordRuleParser {

    private static final Logger log = LoggerFactory.getLogger(WordRuleParser.class);

    /**
     * 解析 Word 文档中的全部规则表；导入的规则默认启用
     *
     * @throws IllegalArgumentException 文件不是有效的 .docx 文档
     */
    public List<ComplianceRule> parse(InputStream inputStream) {
        List<ComplianceRule> rules = new ArrayList<>();
        try (XWPFDocument document = new XWPFDocument(inputStream)) {
            for (XWPFTable table : document.getTables()) {
                rules.addAll(parseTable(table));
            }
        } catch (IOException | RuntimeException e) {
            log.error("解析 Word 文档失败", e);
            throw new IllegalArgumentException("无法解析上传的 Word 文档: " + e.getMessage(), e);
        }
        log.info("从 Word 文档中解析出 {} 条规则", rules.size());
        return rules;
    }

    private List<ComplianceRule> parseTable(XWPFTable table) {
        List<ComplianceRule> rules = new ArrayList<>();
        List<XWPFTableRow> rows = table.getRows();
        if (rows.size() < 2) {
            return rules;
        }

        Columns columns = Columns.fromHeader(rows.get(0));
        if (columns.code < 0 || columns.description < 0) {
            log.info("表格缺少规则编号或规则描述列，已跳过");
            return rules;
        }

        for (int i = 1; i < rows.size(); i++) {
            XWPFTableRow row = rows.get(i);
            String code = cellText(row, columns.code);
            String description = cellText(row, columns.description);
            if (code.isBlank() || description.isBlank()) {
                continue;
            }
            rules.add(ComplianceRule.builder()
                    .ruleCode(code)
                    .description(description)
                    .evaluationCriteria(blankToNull(cellText(row, columns.criteria)))
                    .targetTable(blankToNull(cellText(row, columns.targetTable)))
                    .severity(parseSeverity(cellText(row, columns.severity)))
                    .presetQuery(blankToNull(cellText(row, columns.presetQuery)))
                    .active(true)
                    .build());
        }
        return rules;
    }

    /**
     * 表头中各列的位置，未出现的列为 -1
     */
    private static final class Columns {
        int code = -1;
        int description = -1;
        int criteria = -1;
        int targetTable = -1;
        int severity = -1;
        int presetQuery = -1;

        static Columns fromHeader(XWPFTableRow header) {
            Columns columns = new Columns();
            for (int i = 0; i < header.getTableCells().size(); i++) {
                String text = header.getCell(i).getText().trim().toLowerCase(Locale.ROOT);
                if (text.contains("编号") || text.contains("code") || text.equals("id")) {
                    columns.code = i;
                } else if (text.contains("判定") || text.contains("条件") || text.contains("criteria")) {
                    columns.criteria = i;
                } else if (text.contains("目标表") || text.contains("table")) {
                    columns.targetTable = i;
                } else if (text.contains("等级") || text.contains("级别") || text.contains("严重")
                        || text.contains("severity")) {
                    columns.severity = i;
                } else if (text.contains("sql") || text.contains("查询")) {
                    columns.presetQuery = i;
                } else if (text.contains("描述") || text.contains("规则") || text.contains("说明")
                        || text.contains("description")) {
                    columns.description = i;
                }
            }
            return columns;
        }
    }

    private String cellText(XWPFTableRow row, int col) {
        if (col >= 0 && col < row.getTableCells().size()) {
            return row.getCell(col).getText().trim();
        }
        return "";
    }

    static Severity parseSeverity(String text) {
        if (text == null || text.isBlank()) {
            return Severity.MEDIUM;
        }
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "LOW", "低" -> Severity.LOW;
            case "HIGH", "高" -> Severity.HIGH;
            case "CRITICAL", "严重", "致命" -> Severity.CRITICAL;
            default -> Severity.MEDIUM;
        };
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }
}
