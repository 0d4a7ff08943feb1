package com.compliancescan.parser;

import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ComplianceRule.Severity;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordRuleParserTest {

    @TempDir
    Path tempDir;

    private final WordRuleParser parser = new WordRuleParser();

    private Path writeDocx(String name, String[]... rows) throws Exception {
        Path file = tempDir.resolve(name);
        try (XWPFDocument document = new XWPFDocument(); OutputStream out = Files.newOutputStream(file)) {
            document.createParagraph().createRun().setText("合规规则清单");
            XWPFTable table = document.createTable(rows.length, rows[0].length);
            for (int r = 0; r < rows.length; r++) {
                XWPFTableRow row = table.getRow(r);
                for (int c = 0; c < rows[r].length; c++) {
                    row.getCell(c).setText(rows[r][c]);
                }
            }
            document.write(out);
        }
        return file;
    }

    private List<ComplianceRule> parse(Path file) throws Exception {
        try (InputStream in = Files.newInputStream(file)) {
            return parser.parse(in);
        }
    }

    @Test
    void shouldReadRulesFromTableByHeader() throws Exception {
        Path file = writeDocx("rules.docx",
                new String[]{"规则编号", "规则描述", "判定条件", "目标表", "严重等级"},
                new String[]{"FIN-002", "大额交易必须经过核验", "amount > 10000 且未核验", "transactions", "严重"},
                new String[]{"KYC-001", "客户必须完成实名认证", "kyc_level = 0", "", "高"});

        List<ComplianceRule> rules = parse(file);

        assertEquals(2, rules.size());
        ComplianceRule fin = rules.get(0);
        assertEquals("FIN-002", fin.getRuleCode());
        assertEquals("大额交易必须经过核验", fin.getDescription());
        assertEquals("amount > 10000 且未核验", fin.getEvaluationCriteria());
        assertEquals("transactions", fin.getTargetTable());
        assertEquals(Severity.CRITICAL, fin.getSeverity());
        assertTrue(fin.isActive());
        assertNull(fin.getPresetQuery());

        ComplianceRule kyc = rules.get(1);
        assertNull(kyc.getTargetTable());
        assertEquals(Severity.HIGH, kyc.getSeverity());
    }

    @Test
    void shouldReadPresetQueryColumn() throws Exception {
        Path file = writeDocx("preset.docx",
                new String[]{"Code", "Description", "Criteria", "SQL"},
                new String[]{"AML-004", "可疑转账需上报", "flagged = true", "SELECT id FROM transfers WHERE flagged"});

        ComplianceRule rule = parse(file).get(0);

        assertEquals("SELECT id FROM transfers WHERE flagged", rule.getPresetQuery());
        assertEquals(Severity.MEDIUM, rule.getSeverity());
    }

    @Test
    void shouldSkipRowsWithoutCodeOrDescription() throws Exception {
        Path file = writeDocx("partial.docx",
                new String[]{"编号", "说明"},
                new String[]{"", "缺少编号"},
                new String[]{"R-2", ""},
                new String[]{"R-3", "完整规则"});

        List<ComplianceRule> rules = parse(file);

        assertEquals(1, rules.size());
        assertEquals("R-3", rules.get(0).getRuleCode());
    }

    @Test
    void shouldIgnoreTablesWithoutRuleColumns() throws Exception {
        Path file = writeDocx("other.docx",
                new String[]{"姓名", "部门"},
                new String[]{"张三", "风控部"});

        assertTrue(parse(file).isEmpty());
    }

    @Test
    void shouldRejectNonDocxContent() {
        InputStream notWord = new ByteArrayInputStream("plain text".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> parser.parse(notWord));
    }

    @Test
    void shouldMapSeverityNames() {
        assertEquals(Severity.LOW, WordRuleParser.parseSeverity("low"));
        assertEquals(Severity.LOW, WordRuleParser.parseSeverity("低"));
        assertEquals(Severity.CRITICAL, WordRuleParser.parseSeverity("致命"));
        assertEquals(Severity.MEDIUM, WordRuleParser.parseSeverity(null));
        assertEquals(Severity.MEDIUM, WordRuleParser.parseSeverity("未知"));
    }
}
