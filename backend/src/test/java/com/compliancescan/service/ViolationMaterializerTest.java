package com.compliancescan.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.ComplianceRule.Severity;
import com.compliancescan.model.Detection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ViolationMaterializerTest {

    private final ViolationMaterializer materializer = new ViolationMaterializer();

    private final ComplianceRule rule = ComplianceRule.builder()
            .id("rule-1")
            .ruleCode("FIN-002")
            .description("大额交易必须经过核验")
            .evaluationCriteria("amount > 10000 且 verified 为 false")
            .severity(Severity.CRITICAL)
            .active(true)
            .build();

    private final Logger materializerLog = (Logger) LoggerFactory.getLogger(ViolationMaterializer.class);
    private final ListAppender<ILoggingEvent> logEvents = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        logEvents.start();
        materializerLog.addAppender(logEvents);
    }

    @AfterEach
    void detachAppender() {
        materializerLog.detachAppender(logEvents);
        logEvents.stop();
    }

    private List<ILoggingEvent> warnings() {
        return logEvents.list.stream().filter(e -> e.getLevel() == Level.WARN).toList();
    }

    private static Map<String, Object> row(Object... pairs) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            row.put((String) pairs[i], pairs[i + 1]);
        }
        return row;
    }

    @Test
    void shouldUsePrimaryKeyColumnsInOrder() {
        Map<String, Object> row = row("ORDER_ID", 7, "line_no", 2, "amount", "10.00");

        assertEquals("7|2", materializer.recordIdentifier(row, List.of("order_id", "LINE_NO")));
    }

    @Test
    void shouldFallBackToIdThenForeignKeyThenFirstColumn() {
        assertEquals("42", materializer.recordIdentifier(row("name", "x", "ID", 42), List.of("pk")));
        assertEquals("9", materializer.recordIdentifier(row("name", "x", "customer_id", 9), List.of()));
        assertEquals("x", materializer.recordIdentifier(row("name", "x", "amount", 1), List.of()));
        assertEquals("unknown", materializer.recordIdentifier(row(), List.of()));
    }

    @Test
    void shouldKeepFirstRowPerIdentifier() {
        List<Detection> detections = materializer.materialize(rule, List.of("id"), List.of(
                row("id", 1, "amount", "20000.00"),
                row("id", 1, "amount", "30000.00"),
                row("id", 2, "amount", "40000.00")));

        assertEquals(2, detections.size());
        assertEquals("20000.00", detections.get(0).recordData().get("amount"));
    }

    @Test
    void shouldDescribeViolationFromRule() {
        Detection detection = materializer.materialize(rule, List.of("id"), List.of(row("id", 5))).get(0);

        assertEquals("rule-1", detection.key().ruleId());
        assertEquals("5", detection.key().recordIdentifier());
        assertEquals(Severity.CRITICAL, detection.severity());
        assertEquals("记录违反规则 'FIN-002'：大额交易必须经过核验。判定条件：amount > 10000 且 verified 为 false",
                detection.justification());
        assertEquals("请核查记录 '5'，使其符合规则 'FIN-002' 的要求。", detection.remediation());
    }

    @Test
    void shouldWarnOnceWhenIdentifierFallsBackToJoinedKey() {
        List<Detection> detections = materializer.materialize(rule, List.of("id"), List.of(
                row("customer_id", 7, "amount", "20000.00"),
                row("customer_id", 8, "amount", "30000.00")));

        assertEquals(List.of("7", "8"), detections.stream().map(d -> d.key().recordIdentifier()).toList());
        List<ILoggingEvent> warnings = warnings();
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getFormattedMessage().contains("FIN-002"));
        assertTrue(warnings.get(0).getFormattedMessage().contains("customer_id"));
    }

    @Test
    void shouldNotWarnWhenPrimaryKeyIsSelected() {
        materializer.materialize(rule, List.of("id"), List.of(row("id", 1, "customer_id", 7)));
        materializer.materialize(rule, List.of("id"), List.of());

        assertTrue(warnings().isEmpty());
    }
}
