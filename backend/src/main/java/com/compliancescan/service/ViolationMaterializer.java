package com.compliancescan.service;

import com.compliancescan.model.ComplianceRule;
import com.compliancescan.model.Detection;
import com.compliancescan.model.ViolationKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * 把命中行转换为违规候选
 * <p>
 * 记录标识优先取驱动表主键列；结果集中缺少主键列时依次退回 {@code id} 列、任意 {@code *_id} 列、第一列。
 * 同一规则下标识相同的行只保留第一行。
 */
@Service
public class ViolationMaterializer {

    private static final Logger log = LoggerFactory.getLogger(ViolationMaterializer.class);

    static final String UNKNOWN_IDENTIFIER = "unknown";

    /**
     * 读取当前行，字段值转换为可以序列化为 JSON 的形式
     */
    public Map<String, Object> readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            String label = meta.getColumnLabel(i);
            if (row.containsKey(label)) {
                continue;
            }
            row.put(label, toJsonValue(rs.getObject(i)));
        }
        return row;
    }

    public List<Detection> materialize(ComplianceRule rule, List<String> identifierColumns,
                                       List<Map<String, Object>> rows) {
        if (!rows.isEmpty() && !hasColumns(rows.get(0), identifierColumns)) {
            // 关联查询中退回的列可能属于被关联的表，标识可能不唯一
            log.warn("规则 {} 的结果缺少主键列 {}，记录标识改用 {} 列", rule.getRuleCode(), identifierColumns,
                    fallbackLabel(rows.get(0)));
        }
        Map<String, Detection> byIdentifier = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            String identifier = recordIdentifier(row, identifierColumns);
            if (byIdentifier.containsKey(identifier)) {
                continue;
            }
            byIdentifier.put(identifier, new Detection(
                    new ViolationKey(rule.getId(), identifier),
                    rule.getRuleCode(),
                    rule.getSeverity(),
                    row,
                    justification(rule),
                    remediation(rule, identifier)));
        }
        return new ArrayList<>(byIdentifier.values());
    }

    String recordIdentifier(Map<String, Object> row, List<String> identifierColumns) {
        if (hasColumns(row, identifierColumns)) {
            StringJoiner joiner = new StringJoiner("|");
            for (String column : identifierColumns) {
                joiner.add(String.valueOf(row.get(findLabel(row, column))));
            }
            return joiner.toString();
        }
        String fallback = fallbackLabel(row);
        return fallback == null ? UNKNOWN_IDENTIFIER : String.valueOf(row.get(fallback));
    }

    private static boolean hasColumns(Map<String, Object> row, List<String> identifierColumns) {
        return !identifierColumns.isEmpty()
                && identifierColumns.stream().allMatch(column -> findLabel(row, column) != null);
    }

    /**
     * 依次取 id 列、第一个 *_id 列、第一列；空行返回 null
     */
    private static String fallbackLabel(Map<String, Object> row) {
        String id = findLabel(row, "id");
        if (id != null) {
            return id;
        }
        for (String label : row.keySet()) {
            if (label.toLowerCase(Locale.ROOT).endsWith("_id")) {
                return label;
            }
        }
        return row.isEmpty() ? null : row.keySet().iterator().next();
    }

    private static String findLabel(Map<String, Object> row, String column) {
        for (String label : row.keySet()) {
            if (label.equalsIgnoreCase(column)) {
                return label;
            }
        }
        return null;
    }

    private static String justification(ComplianceRule rule) {
        return "记录违反规则 '" + rule.getRuleCode() + "'：" + nullToEmpty(rule.getDescription())
                + "。判定条件：" + nullToEmpty(rule.getEvaluationCriteria());
    }

    private static String remediation(ComplianceRule rule, String identifier) {
        return "请核查记录 '" + identifier + "'，使其符合规则 '" + rule.getRuleCode() + "' 的要求。";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static Object toJsonValue(Object value) throws SQLException {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Integer
                || value instanceof Long || value instanceof Short) {
            return value;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().toString();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof Time time) {
            return time.toLocalTime().toString();
        }
        if (value instanceof Clob clob) {
            long length = clob.length();
            return clob.getSubString(1, (int) Math.min(length, 4096));
        }
        if (value instanceof byte[] bytes) {
            return "<binary " + bytes.length + " bytes>";
        }
        return value.toString();
    }
}
