package com.compliancescan.rule.checker;

import com.compliancescan.model.ColumnInfo;
import com.compliancescan.model.SchemaSnapshot;
import com.compliancescan.model.TableInfo;
import com.compliancescan.parser.ColumnRef;
import com.compliancescan.parser.CommonTableExpression;
import com.compliancescan.parser.Expression;
import com.compliancescan.parser.FromItem;
import com.compliancescan.parser.FromItem.DerivedTable;
import com.compliancescan.parser.FromItem.TableRef;
import com.compliancescan.parser.QueryBlock;
import com.compliancescan.parser.SelectItem;
import com.compliancescan.parser.SelectQuery;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 结构引用检查：查询中的每个表、限定符与列都必须能在结构快照中解析
 * <p>
 * 解析顺序与数据库一致：先当前块的来源（物理表、WITH 定义、派生表），再外层查询（相关子查询）。
 * ORDER BY / GROUP BY / HAVING 中可以使用 SELECT 列表别名。
 * 通过时把引用到的物理表与驱动表主键写入上下文。
 */
@Component
@Order(3)
public class SchemaReferenceChecker implements QueryChecker {

    @Override
    public String name() {
        return "SCHEMA_REFERENCE";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        Resolver resolver = new Resolver(context.getSnapshot());
        try {
            resolver.resolveQuery(context.query(), null, Map.of(), true);
        } catch (UnresolvedReferenceException e) {
            return CheckResult.reject(e.getMessage(), e.offendingText);
        }
        if (resolver.referencedTables.isEmpty()) {
            return CheckResult.reject("查询未引用数据库中的任何表");
        }
        context.getReferencedTables().addAll(resolver.referencedTables);
        if (resolver.drivingTable != null) {
            context.getIdentifierColumns().addAll(resolver.drivingTable.primaryKeyColumns());
        }
        return CheckResult.pass();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * FROM 中的一个来源及其可见列
     */
    private record Source(String referenceName, TableInfo table, List<String> columns) {

        boolean matches(String qualifier) {
            if (referenceName.equalsIgnoreCase(qualifier)) {
                return true;
            }
            return table != null && table.name().equalsIgnoreCase(qualifier);
        }

        boolean hasColumn(String column) {
            return columns.stream().anyMatch(c -> c != null && c.equalsIgnoreCase(column));
        }
    }

    private static final class Scope {
        private final Scope parent;
        private final List<Source> sources = new ArrayList<>();
        private final Set<String> selectAliases = new HashSet<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        Optional<Source> findSource(String qualifier) {
            return sources.stream().filter(s -> s.matches(qualifier)).findFirst();
        }
    }

    private static final class Resolver {
        private final SchemaSnapshot snapshot;
        private final Set<String> referencedTables = new LinkedHashSet<>();
        private TableInfo drivingTable;

        Resolver(SchemaSnapshot snapshot) {
            this.snapshot = snapshot;
        }

        /**
         * 解析查询并返回其输出列名（按第一个分支）
         */
        List<String> resolveQuery(SelectQuery query, Scope outer, Map<String, List<String>> visibleCtes,
                                  boolean topLevel) {
            Map<String, List<String>> ctes = new HashMap<>(visibleCtes);
            for (CommonTableExpression cte : query.ctes()) {
                List<String> columns = resolveQuery(cte.query(), outer, ctes, false);
                if (!cte.columnNames().isEmpty()) {
                    if (cte.columnNames().size() != columns.size()) {
                        throw new UnresolvedReferenceException(
                                "WITH 子句 " + cte.name() + " 声明的列数与查询输出不一致", cte.name());
                    }
                    columns = cte.columnNames();
                }
                ctes.put(key(cte.name()), columns);
            }

            List<String> outputs = null;
            Scope firstScope = null;
            for (int i = 0; i < query.blocks().size(); i++) {
                QueryBlock block = query.blocks().get(i);
                Scope scope = new Scope(outer);
                List<String> blockOutputs = resolveBlock(block, scope, ctes, topLevel && i == 0);
                if (outputs == null) {
                    outputs = blockOutputs;
                    firstScope = scope;
                }
            }

            if (!query.orderBy().isEmpty()) {
                // 集合运算的 ORDER BY 只能引用输出列
                Scope orderScope = query.blocks().size() == 1 ? firstScope : outputScope(outer, outputs);
                for (Expression expression : query.orderBy()) {
                    resolveExpression(expression, orderScope, ctes, true);
                }
            }
            return outputs;
        }

        private Scope outputScope(Scope outer, List<String> outputs) {
            Scope scope = new Scope(outer);
            for (String output : outputs) {
                if (output != null) {
                    scope.selectAliases.add(key(output));
                }
            }
            return scope;
        }

        private List<String> resolveBlock(QueryBlock block, Scope scope, Map<String, List<String>> ctes,
                                          boolean drivingBlock) {
            if (block.parenthesized() != null) {
                return resolveQuery(block.parenthesized(), scope.parent, ctes, drivingBlock);
            }

            for (FromItem item : block.from()) {
                Source source = resolveFromItem(item, scope.parent, ctes, drivingBlock && scope.sources.isEmpty());
                if (scope.findSource(source.referenceName()).isPresent()) {
                    throw new UnresolvedReferenceException("表别名 " + source.referenceName() + " 重复出现",
                            source.referenceName());
                }
                scope.sources.add(source);
            }

            for (String using : block.usingColumns()) {
                if (scope.sources.stream().noneMatch(s -> s.hasColumn(using))) {
                    throw new UnresolvedReferenceException("USING 列 " + using + " 不存在", using);
                }
            }
            for (Expression condition : block.joinConditions()) {
                resolveExpression(condition, scope, ctes, false);
            }
            if (block.where() != null) {
                resolveExpression(block.where(), scope, ctes, false);
            }

            List<String> outputs = new ArrayList<>();
            for (SelectItem item : block.items()) {
                if (item.star()) {
                    outputs.addAll(expandStar(item, scope));
                    continue;
                }
                resolveExpression(item.expression(), scope, ctes, false);
                outputs.add(item.outputName());
                if (item.alias() != null) {
                    scope.selectAliases.add(key(item.alias()));
                }
            }

            for (Expression expression : block.groupBy()) {
                resolveExpression(expression, scope, ctes, true);
            }
            if (block.having() != null) {
                resolveExpression(block.having(), scope, ctes, true);
            }
            for (Expression expression : block.distinctOn()) {
                resolveExpression(expression, scope, ctes, true);
            }
            return outputs;
        }

        private Source resolveFromItem(FromItem item, Scope outer, Map<String, List<String>> ctes,
                                       boolean driving) {
            if (item instanceof DerivedTable derived) {
                List<String> columns = resolveQuery(derived.query(), outer, ctes, false);
                if (!derived.columnAliases().isEmpty()) {
                    columns = derived.columnAliases();
                }
                return new Source(derived.alias(), null, columns);
            }

            TableRef ref = (TableRef) item;
            if (ref.schema() == null && ctes.containsKey(key(ref.name()))) {
                return new Source(ref.referenceName(), null, ctes.get(key(ref.name())));
            }
            TableInfo table = snapshot.findTable(ref.schema(), ref.name())
                    .orElseThrow(() -> new UnresolvedReferenceException(
                            "表 " + ref.display() + " 不存在于当前数据库结构中", ref.display()));
            referencedTables.add(table.qualifiedName());
            if (driving && drivingTable == null) {
                drivingTable = table;
            }
            List<String> columns = table.columns().stream().map(ColumnInfo::name).toList();
            return new Source(ref.referenceName(), table, columns);
        }

        private List<String> expandStar(SelectItem item, Scope scope) {
            if (item.starQualifier() == null) {
                if (scope.sources.isEmpty()) {
                    throw new UnresolvedReferenceException("SELECT * 缺少 FROM 子句", "*");
                }
                List<String> columns = new ArrayList<>();
                scope.sources.forEach(s -> columns.addAll(s.columns()));
                return columns;
            }
            Source source = scope.findSource(item.starQualifier())
                    .orElseThrow(() -> new UnresolvedReferenceException(
                            "未知的表或别名 " + item.starQualifier(), item.starQualifier() + ".*"));
            return source.columns();
        }

        private void resolveExpression(Expression expression, Scope scope, Map<String, List<String>> ctes,
                                       boolean aliasesVisible) {
            for (ColumnRef column : expression.columns()) {
                resolveColumn(column, scope, aliasesVisible);
            }
            for (SelectQuery subquery : expression.subqueries()) {
                resolveQuery(subquery, scope, ctes, false);
            }
        }

        private void resolveColumn(ColumnRef ref, Scope scope, boolean aliasesVisible) {
            if (ref.qualifier() != null) {
                for (Scope s = scope; s != null; s = s.parent) {
                    Optional<Source> source = s.findSource(ref.qualifier());
                    if (source.isPresent()) {
                        if (!source.get().hasColumn(ref.name())) {
                            throw new UnresolvedReferenceException(
                                    "列 " + ref.display() + " 不存在", ref.display());
                        }
                        return;
                    }
                }
                throw new UnresolvedReferenceException("未知的表或别名 " + ref.qualifier(), ref.display());
            }

            boolean first = true;
            for (Scope s = scope; s != null; s = s.parent) {
                if (s.sources.stream().anyMatch(source -> source.hasColumn(ref.name()))) {
                    return;
                }
                if (first && aliasesVisible && s.selectAliases.contains(key(ref.name()))) {
                    return;
                }
                first = false;
            }
            throw new UnresolvedReferenceException("列 " + ref.name() + " 不存在于引用的表中", ref.name());
        }
    }

    private static final class UnresolvedReferenceException extends RuntimeException {
        private final String offendingText;

        UnresolvedReferenceException(String message, String offendingText) {
            super(message);
            this.offendingText = offendingText;
        }
    }
}
