package com.compliancescan.parser;

import java.util.List;

/**
 * FROM 子句中的数据来源：物理表或派生表
 */
public sealed interface FromItem permits FromItem.TableRef, FromItem.DerivedTable {

    /** 在查询中引用该来源时使用的名字 */
    String referenceName();

    record TableRef(String schema, String name, String alias, int position) implements FromItem {

        @Override
        public String referenceName() {
            return alias != null ? alias : name;
        }

        public String display() {
            return schema == null ? name : schema + "." + name;
        }
    }

    record DerivedTable(SelectQuery query, String alias, List<String> columnAliases) implements FromItem {

        public DerivedTable {
            columnAliases = List.copyOf(columnAliases);
        }

        @Override
        public String referenceName() {
            return alias;
        }
    }
}
