package top.guoziyang.sqlparser.backend.parser.statement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;

/**
 * 一条语句解析后的语法树
 *
 * 解析开始时创建一棵空树，由状态机在一次线性扫描中逐步填充，
 * 随后交给校验器检查，最后返回给调用方。
 *
 * 各字段的含义依赖语句类型：
 * - SELECT: fields 为查询的列（或 *），maxRows 为 TOP 的行数，0 表示不限
 * - INSERT: fields 为插入的列，inserts 的每一行与 fields 按位置对应
 * - UPDATE: updates 为 SET 的 字段 -> 值，重复字段后写覆盖前写
 * - SELECT / UPDATE / DELETE: conditions 为 WHERE 条件，彼此 AND
 *
 * orderFields 与 orderDirs 始终等长。
 *
 * 支持的语法示例：
 * <pre>
 * SELECT TOP 10 a, b FROM db.t JOIN u ON t.id = u.tid WHERE a = 'x' ORDER BY b DESC
 * INSERT INTO t (a, b) VALUES (1, 2), (3, 4)
 * UPDATE t SET a = 1, b = 'two' WHERE id = 3
 * DELETE FROM t WHERE id = 3
 * </pre>
 */
public class Query {
    public QueryType type = QueryType.UNKNOWN;

    public String database = "";

    public String tableName = "";

    public List<String> fields = new ArrayList<>();

    public int maxRows;

    public List<Condition> conditions = new ArrayList<>();

    public Map<String, String> updates = new LinkedHashMap<>();

    public List<List<String>> inserts = new ArrayList<>();

    public List<String> orderFields = new ArrayList<>();

    public List<Direction> orderDirs = new ArrayList<>();

    public List<Join> joins = new ArrayList<>();

    /**
     * 最后一个条件，WHERE 的运算符和右操作数都写到它上面
     */
    public Condition lastCondition() {
        return conditions.get(conditions.size() - 1);
    }

    public List<String> lastInsertRow() {
        return inserts.get(inserts.size() - 1);
    }

    public Join lastJoin() {
        return joins.get(joins.size() - 1);
    }

    @Override
    public String toString() {
        MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this)
            .add("type", type);
        if(!database.isEmpty()) {
            helper.add("database", database);
        }
        helper.add("table", tableName);
        if(!fields.isEmpty()) {
            helper.add("fields", fields);
        }
        if(maxRows > 0) {
            helper.add("maxRows", maxRows);
        }
        if(!joins.isEmpty()) {
            helper.add("joins", joins);
        }
        if(!conditions.isEmpty()) {
            helper.add("conditions", conditions);
        }
        if(!updates.isEmpty()) {
            helper.add("updates", updates);
        }
        if(!inserts.isEmpty()) {
            helper.add("inserts", inserts);
        }
        if(!orderFields.isEmpty()) {
            helper.add("orderFields", orderFields).add("orderDirs", orderDirs);
        }
        return helper.toString();
    }
}
