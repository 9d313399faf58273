package top.guoziyang.sqlparser.backend.parser.statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * 一个 JOIN 子句
 *
 * type 是 JOIN 关键字本身（JOIN、LEFT JOIN、RIGHT JOIN、INNER JOIN），
 * conditions 之间是 AND 关系，没有 ON 时为空。
 */
public class Join {
    public String type;

    public String table;

    public List<JoinCondition> conditions = new ArrayList<>();

    public Join(String type) {
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Join)) {
            return false;
        }
        Join other = (Join) o;
        return Objects.equals(type, other.type)
            && Objects.equals(table, other.table)
            && Objects.equals(conditions, other.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, table, conditions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("type", type)
            .add("table", table)
            .add("conditions", conditions)
            .toString();
    }
}
