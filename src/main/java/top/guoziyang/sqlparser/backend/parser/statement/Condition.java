package top.guoziyang.sqlparser.backend.parser.statement;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * WHERE 子句中的一个比较条件
 *
 * 左操作数总是字段；右操作数可以是字段也可以是字面量，由 operand2IsField 区分。
 * 多个条件之间是 AND 关系。
 */
public class Condition {
    public String operand1;

    public boolean operand1IsField;

    public Operator operator = Operator.UNKNOWN;

    public String operand2;

    public boolean operand2IsField;

    public Condition(String operand1, Operator operator, String operand2, boolean operand2IsField) {
        this.operand1 = operand1;
        this.operand1IsField = true;
        this.operator = operator;
        this.operand2 = operand2;
        this.operand2IsField = operand2IsField;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Condition)) {
            return false;
        }
        Condition other = (Condition) o;
        return operand1IsField == other.operand1IsField
            && operand2IsField == other.operand2IsField
            && operator == other.operator
            && Objects.equals(operand1, other.operand1)
            && Objects.equals(operand2, other.operand2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand1, operand1IsField, operator, operand2, operand2IsField);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("operand1", operand1)
            .add("operator", operator.symbol())
            .add("operand2", operand2IsField ? operand2 : "'" + operand2 + "'")
            .toString();
    }
}
