package top.guoziyang.sqlparser.backend.parser.statement;

import java.util.Objects;

/**
 * JOIN ... ON 中的一个条件：table1.operand1 运算符 table2.operand2
 */
public class JoinCondition {
    public String table1;

    public String operand1;

    public Operator operator = Operator.UNKNOWN;

    public String table2;

    public String operand2;

    public JoinCondition(String table1, String operand1, Operator operator, String table2, String operand2) {
        this.table1 = table1;
        this.operand1 = operand1;
        this.operator = operator;
        this.table2 = table2;
        this.operand2 = operand2;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof JoinCondition)) {
            return false;
        }
        JoinCondition other = (JoinCondition) o;
        return operator == other.operator
            && Objects.equals(table1, other.table1)
            && Objects.equals(operand1, other.operand1)
            && Objects.equals(table2, other.table2)
            && Objects.equals(operand2, other.operand2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table1, operand1, operator, table2, operand2);
    }

    @Override
    public String toString() {
        return table1 + "." + operand1 + " " + operator.symbol() + " " + table2 + "." + operand2;
    }
}
