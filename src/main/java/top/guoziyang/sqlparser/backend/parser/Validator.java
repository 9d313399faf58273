package top.guoziyang.sqlparser.backend.parser;

import java.util.List;

import top.guoziyang.sqlparser.backend.parser.statement.Condition;
import top.guoziyang.sqlparser.backend.parser.statement.Operator;
import top.guoziyang.sqlparser.backend.parser.statement.Query;
import top.guoziyang.sqlparser.backend.parser.statement.QueryType;
import top.guoziyang.sqlparser.common.Error;

/**
 * 语法树结构校验
 *
 * 状态机每一步只能看到当前的词法单元，这里在解析结束后检查整棵树，
 * 按固定顺序报告第一个问题：
 * 1. 读到 WHERE 却没有任何条件
 * 2. 语句类型为空
 * 3. 表名为空
 * 4. UPDATE / DELETE 没有 WHERE 条件
 * 5. 条件缺少运算符或操作数
 * 6. INSERT 没有任何一行
 * 7. INSERT 某一行的值个数与字段个数不一致
 */
public class Validator {

    /**
     * @param query 状态机构造出的语法树
     * @param step 状态机结束时所在的步骤
     * @throws Exception {@link Error} 中预定义的校验异常
     */
    public static void validate(Query query, Step step) throws Exception {
        if(query.conditions.isEmpty() && step == Step.WHERE_FIELD) {
            throw Error.EmptyWhereException;
        }
        if(query.type == QueryType.UNKNOWN) {
            throw Error.EmptyQueryTypeException;
        }
        if(query.tableName.isEmpty()) {
            throw Error.EmptyTableNameException;
        }
        if(query.conditions.isEmpty() && (query.type == QueryType.UPDATE || query.type == QueryType.DELETE)) {
            throw Error.WhereMandatoryException;
        }
        for(Condition c : query.conditions) {
            if(c.operator == Operator.UNKNOWN) {
                throw Error.ConditionWithoutOperatorException;
            }
            if(c.operand1 == null || c.operand1.isEmpty()) {
                throw Error.EmptyLeftOperandException;
            }
            // 空的引号字面量 '' 是合法的右操作数
            if(c.operand2 == null || (c.operand2.isEmpty() && c.operand2IsField)) {
                throw Error.EmptyRightOperandException;
            }
        }
        if(query.type == QueryType.INSERT) {
            if(query.inserts.isEmpty()) {
                throw Error.NoInsertRowsException;
            }
            for(List<String> row : query.inserts) {
                if(row.size() != query.fields.size()) {
                    throw Error.ValueCountMismatchException;
                }
            }
        }
    }
}
