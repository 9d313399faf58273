package top.guoziyang.sqlparser.backend.parser;

/**
 * 状态机的步骤，即当前所处的语法位置，决定下一个词法单元可以是什么
 */
public enum Step {
    TYPE,
    TOP,
    SELECT_FIELD,
    SELECT_COMMA,
    SELECT_FROM,
    SELECT_FROM_TABLE,
    INSERT_TABLE,
    INSERT_FIELDS_OPENING_PARENS,
    INSERT_FIELDS,
    INSERT_FIELDS_COMMA_OR_CLOSING_PARENS,
    INSERT_VALUES_RWORD,
    INSERT_VALUES_OPENING_PARENS,
    INSERT_VALUES,
    INSERT_VALUES_COMMA_OR_CLOSING_PARENS,
    INSERT_VALUES_COMMA_BEFORE_OPENING_PARENS,
    UPDATE_TABLE,
    UPDATE_SET,
    UPDATE_FIELD,
    UPDATE_EQUALS,
    UPDATE_VALUE,
    UPDATE_COMMA,
    DELETE_FROM_TABLE,
    WHERE,
    WHERE_FIELD,
    WHERE_OPERATOR,
    WHERE_VALUE,
    WHERE_AND,
    ORDER,
    ORDER_FIELD,
    ORDER_DIRECTION_OR_COMMA,
    JOIN,
    JOIN_TABLE,
    JOIN_CONDITION
}
