package top.guoziyang.sqlparser.backend.parser.statement;

/**
 * 语句类型，由语句的第一个词法单元决定，且只设置一次
 */
public enum QueryType {
    UNKNOWN,
    SELECT,
    INSERT,
    UPDATE,
    DELETE
}
