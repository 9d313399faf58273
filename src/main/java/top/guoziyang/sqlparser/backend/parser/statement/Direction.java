package top.guoziyang.sqlparser.backend.parser.statement;

public enum Direction {
    ASC,
    DESC
}
