package top.guoziyang.sqlparser.common;

/**
 * Error - 解析错误定义
 *
 * 集中定义解析过程中可能出现的全部错误。状态机在每个步骤校验失败时
 * 直接抛出这里预定义的异常对象，由 {@link top.guoziyang.sqlparser.backend.parser.Parser}
 * 统一包装成带有游标位置的 {@link ParseException}。
 *
 * 错误分类说明：
 * - type: 语句类型识别失败
 * - select / insert / update / where / order / join: 各子句的语法错误
 * - end: 语句在未闭合的结构中提前结束
 * - validate: 解析完成后对整棵语法树的结构校验
 *
 * 使用建议：
 * - 不要修改这些异常对象
 * - 抛出时直接使用预定义的对象，消息格式为 "at 子句: 期望的内容"
 */
public class Error {

    // ========== 语句类型 ==========

    public static final Exception InvalidQueryTypeException = new RuntimeException("invalid query type");

    // ========== SELECT ==========

    /**
     * TOP 之后不是非负整数，例如 SELECT TOP ten a FROM b
     */
    public static final Exception ExpectedTopCountException = new RuntimeException("at SELECT TOP: expected row count");
    public static final Exception ExpectedSelectFieldException = new RuntimeException("at SELECT: expected field to SELECT");
    public static final Exception ExpectedSelectCommaException = new RuntimeException("at SELECT: expected comma or FROM");
    public static final Exception ExpectedFromException = new RuntimeException("at SELECT: expected FROM");
    public static final Exception ExpectedSelectTableException = new RuntimeException("at SELECT: expected table name");

    /**
     * 表名之后只能跟 WHERE、ORDER BY、JOIN 或者语句结束
     */
    public static final Exception ExpectedSelectClauseException = new RuntimeException("at SELECT: expected WHERE, ORDER BY, JOIN or end of statement");

    // ========== INSERT ==========

    public static final Exception ExpectedInsertTableException = new RuntimeException("at INSERT INTO: expected table name");
    public static final Exception ExpectedOpeningParensException = new RuntimeException("at INSERT INTO: expected opening parens");
    public static final Exception ExpectedInsertFieldException = new RuntimeException("at INSERT INTO: expected at least one field to insert");
    public static final Exception ExpectedCommaOrClosingParensException = new RuntimeException("at INSERT INTO: expected comma or closing parens");
    public static final Exception ExpectedValuesException = new RuntimeException("at INSERT INTO: expected 'VALUES'");
    public static final Exception ExpectedInsertValueException = new RuntimeException("at INSERT INTO: expected quoted value");
    public static final Exception ExpectedInsertCommaException = new RuntimeException("at INSERT INTO: expected comma");

    /**
     * 某一行的值个数与字段个数不一致
     *
     * 触发场景：
     * - 状态机在每一行的右括号处检查
     * - 校验器在解析结束后对全部行再检查一次
     */
    public static final Exception ValueCountMismatchException = new RuntimeException("at INSERT INTO: value count doesn't match field count");

    // ========== UPDATE ==========

    public static final Exception ExpectedUpdateTableException = new RuntimeException("at UPDATE: expected table name");
    public static final Exception ExpectedSetException = new RuntimeException("at UPDATE: expected 'SET'");
    public static final Exception ExpectedUpdateFieldException = new RuntimeException("at UPDATE: expected at least one field to update");
    public static final Exception ExpectedEqualsException = new RuntimeException("at UPDATE: expected '='");
    public static final Exception ExpectedUpdateValueException = new RuntimeException("at UPDATE: expected quoted value");
    public static final Exception ExpectedUpdateCommaException = new RuntimeException("at UPDATE: expected ','");

    // ========== DELETE ==========

    public static final Exception ExpectedDeleteTableException = new RuntimeException("at DELETE FROM: expected table name");

    // ========== WHERE ==========

    public static final Exception ExpectedWhereException = new RuntimeException("expected WHERE");
    public static final Exception ExpectedWhereFieldException = new RuntimeException("at WHERE: expected field");
    public static final Exception UnknownWhereOperatorException = new RuntimeException("at WHERE: unknown operator");
    public static final Exception ExpectedWhereValueException = new RuntimeException("at WHERE: expected quoted value");
    public static final Exception ExpectedAndException = new RuntimeException("expected AND");

    // ========== ORDER BY ==========

    public static final Exception ExpectedOrderException = new RuntimeException("expected ORDER");
    public static final Exception ExpectedOrderFieldException = new RuntimeException("at ORDER BY: expected field to ORDER");
    public static final Exception ExpectedOrderCommaException = new RuntimeException("at ORDER BY: expected comma, ASC or DESC");

    // ========== JOIN ==========

    public static final Exception ExpectedJoinException = new RuntimeException("at JOIN: expected JOIN, LEFT JOIN, RIGHT JOIN or INNER JOIN");
    public static final Exception ExpectedJoinTableException = new RuntimeException("at JOIN: expected table name");
    public static final Exception ExpectedJoinClauseException = new RuntimeException("at JOIN: expected ON, JOIN, WHERE, ORDER BY or end of statement");

    /**
     * ON 条件两侧都必须是 表名.字段名 的形式
     */
    public static final Exception ExpectedQualifiedFieldException = new RuntimeException("at ON: expected <tablename>.<fieldname>");
    public static final Exception UnknownJoinOperatorException = new RuntimeException("at ON: unknown operator");
    public static final Exception ExpectedOnClauseException = new RuntimeException("at ON: expected AND, JOIN, WHERE, ORDER BY or end of statement");

    // ========== 提前结束 ==========

    /**
     * 语句在一个尚未闭合的结构里结束
     *
     * 触发场景：
     * - 字段列表或值列表缺少右括号
     * - 悬空的 AND、ON、逗号
     * - JOIN 之后没有表名，TOP 之后没有行数
     */
    public static final Exception UnexpectedEndException = new RuntimeException("unexpected end of statement");

    /** 传入的语句为 null */
    public static final Exception NullStatementException = new RuntimeException("statement cannot be null");

    // ========== 结构校验 ==========

    public static final Exception EmptyWhereException = new RuntimeException("at WHERE: empty WHERE clause");
    public static final Exception EmptyQueryTypeException = new RuntimeException("query type cannot be empty");
    public static final Exception EmptyTableNameException = new RuntimeException("table name cannot be empty");
    public static final Exception WhereMandatoryException = new RuntimeException("at WHERE: WHERE clause is mandatory for UPDATE & DELETE");
    public static final Exception ConditionWithoutOperatorException = new RuntimeException("at WHERE: condition without operator");
    public static final Exception EmptyLeftOperandException = new RuntimeException("at WHERE: condition with empty left side operand");
    public static final Exception EmptyRightOperandException = new RuntimeException("at WHERE: condition with empty right side operand");
    public static final Exception NoInsertRowsException = new RuntimeException("at INSERT INTO: need at least one row to insert");
}
