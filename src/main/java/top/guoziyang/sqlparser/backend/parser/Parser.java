package top.guoziyang.sqlparser.backend.parser;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

import top.guoziyang.sqlparser.backend.parser.statement.Condition;
import top.guoziyang.sqlparser.backend.parser.statement.Direction;
import top.guoziyang.sqlparser.backend.parser.statement.Join;
import top.guoziyang.sqlparser.backend.parser.statement.JoinCondition;
import top.guoziyang.sqlparser.backend.parser.statement.Operator;
import top.guoziyang.sqlparser.backend.parser.statement.Query;
import top.guoziyang.sqlparser.backend.parser.statement.QueryType;
import top.guoziyang.sqlparser.backend.utils.Normalizer;
import top.guoziyang.sqlparser.common.Error;
import top.guoziyang.sqlparser.common.ParseException;

/**
 * SQL语句解析器 - 把一条语句解析成 {@link Query} 语法树
 *
 * 功能概述：
 * 解析器是一个显式的有限状态机。它持有词法分析器（即游标）、正在构造的语法树
 * 和当前步骤 {@link Step}，每一轮预读一个词法单元，按当前步骤的语法规则检查，
 * 通过后消费该单元、修改语法树，并转移到下一个步骤。
 *
 * 设计特点：
 * 1. 单一分发：doParse() 中一个 switch 覆盖全部步骤，没有递归下降
 * 2. 快速失败：任何一步不满足语法规则立即抛出 {@link Error} 中预定义的异常，没有回溯和恢复
 * 3. 向前看：表名、字段之后预读一个单元决定进入 WHERE / ORDER BY / JOIN 还是结束
 * 4. 结构校验：状态机正常结束后交给 {@link Validator} 检查整棵树
 *
 * 支持的语法：
 * <pre>
 * SELECT [TOP n] (*|field, ...) FROM [db.]table
 *     [(JOIN|LEFT JOIN|RIGHT JOIN|INNER JOIN) table [ON t1.f1 op t2.f2 [AND ...]] ...]
 *     [WHERE field op value [AND ...]]
 *     [ORDER BY field [ASC|DESC], ...]
 * INSERT INTO [db.]table (field, ...) VALUES (value, ...), ... [ON DUPLICATE KEY UPDATE ...]
 * UPDATE [db.]table SET field = value, ... WHERE ...
 * DELETE FROM [db.]table WHERE ...
 * </pre>
 * op 为 = &gt; &gt;= &lt; &lt;= != 之一。
 *
 * ON DUPLICATE KEY UPDATE 不受支持：值列表之后遇到它时直接结束解析，
 * 返回已经构造的语法树，不视为错误。
 *
 * 线程安全：每次解析都有独立的 Parser 实例，保留字表是不可变的静态数据，
 * 可以在多个线程中同时解析不同的语句。
 *
 * @author guoziyang
 * @see Tokenizer 词法分析器
 * @see Validator 结构校验
 */
public class Parser {

    private static final Splitter QUALIFIER = Splitter.on('.');

    private final Tokenizer tokenizer;
    private final Query query;
    private Step step;
    /** UPDATE 中读到字段名之后、读到值之前暂存的字段名 */
    private String nextUpdateField;

    private Parser(String statement) {
        this.tokenizer = new Tokenizer(statement);
        this.query = new Query();
        this.step = Step.TYPE;
    }

    /**
     * 解析一条语句
     *
     * 解析流程：
     * 1. 规范化：删除反引号，合并空白，去掉首尾空白
     * 2. 状态机逐个消费词法单元，构造语法树
     * 3. 校验整棵语法树
     *
     * @param sql 待解析的语句
     * @return 解析成功的语法树
     * @throws ParseException 语句不合法，携带出错位置和已经构造的部分语法树
     *
     * 示例用法：
     * <pre>
     * Query q = Parser.parse("SELECT a, b FROM t WHERE a = 'x'");
     * </pre>
     */
    public static Query parse(String sql) {
        if(sql == null) {
            throw new ParseException(Error.NullStatementException, "", 0, new Query());
        }
        Parser parser = new Parser(Normalizer.normalize(sql));
        try {
            parser.doParse();
            Validator.validate(parser.query, parser.step);
        } catch(Exception e) {
            throw new ParseException(e, parser.tokenizer.statement(), parser.tokenizer.position(), parser.query);
        }
        return parser.query;
    }

    /**
     * 依次解析多条语句，遇到第一条失败的语句即停止
     *
     * @param sqls 待解析的语句
     * @return 全部语句的语法树，顺序与输入一致
     * @throws ParseException 第一条失败语句的错误，getParsed() 为它之前解析成功的语句
     */
    public static List<Query> parseMany(List<String> sqls) {
        Preconditions.checkNotNull(sqls, "sqls");
        List<Query> queries = new ArrayList<>();
        for(String sql : sqls) {
            try {
                queries.add(parse(sql));
            } catch(ParseException e) {
                throw e.withParsed(queries);
            }
        }
        return queries;
    }

    private void doParse() throws Exception {
        while(!tokenizer.isEnd()) {
            switch(step) {
                case TYPE:
                    parseType();
                    break;
                case TOP:
                    parseTop();
                    break;
                case SELECT_FIELD:
                    parseSelectField();
                    break;
                case SELECT_COMMA:
                    expect(",", Error.ExpectedSelectCommaException);
                    step = Step.SELECT_FIELD;
                    break;
                case SELECT_FROM:
                    expect("FROM", Error.ExpectedFromException);
                    step = Step.SELECT_FROM_TABLE;
                    break;
                case SELECT_FROM_TABLE:
                    parseTable(Error.ExpectedSelectTableException);
                    nextClause(Error.ExpectedSelectClauseException);
                    break;
                case INSERT_TABLE:
                    parseTable(Error.ExpectedInsertTableException);
                    step = Step.INSERT_FIELDS_OPENING_PARENS;
                    break;
                case INSERT_FIELDS_OPENING_PARENS:
                    expect("(", Error.ExpectedOpeningParensException);
                    step = Step.INSERT_FIELDS;
                    break;
                case INSERT_FIELDS:
                    query.fields.add(parseIdentifier(Error.ExpectedInsertFieldException));
                    step = Step.INSERT_FIELDS_COMMA_OR_CLOSING_PARENS;
                    break;
                case INSERT_FIELDS_COMMA_OR_CLOSING_PARENS:
                    parseInsertFieldsCommaOrClosingParens();
                    break;
                case INSERT_VALUES_RWORD:
                    expect("VALUES", Error.ExpectedValuesException);
                    step = Step.INSERT_VALUES_OPENING_PARENS;
                    break;
                case INSERT_VALUES_OPENING_PARENS:
                    expect("(", Error.ExpectedOpeningParensException);
                    query.inserts.add(new ArrayList<>());
                    step = Step.INSERT_VALUES;
                    break;
                case INSERT_VALUES:
                    query.lastInsertRow().add(parseValue(Error.ExpectedInsertValueException).value);
                    step = Step.INSERT_VALUES_COMMA_OR_CLOSING_PARENS;
                    break;
                case INSERT_VALUES_COMMA_OR_CLOSING_PARENS:
                    parseInsertValuesCommaOrClosingParens();
                    break;
                case INSERT_VALUES_COMMA_BEFORE_OPENING_PARENS:
                    if(!parseInsertValuesCommaBeforeOpeningParens()) {
                        return;
                    }
                    break;
                case UPDATE_TABLE:
                    parseTable(Error.ExpectedUpdateTableException);
                    step = Step.UPDATE_SET;
                    break;
                case UPDATE_SET:
                    expect("SET", Error.ExpectedSetException);
                    step = Step.UPDATE_FIELD;
                    break;
                case UPDATE_FIELD:
                    nextUpdateField = parseIdentifier(Error.ExpectedUpdateFieldException);
                    step = Step.UPDATE_EQUALS;
                    break;
                case UPDATE_EQUALS:
                    expect("=", Error.ExpectedEqualsException);
                    step = Step.UPDATE_VALUE;
                    break;
                case UPDATE_VALUE:
                    parseUpdateValue();
                    break;
                case UPDATE_COMMA:
                    expect(",", Error.ExpectedUpdateCommaException);
                    step = Step.UPDATE_FIELD;
                    break;
                case DELETE_FROM_TABLE:
                    parseTable(Error.ExpectedDeleteTableException);
                    step = Step.WHERE;
                    break;
                case WHERE:
                    expect("WHERE", Error.ExpectedWhereException);
                    step = Step.WHERE_FIELD;
                    break;
                case WHERE_FIELD:
                    parseWhereField();
                    break;
                case WHERE_OPERATOR:
                    query.lastCondition().operator = parseOperator(Error.UnknownWhereOperatorException);
                    step = Step.WHERE_VALUE;
                    break;
                case WHERE_VALUE:
                    parseWhereValue();
                    break;
                case WHERE_AND:
                    expect("AND", Error.ExpectedAndException);
                    step = Step.WHERE_FIELD;
                    break;
                case ORDER:
                    expect("ORDER BY", Error.ExpectedOrderException);
                    step = Step.ORDER_FIELD;
                    break;
                case ORDER_FIELD:
                    query.orderFields.add(parseIdentifier(Error.ExpectedOrderFieldException));
                    query.orderDirs.add(Direction.ASC);
                    step = Step.ORDER_DIRECTION_OR_COMMA;
                    break;
                case ORDER_DIRECTION_OR_COMMA:
                    parseOrderDirectionOrComma();
                    break;
                case JOIN:
                    parseJoin();
                    break;
                case JOIN_TABLE:
                    parseJoinTable();
                    break;
                case JOIN_CONDITION:
                    parseJoinCondition();
                    break;
                default:
                    throw new IllegalStateException("Unknown step: " + step);
            }
        }
        if(endedInsideClause()) {
            throw Error.UnexpectedEndException;
        }
    }

    private void parseType() throws Exception {
        Token token = tokenizer.peekToken();
        if(token.kind != Token.Kind.RESERVED) {
            throw Error.InvalidQueryTypeException;
        }
        switch(token.value) {
            case "SELECT":
                query.type = QueryType.SELECT;
                tokenizer.pop();
                step = peekIs("TOP") ? Step.TOP : Step.SELECT_FIELD;
                break;
            case "INSERT INTO":
                query.type = QueryType.INSERT;
                tokenizer.pop();
                step = Step.INSERT_TABLE;
                break;
            case "UPDATE":
                query.type = QueryType.UPDATE;
                tokenizer.pop();
                step = Step.UPDATE_TABLE;
                break;
            case "DELETE FROM":
                query.type = QueryType.DELETE;
                tokenizer.pop();
                step = Step.DELETE_FROM_TABLE;
                break;
            default:
                throw Error.InvalidQueryTypeException;
        }
    }

    private void parseTop() throws Exception {
        tokenizer.pop();
        Token count = tokenizer.peekToken();
        if(count.kind != Token.Kind.IDENTIFIER) {
            throw Error.ExpectedTopCountException;
        }
        int maxRows;
        try {
            maxRows = Integer.parseInt(count.value);
        } catch(NumberFormatException e) {
            throw Error.ExpectedTopCountException;
        }
        if(maxRows < 0) {
            throw Error.ExpectedTopCountException;
        }
        query.maxRows = maxRows;
        tokenizer.pop();
        step = Step.SELECT_FIELD;
    }

    private void parseSelectField() throws Exception {
        Token token = tokenizer.peekToken();
        if(token.isQuoted() || !(Tokenizer.isIdentifier(token.value) || "*".equals(token.value))) {
            throw Error.ExpectedSelectFieldException;
        }
        query.fields.add(token.value);
        tokenizer.pop();
        step = peekIs("FROM") ? Step.SELECT_FROM : Step.SELECT_COMMA;
    }

    /**
     * 读取表名，db.table 按第一个点拆成库名和表名
     */
    private void parseTable(Exception err) throws Exception {
        String tableName = parseTableName(err);
        List<String> parts = QUALIFIER.limit(2).splitToList(tableName);
        if(parts.size() == 2) {
            query.database = parts.get(0);
            tableName = parts.get(1);
        }
        query.tableName = tableName;
    }

    /**
     * 表名必须是标识符，引号括起的非空名字也可以
     */
    private String parseTableName(Exception err) throws Exception {
        Token token = tokenizer.peekToken();
        if(token.isEmpty() || token.value.isEmpty()) {
            throw err;
        }
        if(!token.isQuoted() && !Tokenizer.isIdentifier(token.value)) {
            throw err;
        }
        tokenizer.pop();
        return token.value;
    }

    /**
     * 表名或 JOIN 条件之后，根据预读决定下一个子句
     */
    private void nextClause(Exception err) throws Exception {
        if(tokenizer.isEnd()) {
            return;
        }
        if(peekIs("WHERE")) {
            step = Step.WHERE;
        } else if(peekIs("ORDER BY")) {
            step = Step.ORDER;
        } else if(isJoin(tokenizer.peekToken())) {
            step = Step.JOIN;
        } else {
            throw err;
        }
    }

    private void parseInsertFieldsCommaOrClosingParens() throws Exception {
        if(peekIs(",")) {
            tokenizer.pop();
            step = Step.INSERT_FIELDS;
        } else if(peekIs(")")) {
            tokenizer.pop();
            step = Step.INSERT_VALUES_RWORD;
        } else {
            throw Error.ExpectedCommaOrClosingParensException;
        }
    }

    private void parseInsertValuesCommaOrClosingParens() throws Exception {
        if(peekIs(",")) {
            tokenizer.pop();
            step = Step.INSERT_VALUES;
            return;
        }
        if(!peekIs(")")) {
            throw Error.ExpectedCommaOrClosingParensException;
        }
        if(query.lastInsertRow().size() != query.fields.size()) {
            throw Error.ValueCountMismatchException;
        }
        tokenizer.pop();
        step = Step.INSERT_VALUES_COMMA_BEFORE_OPENING_PARENS;
    }

    /**
     * @return false 表示遇到 ON DUPLICATE KEY UPDATE 之类的后续子句，解析到此结束
     */
    private boolean parseInsertValuesCommaBeforeOpeningParens() throws Exception {
        Token token = tokenizer.peekToken();
        if(peekIs(",")) {
            tokenizer.pop();
            step = Step.INSERT_VALUES_OPENING_PARENS;
            return true;
        }
        if(token.kind == Token.Kind.RESERVED && Tokenizer.isReservedWord(token.value)) {
            return false;
        }
        throw Error.ExpectedInsertCommaException;
    }

    private void parseUpdateValue() throws Exception {
        query.updates.put(nextUpdateField, parseValue(Error.ExpectedUpdateValueException).value);
        nextUpdateField = null;
        step = peekIs("WHERE") ? Step.WHERE : Step.UPDATE_COMMA;
    }

    private void parseWhereField() throws Exception {
        String field = parseIdentifier(Error.ExpectedWhereFieldException);
        query.conditions.add(new Condition(field, Operator.UNKNOWN, null, false));
        step = Step.WHERE_OPERATOR;
    }

    private void parseWhereValue() throws Exception {
        Token value = parseValue(Error.ExpectedWhereValueException);
        Condition condition = query.lastCondition();
        condition.operand2 = value.value;
        // 引号括起的是字面量，不带引号的标识符是字段，其余（数字等）是字面量
        condition.operand2IsField = !value.isQuoted() && Tokenizer.isIdentifier(value.value);
        if(peekIs("ORDER BY")) {
            tokenizer.pop();
            step = Step.ORDER_FIELD;
        } else {
            step = Step.WHERE_AND;
        }
    }

    private void parseOrderDirectionOrComma() throws Exception {
        if(peekIs("ASC") || peekIs("DESC")) {
            query.orderDirs.set(query.orderDirs.size() - 1, Direction.valueOf(tokenizer.pop()));
            if(tokenizer.isEnd()) {
                return;
            }
        }
        expect(",", Error.ExpectedOrderCommaException);
        step = Step.ORDER_FIELD;
    }

    private void parseJoin() throws Exception {
        Token token = tokenizer.peekToken();
        if(!isJoin(token)) {
            throw Error.ExpectedJoinException;
        }
        query.joins.add(new Join(token.value));
        tokenizer.pop();
        step = Step.JOIN_TABLE;
    }

    private void parseJoinTable() throws Exception {
        query.lastJoin().table = parseTableName(Error.ExpectedJoinTableException);
        if(peekIs("ON")) {
            step = Step.JOIN_CONDITION;
        } else {
            nextClause(Error.ExpectedJoinClauseException);
        }
    }

    /**
     * 当前单元是 ON 或 AND，之后是 table1.field1 op table2.field2
     */
    private void parseJoinCondition() throws Exception {
        tokenizer.pop();
        List<String> left = parseQualifiedField();
        Operator operator = parseOperator(Error.UnknownJoinOperatorException);
        List<String> right = parseQualifiedField();
        query.lastJoin().conditions.add(
            new JoinCondition(left.get(0), left.get(1), operator, right.get(0), right.get(1)));

        if(peekIs("AND")) {
            return;
        }
        nextClause(Error.ExpectedOnClauseException);
    }

    private List<String> parseQualifiedField() throws Exception {
        Token token = tokenizer.peekToken();
        if(token.isQuoted() || !Tokenizer.isIdentifier(token.value)) {
            throw Error.ExpectedQualifiedFieldException;
        }
        List<String> parts = QUALIFIER.splitToList(token.value);
        if(parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
            throw Error.ExpectedQualifiedFieldException;
        }
        tokenizer.pop();
        return parts;
    }

    private String parseIdentifier(Exception err) throws Exception {
        Token token = tokenizer.peekToken();
        if(token.isQuoted() || !Tokenizer.isIdentifier(token.value)) {
            throw err;
        }
        tokenizer.pop();
        return token.value;
    }

    /**
     * 读取一个值：引号字面量或不带引号的单元，保留字和标点不能作为值
     */
    private Token parseValue(Exception err) throws Exception {
        Token token = tokenizer.peekToken();
        if(token.isEmpty() || token.kind == Token.Kind.RESERVED) {
            throw err;
        }
        tokenizer.pop();
        return token;
    }

    private Operator parseOperator(Exception err) throws Exception {
        Token token = tokenizer.peekToken();
        Operator operator = token.kind == Token.Kind.RESERVED ? Operator.of(token.value) : Operator.UNKNOWN;
        if(operator == Operator.UNKNOWN) {
            throw err;
        }
        tokenizer.pop();
        return operator;
    }

    private void expect(String word, Exception err) throws Exception {
        if(!peekIs(word)) {
            throw err;
        }
        tokenizer.pop();
    }

    /**
     * 下一个单元是否为给定的保留字或关键字，忽略大小写，引号字面量不算
     */
    private boolean peekIs(String word) {
        Token token = tokenizer.peekToken();
        return !token.isQuoted() && token.value.equalsIgnoreCase(word);
    }

    private static boolean isJoin(Token token) {
        if(token.kind != Token.Kind.RESERVED) {
            return false;
        }
        switch(token.value) {
            case "JOIN":
            case "LEFT JOIN":
            case "RIGHT JOIN":
            case "INNER JOIN":
                return true;
            default:
                return false;
        }
    }

    /**
     * 语句结束时是否还处在一个没有闭合的结构里
     */
    private boolean endedInsideClause() {
        switch(step) {
            case INSERT_FIELDS:
            case INSERT_FIELDS_COMMA_OR_CLOSING_PARENS:
            case INSERT_VALUES:
            case INSERT_VALUES_COMMA_OR_CLOSING_PARENS:
            case UPDATE_FIELD:
            case UPDATE_EQUALS:
            case UPDATE_VALUE:
            case ORDER_FIELD:
                return true;
            case INSERT_VALUES_OPENING_PARENS:
                // 值列表之后悬空的逗号；VALUES 之后一行都没有时由校验器报告
                return !query.inserts.isEmpty();
            case WHERE_FIELD:
                // 没有任何条件时由校验器报告空 WHERE
                return !query.conditions.isEmpty();
            case JOIN_TABLE:
                return query.lastJoin().table == null;
            default:
                return false;
        }
    }
}
