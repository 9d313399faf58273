package top.guoziyang.sqlparser.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Strings;

import top.guoziyang.sqlparser.backend.parser.statement.Query;

/**
 * 一条语句解析失败时抛给调用方的异常
 *
 * 原因（cause）是 {@link Error} 中预定义的异常对象，本类在其上补充：
 * - statement: 规范化之后的语句
 * - position: 出错时游标在语句中的偏移
 * - query: 出错前已经构造出的部分语法树，什么都没解析出来时是一棵空树
 * - parsed: 批量解析时，失败语句之前已经成功解析的语句
 */
public class ParseException extends RuntimeException {

    private final String statement;
    private final int position;
    private final Query query;
    private final List<Query> parsed;

    public ParseException(Exception cause, String statement, int position, Query query) {
        this(cause, statement, position, query, Collections.emptyList());
    }

    private ParseException(Exception cause, String statement, int position, Query query, List<Query> parsed) {
        super(cause.getMessage(), cause);
        this.statement = statement;
        this.position = position;
        this.query = query;
        this.parsed = parsed;
    }

    /**
     * 附上批量解析中已成功的语句，返回新的异常对象
     */
    public ParseException withParsed(List<Query> parsed) {
        return new ParseException((Exception) getCause(), statement, position, query,
            Collections.unmodifiableList(new ArrayList<>(parsed)));
    }

    public String getStatement() {
        return statement;
    }

    public int getPosition() {
        return position;
    }

    public Query getQuery() {
        return query;
    }

    public List<Query> getParsed() {
        return parsed;
    }

    /**
     * 渲染成三行：语句、指向出错位置的 ^、错误信息
     */
    public String render() {
        return statement + "\n" + Strings.repeat(" ", position) + "^\n" + getMessage();
    }
}
