package top.guoziyang.sqlparser.backend.parser;

/**
 * 词法分析器扫描出的一个词法单元
 *
 * length 是该单元在语句中占用的字符数，对引号字面量来说包含两侧的引号，
 * 因此可能与 value 的长度不同。length 为 0 表示没有可读的内容。
 */
public class Token {
    public enum Kind {
        /** 没有可读内容：语句结束、未闭合的引号或非法字符 */
        NONE,
        RESERVED,
        QUOTED,
        IDENTIFIER
    }

    static final Token NONE = new Token("", 0, Kind.NONE);

    public final String value;

    public final int length;

    public final Kind kind;

    Token(String value, int length, Kind kind) {
        this.value = value;
        this.length = length;
        this.kind = kind;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public boolean isQuoted() {
        return kind == Kind.QUOTED;
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
