package top.guoziyang.sqlparser.backend.parser.statement;

/**
 * 比较运算符
 *
 * WHERE 条件和 JOIN ... ON 条件共用。UNKNOWN 只会出现在尚未读到运算符的条件上，
 * 解析成功的语句中不存在。
 */
public enum Operator {
    UNKNOWN(""),
    EQ("="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    NE("!=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * 根据词法单元查找运算符
     *
     * @param token 词法分析器给出的词法单元
     * @return 对应的运算符，不是运算符时返回 UNKNOWN
     */
    public static Operator of(String token) {
        switch(token) {
            case "=":
                return EQ;
            case ">":
                return GT;
            case ">=":
                return GTE;
            case "<":
                return LT;
            case "<=":
                return LTE;
            case "!=":
                return NE;
            default:
                return UNKNOWN;
        }
    }
}
