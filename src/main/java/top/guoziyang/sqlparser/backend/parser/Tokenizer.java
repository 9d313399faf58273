package top.guoziyang.sqlparser.backend.parser;

import java.util.Locale;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * SQL词法分析器 - 负责把规范化之后的语句切分为词法单元(Token)
 *
 * 功能概述：
 * 词法分析器持有语句和游标，语法分析器通过 peek() 预读、pop() 消费。
 * 真正的扫描逻辑在 {@link #scan(String, int)} 中，它只依赖 (语句, 位置)，
 * 不修改任何状态，因此同一位置可以反复预读。
 *
 * 扫描规则（按优先级）：
 * 1. 保留字：按 {@link #RESERVED_WORDS} 的声明顺序逐个尝试，忽略大小写，
 *    第一个匹配的保留字胜出，返回大写形式。字母组成的保留字要求后面紧跟
 *    的字符不是字母、数字、下划线或点，避免 description 被切成 DESC + ription，
 *    top.users 被切成 TOP + .users；SELECT*FROM 中的 SELECT 仍然是保留字。
 * 2. 引号字面量：单引号括起的内容，没有转义；找不到右引号时返回空单元。
 * 3. 标识符：连续的 [.-a-zA-Z0-9_*] 字符，可以是 db.table、t.field 或 *。
 *
 * 词法单元被消费之后，紧随其后的空格一并跳过，下一次预读从有意义的内容开始。
 * 制表符、换行在规范化阶段已经替换为空格。
 *
 * 使用方式：
 * 1. 创建Tokenizer实例并传入规范化之后的语句
 * 2. 使用peek()预读下一个token
 * 3. 使用pop()消费当前token并移动到下一个
 * 4. isEnd() 为 true 时语句读完
 *
 * @author guoziyang
 * @see Parser SQL语法分析器
 */
public class Tokenizer {
    /**
     * 保留字与标点，顺序即匹配优先级，不要排序：
     * 多字符的运算符必须排在它的前缀之前（>= 在 > 之前）。
     */
    public static final ImmutableList<String> RESERVED_WORDS = ImmutableList.of(
        "(", ")", ">=", "<=", "!=", ",", "=", ">", "<",
        "SELECT", "TOP", "INSERT INTO", "VALUES", "UPDATE", "DELETE FROM",
        "WHERE", "FROM", "SET", "ON DUPLICATE KEY UPDATE", "ORDER BY", "ASC", "DESC",
        "LEFT JOIN", "RIGHT JOIN", "INNER JOIN", "JOIN", "ON");

    /**
     * 去掉标点之后的保留字
     */
    public static final ImmutableList<String> KEYWORDS = ImmutableList.of(
        "SELECT", "TOP", "INSERT INTO", "VALUES", "UPDATE", "DELETE FROM",
        "WHERE", "FROM", "SET", "ON DUPLICATE KEY UPDATE", "ORDER BY", "ASC", "DESC",
        "LEFT JOIN", "RIGHT JOIN", "INNER JOIN", "JOIN", "ON");

    private static final ImmutableSet<String> RESERVED_SET = ImmutableSet.copyOf(RESERVED_WORDS);

    private static final ImmutableSet<String> KEYWORD_SET = ImmutableSet.copyOf(KEYWORDS);

    /** 规范化之后的语句 */
    private final String stat;
    /** 当前读取位置 */
    private int pos;
    /** 当前缓存的token */
    private Token currentToken;
    /** 是否需要刷新token（获取下一个token） */
    private boolean flushToken;

    /**
     * 构造词法分析器
     *
     * @param stat 规范化之后的语句
     */
    public Tokenizer(String stat) {
        this.stat = stat;
        this.pos = 0;
        this.currentToken = Token.NONE;
        this.flushToken = true;
        popBlank();
    }

    /**
     * 预读下一个token，但不消费它
     *
     * @return 下一个token的文本，保留字为大写，引号字面量不含引号；没有可读内容时返回空字符串
     */
    public String peek() {
        return peekToken().value;
    }

    /**
     * 预读下一个token，带上它的长度和种类
     */
    public Token peekToken() {
        if(flushToken) {
            currentToken = scan(stat, pos);
            flushToken = false;
        }
        return currentToken;
    }

    /**
     * 消费当前token，并跳过其后的空格
     *
     * @return 被消费的token文本
     */
    public String pop() {
        Token token = peekToken();
        pos += token.length;
        popBlank();
        flushToken = true;
        return token.value;
    }

    public boolean isEnd() {
        return pos >= stat.length();
    }

    public int position() {
        return pos;
    }

    public String statement() {
        return stat;
    }

    /**
     * 在游标处插入 "<< " 标记，用于错误提示
     */
    public String errStat() {
        return stat.substring(0, pos) + "<< " + stat.substring(pos);
    }

    private void popBlank() {
        while(pos < stat.length() && stat.charAt(pos) == ' ') {
            pos ++;
        }
    }

    /**
     * 从 pos 处扫描一个词法单元
     *
     * @param stat 语句
     * @param pos 起始位置
     * @return 扫描到的词法单元，pos 处没有可读内容时返回长度为 0 的单元
     */
    public static Token scan(String stat, int pos) {
        if(pos >= stat.length()) {
            return Token.NONE;
        }
        Token reserved = nextReservedState(stat, pos);
        if(reserved != null) {
            return reserved;
        }
        if(stat.charAt(pos) == '\'') {
            return nextQuoteState(stat, pos);
        }
        return nextTokenState(stat, pos);
    }

    private static Token nextReservedState(String stat, int pos) {
        for(String word : RESERVED_WORDS) {
            if(!stat.regionMatches(true, pos, word, 0, word.length())) {
                continue;
            }
            int end = pos + word.length();
            if(isAlphaBeta(word.charAt(word.length() - 1))
                && end < stat.length() && isWordChar(stat.charAt(end))) {
                continue;
            }
            return new Token(word, word.length(), Token.Kind.RESERVED);
        }
        return null;
    }

    private static Token nextQuoteState(String stat, int pos) {
        int close = stat.indexOf('\'', pos + 1);
        if(close < 0) {
            return Token.NONE;
        }
        return new Token(stat.substring(pos + 1, close), close - pos + 1, Token.Kind.QUOTED);
    }

    private static Token nextTokenState(String stat, int pos) {
        int i = pos;
        while(i < stat.length() && isIdentifierChar(stat.charAt(i))) {
            i ++;
        }
        if(i == pos) {
            return Token.NONE;
        }
        return new Token(stat.substring(pos, i), i - pos, Token.Kind.IDENTIFIER);
    }

    /**
     * 是否为保留字（不含标点）
     */
    public static boolean isReservedWord(String s) {
        return KEYWORD_SET.contains(s.toUpperCase(Locale.ROOT));
    }

    /**
     * 是否可以作为字段名、表名使用：
     * 不是保留字或标点，只由标识符字符组成，并且至少含有一个字母或下划线
     */
    public static boolean isIdentifier(String s) {
        if(s.isEmpty() || RESERVED_SET.contains(s.toUpperCase(Locale.ROOT))) {
            return false;
        }
        boolean named = false;
        for(int i = 0; i < s.length(); i ++) {
            char c = s.charAt(i);
            if(!isIdentifierChar(c)) {
                return false;
            }
            if(isAlphaBeta(c) || c == '_') {
                named = true;
            }
        }
        return named;
    }

    static boolean isDigit(char c) {
        return (c >= '0' && c <= '9');
    }

    static boolean isAlphaBeta(char c) {
        return ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'));
    }

    /**
     * 可以紧跟在保留字后面、让它不再成为保留字的字符
     */
    static boolean isWordChar(char c) {
        return isAlphaBeta(c) || isDigit(c) || c == '_' || c == '.';
    }

    static boolean isIdentifierChar(char c) {
        return isAlphaBeta(c) || isDigit(c) || c == '.' || c == '-' || c == '_' || c == '*';
    }
}
