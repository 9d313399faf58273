package top.guoziyang.sqlparser.backend.utils;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * 语句规范化
 *
 * 解析前对语句做三件事：
 * 1. 删除全部反引号，`db`.`table` 变成 db.table
 * 2. 把连续的空白字符（空格、制表符、换行等）合并为一个空格
 * 3. 去掉首尾空白
 *
 * 合并空白对引号内部同样生效。对已经规范化的语句再做一次不会有任何变化。
 */
public class Normalizer {

    private static final CharMatcher BACKTICK = CharMatcher.is('`');

    public static String normalize(String sql) {
        Preconditions.checkNotNull(sql, "sql");
        return CharMatcher.whitespace().trimAndCollapseFrom(BACKTICK.removeFrom(sql), ' ');
    }
}
