package top.guoziyang.sqlparser.client;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;

import top.guoziyang.sqlparser.backend.parser.Parser;
import top.guoziyang.sqlparser.backend.parser.statement.Query;
import top.guoziyang.sqlparser.common.ParseException;

/**
 * 交互式命令行
 *
 * 每读入一行就当作一条语句解析，打印语法树或带位置标记的错误。
 * 输入 exit 或 quit 退出，空行忽略。
 */
public class Shell {
    private final InputStream in;
    private final PrintStream out;

    public Shell(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public void run() {
        Scanner sc = new Scanner(in);
        try {
            while(true) {
                out.print(":> ");
                if(!sc.hasNextLine()) {
                    break;
                }
                String statStr = sc.nextLine();
                if("exit".equals(statStr) || "quit".equals(statStr)) {
                    break;
                }
                if(statStr.trim().isEmpty()) {
                    continue;
                }
                out.println(execute(statStr));
            }
        } finally {
            sc.close();
        }
    }

    /**
     * 解析一条语句，返回要打印的文本
     */
    static String execute(String statStr) {
        try {
            Query query = Parser.parse(statStr);
            return query.toString();
        } catch(ParseException e) {
            return e.render();
        }
    }
}
