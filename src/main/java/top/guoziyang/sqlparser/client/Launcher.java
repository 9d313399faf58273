package top.guoziyang.sqlparser.client;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import top.guoziyang.sqlparser.backend.parser.Parser;
import top.guoziyang.sqlparser.backend.parser.statement.Query;
import top.guoziyang.sqlparser.common.ParseException;

/**
 * 命令行入口
 *
 * 用法：
 * <pre>
 * sqlparser "SELECT a FROM t WHERE b = 1"      解析命令行给出的语句
 * sqlparser -f statements.sql                   文件中每个非空行是一条语句
 * sqlparser                                     进入交互式 Shell
 * </pre>
 *
 * 多条语句按顺序解析，遇到第一条失败的语句即停止；
 * 全部成功时退出码为 0，否则为 1。
 */
@Command(name = "sqlparser", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse SQL statements and print their syntax trees")
public class Launcher implements Callable<Integer> {

    @Parameters(arity = "0..*", description = "Statements to parse")
    private List<String> statements = new ArrayList<>();

    @Option(names = {"-f", "--file"}, description = "File with one statement per line")
    private File file;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Launcher()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        List<String> sqls = new ArrayList<>(statements);
        if(file != null) {
            for(String line : Files.readAllLines(file.toPath(), StandardCharsets.UTF_8)) {
                if(!line.trim().isEmpty()) {
                    sqls.add(line);
                }
            }
        }
        if(sqls.isEmpty()) {
            new Shell(System.in, System.out).run();
            return 0;
        }

        try {
            for(Query query : Parser.parseMany(sqls)) {
                System.out.println(query);
            }
            return 0;
        } catch(ParseException e) {
            for(Query query : e.getParsed()) {
                System.out.println(query);
            }
            System.err.println(e.render());
            return 1;
        }
    }
}
