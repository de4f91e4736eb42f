package com.atfengine.cli;

import com.atfengine.config.Constants;
import com.atfengine.config.ParserConfig;
import com.atfengine.document.Column;
import com.atfengine.document.CompositeRef;
import com.atfengine.document.Document;
import com.atfengine.document.Header;
import com.atfengine.document.Line;
import com.atfengine.document.Surface;
import com.atfengine.export.AtfWriter;
import com.atfengine.export.DocumentJsonWriter;
import com.atfengine.legend.LegendItem;
import com.atfengine.parse.AtfParser;
import com.atfengine.text.LookupNormalizer;
import com.atfengine.text.Word;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
    name = "atf",
    description = "📜 ATF 楔形文字转写解析工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ParseSubcommand.class,
        MainCommand.LegendSubcommand.class,
        MainCommand.LookupSubcommand.class,
        MainCommand.NormalizeSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--object-type"}, description = "未声明 @object 时的默认载体类型", defaultValue = Constants.DEFAULT_OBJECT_TYPE)
    private String defaultObjectType;

    @Option(names = {"--compact"}, description = "JSON 输出不缩进")
    private boolean compact;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📜 ATF 楔形文字转写解析工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    ParserConfig buildConfig() {
        ParserConfig config = ParserConfig.defaults();
        if (defaultObjectType != null && !defaultObjectType.isBlank()) {
            config.setDefaultObjectType(defaultObjectType);
        }
        config.setPrettyPrint(!compact);
        return config;
    }

    String readInput(Path file) throws IOException {
        long size = Files.size(file);
        if (size > Constants.MAX_INPUT_BYTES) {
            throw new IOException("输入文件过大: " + size + " 字节（上限 " + Constants.MAX_INPUT_BYTES + "）");
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Command(name = "parse", description = "🔎 解析转写文件并输出结构")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "ATF 转写文件", arity = "1")
        private Path file;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--no-legend"}, description = "不生成图例")
        private boolean noLegend;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                if (!"text".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
                    throw new CommandLine.ParameterException(new CommandLine(this), "不支持的输出格式: " + format);
                }
                ParserConfig config = main.buildConfig();
                config.setLegendEnabled(!noLegend);
                AtfParser.ParseResult result = new AtfParser(config).parse(main.readInput(file));

                if ("json".equalsIgnoreCase(format)) {
                    System.out.println(new DocumentJsonWriter(config).toJson(result));
                } else {
                    printOutline(result);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 解析失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printOutline(AtfParser.ParseResult result) {
            Document document = result.document();
            if (document.isEmpty()) {
                System.out.println("⚠️ 没有可显示的转写内容");
                return;
            }

            Header header = document.header();
            System.out.printf("📜 %s = %s (%s, lang %s)%n",
                valueOrDash(header.catalogId()), valueOrDash(header.title()),
                header.objectType(), valueOrDash(header.language()));

            for (Surface surface : document.surfaces()) {
                System.out.println("─────────────────────────────────");
                System.out.println("▌ " + surface.label());
                for (Line.StateLine state : surface.states()) {
                    System.out.println("   $ " + state.text());
                }
                for (Column column : surface.columns()) {
                    if (document.hasMultipleColumns()) {
                        System.out.println("  [column " + column.number() + "]");
                    }
                    for (Line line : column.lines()) {
                        printLine(line);
                    }
                }
            }

            if (!document.compositeRefs().isEmpty()) {
                System.out.println();
                System.out.println("🔗 复合文本引用: " + document.compositeRefs().stream()
                    .map(ref -> ref.compositeId() + " " + ref.lineRef())
                    .collect(Collectors.joining(", ")));
            }
            if (!result.legend().isEmpty()) {
                System.out.println();
                System.out.println("📖 图例: " + result.legend().stream()
                    .map(LegendItem::label)
                    .collect(Collectors.joining(" | ")));
            }
        }

        private void printLine(Line line) {
            if (line instanceof Line.StateLine state) {
                System.out.println("   $ " + state.text());
                return;
            }
            Line.ContentLine content = (Line.ContentLine) line;
            String keys = content.words().stream()
                .map(Word::lookup)
                .filter(lookup -> lookup != null)
                .collect(Collectors.joining(" "));
            System.out.printf("   %-5s %s%n", content.number(), content.raw());
            if (!keys.isEmpty()) {
                System.out.println("         ↳ " + keys);
            }
            CompositeRef composite = content.composite();
            if (composite != null) {
                System.out.println("         ⇢ " + composite.compositeId() + " " + composite.lineRef());
            }
            for (Map.Entry<String, String> translation : content.translations().entrySet()) {
                System.out.println("         │ " + translation.getKey() + ": " + translation.getValue());
            }
        }

        private static String valueOrDash(String value) {
            return value == null ? "-" : value;
        }
    }

    @Command(name = "legend", description = "📖 输出转写文件对应的图例")
    static class LegendSubcommand implements Callable<Integer> {

        @Parameters(description = "ATF 转写文件", arity = "1")
        private Path file;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                AtfParser.ParseResult result = new AtfParser(main.buildConfig()).parse(main.readInput(file));
                for (LegendItem item : result.legend()) {
                    System.out.printf("%-16s %-18s %s%n", item.cssClass(), item.label(), item.symbol());
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 生成图例失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "lookup", description = "🔤 输出词的词典查询键")
    static class LookupSubcommand implements Callable<Integer> {

        @Parameters(description = "待规范化的词", arity = "1..*")
        private List<String> words;

        @Override
        public Integer call() {
            if (words.size() > Constants.MAX_LOOKUP_WORDS) {
                System.err.printf("⚠️ 词数 %d 超过上限 %d%n", words.size(), Constants.MAX_LOOKUP_WORDS);
                return 1;
            }
            for (String word : words) {
                String key = LookupNormalizer.normalize(word);
                System.out.println(word + "\t" + (key == null ? "-" : key));
            }
            return 0;
        }
    }

    @Command(name = "normalize", description = "🔄 重新输出规范化的 ATF 文本")
    static class NormalizeSubcommand implements Callable<Integer> {

        @Parameters(description = "ATF 转写文件", arity = "1")
        private Path file;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Document document = new AtfParser(main.buildConfig()).parseDocument(main.readInput(file));
                System.out.println(new AtfWriter().write(document));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 规范化失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
