package com.atfengine;

import com.atfengine.legend.LegendItem;
import com.atfengine.parse.AtfParser;
import com.atfengine.text.Word;
import com.atfengine.text.WordTokenizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 解析性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms512m", "-Xmx512m"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ParserBenchmark {

    @State(Scope.Thread)
    public static class ParseState {
        AtfParser parser;
        WordTokenizer tokenizer;
        String atf;
        String contentLine;

        @Setup
        public void setup() {
            parser = new AtfParser();
            tokenizer = new WordTokenizer();
            contentLine = "{d}inana nin# kur-kur-ra [...] _e2-gal_ lugal{ki}-ke4 mu-na-du3?";
            atf = generateDocument(300);
        }

        private String generateDocument(int lineCount) {
            StringBuilder builder = new StringBuilder();
            builder.append("&P000001 = Benchmark Tablet\n");
            builder.append("#atf: lang sux\n");
            builder.append("@tablet\n");
            // 正反两面各占一半，每 40 行换一栏
            for (int i = 0; i < lineCount; i++) {
                if (i == 0) {
                    builder.append("@obverse\n");
                } else if (i == lineCount / 2) {
                    builder.append("@reverse\n");
                }
                if (i % 40 == 0) {
                    builder.append("@column ").append(i / 40 % 4 + 1).append('\n');
                }
                builder.append(i + 1).append(". ").append(contentLine).append('\n');
                if (i % 10 == 0) {
                    builder.append(">>Q000002 ").append(String.format("%03d", i)).append('\n');
                    builder.append("#tr.en: and the goddess built the palace\n");
                }
                if (i % 25 == 0) {
                    builder.append("$ rest broken\n");
                }
            }
            return builder.toString();
        }
    }

    @Benchmark
    public AtfParser.ParseResult parseDocument(ParseState state) {
        return state.parser.parse(state.atf);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    public List<Word> tokenizeLine(ParseState state) {
        return state.tokenizer.tokenize(state.contentLine);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public List<LegendItem> legendOnly(ParseState state) {
        return state.parser.parse(state.atf).legend();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(ParserBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
