package io.acmatcher.jmh;

import io.acmatcher.Configuration;
import io.acmatcher.Machine;
import io.acmatcher.WildcardMachine;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static java.util.concurrent.TimeUnit.SECONDS;

@BenchmarkMode(Mode.Throughput)
@Fork(value = 1, jvmArgsAppend = { "-Xmx1g", "-Xms1g" })
public class MatcherJmhBenchmarks {

    private static final int TEXT_SIZE = 1 << 20;

    @State(Scope.Benchmark)
    public static class Texts {

        Machine machine;
        WildcardMachine wildcardMachine;
        byte[] text;

        @Setup
        public void setup() {
            Random random = new Random(1L);
            Machine.Builder builder = Machine.builder();
            for (int i = 0; i < 1000; i++) {
                builder.addPattern(randomWord(random, 3 + random.nextInt(6)));
            }
            machine = builder.build();
            wildcardMachine = WildcardMachine.compile("ab?c!dd??e",
                    Configuration.builder().withComplement('!').build());
            text = randomWord(random, TEXT_SIZE).getBytes(StandardCharsets.UTF_8);
        }

        private static String randomWord(Random random, int length) {
            StringBuilder sb = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                sb.append((char) ('a' + random.nextInt(6)));
            }
            return sb.toString();
        }
    }

    @Benchmark
    @Warmup(iterations = 3, time = 5, timeUnit = SECONDS)
    @Measurement(iterations = 5, time = 5, timeUnit = SECONDS)
    public void patternSet(Texts texts, Blackhole blackhole) {
        blackhole.consume(texts.machine.matches(texts.text));
    }

    @Benchmark
    @Warmup(iterations = 3, time = 5, timeUnit = SECONDS)
    @Measurement(iterations = 5, time = 5, timeUnit = SECONDS)
    public void wildcardPattern(Texts texts, Blackhole blackhole) {
        blackhole.consume(texts.wildcardMachine.matches(texts.text));
    }
}
