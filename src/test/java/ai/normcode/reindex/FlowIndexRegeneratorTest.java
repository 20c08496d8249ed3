package ai.normcode.reindex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static ai.normcode.Fixtures.plan;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowIndexRegeneratorTest {

    private final FlowIndexRegenerator regenerator = new FlowIndexRegenerator();

    private static final String SOURCE = plan(
            ":<: {result}",
            "    <= ::(combine)",
            "    <- {a}",
            "    | %{ref_axes}: [x]",
            "    <- {b} | ?{flow_index}: 9.9",
            "        <= $.(x) %>({raw}) | /: copy raw",
            "        <- {raw}");

    @Test
    void tagsEveryRoleLine() {
        final FlowIndexRegenerator.Result result = regenerator.regenerate(SOURCE);

        assertThat(result.content()).isEqualTo(plan(
                ":<: {result} | ?{flow_index}: 1",
                "    <= ::(combine) | ?{flow_index}: 1.1",
                "    <- {a} | ?{flow_index}: 1.2",
                "    | %{ref_axes}: [x]",
                "    <- {b} | ?{flow_index}: 1.3",
                "        <= $.(x) %>({raw}) | ?{flow_index}: 1.3.1 | /: copy raw",
                "        <- {raw} | ?{flow_index}: 1.3.2"));
        assertThat(result.updatedCount()).isEqualTo(6);
        assertThat(result.positions().get(5)).isEqualTo("1.3.1");
    }

    @Test
    void regeneratingTwiceChangesNothing() {
        final String once = regenerator.regenerate(SOURCE).content();
        assertThat(regenerator.regenerate(once).content()).isEqualTo(once);
    }

    @Test
    void keepsCarriageReturns() {
        final String result = regenerator.regenerate(":<: {x}\r\n    <= ::(y)\r\n").content();
        assertThat(result).isEqualTo(":<: {x} | ?{flow_index}: 1\r\n    <= ::(y) | ?{flow_index}: 1.1\r\n");
    }

    @Test
    void rootsAreNumberedInSequence() {
        final String source = plan(":<: {a}", "    <= ::(x)", ":<: {b}", "    <= ::(y)");

        assertThat(regenerator.regenerate(source).positions().values())
                .containsExactly("1", "1.1", "2", "2.1");
        assertThat(new FlowIndexRegenerator("3").regenerate(source).positions().values())
                .containsExactly("3", "3.1", "4", "4.1");
    }

    @Test
    void rejectsMalformedBaseIndex() {
        assertThatThrownBy(() -> new FlowIndexRegenerator("1..2")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dryRunLeavesFileUntouched(@TempDir Path dir) throws IOException {
        final Path file = dir.resolve("plan.pf.ncd");
        Files.writeString(file, SOURCE, StandardCharsets.UTF_8);

        final FlowIndexRegenerator.Result dry = regenerator.regenerate(file, true);
        assertThat(dry.updatedCount()).isEqualTo(6);
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(SOURCE);

        regenerator.regenerate(file, false);
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(dry.content());
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        assertThatThrownBy(() -> regenerator.regenerate(dir.resolve("absent.pf.ncd"), false))
                .isInstanceOf(IOException.class);
    }

    @Test
    void roleLineDetection() {
        assertThat(FlowIndexRegenerator.isRoleLine("    <* {item}")).isTrue();
        assertThat(FlowIndexRegenerator.isRoleLine(":>: {input}")).isTrue();
        assertThat(FlowIndexRegenerator.isRoleLine("    | %{ref_axes}: [x]")).isFalse();
        assertThat(FlowIndexRegenerator.isRoleLine("   ")).isFalse();
    }

    @Test
    void appendsWhenNoAnnotationSeparator() {
        assertThat(FlowIndexRegenerator.withPosition("<- {a}   ", "2.1")).isEqualTo("<- {a} | ?{flow_index}: 2.1");
    }

    @Test
    void fillsAnEmptyExistingTag() {
        assertThat(FlowIndexRegenerator.withPosition("<- {a} | ?{flow_index}:", "1.2"))
                .isEqualTo("<- {a} | ?{flow_index}: 1.2");

        final FlowIndexRegenerator.Result result = regenerator.regenerate(plan(
                ":<: {result} | ?{flow_index}:",
                "    <- {a}"));
        assertThat(result.content()).isEqualTo(plan(
                ":<: {result} | ?{flow_index}: 1",
                "    <- {a} | ?{flow_index}: 1.1"));
    }
}
