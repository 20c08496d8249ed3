package ai.normcode.table.syntax;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.normcode.model.InferenceCluster;
import ai.normcode.model.WorkingInterpretation.GroupingSyntax;
import ai.normcode.parse.AxisSpec;

import static ai.normcode.Fixtures.firstCluster;
import static org.assertj.core.api.Assertions.assertThat;

class GroupingExtractorTest {

    private final GroupingExtractor extractor = new GroupingExtractor();

    @Test
    void fallsBackToEachValueConceptsAxes() {
        final GroupingSyntax syntax = extractor.syntax(firstCluster(
                ":<: {bundle}",
                "    <= &[{}] %>[{a}, {b}] %+(pair)",
                "    <- {a}",
                "    | %{ref_axes}: [date]",
                "    <- {b}"));

        assertThat(syntax.marker()).isEqualTo("in");
        assertThat(syntax.sources()).isEqualTo(List.of("{a}", "{b}"));
        assertThat(syntax.createAxis()).isEqualTo("pair");
        assertThat(syntax.byAxesSource()).isEqualTo(GroupingExtractor.FALLBACK);
        assertThat(syntax.byAxes()).containsExactly(List.of("date"), List.of(AxisSpec.NONE_AXIS));
    }

    @Test
    void perConceptCollapseWinsWhenEveryValueHasIt() {
        final GroupingSyntax syntax = extractor.syntax(firstCluster(
                ":<: {bundle}",
                "    <= &[{}] %>[{a}, {b}]",
                "    | %{by_axes}: [signal]",
                "    <- {a}",
                "    | %{collapse_in_grouping}: [[date]]",
                "    <- {b}",
                "    | %{collapse_in_grouping}: [page]"));

        assertThat(syntax.byAxesSource()).isEqualTo(GroupingExtractor.PER_CONCEPT);
        assertThat(syntax.byAxes()).containsExactly(List.of("date"), List.of("page"));
    }

    @Test
    void functionLevelAxesApplyToEveryValue() {
        final GroupingSyntax syntax = extractor.syntax(firstCluster(
                ":<: {bundle}",
                "    <= &[{}] %>[{a}, {b}] %-[ignored]",
                "    | %{by_axes}: [signal]",
                "    <- {a}",
                "    | %{collapse_in_grouping}: [date]",
                "    <- {b}"));

        assertThat(syntax.byAxesSource()).isEqualTo(GroupingExtractor.FUNCTIONAL);
        assertThat(syntax.byAxes()).containsExactly(List.of("signal"), List.of("signal"));
    }

    @Test
    void nestedFunctionLevelAxesAreFittedToValueCount() {
        final GroupingSyntax syntax = extractor.syntax(firstCluster(
                ":<: {bundle}",
                "    <= &[{}] %>[{a}, {b}]",
                "    | %{by_axes}: [[x], [y], [z]]",
                "    <- {a}",
                "    <- {b}"));

        assertThat(syntax.byAxes()).containsExactly(List.of("x"), List.of("y"));
    }

    @Test
    void inlineAxesAndAcrossMarker() {
        final GroupingSyntax syntax = extractor.syntax(firstCluster(
                ":<: {bundle}",
                "    <= &[#] %>[{a}, {b}, {c}] %-[date]",
                "    <- {a}",
                "    <- {b}",
                "    <- {c}"));

        assertThat(syntax.marker()).isEqualTo("across");
        assertThat(syntax.sources()).isEqualTo(List.of("{a}", "{b}", "{c}"));
        assertThat(syntax.byAxesSource()).isEqualTo(GroupingExtractor.INLINE);
        assertThat(syntax.byAxes()).hasSize(3).allMatch(List.of("date")::equals);
    }

    @Test
    void axisListAlwaysMatchesValueCount() {
        final InferenceCluster cluster = firstCluster(
                ":<: {bundle}",
                "    <= &[{}] %>[{a}]",
                "    | %{by_axes}: [[x]]",
                "    <- {a}",
                "    <- {b}",
                "    <- {c}");

        final GroupingSyntax syntax = extractor.syntax(cluster);
        assertThat(syntax.byAxes().size()).isEqualTo(cluster.valueConcepts().size());
        assertThat(syntax.byAxes()).containsExactly(
                List.of("x"), List.of(AxisSpec.NONE_AXIS), List.of(AxisSpec.NONE_AXIS));
    }
}
