package ai.normcode.table;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.normcode.model.AssignSyntax;
import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.InferenceEntry;
import ai.normcode.model.Positions;
import ai.normcode.model.SequenceType;
import ai.normcode.model.WorkingInterpretation;
import ai.normcode.parse.MarkerClassifier;

import static ai.normcode.Fixtures.clusters;
import static org.assertj.core.api.Assertions.assertThat;

class InferenceTableBuilderTest {

    private final InferenceTableBuilder builder = new InferenceTableBuilder();

    private static String fallback(String operatorText, SequenceType type) {
        final ClassifiedLine operator = ClassifiedLine.main("2.1", 1, operatorText, MarkerClassifier.classify(operatorText));
        return InferenceTableBuilder.fallbackConceptToInfer(operator, type);
    }

    @Test
    void specificationRow() {
        final List<InferenceEntry> rows = builder.build(clusters(
                ":<: {result}",
                "    <= $.(...) %>({source})",
                "    <- {source}"));

        assertThat(rows).hasSize(1);
        final InferenceEntry row = rows.get(0);
        assertThat(row.position()).isEqualTo("1");
        assertThat(row.inferenceSequence()).isEqualTo(SequenceType.ASSIGNING);
        assertThat(row.conceptToInfer()).isEqualTo("{result}");
        assertThat(row.functionConcept()).isEqualTo("$.(...) %>({source})");
        assertThat(row.valueConcepts()).isEqualTo(List.of("{source}"));
        assertThat(row.contextConcepts()).isEmpty();

        assertThat(row.workingInterpretation()).isInstanceOf(WorkingInterpretation.Assigning.class);
        final WorkingInterpretation.Assigning wi = (WorkingInterpretation.Assigning) row.workingInterpretation();
        assertThat(wi.flowInfo().flowIndex()).isEqualTo("1");
        assertThat(wi.syntax()).isInstanceOf(AssignSyntax.Specification.class);
        final AssignSyntax.Specification syntax = (AssignSyntax.Specification) wi.syntax();
        assertThat(syntax.marker()).isEqualTo(".");
        assertThat(syntax.assignSource().json()).isEqualTo("{source}");
    }

    @Test
    void boundValueOrderReplacesTheValueList() {
        final InferenceEntry row = builder.build(clusters(
                ":<: {answer}",
                "    <= ::(combine)",
                "    <- {second}<:{2}>",
                "    <- {helper}",
                "    <- {first}<:{1}>")).get(0);

        assertThat(row.inferenceSequence()).isEqualTo(SequenceType.IMPERATIVE);
        assertThat(row.valueConcepts()).isEqualTo(List.of("{second}", "{first}"));
    }

    @Test
    void timingRowCarriesContextAsValues() {
        final InferenceEntry row = builder.build(clusters(
                ":<: {report}",
                "    <= @:'(<data ready>)",
                "    <- {draft}",
                "    <* <data ready>")).get(0);

        assertThat(row.inferenceSequence()).isEqualTo(SequenceType.TIMING);
        assertThat(row.valueConcepts()).isEqualTo(List.of("{draft}", "<data ready>"));
        assertThat(row.contextConcepts()).isEqualTo(List.of("<data ready>"));
        assertThat(row.workingInterpretation()).isInstanceOf(WorkingInterpretation.Timing.class);
        final WorkingInterpretation.Timing wi = (WorkingInterpretation.Timing) row.workingInterpretation();
        assertThat(wi.syntax().marker()).isEqualTo("if");
        assertThat(wi.syntax().condition()).isEqualTo("<data ready>");
        assertThat(wi.blackboard()).isNull();
    }

    @Test
    void nestedOperatorIsPromotedToItsOwnRow() {
        final List<InferenceEntry> rows = builder.build(clusters(
                ":<: {result}",
                "    <= ::(combine)",
                "    <- {a}",
                "    <= $=(copy) %>({a})"));

        assertThat(rows).extracting(InferenceEntry::position).containsExactly("1", "1.3");
        final InferenceEntry nested = rows.get(1);
        assertThat(nested.inferenceSequence()).isEqualTo(SequenceType.ASSIGNING);
        assertThat(nested.conceptToInfer()).isEqualTo("{a}");
        assertThat(nested.functionConcept()).isEqualTo("$=(copy) %>({a})");
        assertThat(nested.valueConcepts()).isEmpty();
        assertThat(nested.contextConcepts()).isEmpty();
        assertThat(nested.workingInterpretation()).isInstanceOf(WorkingInterpretation.Assigning.class);
        final WorkingInterpretation.Assigning wi = (WorkingInterpretation.Assigning) nested.workingInterpretation();
        assertThat(wi.syntax()).isEqualTo(new AssignSyntax.Direct("=", "{a}"));
        assertThat(wi.flowInfo().flowIndex()).isEqualTo("1.3");
    }

    @Test
    void unresolvedClusterIsDropped() {
        final List<InferenceEntry> rows = builder.build(clusters(
                ":<: {result}",
                "    <= mystery op",
                "    <- {a}"));

        assertThat(rows).isEmpty();
        assertThat(builder.droppedCount()).isEqualTo(1);
    }

    @Test
    void functionLikeParentIsReferencedByItsText() {
        final List<InferenceEntry> rows = builder.build(clusters(
                ":<: {x}",
                "    <= $.(a) %>({y})",
                "        <= ::(make y)",
                "        <- {z}",
                "    <- {y}"));

        assertThat(rows).extracting(InferenceEntry::position).containsExactly("1", "1.1");
        assertThat(rows.get(1).conceptToInfer()).isEqualTo("$.(a) %>({y})");
    }

    @Test
    void fallbackConceptToInfer() {
        assertThat(fallback("<= $.(x)", SequenceType.ASSIGNING)).isEqualTo("{assigning_2_1}");
        assertThat(fallback("<= $.(x) %>[{a}, {b}]", SequenceType.ASSIGNING)).isEqualTo("{a}");
        assertThat(fallback("<= $=(x) %>([rows])", SequenceType.ASSIGNING)).isEqualTo("[rows]");
        assertThat(fallback("<= @.({step})", SequenceType.TIMING)).isEqualTo("@.({step})");
    }

    @Test
    void rowsAreSortedByPosition() {
        final List<InferenceEntry> rows = builder.build(clusters(
                ":<: {result}",
                "    <= ::(combine)",
                "    <- {a}",
                "        <= $.(x) %>({raw})",
                "        <- {raw}",
                "    <- {b}",
                "        <= &[{}] %>[{p}, {q}]",
                "        <- {p}",
                "        <- {q}",
                "    <= $=(copy) %>({a})",
                ":<: {second root} | ?{flow_index}: 2",
                "    <= ::(again)",
                "    <- {c}"));

        assertThat(rows).hasSize(5);
        for (int i = 1; i < rows.size(); i++) {
            assertThat(Positions.compare(rows.get(i - 1).position(), rows.get(i).position()))
                    .as("row order at %d", i)
                    .isLessThanOrEqualTo(0);
        }
    }
}
