package ai.normcode.table;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.normcode.model.ConceptEntry;
import ai.normcode.parse.AxisSpec;

import static ai.normcode.Fixtures.clusters;
import static org.assertj.core.api.Assertions.assertThat;

class ConceptTableBuilderTest {

    private final ConceptTableBuilder builder = new ConceptTableBuilder(Disambiguator.counter());

    private static ConceptEntry named(List<ConceptEntry> rows, String conceptName) {
        return rows.stream()
                .filter(r -> r.conceptName().equals(conceptName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no row " + conceptName));
    }

    @Test
    void valueAndFunctionRows() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":<: {result}",
                "    <= ::(combine the inputs)",
                "    | %{v_input_provision}: prompts/combine.md",
                "    <- {a}",
                "    | %{ref_axes}: [date, signal]",
                "    | %{ref_element}: str",
                "    <- {b}",
                "    | %{file_location}: data/b.json",
                "    | %{is_invariant}: true"));

        assertThat(rows).extracting(ConceptEntry::conceptName)
                .containsExactly("{result}", "::(combine the inputs)", "{a}", "{b}");

        final ConceptEntry result = named(rows, "{result}");
        assertThat(result.id()).isEqualTo("c-result");
        assertThat(result.groundConcept()).isFalse();
        assertThat(result.finalConcept()).isTrue();
        assertThat(result.referenceData()).isNull();
        assertThat(result.flowIndices()).isEqualTo(List.of("1"));

        final ConceptEntry a = named(rows, "{a}");
        assertThat(a.groundConcept()).isTrue();
        assertThat(a.finalConcept()).isFalse();
        assertThat(a.type()).isEqualTo("{}");
        assertThat(a.axisName()).isEqualTo("date");
        assertThat(a.referenceAxisNames()).isEqualTo(List.of("date", "signal"));
        assertThat(a.referenceElementType()).isEqualTo("str");
        assertThat(a.referenceData()).isNull();

        final ConceptEntry b = named(rows, "{b}");
        assertThat(b.groundConcept()).isTrue();
        assertThat(b.invariant()).isTrue();
        assertThat(b.referenceData()).isEqualTo(List.of("%{file_location}(data/b.json)"));
        assertThat(b.axisName()).isEqualTo(AxisSpec.NONE_AXIS);

        final ConceptEntry fn = named(rows, "::(combine the inputs)");
        assertThat(fn.id()).isEqualTo("fc-combine-the-inputs");
        assertThat(fn.type()).isEqualTo("({})");
        assertThat(fn.referenceElementType()).isEqualTo(ConceptTableBuilder.PARADIGM);
        assertThat(fn.naturalName()).isEqualTo("combine the inputs");
        assertThat(fn.referenceData()).isEqualTo(List.of("%{prompt_location}000(prompts/combine.md)"));
        assertThat(fn.groundConcept()).isTrue();
    }

    @Test
    void judgementAndPlainOperatorRows() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":<: <valid>",
                "    <= ::(is valid)<{ALL True}>",
                "    <- {doc}",
                "        <= $.(x) %>({raw})",
                "        <- {raw}"));

        final ConceptEntry judgement = named(rows, "::(is valid)<{ALL True}>");
        assertThat(judgement.type()).isEqualTo("<{}>");
        assertThat(judgement.referenceElementType()).isEqualTo(ConceptTableBuilder.PARADIGM);
        assertThat(judgement.referenceData()).isEqualTo(List.of(ConceptTableBuilder.DUMMY_REFERENCE));

        final ConceptEntry assigning = named(rows, "$.(x) %>({raw})");
        assertThat(assigning.referenceElementType()).isEqualTo(ConceptTableBuilder.OPERATOR);
        assertThat(assigning.referenceData()).isEqualTo(List.of(ConceptTableBuilder.DUMMY_REFERENCE));

        assertThat(named(rows, "<valid>").type()).isEqualTo("<>");
        assertThat(named(rows, "{doc}").groundConcept()).isFalse();
        assertThat(named(rows, "{raw}").groundConcept()).isTrue();
    }

    @Test
    void producedConceptWithLiteralIsGround() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":<: {total}",
                "    <= ::(add)",
                "    <- {mid}",
                "    | %{literal_value}: \"5\"",
                "        <= $.(x) %>({raw})",
                "        <- {raw}"));

        final ConceptEntry mid = named(rows, "{mid}");
        assertThat(mid.groundConcept()).isTrue();
        assertThat(mid.referenceData()).isEqualTo(List.of("5"));
    }

    @Test
    void finalConceptIsNeverGround() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":<: {out}",
                "| %{is_ground}: true",
                "    <= ::(make)",
                "    <- {in}"));

        final ConceptEntry out = named(rows, "{out}");
        assertThat(out.finalConcept()).isTrue();
        assertThat(out.groundConcept()).isFalse();
    }

    @Test
    void literalCarriedByName() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":<: {report}",
                "    <= ::(write)",
                "    <- {phase: \"phase_1\"}"));

        final ConceptEntry phase = named(rows, "{phase: \"phase_1\"}");
        assertThat(phase.groundConcept()).isTrue();
        assertThat(phase.referenceData()).isEqualTo(List.of("phase_1"));
    }

    @Test
    void externalInputIsGround() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":>: {input}",
                "    <= $.(x) %>({seed})",
                "    <- {seed}"));

        final ConceptEntry input = named(rows, "{input}");
        assertThat(input.groundConcept()).isTrue();
        assertThat(input.finalConcept()).isFalse();
    }

    @Test
    void loopContextIsNotGround() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":<: {all}",
                "    <= *. %>([items])",
                "    <- {x}",
                "    <* {item}<$({items})*1>"));

        assertThat(named(rows, "{item}").groundConcept()).isFalse();
    }

    @Test
    void positionsAreMergedAndSorted() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":<: {result}",
                "    <= ::(combine)",
                "    <- {shared}",
                "    <- {b}",
                "        <= ::(derive)",
                "        <- {shared}"));

        assertThat(named(rows, "{shared}").flowIndices()).isEqualTo(List.of("1.2", "1.3.2"));
        for (ConceptEntry row : rows) {
            assertThat(row.flowIndices()).isSorted();
        }
    }

    @Test
    void naturalNameFromOperatorText() {
        assertThat(ConceptTableBuilder.naturalName("::(summarize)")).isEqualTo("summarize");
        assertThat(ConceptTableBuilder.naturalName(":>:(check)<{True}>")).isEqualTo("check");
        assertThat(ConceptTableBuilder.naturalName("::<{is ok}>")).isEqualTo("is ok");
        assertThat(ConceptTableBuilder.naturalName("$=(copy)")).isEqualTo("$=(copy)");
    }

    @Test
    void conceptBothSuppliedAndFinalIsFinal() {
        final List<ConceptEntry> rows = builder.build(clusters(
                ":>: {x}",
                "    <= $.(seed) %>({seed})",
                "    <- {seed}",
                ":<: {x} | ?{flow_index}: 2",
                "    <= ::(refine)",
                "    <- {seed}"));

        final ConceptEntry x = named(rows, "{x}");
        assertThat(x.finalConcept()).isTrue();
        assertThat(x.groundConcept()).isFalse();
    }
}
