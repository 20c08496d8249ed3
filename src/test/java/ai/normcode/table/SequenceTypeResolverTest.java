package ai.normcode.table;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import ai.normcode.model.ConceptKind;
import ai.normcode.model.OperatorKind;
import ai.normcode.model.SequenceType;

import static ai.normcode.Fixtures.firstCluster;
import static org.assertj.core.api.Assertions.assertThat;

class SequenceTypeResolverTest {

    private static Optional<SequenceType> text(String operatorText) {
        return SequenceTypeResolver.fromText(operatorText, null, ConceptKind.OPERATOR);
    }

    @Test
    void patternTiersInOrder() {
        assertThat(text("<= ::(is ok)<{ALL True}>")).contains(SequenceType.JUDGEMENT);
        assertThat(text("<= ::<{is complete}>")).contains(SequenceType.JUDGEMENT);
        assertThat(text("<= &[#] %>[{a}]")).contains(SequenceType.GROUPING);
        assertThat(text("<= *. %>([items])")).contains(SequenceType.LOOPING);
        assertThat(text("<= $.(x) %>({s})")).contains(SequenceType.ASSIGNING);
        assertThat(text("$- %>({s})")).contains(SequenceType.ASSIGNING);
        assertThat(text("<= @:'(<ready>)")).contains(SequenceType.TIMING);
        assertThat(text("<= ::(do it)")).contains(SequenceType.IMPERATIVE);
    }

    @Test
    void groupingBeatsTimingWhenBothMatch() {
        assertThat(text("<= &[{}] %>[{a}] @.({b})")).contains(SequenceType.GROUPING);
    }

    @Test
    void operatorKindAndConceptKindTiers() {
        assertThat(SequenceTypeResolver.fromText("<= odd", OperatorKind.TIMING_ACTION, ConceptKind.OPERATOR))
                .contains(SequenceType.TIMING);
        assertThat(SequenceTypeResolver.fromText("<= odd", null, ConceptKind.IMPERATIVE))
                .contains(SequenceType.IMPERATIVE);
        assertThat(SequenceTypeResolver.fromText("<= mystery op", null, ConceptKind.INFORMAL)).isEmpty();
        assertThat(SequenceTypeResolver.fromText("<= *. without base", OperatorKind.LOOPING, ConceptKind.OPERATOR))
                .isEmpty();
    }

    @Test
    void inlineTagWins() {
        final var cluster = firstCluster(
                ":<: {verdict}",
                "    <= ::(check) | ?{sequence}: judgement",
                "    <- {input}");
        assertThat(SequenceTypeResolver.resolve(cluster.functionConcept())).contains(SequenceType.JUDGEMENT);

        final var tableName = firstCluster(
                ":<: {verdict}",
                "    <= ::(check) | ?{sequence}: judgement_in_composition",
                "    <- {input}");
        assertThat(SequenceTypeResolver.resolve(tableName.functionConcept())).contains(SequenceType.JUDGEMENT);
    }

    @Test
    void unknownTagFallsThroughToText() {
        final var cluster = firstCluster(
                ":<: {verdict}",
                "    <= ::(check) | ?{sequence}: bogus",
                "    <- {input}");
        assertThat(SequenceTypeResolver.resolve(cluster.functionConcept())).contains(SequenceType.IMPERATIVE);
    }
}
