package ai.normcode.parse;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.RoleMarker;

import static ai.normcode.Fixtures.clusters;
import static org.assertj.core.api.Assertions.assertThat;

class ClusterBuilderTest {

    @Test
    void singleSpecificationCluster() {
        final List<InferenceCluster> result = clusters(
                ":<: {result}",
                "    <= $.(...) %>({source})",
                "    <- {source}");

        assertThat(result).hasSize(1);
        final InferenceCluster cluster = result.get(0);
        assertThat(cluster.conceptToInfer().conceptName()).isEqualTo("result");
        assertThat(cluster.functionConcept().ncMain()).isEqualTo("<= $.(...) %>({source})");
        assertThat(cluster.valueConcepts()).extracting(ClassifiedLine::conceptName).containsExactly("source");
        assertThat(cluster.otherConcepts()).isEmpty();
        assertThat(cluster.position()).isEqualTo("1");
    }

    @Test
    void classifiesChildrenAndOrdersClustersByPosition() {
        final List<InferenceCluster> result = clusters(
                ":<: {result}",
                "    <= ::(combine)",
                "    <- {a}",
                "        <= $.(x) %>({raw})",
                "        <- {raw}",
                "    <* {ctx}",
                "    <= $=(copy) %>({a})");

        assertThat(result).extracting(InferenceCluster::position).containsExactly("1", "1.2");

        final InferenceCluster root = result.get(0);
        assertThat(root.functionConcept().ncMain()).isEqualTo("<= ::(combine)");
        assertThat(root.valueConcepts()).extracting(ClassifiedLine::flowIndex).containsExactly("1.2");
        assertThat(root.otherConcepts()).extracting(ClassifiedLine::flowIndex).containsExactly("1.3", "1.4");
        assertThat(root.otherConcepts().get(1).hasMarker(RoleMarker.OPERATOR)).isTrue();
        assertThat(root.contextConcepts()).extracting(ClassifiedLine::conceptName).containsExactly("ctx");

        final InferenceCluster nested = result.get(1);
        assertThat(nested.conceptToInfer().conceptName()).isEqualTo("a");
        assertThat(nested.valueConcepts()).extracting(ClassifiedLine::conceptName).containsExactly("raw");
    }

    @Test
    void parentWithoutOperatorIsNotACluster() {
        final List<InferenceCluster> result = clusters(
                ":<: {result}",
                "    <- {a}",
                "    <- {b}");
        assertThat(result).isEmpty();
    }

    @Test
    void clusterLinesCarryTheirComments() {
        final InferenceCluster cluster = clusters(
                ":<: {result}",
                "    | %{ref_axes}: [date]",
                "    <= ::(summarize) | ?{sequence}: imperative",
                "    | %{norm_input}: summarize.md",
                "    <- {text}").get(0);

        assertThat(Annotations.value(cluster.conceptToInfer(), Annotations.REF_AXES)).isEqualTo("[date]");
        assertThat(Annotations.value(cluster.functionConcept(), Annotations.NORM_INPUT)).isEqualTo("summarize.md");
        assertThat(Annotations.sequenceTag(cluster.functionConcept().comments())).isEqualTo("imperative");
    }
}
