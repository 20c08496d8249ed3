package ai.normcode.table.syntax;

import org.junit.jupiter.api.Test;

import ai.normcode.model.WorkingInterpretation.TimingSyntax;

import static org.assertj.core.api.Assertions.assertThat;


class TimingExtractorTest {

    @Test
    void conditionalMarkersTestAProposition() {
        assertThat(TimingExtractor.syntax("<= @:'(<data ready>)")).isEqualTo(new TimingSyntax("if", "<data ready>"));
        assertThat(TimingExtractor.syntax("<= @:!(<data ready>)")).isEqualTo(new TimingSyntax("if!", "<data ready>"));
        assertThat(TimingExtractor.syntax("<= @:'(bare)")).isEqualTo(new TimingSyntax("if", "<bare>"));
    }

    @Test
    void afterKeepsTheConditionsBrackets() {
        assertThat(TimingExtractor.syntax("<= @.({step one})")).isEqualTo(new TimingSyntax("after", "{step one}"));
        assertThat(TimingExtractor.syntax("<= @.([rows])")).isEqualTo(new TimingSyntax("after", "[rows]"));
        assertThat(TimingExtractor.syntax("<= @.(done)")).isEqualTo(new TimingSyntax("after", "{done}"));
    }

    @Test
    void missingConditionIsNull() {
        assertThat(TimingExtractor.syntax("<= @:'").condition()).isNull();
    }
}
