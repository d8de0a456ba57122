package org.neuralchilli.rasterindex.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MacroCallTest {

    @Test
    void shouldFindCallsInOrderOfAppearance() {
        List<MacroCall> calls = MacroCall.scan("func_index(ExG_wernette) - func_band_max(R)");

        assertThat(calls).hasSize(2);
        assertThat(calls.get(0).wholeMatch()).isEqualTo("func_index(ExG_wernette)");
        assertThat(calls.get(0).functionName()).isEqualTo("index");
        assertThat(calls.get(0).firstArgument()).isEqualTo("ExG_wernette");
        assertThat(calls.get(1).functionName()).isEqualTo("band_max");
        assertThat(calls.get(1).firstArgument()).isEqualTo("R");
    }

    @Test
    void shouldSplitAndTrimArguments() {
        List<MacroCall> calls = MacroCall.scan("func_custom( R , G,B )");

        assertThat(calls).singleElement()
                .satisfies(call -> assertThat(call.arguments()).containsExactly("R", "G", "B"));
    }

    @Test
    void shouldStopArgumentsAtFirstClosingParenthesis() {
        List<MacroCall> calls = MacroCall.scan("func_band_max((R))");

        assertThat(calls).singleElement()
                .satisfies(call -> assertThat(call.wholeMatch()).isEqualTo("func_band_max((R)"));
    }

    @Test
    void shouldReportMissingArgumentAsNull() {
        MacroCall call = MacroCall.scan("func_band_max()").get(0);

        assertThat(call.arguments()).isEmpty();
        assertThat(call.firstArgument()).isNull();
    }

    @Test
    void shouldFindNothingInFlatExpression() {
        assertThat(MacroCall.scan("(G - R) / (G + R)")).isEmpty();
        assertThat(MacroCall.containsMacros("(G - R) / (G + R)")).isFalse();
        assertThat(MacroCall.containsMacros("R / func_band_max(R)")).isTrue();
        assertThat(MacroCall.scan(null)).isEmpty();
    }
}
