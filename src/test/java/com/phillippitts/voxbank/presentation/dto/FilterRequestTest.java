package com.phillippitts.voxbank.presentation.dto;

import com.phillippitts.voxbank.domain.CustomFilterSettings;
import com.phillippitts.voxbank.domain.FilterPreset;
import com.phillippitts.voxbank.domain.FilterSpec;
import com.phillippitts.voxbank.domain.Token;
import com.phillippitts.voxbank.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterRequestTest {

    @Test
    void missingFilterMeansOff() {
        assertThat(FilterRequest.toSpec(null)).isEqualTo(FilterSpec.off());
        assertThat(new FilterRequest(null, null, null, null, null).toSpec()).isEqualTo(FilterSpec.off());
    }

    @Test
    void presetNamesAreCaseInsensitive() {
        assertThat(new FilterRequest(" Light ", null, null, null, null).toSpec())
                .isEqualTo(FilterSpec.preset(FilterPreset.LIGHT));
    }

    @Test
    void unknownPresetIsRejected() {
        assertThatThrownBy(() -> new FilterRequest("radio", null, null, null, null).toSpec())
                .isInstanceOfSatisfying(InvalidRequestException.class,
                        e -> assertThat(e.getField()).isEqualTo("filter.preset"));
    }

    @Test
    void customValuesMustBeComplete() {
        assertThatThrownBy(() -> new FilterRequest(null, 300.0, null, 2.0, 0.1).toSpec())
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("requires");
    }

    @Test
    void customValuesAreRangeChecked() {
        assertThat(new FilterRequest(null, 300.0, 3_400.0, 2.0, 0.1).toSpec())
                .isEqualTo(FilterSpec.custom(new CustomFilterSettings(300.0, 3_400.0, 2.0, 0.1)));
        assertThatThrownBy(() -> new FilterRequest(null, 300.0, 3_400.0, 2.0, 3.0).toSpec())
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("distortion");
    }

    @Test
    void compositionEntriesMapToTokens() {
        assertThat(new CompositionEntry("gate", null, null).toToken()).isEqualTo(Token.word("gate"));
        assertThat(new CompositionEntry(null, ",", 150).toToken()).isEqualTo(Token.pause(",", 150));
        assertThatThrownBy(() -> new CompositionEntry("gate", null, 100).toToken())
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> new CompositionEntry(null, ".", -1).toToken())
                .isInstanceOf(InvalidRequestException.class);
    }
}
