package com.handelsregister.scraper.state;

import com.handelsregister.scraper.model.StateCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StateRegistryTest {

    private final StateRegistry registry = new StateRegistry();

    @Test
    void listsSixteenStatesInPortalOrder() {
        assertThat(registry.list())
                .extracting(StateCode::name)
                .containsExactly("BW", "BY", "BE", "BR", "HB", "HH", "HE", "MV",
                        "NI", "NW", "RP", "SL", "SN", "ST", "SH", "TH");
    }

    @Test
    void everyCodeAndCanonicalNameResolvesToItself() {
        for (StateCode code : registry.list()) {
            assertThat(registry.resolve(code.name())).contains(code);
            assertThat(registry.resolve(code.name().toLowerCase())).contains(code);
            assertThat(registry.resolve(code.getNameDe())).contains(code);
            assertThat(registry.resolve(code.getNameDe().toUpperCase())).contains(code);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "Bavaria, BY",
            "bayern, BY",
            "  Berlin  , BE",
            "North Rhine-Westphalia, NW",
            "nordrhein westfalen, NW",
            "Baden-Wuerttemberg, BW",
            "Thueringen, TH",
            "Thuringia, TH",
            "Lower Saxony, NI",
            "Saxony-Anhalt, ST",
            "hesse, HE"
    })
    void resolvesAliases(final String input, final StateCode expected) {
        assertThat(registry.resolve(input)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "XX", "Bay", "Atlantis", "Nordrhein"})
    void unknownOrPartialInputIsNotFound(final String input) {
        assertThat(registry.resolve(input)).isEmpty();
    }

    @Test
    void nullIsNotFound() {
        assertThat(registry.resolve(null)).isEmpty();
    }

    @Test
    void formFieldFollowsPortalNaming() {
        assertThat(StateCode.BE.formField()).isEqualTo("bundeslandBE");
        assertThat(registry.list()).extracting(StateCode::formField)
                .allMatch(field -> field.startsWith("bundesland"))
                .doesNotHaveDuplicates();
    }

    @Test
    void listIsStable() {
        List<StateCode> first = registry.list();
        assertThat(registry.list()).isEqualTo(first);
    }
}
