package com.handelsregister.scraper.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RegisterNumbersTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Berlin (Charlottenburg) HRB 12345 | Berlin | HRB 12345 B",
            "Berlin (Charlottenburg) HRB 12345 B | Berlin | HRB 12345 B",
            "Berlin (Charlottenburg) HRA 777 | Berlin | HRA 777",
            "Bremen HRA 999 | Bremen | HRA 999 HB",
            "Bremen VR 12 | Bremen | VR 12 HB",
            "Bremen GnR 5 | Bremen | GnR 5 HB",
            "München HRB 1000 | Bayern | HRB 1000",
            "Hamburg HRB12345 | Hamburg | HRB12345"
    })
    void extractsAndNormalises(final String court, final String state, final String expected) {
        assertThat(RegisterNumbers.extract(court, state)).contains(expected);
    }

    @Test
    void suffixLetterRequiresWordBoundary() {
        assertThat(RegisterNumbers.extract("Amtsgericht HRB 4711 Formerly X", "Hessen"))
                .contains("HRB 4711");
    }

    @Test
    void courtWithoutNumberYieldsEmpty() {
        assertThat(RegisterNumbers.extract("Amtsgericht Berlin", "Berlin")).isEmpty();
        assertThat(RegisterNumbers.extract(null, "Berlin")).isEmpty();
    }

    @Test
    void suffixNotDuplicated() {
        assertThat(RegisterNumbers.withStateSuffix("HRA 999 HB", "HRA", "Bremen")).isEqualTo("HRA 999 HB");
    }
}
