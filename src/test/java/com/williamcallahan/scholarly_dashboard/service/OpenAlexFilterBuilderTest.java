package com.williamcallahan.scholarly_dashboard.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAlexFilterBuilderTest {

    @Test
    void institutionOnly() {
        assertThat(OpenAlexFilterBuilder.build(" 03490as77 ", null, null)).isEqualTo("institutions.ror:03490as77");
    }

    @Test
    void bothYearBounds() {
        assertThat(OpenAlexFilterBuilder.build("03490as77", 2019, 2023))
            .isEqualTo("institutions.ror:03490as77,publication_year:2019-2023");
    }

    @Test
    void singleYearBound() {
        assertThat(OpenAlexFilterBuilder.build("03490as77", 2019, null))
            .isEqualTo("institutions.ror:03490as77,publication_year:>=2019");
        assertThat(OpenAlexFilterBuilder.build("03490as77", null, 2023))
            .isEqualTo("institutions.ror:03490as77,publication_year:<=2023");
    }

    @Test
    void blankRorIsRejected() {
        assertThatThrownBy(() -> OpenAlexFilterBuilder.build(" ", 2019, 2023))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
