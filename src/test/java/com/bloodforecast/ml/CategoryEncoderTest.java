package com.bloodforecast.ml;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryEncoderTest {

    @Test
    void fit_assignsCodesInSortedOrder() {
        CategoryEncoder encoder = CategoryEncoder.fit("region", List.of("Noida", "Dwarka", "Gurgaon", "Dwarka"));

        assertThat(encoder.size()).isEqualTo(3);
        assertThat(encoder.encode("Dwarka")).isZero();
        assertThat(encoder.encode("Gurgaon")).isEqualTo(1);
        assertThat(encoder.encode("Noida")).isEqualTo(2);
        assertThat(encoder.vocabulary()).containsExactly("Dwarka", "Gurgaon", "Noida");
    }

    @Test
    void fit_isIndependentOfInputOrder() {
        CategoryEncoder a = CategoryEncoder.fit("blood_type", List.of("O+", "A-", "AB+"));
        CategoryEncoder b = CategoryEncoder.fit("blood_type", List.of("AB+", "O+", "A-"));

        for (String value : List.of("O+", "A-", "AB+")) {
            assertThat(a.encode(value)).isEqualTo(b.encode(value));
        }
    }

    @Test
    void encode_unknownValue_fallsBackAndNotifiesListener() {
        CategoryEncoder encoder = CategoryEncoder.fit("region", List.of("South Delhi", "North Delhi"));
        List<String> reported = new ArrayList<>();

        int code = encoder.encode("Faridabad", (column, value) -> reported.add(column + "=" + value));

        assertThat(code).isEqualTo(CategoryEncoder.FALLBACK_CODE);
        assertThat(reported).containsExactly("region=Faridabad");
        assertThat(encoder.contains("Faridabad")).isFalse();
    }

    @Test
    void encode_knownValue_doesNotNotifyListener() {
        CategoryEncoder encoder = CategoryEncoder.fit("season", List.of("Winter", "Monsoon"));
        List<String> reported = new ArrayList<>();

        encoder.encode("Monsoon", (column, value) -> reported.add(value));

        assertThat(reported).isEmpty();
    }
}
