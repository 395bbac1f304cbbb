package com.tasktracker.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class BearerTokenExtractorTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        void extractsTokenAfterScheme() {
            assertThat(BearerTokenExtractor.extract("Bearer abc.def.ghi")).contains("abc.def.ghi");
        }

        @ParameterizedTest
        @ValueSource(strings = {"bearer abc.def.ghi", "BEARER abc.def.ghi", "BeArEr abc.def.ghi"})
        void schemeIsCaseInsensitive(String header) {
            assertThat(BearerTokenExtractor.extract(header)).contains("abc.def.ghi");
        }

        @Test
        void surroundingWhitespaceIsIgnored() {
            assertThat(BearerTokenExtractor.extract("  Bearer   abc.def.ghi  ")).contains("abc.def.ghi");
        }
    }

    @Nested
    @DisplayName("rejected headers")
    class RejectedHeaders {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "Bearer", "Bearer ", "Bearer    "})
        void missingToken(String header) {
            assertThat(BearerTokenExtractor.extract(header)).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"Basic YWxpY2U6c2VjcmV0", "Token abc.def.ghi", "abc.def.ghi", "Bearerabc.def.ghi"})
        void otherSchemes(String header) {
            assertThat(BearerTokenExtractor.extract(header)).isEmpty();
        }
    }
}
