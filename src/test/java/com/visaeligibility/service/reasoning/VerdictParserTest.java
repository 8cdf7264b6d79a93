package com.visaeligibility.service.reasoning;

import com.visaeligibility.dto.internal.ParsedVerdict;
import com.visaeligibility.model.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class VerdictParserTest {

    private final VerdictParser parser = new VerdictParser();

    @Nested
    @DisplayName("JSON block")
    class JsonBlock {

        @Test
        @DisplayName("reads outcome and confidence from the trailing JSON block")
        void jsonVerdict() {
            String response = """
                    The salary exceeds the threshold and the sponsor is licensed [1].

                    {"outcome": "eligible", "confidence": 0.85, "citations": [1]}
                    """;

            ParsedVerdict verdict = parser.parse(response);

            assertThat(verdict.outcome()).isEqualTo(Outcome.ELIGIBLE);
            assertThat(verdict.confidence()).isEqualTo(0.85);
        }

        @Test
        @DisplayName("percent strings are scaled")
        void percentString() {
            assertThat(parser.extractConfidence("{\"outcome\": \"not_eligible\", \"confidence\": \"70%\"}"))
                    .contains(0.7);
        }

        @Test
        @DisplayName("the JSON block wins over markers")
        void jsonBeforeMarkers() {
            String response = """
                    OUTCOME: eligible
                    CONFIDENCE: 0.9
                    {"outcome": "requires_review", "confidence": 0.55}
                    """;

            assertThat(parser.extractOutcome(response)).contains(Outcome.REQUIRES_REVIEW);
            assertThat(parser.extractConfidence(response)).contains(0.55);
        }
    }

    @Nested
    @DisplayName("markers")
    class Markers {

        @Test
        @DisplayName("reads OUTCOME and CONFIDENCE lines")
        void markers() {
            String response = """
                    Analysis...
                    **OUTCOME:** not eligible
                    CONFIDENCE: 80%
                    """;

            ParsedVerdict verdict = parser.parse(response);

            assertThat(verdict.outcome()).isEqualTo(Outcome.NOT_ELIGIBLE);
            assertThat(verdict.confidence()).isEqualTo(0.8);
        }

        @Test
        @DisplayName("the last marker counts")
        void lastMarker() {
            String response = "OUTCOME: eligible\nreconsidering...\nOUTCOME: requires_review\n";

            assertThat(parser.extractOutcome(response)).contains(Outcome.REQUIRES_REVIEW);
        }
    }

    @Nested
    @DisplayName("unknown")
    class Unknown {

        @Test
        @DisplayName("free text without markers is unknown, never guessed")
        void noGuessing() {
            ParsedVerdict verdict = parser.parse("The applicant is likely eligible, roughly 90% sure.");

            assertThat(verdict.outcome()).isNull();
            assertThat(verdict.confidence()).isNull();
            assertThat(verdict.isComplete()).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {"CONFIDENCE: 1.5", "CONFIDENCE: 150%", "{\"confidence\": -0.2}", "{\"confidence\": \"high\"}"})
        @DisplayName("out-of-range or non-numeric confidence is unknown")
        void badConfidence(String response) {
            assertThat(parser.extractConfidence(response)).isEmpty();
        }

        @Test
        @DisplayName("unrecognised outcome wording is unknown")
        void badOutcome() {
            assertThat(parser.extractOutcome("OUTCOME: maybe")).isEmpty();
            assertThat(parser.extractOutcome("{\"outcome\": \"perhaps\", \"confidence\": 0.5}")).isEmpty();
        }

        @Test
        @DisplayName("blank or null input is unknown")
        void blank() {
            assertThat(parser.parse(null)).isEqualTo(ParsedVerdict.unknown());
            assertThat(parser.parse("  ")).isEqualTo(ParsedVerdict.unknown());
        }
    }
}
