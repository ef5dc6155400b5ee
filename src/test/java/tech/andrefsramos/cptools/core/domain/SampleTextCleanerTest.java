package tech.andrefsramos.cptools.core.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SampleTextCleanerTest {

    @Nested
    @DisplayName("clean")
    class Clean {

        @Test
        @DisplayName("clean_nbspAndBr_becomeSpaceAndNewline")
        void clean_nbspAndBr_becomeSpaceAndNewline() {
            assertThat(SampleTextCleaner.clean("1&nbsp;2<br/>3 4")).isEqualTo("1 2\n3 4");
        }

        @Test
        @DisplayName("clean_lineDivs_becomeLines")
        void clean_lineDivs_becomeLines() {
            String raw = "<div class=\"test-example-line test-example-line-even\">3</div>"
                    + "<div class=\"test-example-line test-example-line-odd\">1 2 3</div>";

            assertThat(SampleTextCleaner.clean(raw)).isEqualTo("3\n1 2 3");
        }

        @Test
        @DisplayName("clean_entities_decoded")
        void clean_entities_decoded() {
            assertThat(SampleTextCleaner.clean("a &lt; b &amp;&amp; c &gt; d")).isEqualTo("a < b && c > d");
        }

        @Test
        @DisplayName("clean_crlfTrailingSpacesAndBlankRuns_normalized")
        void clean_crlfTrailingSpacesAndBlankRuns_normalized() {
            assertThat(SampleTextCleaner.clean("\r\n  5 \r\n\r\n\r\n1 2   \r\n")).isEqualTo("5\n1 2");
        }

        @Test
        @DisplayName("clean_nullOrEmpty_returnsEmpty")
        void clean_nullOrEmpty_returnsEmpty() {
            assertThat(SampleTextCleaner.clean(null)).isEmpty();
            assertThat(SampleTextCleaner.clean("")).isEmpty();
        }

        @Test
        @DisplayName("clean_unknownTags_stripped")
        void clean_unknownTags_stripped() {
            assertThat(SampleTextCleaner.clean("<span class=\"x\">7</span> <b>8</b>")).isEqualTo("7 8");
        }
    }

    @Nested
    @DisplayName("idempotence")
    class Idempotence {

        @ParameterizedTest
        @ValueSource(strings = {
                "1&nbsp;2<br/>3 4",
                "<div>3</div><div>1 2 3</div>",
                "  10\r\n\r\n20  ",
                "plain",
                "x&amp;y"
        })
        void clean_appliedTwice_sameResult(String raw) {
            String once = SampleTextCleaner.clean(raw);
            assertThat(SampleTextCleaner.clean(once)).isEqualTo(once);
        }
    }
}
