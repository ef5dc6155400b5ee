package tech.andrefsramos.cptools.adapters.outbound.judges;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpSession;
import tech.andrefsramos.cptools.core.domain.SampleTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CsesJudgeAdapterTest {

    private static final String TASK_URL = "https://cses.fi/problemset/task/1068";

    private static final String TASK_PAGE = """
            <html><head><title>CSES - Weird Algorithm</title></head><body>
            <div class="md"><p>Consider an algorithm...</p>
            <p>Input:</p>
            <pre>3
            </pre>
            <p>Output:</p>
            <pre>3 10 5 16 8 4 2 1
            </pre></div></body></html>
            """;

    @Mock
    private HttpFetch http;

    @Mock
    private HttpSession session;

    private CsesJudgeAdapter judge;

    @BeforeEach
    void setUp() {
        judge = new CsesJudgeAdapter(http, session, List.of());
    }

    @Test
    void fetchProblemName_fromTitle() {
        when(http.fetchUrl(eq(TASK_URL), anyInt())).thenReturn(TASK_PAGE);

        assertThat(judge.fetchProblemName("problemset", "1068")).contains("Weird Algorithm");
    }

    @Test
    void fetchProblemName_unexpectedTitle_empty() {
        when(http.fetchUrl(eq(TASK_URL), anyInt())).thenReturn("<title>Login</title>");

        assertThat(judge.fetchProblemName("problemset", "1068")).isEmpty();
    }

    @Test
    void fetchSamples_labelledPreBlocks() {
        when(http.fetchUrl(eq(TASK_URL), anyInt())).thenReturn(TASK_PAGE);

        assertThat(judge.fetchSamples(TASK_URL)).hasValue(List.of(new SampleTest("3", "3 10 5 16 8 4 2 1")));
    }

    @Test
    void fetchContestProblems_alwaysEmpty() {
        assertThat(judge.fetchContestProblems("problemset")).isEmpty();
        verifyNoInteractions(http, session);
    }
}
