package tech.andrefsramos.cptools.adapters.outbound.judges;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpSession;
import tech.andrefsramos.cptools.core.domain.LoginMarkers;
import tech.andrefsramos.cptools.core.domain.SampleTest;
import tech.andrefsramos.cptools.core.domain.SampleTextCleaner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/*
 * CSES Problem Set. No contests; the name comes from "<title>CSES - Name</title>" and the
 * samples from the pre blocks introduced by "Input:" / "Output:" paragraphs.
 */
@Component
public class CsesJudgeAdapter extends AbstractJudgeAdapter {

    private static final String DOMAIN = "cses.fi";
    private static final String TASK_URL = "https://cses.fi/problemset/task/%s";
    private static final String TITLE_PREFIX = "CSES - ";

    public CsesJudgeAdapter(
            HttpFetch http,
            HttpSession session,
            @Value("${cptools.judges.cses.login-markers:}") List<String> loginMarkers
    ) {
        super(http, session, new LoginMarkers(loginMarkers));
    }

    @Override
    public String platformName() {
        return "CSES";
    }

    @Override
    public String cookieDomain() {
        return DOMAIN;
    }

    @Override
    public boolean detect(String url) {
        return hostMatches(url, DOMAIN);
    }

    @Override
    public Optional<String> fetchProblemName(String contestId, String problemId) {
        if (problemId == null || problemId.isBlank()) return Optional.empty();

        return fetchDocument(String.format(TASK_URL, problemId.trim()), http.apiTimeoutMs())
                .flatMap(CsesJudgeAdapter::parseName);
    }

    @Override
    public Map<String, String> fetchContestProblems(String contestId) {
        return Map.of();
    }

    @Override
    public Optional<List<SampleTest>> fetchSamples(String url) {
        return scrapeSamples(url, CsesJudgeAdapter::parseSamples);
    }

    static Optional<String> parseName(Document doc) {
        String title = doc.title();
        if (title == null || !title.startsWith(TITLE_PREFIX)) return Optional.empty();
        String name = title.substring(TITLE_PREFIX.length()).trim();
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }

    static List<SampleTest> parseSamples(Document doc) {
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();

        for (Element pre : doc.select("pre")) {
            Element label = pre.previousElementSibling();
            if (label == null) continue;

            String text = label.text().trim();
            if ("Input:".equals(text)) {
                inputs.add(SampleTextCleaner.clean(pre.html()));
            } else if ("Output:".equals(text)) {
                outputs.add(SampleTextCleaner.clean(pre.html()));
            }
        }

        int n = Math.min(inputs.size(), outputs.size());
        List<SampleTest> samples = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            samples.add(new SampleTest(inputs.get(i), outputs.get(i)));
        }
        return samples;
    }
}
