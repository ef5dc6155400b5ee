package tech.andrefsramos.cptools.adapters.outbound.judges;

import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpSession;
import tech.andrefsramos.cptools.core.domain.LoginMarkers;
import tech.andrefsramos.cptools.core.domain.SampleTest;
import tech.andrefsramos.cptools.core.domain.SampleTextCleaner;
import tech.andrefsramos.cptools.core.exception.NetworkException;
import tech.andrefsramos.cptools.core.exception.ParsingException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/*
 * Purpose

 * Codeforces, including Gym and group (training) contests.

 * How it works

 * - Metadata from the public API: api/contest.standings?contestId=N&from=1&count=1
 *   ("status" must be "OK"; problems under result.problems[].index/name).
 * - Samples scraped from the problem page: div.sample-test, pairing "div.input pre" with
 *   "div.output pre" in page order. Newer statements wrap each input line in
 *   div.test-example-line, which the cleaner turns into line breaks.
 * - /group/ pages are private: they go through the authenticated session, and the login
 *   page markers (configurable) trigger the single cookie refresh.
 */
@Component
public class CodeforcesJudgeAdapter extends AbstractJudgeAdapter {
    private static final Logger log = LoggerFactory.getLogger(CodeforcesJudgeAdapter.class);

    private static final String DOMAIN = "codeforces.com";
    private static final String API_STANDINGS = "https://codeforces.com/api/contest.standings?contestId=%s&from=1&count=1";

    public CodeforcesJudgeAdapter(
            HttpFetch http,
            HttpSession session,
            @Value("${cptools.judges.codeforces.login-markers:id=\"enterForm\"}") List<String> loginMarkers
    ) {
        super(http, session, new LoginMarkers(loginMarkers));
    }

    @Override
    public String platformName() {
        return "Codeforces";
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
    public boolean isPrivateUrl(String url) {
        return pathOf(url).startsWith("/group/");
    }

    @Override
    public Optional<String> fetchProblemName(String contestId, String problemId) {
        if (problemId == null || problemId.isBlank()) return Optional.empty();

        Map<String, String> problems = fetchContestProblems(contestId);
        String name = problems.get(problemId);
        if (name == null) {
            name = problems.get(problemId.toUpperCase(Locale.ROOT));
        }
        if (name == null) {
            log.debug("[Codeforces] problem {} not in contest {} (problems={})", problemId, contestId, problems.keySet());
        }
        return Optional.ofNullable(name);
    }

    @Override
    public Map<String, String> fetchContestProblems(String contestId) {
        if (contestId == null || contestId.isBlank()) return Map.of();

        final long t0 = System.nanoTime();
        final String api = String.format(API_STANDINGS, URLEncoder.encode(contestId.trim(), StandardCharsets.UTF_8));
        try {
            JsonNode root = http.fetchJson(api, http.apiTimeoutMs());
            Map<String, String> out = parseStandings(root);
            log.info("[Codeforces] contest={} problems={} ({} ms)", contestId, out.size(), (System.nanoTime() - t0) / 1_000_000);
            return out;
        } catch (NetworkException | ParsingException e) {
            log.warn("[Codeforces] standings unavailable contest={}: {}", contestId, e.getMessage());
            return Map.of();
        }
    }

    @Override
    public Optional<List<SampleTest>> fetchSamples(String url) {
        return scrapeSamples(url, CodeforcesJudgeAdapter::parseSamples);
    }

    static Map<String, String> parseStandings(JsonNode root) {
        if (root == null || !"OK".equals(root.path("status").asText())) {
            String comment = root == null ? "" : root.path("comment").asText("");
            throw new ParsingException("Codeforces API status is not OK" + (comment.isEmpty() ? "" : ": " + comment));
        }

        JsonNode problems = root.path("result").path("problems");
        if (!problems.isArray()) {
            throw new ParsingException("Codeforces API response has no result.problems array");
        }

        Map<String, String> out = new LinkedHashMap<>();
        for (JsonNode p : problems) {
            String index = p.path("index").asText("");
            String name = p.path("name").asText("");
            if (!index.isEmpty() && !name.isEmpty()) {
                out.put(index, name);
            }
        }
        return out;
    }

    static List<SampleTest> parseSamples(Document doc) {
        Elements sections = doc.select("div.sample-test");
        if (sections.isEmpty()) {
            return List.of();
        }

        Elements inputs = sections.select("div.input pre");
        Elements outputs = sections.select("div.output pre");
        if (inputs.isEmpty() && outputs.isEmpty()) {
            throw new ParsingException("div.sample-test without input/output pre blocks");
        }
        if (inputs.size() != outputs.size()) {
            log.warn("[Codeforces] unbalanced samples inputs={} outputs={}; pairing the first {}",
                    inputs.size(), outputs.size(), Math.min(inputs.size(), outputs.size()));
        }

        int n = Math.min(inputs.size(), outputs.size());
        List<SampleTest> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Element in = inputs.get(i);
            Element ou = outputs.get(i);
            out.add(new SampleTest(SampleTextCleaner.clean(in.html()), SampleTextCleaner.clean(ou.html())));
        }
        return out;
    }
}
