package tech.andrefsramos.cptools.adapters.outbound.judges;

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
import tech.andrefsramos.cptools.core.exception.ParsingException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Purpose

 * AtCoder contests (ABC/ARC/AGC and others under atcoder.jp/contests).

 * How it works

 * - Names from the task list /contests/{id}/tasks: each row links the task id in the first
 *   cell and shows the name in the second. The contest index is the upper-cased suffix after
 *   the last "_" of the task id (abc300_a -> A).
 * - Samples from the statement: h3 "Sample Input N" / "入力例 N" and "Sample Output N" /
 *   "出力例 N", each followed by a pre. The English section (span.lang-en) is preferred, the
 *   statement is bilingual. Inputs and outputs are paired by N; a missing output stays empty.
 */
@Component
public class AtCoderJudgeAdapter extends AbstractJudgeAdapter {
    private static final Logger log = LoggerFactory.getLogger(AtCoderJudgeAdapter.class);

    private static final String DOMAIN = "atcoder.jp";
    private static final String TASKS_URL = "https://atcoder.jp/contests/%s/tasks";

    private static final Pattern SAMPLE_INPUT = Pattern.compile("(?:Sample Input|入力例)\\s*(\\d+)");
    private static final Pattern SAMPLE_OUTPUT = Pattern.compile("(?:Sample Output|出力例)\\s*(\\d+)");
    private static final int SIBLING_HOPS = 3;

    public AtCoderJudgeAdapter(
            HttpFetch http,
            HttpSession session,
            @Value("${cptools.judges.atcoder.login-markers:Sign In - AtCoder}") List<String> loginMarkers
    ) {
        super(http, session, new LoginMarkers(loginMarkers));
    }

    @Override
    public String platformName() {
        return "AtCoder";
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
        if (contestId == null || contestId.isBlank() || problemId == null || problemId.isBlank()) {
            return Optional.empty();
        }

        final String taskId = problemId.contains("_")
                ? problemId
                : contestId + "_" + problemId.toLowerCase(Locale.ROOT);

        return fetchTasks(contestId)
                .map(tasks -> tasks.get(taskId));
    }

    @Override
    public Map<String, String> fetchContestProblems(String contestId) {
        if (contestId == null || contestId.isBlank()) return Map.of();

        Optional<Map<String, String>> tasks = fetchTasks(contestId);
        if (tasks.isEmpty()) return Map.of();

        Map<String, String> out = new LinkedHashMap<>();
        tasks.get().forEach((taskId, name) -> out.put(indexOf(taskId), name));
        log.info("[AtCoder] contest={} problems={}", contestId, out.size());
        return out;
    }

    @Override
    public Optional<List<SampleTest>> fetchSamples(String url) {
        return scrapeSamples(url, AtCoderJudgeAdapter::parseSamples);
    }

    private Optional<Map<String, String>> fetchTasks(String contestId) {
        final String url = String.format(TASKS_URL, contestId.trim());
        return fetchDocument(url, http.apiTimeoutMs()).map(AtCoderJudgeAdapter::parseTasks);
    }

    /** Task id to task name, in table order. */
    static Map<String, String> parseTasks(Document doc) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Element tr : doc.select("table tr")) {
            Elements tds = tr.select("> td");
            if (tds.size() < 2) continue;

            Element link = tds.get(0).selectFirst("a[href*=/tasks/]");
            Element nameLink = tds.get(1).selectFirst("a");
            if (link == null || nameLink == null) continue;

            String href = link.attr("href");
            String taskId = href.substring(href.lastIndexOf("/tasks/") + "/tasks/".length());
            String name = nameLink.text().trim();
            if (!taskId.isEmpty() && !name.isEmpty()) {
                out.put(taskId, name);
            }
        }
        return out;
    }

    static String indexOf(String taskId) {
        int us = taskId.lastIndexOf('_');
        return us >= 0 ? taskId.substring(us + 1).toUpperCase(Locale.ROOT) : taskId;
    }

    static List<SampleTest> parseSamples(Document doc) {
        Element root = doc.selectFirst("span.lang-en");
        if (root == null) {
            root = doc;
        }

        Map<Integer, String> inputs = new TreeMap<>();
        Map<Integer, String> outputs = new TreeMap<>();

        for (Element h3 : root.select("h3")) {
            String title = h3.text();
            Matcher in = SAMPLE_INPUT.matcher(title);
            Matcher out = SAMPLE_OUTPUT.matcher(title);

            Element pre = followingPre(h3);
            if (pre == null) continue;

            if (in.find()) {
                inputs.putIfAbsent(sampleNumber(in.group(1), title), SampleTextCleaner.clean(pre.html()));
            } else if (out.find()) {
                outputs.putIfAbsent(sampleNumber(out.group(1), title), SampleTextCleaner.clean(pre.html()));
            }
        }

        List<SampleTest> samples = new ArrayList<>(inputs.size());
        inputs.forEach((n, input) -> samples.add(new SampleTest(input, outputs.getOrDefault(n, ""))));
        return samples;
    }

    private static int sampleNumber(String digits, String header) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ParsingException("unexpected sample header: " + header, e);
        }
    }

    private static Element followingPre(Element h3) {
        Element e = h3.nextElementSibling();
        for (int hops = 0; e != null && hops < SIBLING_HOPS; hops++) {
            if ("pre".equals(e.normalName())) return e;
            if ("h3".equals(e.normalName())) return null;
            e = e.nextElementSibling();
        }
        return null;
    }
}
