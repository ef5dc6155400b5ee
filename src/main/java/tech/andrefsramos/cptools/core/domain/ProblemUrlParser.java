package tech.andrefsramos.cptools.core.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Turns problem and contest URLs into the structured fields used to route a fetch
 * and to name the created files.
 *
 * Problem URLs: Codeforces problemset/contest/gym, AtCoder tasks, Yosupo Library Checker, CSES.
 * Contest URLs: Codeforces group/gym/contest, vJudge, AtCoder.
 * Group patterns are tried before the generic ones, gym before contest.
 */
public final class ProblemUrlParser {

    private static final Pattern CF_PROBLEMSET = Pattern.compile("codeforces\\.com/problemset/problem/(\\d+)/([A-Za-z]\\d*)");
    private static final Pattern CF_CONTEST_PROBLEM = Pattern.compile("codeforces\\.com/contest/(\\d+)/problem/([A-Za-z]\\d*)");
    private static final Pattern CF_GYM_PROBLEM = Pattern.compile("codeforces\\.com/gym/(\\d+)/problem/([A-Za-z]\\d*)");
    private static final Pattern ATCODER_TASK = Pattern.compile("atcoder\\.jp/contests/([^/]+)/tasks/([^/?#]+)");
    private static final Pattern YOSUPO_PROBLEM = Pattern.compile("judge\\.yosupo\\.jp/problem/([^/?#]+)");
    private static final Pattern CSES_TASK = Pattern.compile("cses\\.fi/problemset/task/(\\d+)");

    private static final Pattern PROBLEM_LETTER = Pattern.compile("(?:problem/|tasks/[^/]+_)([A-Za-z])");
    private static final Pattern CF_GROUP = Pattern.compile("codeforces\\.com/group/([^/]+)/contest/(\\d+)");
    private static final Pattern CF_GYM = Pattern.compile("codeforces\\.com/gym/(\\d+)");
    private static final Pattern CF_CONTEST = Pattern.compile("codeforces\\.com/contest/(\\d+)");
    private static final Pattern VJUDGE_CONTEST = Pattern.compile("vjudge\\.net/contest/(\\d+)");
    private static final Pattern ATCODER_CONTEST = Pattern.compile("atcoder\\.jp/contests/([^/?#]+)");

    private ProblemUrlParser() {}

    public static Optional<ProblemUrl> parseProblemUrl(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        final String url = raw.strip();

        Matcher m = CF_PROBLEMSET.matcher(url);
        if (m.find()) {
            return Optional.of(codeforces(m.group(1), m.group(2), m.group(1) + m.group(2), url));
        }
        m = CF_CONTEST_PROBLEM.matcher(url);
        if (m.find()) {
            return Optional.of(codeforces(m.group(1), m.group(2), m.group(1) + m.group(2), url));
        }
        m = CF_GYM_PROBLEM.matcher(url);
        if (m.find()) {
            return Optional.of(codeforces(m.group(1), m.group(2), "gym" + m.group(1) + m.group(2), url));
        }

        m = ATCODER_TASK.matcher(url);
        if (m.find()) {
            String taskId = m.group(2);
            int us = taskId.lastIndexOf('_');
            String letter = us >= 0 ? taskId.substring(us + 1).toUpperCase(Locale.ROOT) : taskId;
            return Optional.of(new ProblemUrl("AtCoder/Problemset", m.group(1), letter, taskId, url, "atcoder"));
        }

        m = YOSUPO_PROBLEM.matcher(url);
        if (m.find()) {
            String name = m.group(1);
            return Optional.of(new ProblemUrl("Yosupo", name, name, name, url, "yosupo"));
        }

        m = CSES_TASK.matcher(url);
        if (m.find()) {
            String id = m.group(1);
            return Optional.of(new ProblemUrl("CSES", "problemset", id, id, url, "cses"));
        }

        return Optional.empty();
    }

    public static Optional<ContestUrl> parseContestUrl(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        final String url = raw.strip();

        String defaultRange = null;
        Matcher pm = PROBLEM_LETTER.matcher(url);
        if (pm.find()) {
            defaultRange = "A~" + pm.group(1).toUpperCase(Locale.ROOT);
        }

        Matcher m = CF_GROUP.matcher(url);
        if (m.find()) {
            return Optional.of(new ContestUrl("Trainings",
                    "https://codeforces.com/group/{group_id}/contest/{id}/problem/{char}",
                    true, m.group(2), m.group(1), defaultRange));
        }
        m = CF_GYM.matcher(url);
        if (m.find()) {
            return Optional.of(new ContestUrl("Codeforces/Gym",
                    "https://codeforces.com/gym/{id}/problem/{char}",
                    false, m.group(1), null, defaultRange));
        }
        m = CF_CONTEST.matcher(url);
        if (m.find()) {
            return Optional.of(new ContestUrl("Codeforces",
                    "https://codeforces.com/contest/{id}/problem/{char}",
                    false, m.group(1), null, defaultRange));
        }
        m = VJUDGE_CONTEST.matcher(url);
        if (m.find()) {
            return Optional.of(new ContestUrl("vJudge",
                    "https://vjudge.net/contest/{id}#problem/{char}",
                    false, m.group(1), null, defaultRange));
        }
        m = ATCODER_CONTEST.matcher(url);
        if (m.find()) {
            return Optional.of(new ContestUrl("AtCoder",
                    "https://atcoder.jp/contests/{id}/tasks/{id}_{char}",
                    false, m.group(1), null, defaultRange));
        }
        return Optional.empty();
    }

    private static ProblemUrl codeforces(String contestId, String letter, String filename, String url) {
        return new ProblemUrl("Codeforces/Problemset", contestId, letter, filename, url, "codeforces");
    }
}
