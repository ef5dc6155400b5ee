package tech.andrefsramos.cptools.core.domain;

import org.jsoup.parser.Parser;

import java.util.regex.Pattern;

/*
 * Normalizes the raw markup captured from a sample block into plain text:
 *  - <br> and </div> become line breaks (Codeforces wraps each line in a div);
 *  - remaining tags are dropped;
 *  - HTML entities are decoded, &nbsp; becomes a plain space;
 *  - trailing spaces per line and blank-line runs are removed, then the text is trimmed.
 *
 * Applying it to its own output is a no-op as long as the decoded text has no markup.
 */
public final class SampleTextCleaner {

    private static final Pattern BR = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIV_CLOSE = Pattern.compile("</div\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("</?[A-Za-z][^>]*>");
    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);
    private static final Pattern BLANK_RUNS = Pattern.compile("\\n{2,}");

    private SampleTextCleaner() {}

    public static String clean(String raw) {
        if (raw == null || raw.isEmpty()) return "";

        String t = BR.matcher(raw).replaceAll("\n");
        t = DIV_CLOSE.matcher(t).replaceAll("\n");
        t = TAG.matcher(t).replaceAll("");
        t = Parser.unescapeEntities(t, false);
        t = t.replace('\u00A0', ' ');
        t = t.replace("\r\n", "\n").replace('\r', '\n');
        t = TRAILING_SPACES.matcher(t).replaceAll("");
        t = BLANK_RUNS.matcher(t).replaceAll("\n");
        return t.strip();
    }
}
