package tech.andrefsramos.cptools.core.domain;

import java.util.Locale;

/**
 * Parsed contest URL. {@code baseUrl} is a template with the placeholders
 * {@code {id}}, {@code {group_id}} and {@code {char}}.
 */
public record ContestUrl(
        String platform,
        String baseUrl,
        boolean training,
        String contestId,
        String groupId,
        String defaultRange
) {

    public String problemLink(String index) {
        String idx = index == null ? "" : index;
        String ch = "AtCoder".equals(platform) ? idx.toLowerCase(Locale.ROOT) : idx;
        return baseUrl
                .replace("{group_id}", groupId == null ? "" : groupId)
                .replace("{id}", contestId)
                .replace("{char}", ch);
    }
}
