package tech.andrefsramos.cptools.core.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Expands the problem argument of the CLI.
 * {@code "A~E"} yields A..E (single letters only, upper-cased); anything else is split
 * on commas and whitespace with its case preserved.
 */
public final class ProblemRange {

    private ProblemRange() {}

    public static List<String> parse(String input) {
        if (input == null || input.isBlank()) return List.of();

        if (input.contains("~")) {
            String[] parts = input.split("~", -1);
            if (parts.length == 2 && parts[0].strip().length() == 1 && parts[1].strip().length() == 1) {
                char start = parts[0].strip().toUpperCase(Locale.ROOT).charAt(0);
                char end = parts[1].strip().toUpperCase(Locale.ROOT).charAt(0);
                List<String> out = new ArrayList<>();
                for (char c = start; c <= end; c++) {
                    out.add(String.valueOf(c));
                }
                return out;
            }
        }

        return Arrays.stream(input.replace(',', ' ').trim().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
