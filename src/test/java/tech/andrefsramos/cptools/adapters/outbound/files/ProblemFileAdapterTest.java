package tech.andrefsramos.cptools.adapters.outbound.files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.andrefsramos.cptools.core.domain.SampleTest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProblemFileAdapterTest {

    @TempDir
    Path dir;

    private final ProblemFileAdapter files = new ProblemFileAdapter();

    @Test
    void readLink_fromHeaderComment() throws Exception {
        Files.writeString(dir.resolve("A.cpp"), """
                /**
                 * Author: someone
                 * Problem: A - To My Critics
                 * Link: https://codeforces.com/contest/1850/problem/A
                 **/
                #include <bits/stdc++.h>
                """);

        assertThat(files.exists(dir, "A")).isTrue();
        assertThat(files.readLink(dir, "A")).contains("https://codeforces.com/contest/1850/problem/A");
    }

    @Test
    void readLink_beyondHeaderWindow_empty() throws Exception {
        String padding = "// " + "x".repeat(ProblemFileAdapter.HEADER_CHARS) + "\n";
        Files.writeString(dir.resolve("B.cpp"), padding + "// Link: https://codeforces.com/contest/1850/problem/B\n");

        assertThat(files.readLink(dir, "B")).isEmpty();
    }

    @Test
    void readLink_missingFile_empty() {
        assertThat(files.exists(dir, "Z")).isFalse();
        assertThat(files.readLink(dir, "Z")).isEmpty();
    }

    @Test
    void saveSamples_numberedFromOne_outOnlyWhenPresent() throws Exception {
        int saved = files.saveSamples(dir, "A", List.of(
                new SampleTest("1 2\n3 4", "3\n7"),
                new SampleTest("5", "")));

        assertThat(saved).isEqualTo(2);
        assertThat(Files.readString(dir.resolve("A_1.in"))).isEqualTo("1 2\n3 4\n");
        assertThat(Files.readString(dir.resolve("A_1.out"))).isEqualTo("3\n7\n");
        assertThat(Files.readString(dir.resolve("A_2.in"))).isEqualTo("5\n");
        assertThat(dir.resolve("A_2.out")).doesNotExist();
    }
}
