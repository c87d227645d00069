package com.engagewatch.slack.render;

import com.engagewatch.slack.engine.NonEngagerReport;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NonEngagerRendererTest {

    private final NonEngagerRenderer renderer = new NonEngagerRenderer();

    private static List<String> names(int count) {
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            names.add("Person " + i);
        }
        return names;
    }

    @Test
    void summarize_truncatesAtLimit() {
        String summary = renderer.summarize(names(25));
        String[] lines = summary.split("\n");

        assertEquals(21, lines.length);
        for (int i = 0; i < 20; i++) {
            assertEquals("• Person " + (i + 1), lines[i]);
        }
        assertEquals("…and 5 more", lines[20]);
    }

    @Test
    void summarize_exactlyAtLimit_noOverflowLine() {
        String summary = NonEngagerRenderer.summarize(names(3), 3);

        assertEquals("• Person 1\n• Person 2\n• Person 3", summary);
    }

    @Test
    void summarize_keepsGivenOrder() {
        assertEquals("• Zed\n• Amy", NonEngagerRenderer.summarize(List.of("Zed", "Amy"), 20));
    }

    @Test
    void summaryText_withNonEngagers() {
        NonEngagerReport report = new NonEngagerReport(Set.of("U1", "U2", "U3"), Set.of("U1"),
                List.of("U2", "U3"), List.of("Bo", "Cy"));

        assertEquals("*Members considered:* 3  ·  *Engaged:* 1  ·  *Non-engagers:* 2\n\n• Bo\n• Cy",
                renderer.summaryText(report));
    }

    @Test
    void summaryText_everyoneEngaged_celebrates() {
        NonEngagerReport report = new NonEngagerReport(Set.of("U1"), Set.of("U1"), List.of(), List.of());

        String text = renderer.summaryText(report);

        assertTrue(text.endsWith("🎉 Everyone engaged (reacted or replied)!"));
        assertFalse(text.contains("•"));
    }

    @Test
    void shortcutText_linksMessage() {
        NonEngagerReport report = new NonEngagerReport(Set.of("U1", "U2"), Set.of("U1"),
                List.of("U2"), List.of("Bo"));

        String text = renderer.shortcutText(report, "https://app.slack.com/client/T1/C1/thread/C1-1");

        assertTrue(text.startsWith("*Non-engagers for <https://app.slack.com/client/T1/C1/thread/C1-1|this message>*\n"));
        assertTrue(text.endsWith("• Bo"));
    }

    @Test
    void shortcutText_everyoneEngaged_onlyCelebration() {
        NonEngagerReport report = new NonEngagerReport(Set.of("U1"), Set.of("U1"), List.of(), List.of());

        assertEquals("🎉 Everyone engaged (reacted or replied)!", renderer.shortcutText(report, "link"));
    }

    @Test
    void toCsv_listsEveryone_untruncated() {
        List<String> ids = new ArrayList<>();
        for (int i = 10; i < 35; i++) {
            ids.add("U" + i);
        }
        NonEngagerReport report = new NonEngagerReport(Set.copyOf(ids), Set.of(), ids, names(25));

        String csv = new String(renderer.toCsv(report), StandardCharsets.UTF_8);
        String[] lines = csv.split("\n");

        assertEquals("user_id,name", lines[0]);
        assertEquals(26, lines.length);
        assertTrue(lines[1].equals("U10,Person 1") || lines[1].equals("U10,\"Person 1\""), lines[1]);
        assertTrue(lines[25].startsWith("U34,"));
    }

    @Test
    void toCsv_quotesNamesWithCommas() {
        NonEngagerReport report = new NonEngagerReport(Set.of("U1"), Set.of(),
                List.of("U1"), List.of("Lee, Anne"));

        String csv = new String(renderer.toCsv(report), StandardCharsets.UTF_8);

        assertTrue(csv.contains("U1,\"Lee, Anne\""));
    }

    @Test
    void constructor_rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new NonEngagerRenderer(0));
    }
}
