package com.engagewatch.slack.link;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PermalinksTest {

    @Test
    void parse_plainPermalink() {
        Optional<MessageRef> ref = Permalinks.parse("https://x.test/archives/C123/p1700000000123456");

        assertTrue(ref.isPresent());
        assertEquals("C123", ref.get().channel());
        assertEquals("1700000000.123456", ref.get().ts());
    }

    @Test
    void parse_linkInsideText_withThreadQuery() {
        Optional<MessageRef> ref = Permalinks.parse(
                "check <https://acme.slack.com/archives/C0ABCDEF1/p1712345678000200?thread_ts=1712345678.000200&cid=C0ABCDEF1>");

        assertEquals(new MessageRef("C0ABCDEF1", "1712345678.000200"), ref.orElseThrow());
    }

    @Test
    void parse_httpScheme() {
        assertTrue(Permalinks.parse("http://x.test/archives/G01/p1700000000123456").isPresent());
    }

    @Test
    void parse_tooFewDigits_rejected() {
        assertTrue(Permalinks.parse("https://x.test/archives/C123/p170000000012345").isEmpty());
    }

    @Test
    void parse_lowercaseChannel_rejected() {
        assertTrue(Permalinks.parse("https://x.test/archives/c123/p1700000000123456").isEmpty());
    }

    @Test
    void parse_blankOrNull() {
        assertTrue(Permalinks.parse(null).isEmpty());
        assertTrue(Permalinks.parse("   ").isEmpty());
        assertTrue(Permalinks.parse("not a link").isEmpty());
    }

    @Test
    void tsFromPermalinkDigits_longerSeconds() {
        assertEquals("17000000001.123456", Permalinks.tsFromPermalinkDigits("17000000001123456"));
    }

    @Test
    void threadLink_stripsDot() {
        assertEquals("https://app.slack.com/client/T1/C123/thread/C123-1700000000123456",
                Permalinks.threadLink("T1", new MessageRef("C123", "1700000000.123456")));
    }
}
