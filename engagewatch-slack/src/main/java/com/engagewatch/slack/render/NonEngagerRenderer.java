package com.engagewatch.slack.render;

import com.engagewatch.slack.engine.NonEngagerReport;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link NonEngagerReport} into Slack mrkdwn text and a CSV export.
 * The text is capped; the CSV always lists every non-engager.
 */
public class NonEngagerRenderer {

    public static final int DEFAULT_SUMMARY_LIMIT = 20;
    public static final String CSV_FILENAME = "non_engagers.csv";
    public static final String CSV_TITLE = "Non-engagers";

    static final String EVERYONE_ENGAGED = "🎉 Everyone engaged (reacted or replied)!";

    @JsonPropertyOrder({ "user_id", "name" })
    record CsvRow(@JsonProperty("user_id") String userId, @JsonProperty("name") String name) {
    }

    private final int summaryLimit;
    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema csvSchema = csvMapper.schemaFor(CsvRow.class).withHeader();

    public NonEngagerRenderer() {
        this(DEFAULT_SUMMARY_LIMIT);
    }

    public NonEngagerRenderer(int summaryLimit) {
        if (summaryLimit <= 0) {
            throw new IllegalArgumentException("summaryLimit must be positive: " + summaryLimit);
        }
        this.summaryLimit = summaryLimit;
    }

    /**
     * Bulleted list of at most {@code limit} names, followed by
     * "…and N more" when names were cut.
     */
    public static String summarize(List<String> names, int limit) {
        List<String> shown = names.subList(0, Math.min(limit, names.size()));
        int extra = names.size() - shown.size();
        List<String> lines = new ArrayList<>(shown.size() + 1);
        for (String name : shown) {
            lines.add("• " + name);
        }
        if (extra > 0) {
            lines.add("…and " + extra + " more");
        }
        return String.join("\n", lines);
    }

    public String summarize(List<String> names) {
        return summarize(names, summaryLimit);
    }

    public String countsLine(NonEngagerReport report) {
        return "*Members considered:* " + report.populationIds().size()
                + "  ·  *Engaged:* " + report.engagedIds().size()
                + "  ·  *Non-engagers:* " + report.nonEngagedIds().size();
    }

    /**
     * Counts plus the capped list, or the celebration line when nobody is
     * missing.
     */
    public String summaryText(NonEngagerReport report) {
        if (report.everyoneEngaged()) {
            return countsLine(report) + "\n\n" + EVERYONE_ENGAGED;
        }
        return countsLine(report) + "\n\n" + summarize(report.nonEngagedNames());
    }

    /**
     * DM text for the message shortcut, linking back to the thread.
     */
    public String shortcutText(NonEngagerReport report, String threadLink) {
        if (report.everyoneEngaged()) {
            return EVERYONE_ENGAGED;
        }
        return "*Non-engagers for <" + threadLink + "|this message>*\n"
                + countsLine(report) + "\n\n"
                + summarize(report.nonEngagedNames());
    }

    /**
     * UTF-8 CSV with header {@code user_id,name}, one row per non-engager in
     * id order.
     */
    public byte[] toCsv(NonEngagerReport report) {
        List<CsvRow> rows = new ArrayList<>(report.nonEngagedIds().size());
        for (int i = 0; i < report.nonEngagedIds().size(); i++) {
            rows.add(new CsvRow(report.nonEngagedIds().get(i), report.nonEngagedNames().get(i)));
        }
        try {
            return csvMapper.writer(csvSchema).writeValueAsBytes(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("CSV export failed", e);
        }
    }
}
