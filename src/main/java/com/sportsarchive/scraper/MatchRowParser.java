package com.sportsarchive.scraper;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the raw entries returned by {@link PageScripts#MATCH_ROWS} into {@link Match} records.
 * <p>
 * Entries arrive in document order: a {@code date} entry sets the date of every following {@code match} entry until
 * the next heading. Date headings are normalised to {@code YYYY-MM-DD} when a recognisable date is found in them.
 */
public final class MatchRowParser {
    private MatchRowParser() {}

    private static final Pattern ISO = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern NUMERIC_DMY = Pattern.compile("(\\d{1,2})[./](\\d{1,2})[./](\\d{4})");
    private static final Pattern TEXT_DMY = Pattern.compile("(\\d{1,2})\\s+([A-Za-z]+)\\s+(\\d{4})");
    private static final DateTimeFormatter LONG_MONTH = DateTimeFormatter.ofPattern("d MMMM uuuu", Locale.ENGLISH);
    private static final DateTimeFormatter SHORT_MONTH = DateTimeFormatter.ofPattern("d MMM uuuu", Locale.ENGLISH);

    /**
     * @param entries Raw entries in document order
     * @param baseUrl Site base URL used to resolve relative stats links
     * @return Extracted matches, or the structural error of the first incomplete row
     */
    public static RowExtraction parse(List<Map<String, Object>> entries, String baseUrl) {
        List<Match> matches = new ArrayList<>();
        String currentDate = "";
        for (Map<String, Object> entry : entries) {
            String kind = PageScripts.asString(entry.get("kind"));
            if ("date".equals(kind)) {
                currentDate = normalizeDate(PageScripts.asString(entry.get("text")));
                continue;
            }
            if (!"match".equals(kind)) continue;

            String href = PageScripts.asString(entry.get("href"));
            String homeTeam = PageScripts.asString(entry.get("homeTeam"));
            String awayTeam = PageScripts.asString(entry.get("awayTeam"));
            if (homeTeam.isEmpty() || awayTeam.isEmpty() || href.isEmpty()) {
                return RowExtraction.failed("Missing data in gameweek: homeTeam=" + homeTeam
                    + ", awayTeam=" + awayTeam + ", statsUrl=" + href);
            }
            String time = PageScripts.asString(entry.get("time"));
            String score = PageScripts.asString(entry.get("score"));
            if (score.isEmpty()) score = ":";
            matches.add(new Match(
                currentDate,
                time.isEmpty() ? "TBD" : time,
                homeTeam,
                awayTeam,
                score,
                Utils.absoluteUrl(baseUrl, href),
                score.contains("AWD") ? Boolean.TRUE : null
            ));
        }
        return RowExtraction.success(matches);
    }

    /**
     * Extracts a calendar date from a heading such as {@code "Saturday, 12 August 2023"} or {@code "12.08.2023"}.
     * @param heading Raw heading text
     * @return ISO date, or the trimmed heading when no date could be recognised
     */
    static String normalizeDate(String heading) {
        if (heading == null) return "";
        String text = heading.trim();
        Matcher iso = ISO.matcher(text);
        if (iso.find()) {
            return toIso(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)),
                Integer.parseInt(iso.group(3)), text);
        }
        Matcher numeric = NUMERIC_DMY.matcher(text);
        if (numeric.find()) {
            return toIso(Integer.parseInt(numeric.group(3)), Integer.parseInt(numeric.group(2)),
                Integer.parseInt(numeric.group(1)), text);
        }
        Matcher named = TEXT_DMY.matcher(text);
        if (named.find()) {
            String candidate = named.group(1) + " " + named.group(2) + " " + named.group(3);
            for (DateTimeFormatter formatter : List.of(LONG_MONTH, SHORT_MONTH)) {
                try {
                    return LocalDate.parse(candidate, formatter).toString();
                } catch (DateTimeParseException ignored) {
                    // next format
                }
            }
        }
        return text;
    }

    private static String toIso(int year, int month, int day, String fallback) {
        try {
            return LocalDate.of(year, month, day).toString();
        } catch (DateTimeException e) {
            return fallback;
        }
    }
}
