package com.sportsarchive.scraper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-page scripts evaluated through {@link BrowserSessionInterface#evaluate(String, Object)}.
 * <p>
 * Each script is a single-argument function. Selectors are always passed in as the argument (see
 * {@link PageSelectors}), so scripts carry no markup knowledge of their own. Scripts only read the DOM and return
 * plain values; validation and parsing happen on the Java side.
 * <p>
 * The static helpers at the bottom coerce the loosely typed evaluation results into Java values.
 */
public final class PageScripts {
    private PageScripts() {}

    /** arg: selector. Returns true when at least one element matches. */
    public static final String EXISTS =
        "(sel) => !!document.querySelector(sel)";

    /** arg: selector. Returns the trimmed text of the first match, or null. */
    public static final String TEXT_OF =
        "(sel) => { const el = document.querySelector(sel); return el ? el.textContent.trim() : null; }";

    /** arg: selector. Returns the value attribute of the first match, or null. */
    public static final String VALUE_OF =
        "(sel) => { const el = document.querySelector(sel); return el ? String(el.value) : null; }";

    /** arg: selector. Clicks the first match from within the page. Returns false when nothing matched. */
    public static final String CLICK_IF_PRESENT =
        "(sel) => { const el = document.querySelector(sel); if (!el) return false; el.click(); return true; }";

    /** arg: score selector. True when any score cell holds something other than the unplayed marker. */
    public static final String HAS_RESULTS =
        "(sel) => Array.from(document.querySelectorAll(sel)).some(el => el.textContent.trim() !== ':')";

    private static final String FIND_SEASON_SELECT =
        "const seasonSelect = Array.from(document.querySelectorAll(sel))" +
        ".filter(s => Array.from(s.options).some(o => /20\\d{2}\\/20\\d{2}/.test(o.textContent))).pop();";

    /** arg: select selector. Option count of the season selector, or -1 when there is none. */
    public static final String SEASON_OPTION_COUNT =
        "(sel) => { " + FIND_SEASON_SELECT + " return seasonSelect ? seasonSelect.options.length : -1; }";

    /** arg: select selector. Season options as {season, url}, skipping options without a value. */
    public static final String SEASON_OPTIONS =
        "(sel) => { " + FIND_SEASON_SELECT +
        " if (!seasonSelect) return [];" +
        " return Array.from(seasonSelect.options)" +
        ".map(o => ({ season: o.textContent.trim(), url: o.value }))" +
        ".filter(o => o.url); }";

    /** arg: {rows, required}. Row count and whether every row holds the required child element. */
    public static final String ROW_STATE =
        "(a) => { const rows = Array.from(document.querySelectorAll(a.rows));" +
        " return { count: rows.length, complete: rows.every(r => !!r.querySelector(a.required)) }; }";

    /** arg: {row, columns: {name: selector}}. One map of column name to cell text per row. */
    public static final String STANDING_ROWS =
        "(a) => Array.from(document.querySelectorAll(a.row)).map(row => {" +
        " const out = {};" +
        " for (const [name, sel] of Object.entries(a.columns)) {" +
        "   const cell = row.querySelector(sel); out[name] = cell ? cell.textContent.trim() : ''; }" +
        " return out; })";

    /**
     * arg: {container, row, time, home, score, away}. Walks the gameweek container in document order and returns
     * {kind: 'date', text} for bold date headings and {kind: 'match', href, time, homeTeam, awayTeam, score} for
     * every anchor wrapping a match row.
     */
    public static final String MATCH_ROWS =
        "(a) => { const container = document.querySelector(a.container);" +
        " if (!container) return [];" +
        " const out = [];" +
        " for (const el of Array.from(container.children)) {" +
        "   if ((el.getAttribute('style') || '').replace(/\\s/g, '').includes('font-weight:bold')) {" +
        "     out.push({ kind: 'date', text: el.textContent.trim() }); continue; }" +
        "   const row = el.tagName === 'A' ? el.querySelector(a.row) : null;" +
        "   if (!row) continue;" +
        "   const text = (q) => { const n = row.querySelector(q); return n ? n.textContent.trim() : ''; };" +
        "   out.push({ kind: 'match', href: el.getAttribute('href') || '', time: text(a.time)," +
        "     homeTeam: text(a.home), awayTeam: text(a.away), score: text(a.score) });" +
        " }" +
        " return out; }";

    /** arg: {label, week}. True once the gameweek label shows the given index. */
    public static final String WEEK_LABEL_IS =
        "(a) => { const el = document.querySelector(a.label); if (!el) return false;" +
        " const m = el.textContent.match(/\\d+/); return !!m && parseInt(m[0], 10) === a.week; }";

    /** arg: {label, from}. True once the gameweek label shows an index other than {@code from}. */
    public static final String WEEK_LABEL_CHANGED =
        "(a) => { const el = document.querySelector(a.label); if (!el) return false;" +
        " const m = el.textContent.match(/\\d+/); return !!m && parseInt(m[0], 10) !== a.from; }";

    /**
     * arg: {selector, parent, limit}. innerHTML of the first match (or of its parent when {@code parent} is true),
     * truncated to {@code limit} characters; null when nothing matched.
     */
    public static final String HTML_SNAPSHOT =
        "(a) => { let el = document.querySelector(a.selector);" +
        " if (el && a.parent) el = el.parentElement;" +
        " if (!el) return null;" +
        " const html = el.innerHTML; return a.limit > 0 ? html.slice(0, a.limit) : html; }";

    // --- result coercion ---

    public static boolean asBoolean(Object value) {
        return value instanceof Boolean b ? b : false;
    }

    public static int asInt(Object value, int defaultVal) {
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException ignored) {
                return defaultVal;
            }
        }
        return defaultVal;
    }

    public static String asString(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    /**
     * Coerces an evaluated array of objects into a list of string-keyed maps, skipping anything else.
     */
    public static List<Map<String, Object>> asMapList(Object value) {
        if (!(value instanceof List<?> list)) return Collections.emptyList();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> entry = new LinkedHashMap<>();
                map.forEach((k, v) -> entry.put(String.valueOf(k), v));
                out.add(entry);
            }
        }
        return out;
    }

    public static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) return Collections.emptyMap();
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
