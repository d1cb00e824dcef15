package com.sportsarchive.scraper;

import java.util.List;

/**
 * Central registry of the sports archive page elements used by discovery, navigation and extraction.
 * When the site markup changes, only this class needs updating.
 */
public final class PageSelectors {
    private PageSelectors() {}

    // Season pages
    public static final PageSelector SELECT = new PageSelector("select", "select");
    public static final PageSelector SCORE = new PageSelector("score", ".gsa-c-match-c3");
    public static final PageSelector PAGE_BODY = new PageSelector("body", "body");

    // Gameweek navigation
    public static final PageSelector WEEK_LABEL = new PageSelector("weekLabel", "#week_sel");
    public static final PageSelector WEEK_BUTTONS = new PageSelector("weekButtons", "#weeks .week_num");
    public static final PageSelector WEEK_DROPDOWN = new PageSelector("weekDropdown", "#week_select");
    public static final PageSelector WEEK_PREV = new PageSelector("weekPrev", "#week_prev");
    public static final PageSelector WEEK_NEXT = new PageSelector("weekNext", "#week_next");
    public static final PageSelector MAX_WEEK = new PageSelector("maxWeek", "#maxweek");

    // Gameweek matches
    public static final PageSelector WEEK_CONTAINER = new PageSelector("weekContainer", "#week_container");
    public static final PageSelector WEEK_MATCH_ROWS = new PageSelector("weekMatchRows", "#week_container .gsa-c-match-row");
    public static final PageSelector MATCH_ROW = new PageSelector("matchRow", ".gsa-c-match-row");
    public static final PageSelector TEAM_NAME = new PageSelector("teamName", ".gsa-c-team_full");
    public static final PageSelector MATCH_TIME = new PageSelector("time", ".gsa-c-match-c1");
    public static final PageSelector HOME_TEAM = new PageSelector("homeTeam", ".gsa-c-match-c2 .gsa-c-team_full");
    public static final PageSelector AWAY_TEAM = new PageSelector("awayTeam", ".gsa-c-match-c4 .gsa-c-team_full");

    // League standings
    public static final PageSelector STANDING_ROW = new PageSelector("standingRow", ".player_row");
    public static final PageSelector STANDING_TEAM = new PageSelector("team", ".col_name .fullname");
    public static final PageSelector STANDINGS_HEADER = new PageSelector("standingsHeader", ".gsa_subheader_2");

    /**
     * Columns of a standings row, in {@link StandingRow} order.
     */
    public static final List<PageSelector> STANDING_COLUMNS = List.of(
        new PageSelector("rank", ".col_shirt"),
        STANDING_TEAM,
        new PageSelector("matchPlayed", ".col_p1"),
        new PageSelector("won", ".col_p2"),
        new PageSelector("draw", ".col_p3"),
        new PageSelector("lost", ".col_p4"),
        new PageSelector("goalsScored", ".col_p5"),
        new PageSelector("goalsAllowed", ".col_p6"),
        new PageSelector("goalDifference", ".col_p7"),
        new PageSelector("points", ".col_p8")
    );

    /**
     * @param week Gameweek index
     * @return selector of the discrete control for that index
     */
    public static PageSelector weekButton(int week) {
        return new PageSelector("weekButton", ".week_num.week_" + week);
    }
}
