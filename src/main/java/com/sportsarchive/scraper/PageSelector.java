package com.sportsarchive.scraper;

import java.util.List;

/**
 * A named page element with one or more CSS selector alternatives.
 * Alternatives are combined into a single selector list when queried.
 */
public class PageSelector {
    public final String name;
    public final List<String> selectors;

    public PageSelector(String name, List<String> selectors) {
        this.name = name;
        this.selectors = selectors == null ? List.of() : List.copyOf(selectors);
    }

    public PageSelector(String name, String selector) {
        this(name, List.of(selector));
    }

    /**
     * @return all alternatives joined into one CSS selector list
     */
    public String css() {
        return String.join(", ", selectors);
    }

    @Override
    public String toString() {
        return name + "[" + css() + "]";
    }
}
