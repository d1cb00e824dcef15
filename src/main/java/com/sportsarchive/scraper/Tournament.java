package com.sportsarchive.scraper;

/**
 * Catalog entry for a single competition landing page.
 */
public record Tournament(String name, String url) {}
