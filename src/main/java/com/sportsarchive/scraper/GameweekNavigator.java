package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves a season page to an arbitrary gameweek index.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #detect(BrowserSessionInterface, RetryOrchestrator, int)} inspects the page once per season and binds
 *   one strategy: index buttons, a dropdown, or sequential previous/next stepping, in that priority.</li>
 *   <li>{@link #navigateTo(int)} performs the move, then waits for the gameweek label to show the target index.
 *   The whole transition runs through the {@link RetryOrchestrator}.</li>
 *   <li>State goes {@code UNKNOWN -> NAVIGATING -> CONFIRMED | FAILED} for every transition.</li>
 * </ul>
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class GameweekNavigator {
    private static final Logger logger = LoggerFactory.getLogger(GameweekNavigator.class);
    private static final Pattern INDEX = Pattern.compile("\\d{1,9}");

    public enum NavigationState { UNKNOWN, NAVIGATING, CONFIRMED, FAILED }

    private interface NavigationStrategy {
        String name();

        void moveTo(BrowserSessionInterface session, int week, int timeoutMs);
    }

    private static final class IndexButtonStrategy implements NavigationStrategy {
        @Override
        public String name() {
            return "index-buttons";
        }

        @Override
        public void moveTo(BrowserSessionInterface session, int week, int timeoutMs) {
            String selector = PageSelectors.weekButton(week).css();
            if (!PageScripts.asBoolean(session.evaluate(PageScripts.CLICK_IF_PRESENT, selector))) {
                throw new StructuralExtractionException("No gameweek control for index " + week);
            }
        }
    }

    private static final class DropdownStrategy implements NavigationStrategy {
        @Override
        public String name() {
            return "dropdown";
        }

        @Override
        public void moveTo(BrowserSessionInterface session, int week, int timeoutMs) {
            session.selectOption(PageSelectors.WEEK_DROPDOWN.css(), String.valueOf(week));
        }
    }

    private static final class SequentialStrategy implements NavigationStrategy {
        private final int maxSteps;

        SequentialStrategy(int maxSteps) {
            this.maxSteps = maxSteps;
        }

        @Override
        public String name() {
            return "sequential";
        }

        @Override
        public void moveTo(BrowserSessionInterface session, int week, int timeoutMs) {
            int current = currentIndex(session);
            int steps = 0;
            while (current != week) {
                if (steps++ >= maxSteps) {
                    throw new StructuralExtractionException("Gameweek " + week + " not reached after " + maxSteps
                        + " steps (at " + current + ")");
                }
                PageSelector control = current < week ? PageSelectors.WEEK_NEXT : PageSelectors.WEEK_PREV;
                session.click(control.css());
                session.waitForFunction(PageScripts.WEEK_LABEL_CHANGED,
                    Map.of("label", PageSelectors.WEEK_LABEL.css(), "from", current), timeoutMs);
                current = currentIndex(session);
            }
        }
    }

    private final BrowserSessionInterface session;
    private final RetryOrchestrator retry;
    private final int timeoutMs;
    private final NavigationStrategy strategy;
    private NavigationState state = NavigationState.UNKNOWN;
    private int target;

    private GameweekNavigator(BrowserSessionInterface session, RetryOrchestrator retry, int timeoutMs,
                              NavigationStrategy strategy) {
        this.session = session;
        this.retry = retry;
        this.timeoutMs = timeoutMs;
        this.strategy = strategy;
    }

    /**
     * Detects the navigation affordance of the loaded season page and binds the matching strategy.
     * @param session Session on a loaded season page
     * @param retry Retry wrapper for detection and transitions
     * @param timeoutMs Timeout of each label wait
     * @return Navigator bound to one strategy for the rest of the season
     */
    public static GameweekNavigator detect(BrowserSessionInterface session, RetryOrchestrator retry, int timeoutMs)
            throws Exception {
        NavigationStrategy strategy = retry.execute(() -> {
            if (exists(session, PageSelectors.WEEK_BUTTONS)) return new IndexButtonStrategy();
            if (exists(session, PageSelectors.WEEK_DROPDOWN)) return new DropdownStrategy();
            return new SequentialStrategy(maxWeek(session) + 1);
        }, "navigation strategy detection");
        logger.info("Gameweek navigation strategy: {}", strategy.name());
        return new GameweekNavigator(session, retry, timeoutMs, strategy);
    }

    /**
     * Navigates to a gameweek and waits until the page confirms it.
     * @param week Target index, starting at 1
     * @throws Exception the error of the last failed transition; the state is then {@code FAILED}
     */
    public void navigateTo(int week) throws Exception {
        target = week;
        state = NavigationState.NAVIGATING;
        try {
            retry.run(() -> {
                strategy.moveTo(session, week, timeoutMs);
                session.waitForFunction(PageScripts.WEEK_LABEL_IS,
                    Map.of("label", PageSelectors.WEEK_LABEL.css(), "week", week), timeoutMs);
            }, "navigation to gameweek " + week);
            state = NavigationState.CONFIRMED;
        } catch (Exception e) {
            state = NavigationState.FAILED;
            throw e;
        }
    }

    public NavigationState state() {
        return state;
    }

    public int target() {
        return target;
    }

    public String strategyName() {
        return strategy.name();
    }

    /**
     * @param session Session on a loaded season page
     * @return Value of the max gameweek input, or 1 when absent or unreadable
     */
    public static int maxWeek(BrowserSessionInterface session) {
        String raw = PageScripts.asString(session.evaluate(PageScripts.VALUE_OF, PageSelectors.MAX_WEEK.css()));
        int value = parseIndex(raw);
        return value > 0 ? value : 1;
    }

    /**
     * @param label Label text such as {@code "Gameweek 12"}
     * @return First integer in the label, or -1 when there is none
     */
    public static int parseIndex(String label) {
        if (label == null) return -1;
        Matcher m = INDEX.matcher(label);
        return m.find() ? Integer.parseInt(m.group()) : -1;
    }

    private static int currentIndex(BrowserSessionInterface session) {
        int index = parseIndex(PageScripts.asString(
            session.evaluate(PageScripts.TEXT_OF, PageSelectors.WEEK_LABEL.css())));
        return index > 0 ? index : 1;
    }

    private static boolean exists(BrowserSessionInterface session, PageSelector selector) {
        return PageScripts.asBoolean(session.evaluate(PageScripts.EXISTS, selector.css()));
    }
}
