package org.rungforge.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is allowed with {@link AllowLog} or
 * expected with {@link ExpectLog}, and fails it when an expected event is missing.
 * <p>
 * A Logback turbo filter is installed for the duration of each test. Allowed and expected events
 * are captured and suppressed so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.of(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        for (Event event : filter.events) {
            if (event.level.isGreaterOrEqual(Rules.FAIL_LEVEL) && !rules.permits(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (Rule expected : rules.expected) {
            long found = filter.events.stream().filter(expected::matches).count();
            if (found < expected.occurrences) {
                problems.add(String.format("Expected %d x %s, but found %d", expected.occurrences, expected, found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private record Rule(Level level, Pattern logger, Pattern message, int occurrences) {
        static Rule of(AllowLog allow) {
            return new Rule(toLogback(allow.level()), Pattern.compile(allow.loggerPattern()), Pattern.compile(allow.messagePattern()), 0);
        }

        static Rule of(ExpectLog expect) {
            return new Rule(toLogback(expect.level()), Pattern.compile(expect.loggerPattern()), Pattern.compile(expect.messagePattern()), expect.occurrences());
        }

        boolean matches(Event event) {
            return event.level.isGreaterOrEqual(level)
                    && logger.matcher(event.logger).matches()
                    && message.matcher(event.message).matches();
        }

        @Override
        public String toString() {
            return "[" + level + "] logger=\"" + logger + "\" message=\"" + message + "\"";
        }
    }

    private static final class Rules {
        static final Level FAIL_LEVEL = Level.WARN;
        final List<Rule> allowed = new ArrayList<>();
        final List<Rule> expected = new ArrayList<>();

        static Rules of(ExtensionContext context) {
            Optional<Class<?>> testClass = context.getTestClass();
            Optional<? extends AnnotatedElement> method = context.getTestMethod();
            Rules rules = new Rules();

            List<AnnotatedElement> sources = new ArrayList<>();
            testClass.ifPresent(sources::add);
            method.ifPresent(sources::add);
            for (AnnotatedElement source : sources) {
                for (AllowLog allow : source.getAnnotationsByType(AllowLog.class)) {
                    rules.allowed.add(Rule.of(allow));
                }
                for (ExpectLog expect : source.getAnnotationsByType(ExpectLog.class)) {
                    rules.expected.add(Rule.of(expect));
                }
            }
            return rules;
        }

        Level captureLevel() {
            Level lowest = FAIL_LEVEL;
            for (Rule rule : expected) {
                if (!rule.level.isGreaterOrEqual(lowest)) {
                    lowest = rule.level;
                }
            }
            return lowest;
        }

        boolean permits(Event event) {
            return allowed.stream().anyMatch(r -> r.matches(event)) || expected.stream().anyMatch(r -> r.matches(event));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final Level captureLevel;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
            this.captureLevel = rules.captureLevel();
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (level == null || !level.isGreaterOrEqual(captureLevel)) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message);
            events.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
