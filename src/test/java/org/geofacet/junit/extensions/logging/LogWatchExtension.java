package org.geofacet.junit.extensions.logging;

import ch.qos.logback.classic.Level;
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
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is declared with {@link ExpectLog}
 * or {@link AllowLog}, and fails it when an {@link ExpectLog} event is not produced.
 * <p>
 * A Logback {@link TurboFilter} is installed around every test method. Declared events are
 * captured and suppressed from the console; everything else passes through unchanged.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        Rules rules = Rules.resolve(context);
        CapturingFilter filter = new CapturingFilter(rules);
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
            if (event.level().isGreaterOrEqual(toLogback(rules.failLevel())) && !rules.permits(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expect : rules.expects()) {
            long found = filter.events.stream().filter(e -> matches(e, expect.level(),
                    expect.loggerPattern(), expect.messagePattern())).count();
            if (found < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level().isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.logger())
                && Pattern.matches(messagePattern, event.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
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

    private record Rules(LogLevel failLevel, List<AllowLog> allows, List<ExpectLog> expects) {

        static Rules resolve(ExtensionContext context) {
            Optional<Class<?>> testClass = context.getTestClass();
            Optional<? extends AnnotatedElement> method = context.getTestMethod();

            FailOnLog fail = method.map(m -> m.getAnnotation(FailOnLog.class))
                    .orElseGet(() -> testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));

            List<AllowLog> allows = new ArrayList<>();
            testClass.ifPresent(c -> allows.addAll(Arrays.asList(c.getAnnotationsByType(AllowLog.class))));
            method.ifPresent(m -> allows.addAll(Arrays.asList(m.getAnnotationsByType(AllowLog.class))));

            List<ExpectLog> expects = new ArrayList<>();
            testClass.ifPresent(c -> expects.addAll(Arrays.asList(c.getAnnotationsByType(ExpectLog.class))));
            method.ifPresent(m -> expects.addAll(Arrays.asList(m.getAnnotationsByType(ExpectLog.class))));

            return new Rules(fail != null ? fail.level() : LogLevel.WARN,
                    List.copyOf(allows), List.copyOf(expects));
        }

        boolean permits(Event event) {
            for (AllowLog allow : allows) {
                if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog expect : expects) {
                if (matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // isXxxEnabled() checks carry no message
            if (format == null) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
