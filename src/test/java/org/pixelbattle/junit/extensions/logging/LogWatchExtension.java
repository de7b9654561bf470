package org.pixelbattle.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
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
 * expected with {@link ExpectLog}. Expected events that never occur fail the test as well.
 * Matching events are swallowed so they do not clutter the build output.
 * <p>
 * The capturing filter is installed as a Logback turbo filter, so it survives appender
 * reconfiguration during a test.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(final ExtensionContext context) {
        final CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(final ExtensionContext context) {
        final CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(final ExtensionContext context) {
        final CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        final Rules rules = filter.rules;
        final List<Event> events = filter.events();
        filter.clear();

        final List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (final Event event : events) {
                if (event.level.isGreaterOrEqual(rules.minLevel) && !rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (final ExpectLog expect : rules.expects) {
            final long found = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (found < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d.",
                    expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(final ExtensionContext context) {
        final CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(final ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(final ExtensionContext context) {
        final Optional<AnnotatedElement> element = context.getElement();
        final Optional<Class<?>> testClass = context.getTestClass();

        FailOnLog fail = element.map(e -> e.getAnnotation(FailOnLog.class)).orElse(null);
        if (fail == null) {
            fail = testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null);
        }
        final List<AllowLog> allows = new ArrayList<>();
        final List<ExpectLog> expects = new ArrayList<>();
        testClass.ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        // Class-level context: the element is the class itself, already collected above
        element.filter(e -> !(e instanceof Class)).ifPresent(e -> {
            allows.addAll(List.of(e.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(e.getAnnotationsByType(ExpectLog.class)));
        });

        final Level minLevel = toLogback(fail != null ? fail.level() : LogLevel.WARN);
        return new Rules(minLevel, fail != null && fail.disabled(), allows, expects);
    }

    private static boolean matches(final Event event, final LogLevel level, final String loggerPattern,
                                   final String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, event.loggerName)
            && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(event.message).matches();
    }

    private static Level toLogback(final LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> captured = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(final Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(final Marker marker, final ch.qos.logback.classic.Logger logger, final Level level,
                                  final String format, final Object[] params, final Throwable t) {
            // Called for every logger.isXxxEnabled() check too, those come with a null format
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            final Event event = new Event(logger.getName(), level,
                MessageFormatter.arrayFormat(format, params).getMessage());
            captured.add(event);
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(captured);
        }

        void clear() {
            captured.clear();
        }
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private record Rules(Level minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
        boolean permits(final Event event) {
            for (final AllowLog allow : allows) {
                if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                    return true;
                }
            }
            for (final ExpectLog expect : expects) {
                if (matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }
}
