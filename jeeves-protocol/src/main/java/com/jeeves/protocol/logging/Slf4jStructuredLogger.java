package com.jeeves.protocol.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link StructuredLogger} rendering {@code event | k1=v1 k2=v2} lines to an SLF4J logger. Bound
 * fields come first. A trailing {@link Throwable} without a key is passed to SLF4J as the cause.
 */
public final class Slf4jStructuredLogger implements StructuredLogger {

    private final Logger delegate;
    private final List<Object> bound;

    public Slf4jStructuredLogger(Logger delegate) {
        this(delegate, List.of());
    }

    private Slf4jStructuredLogger(Logger delegate, List<Object> bound) {
        this.delegate = delegate;
        this.bound = bound;
    }

    public static StructuredLogger forClass(Class<?> type) {
        return new Slf4jStructuredLogger(LoggerFactory.getLogger(type));
    }

    @Override
    public void debug(String event, Object... keyValues) {
        if (delegate.isDebugEnabled()) {
            Throwable t = trailingThrowable(keyValues);
            delegate.debug(render(event, keyValues, t != null), t);
        }
    }

    @Override
    public void info(String event, Object... keyValues) {
        if (delegate.isInfoEnabled()) {
            Throwable t = trailingThrowable(keyValues);
            delegate.info(render(event, keyValues, t != null), t);
        }
    }

    @Override
    public void warn(String event, Object... keyValues) {
        if (delegate.isWarnEnabled()) {
            Throwable t = trailingThrowable(keyValues);
            delegate.warn(render(event, keyValues, t != null), t);
        }
    }

    @Override
    public void error(String event, Object... keyValues) {
        if (delegate.isErrorEnabled()) {
            Throwable t = trailingThrowable(keyValues);
            delegate.error(render(event, keyValues, t != null), t);
        }
    }

    @Override
    public StructuredLogger bind(Object... keyValues) {
        List<Object> merged = new ArrayList<>(bound);
        merged.addAll(Arrays.asList(keyValues));
        return new Slf4jStructuredLogger(delegate, List.copyOf(merged));
    }

    /** Bound fields of this logger, as alternating keys and values. */
    List<Object> boundFields() {
        return bound;
    }

    String render(String event, Object[] keyValues, boolean dropLast) {
        StringBuilder sb = new StringBuilder(event);
        int n = dropLast ? keyValues.length - 1 : keyValues.length;
        if (bound.isEmpty() && n <= 0) {
            return sb.toString();
        }
        sb.append(" |");
        appendPairs(sb, bound.toArray(), bound.size());
        appendPairs(sb, keyValues, n);
        return sb.toString();
    }

    private static void appendPairs(StringBuilder sb, Object[] kv, int n) {
        for (int i = 0; i < n; i += 2) {
            sb.append(' ').append(kv[i]).append('=');
            sb.append(i + 1 < n ? kv[i + 1] : "?");
        }
    }

    private static Throwable trailingThrowable(Object[] keyValues) {
        if (keyValues.length % 2 == 1 && keyValues[keyValues.length - 1] instanceof Throwable t) {
            return t;
        }
        return null;
    }
}
