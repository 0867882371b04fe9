package com.jeeves.envelope;

import java.time.Duration;
import java.util.Map;

/**
 * Optional setting applied to a new interrupt by {@link Envelope#setInterrupt}.
 */
@FunctionalInterface
public interface InterruptOption {

    FlowInterrupt apply(FlowInterrupt interrupt);

    static InterruptOption question(String question) {
        return i -> i.withQuestion(question);
    }

    static InterruptOption message(String message) {
        return i -> i.withMessage(message);
    }

    /** Expiry relative to the interrupt's creation time. */
    static InterruptOption expiresIn(Duration duration) {
        return i -> i.withExpiresAt(i.getCreatedAt().plus(duration));
    }

    static InterruptOption data(Map<String, ?> data) {
        return i -> i.withData(data);
    }
}
