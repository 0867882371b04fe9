package com.jeeves.envelope;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller's answer to a {@link FlowInterrupt}. Which field is meaningful depends on the interrupt
 * kind: {@code text} for clarification, {@code approved} for confirmation, {@code decision} for
 * agent review. {@code receivedAt} is stamped by {@link Envelope#resolveInterrupt}.
 * Immutable; {@link #getData()} returns a copy.
 */
public final class InterruptResponse {

    private final String text;
    private final Boolean approved;
    private final String decision;
    private final Map<String, Object> data;
    private final Instant receivedAt;

    public InterruptResponse(String text, Boolean approved, String decision, Map<String, ?> data, Instant receivedAt) {
        this.text = text;
        this.approved = approved;
        this.decision = decision;
        this.data = DeepCopy.copyMap(data);
        this.receivedAt = receivedAt;
    }

    public static InterruptResponse ofText(String text) {
        return new InterruptResponse(text, null, null, null, null);
    }

    public static InterruptResponse ofApproval(boolean approved) {
        return new InterruptResponse(null, approved, null, null, null);
    }

    public static InterruptResponse ofDecision(String decision) {
        return new InterruptResponse(null, null, decision, null, null);
    }

    /** Returns a copy stamped with the given receipt time. */
    public InterruptResponse withReceivedAt(Instant at) {
        return new InterruptResponse(text, approved, decision, data, at);
    }

    public Optional<String> getText() {
        return Optional.ofNullable(text);
    }

    public Optional<Boolean> getApproved() {
        return Optional.ofNullable(approved);
    }

    /** True only when the response explicitly approves. */
    public boolean isApproved() {
        return Boolean.TRUE.equals(approved);
    }

    public Optional<String> getDecision() {
        return Optional.ofNullable(decision);
    }

    /** Copy of the extensible payload, or null when none was given. */
    public Map<String, Object> getData() {
        return DeepCopy.copyMap(data);
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InterruptResponse that = (InterruptResponse) o;
        return Objects.equals(text, that.text)
                && Objects.equals(approved, that.approved)
                && Objects.equals(decision, that.decision)
                && Objects.equals(data, that.data)
                && Objects.equals(receivedAt, that.receivedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, approved, decision, data, receivedAt);
    }

    @Override
    public String toString() {
        return "InterruptResponse{text=" + text + ", approved=" + approved + ", decision=" + decision
                + ", receivedAt=" + receivedAt + "}";
    }
}
