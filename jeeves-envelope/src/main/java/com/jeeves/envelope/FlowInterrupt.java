package com.jeeves.envelope;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed pause request held in the envelope's single interrupt slot. Immutable: resolving an
 * interrupt replaces it with a copy carrying the response.
 */
public final class FlowInterrupt {

    private final InterruptKind kind;
    private final String id;
    private final String question;
    private final String message;
    private final Map<String, Object> data;
    private final InterruptResponse response;
    private final Instant createdAt;
    private final Instant expiresAt;

    public FlowInterrupt(InterruptKind kind,
                         String id,
                         String question,
                         String message,
                         Map<String, ?> data,
                         InterruptResponse response,
                         Instant createdAt,
                         Instant expiresAt) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = id != null ? id : "";
        this.question = question;
        this.message = message;
        this.data = DeepCopy.copyMap(data);
        this.response = response;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public InterruptKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public Optional<String> getQuestion() {
        return Optional.ofNullable(question).filter(q -> !q.isEmpty());
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message).filter(m -> !m.isEmpty());
    }

    /** Copy of the payload, or null. */
    public Map<String, Object> getData() {
        return DeepCopy.copyMap(data);
    }

    public Optional<InterruptResponse> getResponse() {
        return Optional.ofNullable(response);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    /** True when an expiry is set and lies before {@code now}. */
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public FlowInterrupt withResponse(InterruptResponse newResponse) {
        return new FlowInterrupt(kind, id, question, message, data, newResponse, createdAt, expiresAt);
    }

    FlowInterrupt withQuestion(String q) {
        return new FlowInterrupt(kind, id, q, message, data, response, createdAt, expiresAt);
    }

    FlowInterrupt withMessage(String m) {
        return new FlowInterrupt(kind, id, question, m, data, response, createdAt, expiresAt);
    }

    FlowInterrupt withData(Map<String, ?> d) {
        return new FlowInterrupt(kind, id, question, message, d, response, createdAt, expiresAt);
    }

    FlowInterrupt withExpiresAt(Instant at) {
        return new FlowInterrupt(kind, id, question, message, data, response, createdAt, at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowInterrupt that = (FlowInterrupt) o;
        return kind == that.kind
                && Objects.equals(id, that.id)
                && Objects.equals(question, that.question)
                && Objects.equals(message, that.message)
                && Objects.equals(data, that.data)
                && Objects.equals(response, that.response)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(expiresAt, that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, question, message, data, response, createdAt, expiresAt);
    }

    @Override
    public String toString() {
        return "FlowInterrupt{kind=" + kind + ", id=" + id + ", pendingResponse=" + (response == null) + "}";
    }
}
