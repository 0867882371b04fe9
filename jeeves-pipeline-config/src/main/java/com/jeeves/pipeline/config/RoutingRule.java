package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * Conditional transition: when the agent's output has {@code condition} equal to {@code value},
 * the run moves to {@code target}. Rules are evaluated in declaration order; the first match wins.
 */
public final class RoutingRule {

    private final String condition;
    private final Object value;
    private final String target;

    @JsonCreator
    public RoutingRule(
            @JsonProperty("condition") String condition,
            @JsonProperty("value") Object value,
            @JsonProperty("target") String target) {
        this.condition = condition;
        this.value = value;
        this.target = target;
    }

    @JsonProperty("condition")
    public String getCondition() {
        return condition;
    }

    @JsonProperty("value")
    public Object getValue() {
        return value;
    }

    @JsonProperty("target")
    public String getTarget() {
        return target;
    }

    /**
     * True when {@code output} contains the condition key with a value equal to this rule's value.
     * Numbers compare by numeric value so that {@code 1}, {@code 1L} and {@code 1.0} match.
     */
    public boolean matches(Map<String, ?> output) {
        if (output == null || !output.containsKey(condition)) return false;
        return valuesEqual(output.get(condition), value);
    }

    static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            try {
                return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
            } catch (NumberFormatException e) {
                return a.doubleValue() == b.doubleValue();
            }
        }
        return Objects.equals(actual, expected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RoutingRule that = (RoutingRule) o;
        return Objects.equals(condition, that.condition)
                && Objects.equals(value, that.value)
                && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, value, target);
    }

    @Override
    public String toString() {
        return "RoutingRule{" + condition + "=" + value + " -> " + target + "}";
    }
}
