package com.agentguard.condition;

import lombok.Getter;

/**
 * Outcome of evaluating one condition expression.
 *
 * <p>A malformed expression never holds; {@code detail} then names the offending clause.
 */
@Getter
public class ConditionCheck {

    private final boolean holds;
    private final boolean malformed;
    private final String detail;

    private ConditionCheck(boolean holds, boolean malformed, String detail) {
        this.holds = holds;
        this.malformed = malformed;
        this.detail = detail;
    }

    public static ConditionCheck satisfied() {
        return new ConditionCheck(true, false, null);
    }

    public static ConditionCheck unsatisfied(String detail) {
        return new ConditionCheck(false, false, detail);
    }

    public static ConditionCheck malformed(String detail) {
        return new ConditionCheck(false, true, detail);
    }
}
