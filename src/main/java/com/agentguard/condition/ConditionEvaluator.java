package com.agentguard.condition;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates the restricted condition language attached to permissions.
 *
 * <p>Grammar: {@code clause ( "and" clause )*} where a clause is
 * {@code time <op> HH:MM[:SS]} and {@code <op>} is one of {@code < <= > >= ==}.
 * Keywords are case-insensitive. The current time is truncated to the precision of each
 * literal, so {@code time == 09:00} holds for the whole minute. A blank expression always holds. Anything outside the
 * grammar is malformed and never holds; there is no dynamic code evaluation.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final Pattern CONJUNCTION = Pattern.compile("\\s+and\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern TIME_CLAUSE = Pattern.compile(
            "^time\\s*(<=|>=|==|<|>)\\s*(\\d{2}:\\d{2}(?::\\d{2})?)$", Pattern.CASE_INSENSITIVE);

    public ConditionCheck check(String expression, EvaluationContext context) {
        if (expression == null || expression.isBlank()) {
            return ConditionCheck.satisfied();
        }

        LocalTime now = context.localTime();
        for (String clause : CONJUNCTION.split(expression.trim())) {
            Matcher matcher = TIME_CLAUSE.matcher(clause.trim());
            if (!matcher.matches()) {
                log.warn("Unparseable condition clause '{}' in '{}'", clause, expression);
                return ConditionCheck.malformed("unrecognized clause: " + clause.trim());
            }

            Optional<TimeComparison> comparison = TimeComparison.fromSymbol(matcher.group(1));
            Optional<LocalTime> bound = parseTime(matcher.group(2));
            if (comparison.isEmpty() || bound.isEmpty()) {
                log.warn("Invalid time bound in condition clause '{}'", clause);
                return ConditionCheck.malformed("invalid time in clause: " + clause.trim());
            }

            LocalTime actual = now.truncatedTo(precisionOf(matcher.group(2)));
            if (!comparison.get().test(actual, bound.get())) {
                return ConditionCheck.unsatisfied(clause.trim());
            }
        }
        return ConditionCheck.satisfied();
    }

    public boolean holds(String expression, EvaluationContext context) {
        return check(expression, context).isHolds();
    }

    /** The clock is compared at the literal's resolution: minutes for HH:MM, seconds for HH:MM:SS. */
    private static ChronoUnit precisionOf(String literal) {
        return literal.length() > 5 ? ChronoUnit.SECONDS : ChronoUnit.MINUTES;
    }

    private Optional<LocalTime> parseTime(String text) {
        try {
            return Optional.of(LocalTime.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
