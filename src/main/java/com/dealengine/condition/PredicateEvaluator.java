package com.dealengine.condition;

import com.dealengine.game.GameFact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evaluates compiled predicates against a game fact.
 *
 * Evaluation is pure and total: it never throws. A comparison whose fact is
 * missing evaluates to false, since upstream stat capture can be partial, and an
 * incomplete game makes every comparison false.
 */
@Component
@Slf4j
public class PredicateEvaluator {

    private final AtomicLong missingFactCount = new AtomicLong();

    public boolean evaluate(Predicate predicate, GameFact fact) {
        if (predicate == null || fact == null) {
            return false;
        }
        if (predicate instanceof Literal) {
            return ((Literal) predicate).isValue();
        }
        if (predicate instanceof Comparison) {
            return evaluateComparison((Comparison) predicate, fact);
        }
        if (predicate instanceof Conjunction) {
            for (Predicate child : ((Conjunction) predicate).getChildren()) {
                if (!evaluate(child, fact)) {
                    return false;
                }
            }
            return true;
        }
        if (predicate instanceof Disjunction) {
            for (Predicate child : ((Disjunction) predicate).getChildren()) {
                if (evaluate(child, fact)) {
                    return true;
                }
            }
            return false;
        }
        log.warn("Unknown predicate type {}, evaluating as false", predicate.getClass().getName());
        return false;
    }

    /**
     * Number of comparisons that found no value for their fact since startup.
     */
    public long getMissingFactCount() {
        return missingFactCount.get();
    }

    private boolean evaluateComparison(Comparison comparison, GameFact fact) {
        if (!fact.isComplete()) {
            return false;
        }
        OptionalInt value = fact.valueOf(comparison.getFact());
        if (value.isEmpty()) {
            missingFactCount.incrementAndGet();
            log.debug("Data quality: game {} has no value for '{}', comparison {} evaluates false",
                fact.getGameId(), comparison.getFact(), comparison.describe());
            return false;
        }
        return comparison.getOperator().test(value.getAsInt(), comparison.getThreshold());
    }
}
