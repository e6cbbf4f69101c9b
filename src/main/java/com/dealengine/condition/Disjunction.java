package com.dealengine.condition;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * True when at least one child is true.
 */
@Value
public class Disjunction implements Predicate {

    List<Predicate> children;

    public Disjunction(List<Predicate> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public String describe() {
        return children.stream()
            .map(Predicate::describe)
            .collect(Collectors.joining(" OR ", "(", ")"));
    }
}
