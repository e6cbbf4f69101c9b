package com.dealengine.condition;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * True when every child is true.
 */
@Value
public class Conjunction implements Predicate {

    List<Predicate> children;

    public Conjunction(List<Predicate> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public String describe() {
        return children.stream()
            .map(Predicate::describe)
            .collect(Collectors.joining(" AND ", "(", ")"));
    }
}
