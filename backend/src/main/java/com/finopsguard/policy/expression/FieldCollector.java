package com.finopsguard.policy.expression;

import java.util.LinkedHashSet;
import java.util.Set;

class FieldCollector implements ExpressionVisitor<Set<String>> {

    @Override
    public Set<String> visitRule(Rule rule) {
        Set<String> fields = new LinkedHashSet<>();
        if (rule.field() != null) {
            fields.add(rule.field());
        }
        return fields;
    }

    @Override
    public Set<String> visitAnd(And and) {
        Set<String> fields = new LinkedHashSet<>();
        and.children().forEach(child -> fields.addAll(child.accept(this)));
        return fields;
    }

    @Override
    public Set<String> visitOr(Or or) {
        Set<String> fields = new LinkedHashSet<>();
        or.children().forEach(child -> fields.addAll(child.accept(this)));
        return fields;
    }
}
