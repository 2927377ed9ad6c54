package com.finopsguard.policy.expression;

import java.util.ArrayList;
import java.util.List;

class RuleCollector implements ExpressionVisitor<List<Rule>> {

    @Override
    public List<Rule> visitRule(Rule rule) {
        return List.of(rule);
    }

    @Override
    public List<Rule> visitAnd(And and) {
        List<Rule> rules = new ArrayList<>();
        and.children().forEach(child -> rules.addAll(child.accept(this)));
        return rules;
    }

    @Override
    public List<Rule> visitOr(Or or) {
        List<Rule> rules = new ArrayList<>();
        or.children().forEach(child -> rules.addAll(child.accept(this)));
        return rules;
    }
}
