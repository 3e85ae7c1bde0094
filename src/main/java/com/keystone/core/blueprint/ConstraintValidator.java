package com.keystone.core.blueprint;

import com.keystone.core.model.Blueprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates every rule against a blueprint and returns all violations; never stops at
 * the first failing rule.
 */
@Service
public class ConstraintValidator {

    private static final Logger log = LoggerFactory.getLogger(ConstraintValidator.class);

    private final List<ConstraintRule> rules;

    public ConstraintValidator() {
        this(ConstraintRules.standard());
    }

    public ConstraintValidator(List<ConstraintRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public ValidationResult validate(Blueprint blueprint) {
        var violations = new ArrayList<Violation>();
        for (ConstraintRule rule : rules) {
            List<Violation> found = rule.evaluate(blueprint);
            if (!found.isEmpty()) {
                log.debug("Rule {} reported {} violation(s)", rule.name(), found.size());
            }
            violations.addAll(found);
        }
        if (violations.isEmpty()) {
            log.info("Blueprint passed {} constraint rules", rules.size());
            return ValidationResult.ok();
        }
        log.info("Blueprint has {} constraint violation(s)", violations.size());
        return new ValidationResult(violations);
    }

    public List<String> ruleNames() {
        return rules.stream().map(ConstraintRule::name).toList();
    }
}
