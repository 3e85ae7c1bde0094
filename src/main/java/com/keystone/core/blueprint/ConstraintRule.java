package com.keystone.core.blueprint;

import com.keystone.core.model.Blueprint;

import java.util.List;

/**
 * One named cross-field constraint over a {@link Blueprint}. Rules must tolerate missing
 * sections (a hand-edited blueprint file may omit them) and report every violation they
 * find rather than stopping at the first.
 */
public interface ConstraintRule {

    String name();

    List<Violation> evaluate(Blueprint blueprint);
}
