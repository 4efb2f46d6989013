package com.platform.wafoperator.model;

/**
 * Reference to a RuleSet in the policy's namespace.
 */
public record RuleSetReference(String name) {
}
