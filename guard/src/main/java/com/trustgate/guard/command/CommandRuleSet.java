package com.trustgate.guard.command;

import java.util.List;

/**
 * Ordered rule table evaluated in a single pass. All overrides come before
 * all block rules, so a command matching both is always allowed; a table
 * violating that order is rejected at construction.
 */
public record CommandRuleSet(List<CommandRule> rules) {

    public CommandRuleSet {
        rules = List.copyOf(rules);
        boolean seenBlock = false;
        for (CommandRule rule : rules) {
            if (rule.type() == CommandRule.Type.BLOCK) {
                seenBlock = true;
            } else if (seenBlock) {
                throw new IllegalArgumentException(
                        "Override rule '" + rule.pattern() + "' must precede every block rule");
            }
        }
    }

    public List<CommandRule> overrides() {
        return rules.stream().filter(r -> r.type() == CommandRule.Type.OVERRIDE).toList();
    }

    public List<CommandRule> blocks() {
        return rules.stream().filter(r -> r.type() == CommandRule.Type.BLOCK).toList();
    }
}
