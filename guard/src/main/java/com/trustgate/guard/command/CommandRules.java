package com.trustgate.guard.command;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The default rule table. Matching is substring/regex on the raw command,
 * so every verb is anchored on a word boundary ({@code \bdd\s+} blocks the
 * {@code dd} command, not "add" or "odd").
 */
public final class CommandRules {

    private CommandRules() {}

    public static CommandRuleSet defaults(String stateDirName) {
        String state = Pattern.quote(stateDirName) + "/";
        List<CommandRule> rules = new ArrayList<>();

        // Scoped deletions: only the matched file set can go.
        rules.add(CommandRule.override("\\bfind\\b\\s+.+-exec(dir)?\\s+rm\\b",
                "find -exec rm deletes only the matched files"));
        rules.add(CommandRule.override("\\bfind\\b\\s+.+-delete\\b",
                "find -delete deletes only the matched files"));
        rules.add(CommandRule.override("project-scoped-rm",
                "recursive rm whose every target lies strictly inside the working directory",
                new ProjectScopedRemoval(stateDirName)::matches));

        rules.add(CommandRule.block("\\brm\\s+-\\S*r\\S*f",
                "recursive force delete (rm -rf)"));
        rules.add(CommandRule.block("\\brm\\s+-\\S*f\\S*r",
                "recursive force delete (rm -fr)"));
        rules.add(CommandRule.block(
                "\\brm\\s+(?:-\\S+\\s+)*(?:-[a-z]*r[a-z]*|--recursive)\\s+(?:\\S+\\s+)*?(?:-[a-z]*f[a-z]*|--force)(?:\\s|$)",
                "recursive force delete (separate flags)"));
        rules.add(CommandRule.block(
                "\\brm\\s+(?:-\\S+\\s+)*(?:-[a-z]*f[a-z]*|--force)\\s+(?:\\S+\\s+)*?(?:-[a-z]*r[a-z]*|--recursive)(?:\\s|$)",
                "recursive force delete (separate flags, reversed)"));
        rules.add(CommandRule.block("\\bmkfs(\\.\\w+)?\\b",
                "filesystem formatting"));
        rules.add(CommandRule.block("\\bdd\\s+",
                "raw block-device copy (dd)"));
        rules.add(CommandRule.block(">\\s*/dev/(sd[a-z]|hd[a-z]|vd[a-z]|xvd[a-z]|nvme\\d|mmcblk\\d|disk\\d)",
                "redirection onto a block device"));
        rules.add(CommandRule.block("\\bchmod\\s+(?:-\\S+\\s+)*0?777\\b",
                "world-writable permissions (chmod 777)"));
        rules.add(CommandRule.block(":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*\\}\\s*;\\s*:",
                "fork bomb"));
        rules.add(CommandRule.block("\\bcurl\\b.*\\|\\s*(?:sudo\\s+)?(?:bash|sh|zsh)\\b",
                "remote script piped to a shell (curl | sh)"));
        rules.add(CommandRule.block("\\bwget\\b.*\\|\\s*(?:sudo\\s+)?(?:bash|sh|zsh)\\b",
                "remote script piped to a shell (wget | sh)"));

        // The agent's own state store: a stray redirect truncates the pipeline database.
        rules.add(CommandRule.block("\\bsqlite3\\s+.*" + state,
                "database client on internal state"));
        rules.add(CommandRule.block(">+\\s*\\S*" + state,
                "redirect into internal state"));
        rules.add(CommandRule.block("\\btee\\b.*" + state,
                "tee into internal state"));
        rules.add(CommandRule.block("\\bmv\\b.*" + state,
                "mv involving internal state"));
        rules.add(CommandRule.block("\\bcp\\b.*" + state,
                "cp into internal state"));
        rules.add(CommandRule.block("\\brm\\b.*" + state,
                "rm inside internal state"));
        rules.add(CommandRule.block("\\btruncate\\b.*" + state,
                "truncate internal state"));

        return new CommandRuleSet(rules);
    }
}
