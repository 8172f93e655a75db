package com.purchasingpower.genki.util;

import com.purchasingpower.genki.model.github.GitHubCommit;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.google.common.base.Strings.nullToEmpty;

/**
 * Decides whether a commit counts toward the monitored user's activity.
 *
 * A commit is excluded when any of the following holds:
 * - author login, name or email looks like an automation account
 * - it has two or more parents (merge commit)
 * - its author login is not exactly the monitored login
 *
 * The last rule also drops commits by the user that GitHub attributes to another
 * login, e.g. through co-authoring tools. Counting only what is unambiguously
 * the user's own is intended.
 *
 * Pure and stateless.
 */
public final class CommitQualifier {

    private static final List<Pattern> BOT_PATTERNS = List.of(
            Pattern.compile("dependabot"),
            Pattern.compile("renovate"),
            Pattern.compile("greenkeeper"),
            Pattern.compile("github-actions"),
            Pattern.compile("codecov"),
            Pattern.compile("snyk"),
            Pattern.compile("web-flow"),
            // Suffix/prefix rules apply per identity field of the joined string
            Pattern.compile("\\[bot\\](\\s|$)"),
            Pattern.compile("-bot(\\s|$)"),
            Pattern.compile("(^|\\s)bot-"),
            Pattern.compile("noreply@github\\.com")
    );

    private CommitQualifier() {
    }

    /**
     * Check identity fields against known automation accounts. Any argument may be null.
     */
    public static boolean isBotAccount(String login, String name, String email) {
        if (login == null && name == null && email == null) {
            return false;
        }
        String identity = String.join(" ",
                        nullToEmpty(login), nullToEmpty(name), nullToEmpty(email))
                .toLowerCase(Locale.ROOT);
        return BOT_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(identity).find());
    }

    /**
     * Identity-only check used before monitoring a login at all.
     */
    public static boolean isBotAccount(String login) {
        return isBotAccount(login, null, null);
    }

    public static boolean isMergeCommit(int parentCount) {
        return parentCount >= 2;
    }

    public static boolean qualifies(String authorLogin, String authorName, String authorEmail,
                                    int parentCount, String monitoredLogin) {
        return !isBotAccount(authorLogin, authorName, authorEmail)
                && !isMergeCommit(parentCount)
                && authorLogin != null
                && authorLogin.equals(monitoredLogin);
    }

    public static boolean qualifies(GitHubCommit commit, String monitoredLogin) {
        return qualifies(commit.authorLogin(), commit.authorName(), commit.authorEmail(),
                commit.parentCount(), monitoredLogin);
    }
}
