package com.questrail.recorder.format;

/**
 * Count phrases such as "1 test" or "3 known issues".
 */
public final class Counting
{
    private Counting() {}

    /**
     * Returns {@code "<count> <noun>"}, pluralizing the noun with a trailing
     * {@code s} unless the count is exactly one.
     */
    public static String of(int count, String noun) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (was " + count + ")");
        }
        return count == 1 ? count + " " + noun : count + " " + noun + "s";
    }

    /**
     * Describes issue counts as a suffix for "passed after ..." and
     * "failed after ..." lines.
     *
     * <ul>
     *   <li>(0, 0) → {@code ""}</li>
     *   <li>(N, 0) → {@code " with N issues"}</li>
     *   <li>(0, K) → {@code " with K known issues"}</li>
     *   <li>(N, K) → {@code " with N+K issues (including K known issues)"}</li>
     * </ul>
     *
     * @param issueCount      unexpected issues
     * @param knownIssueCount known issues
     */
    public static String issueSuffix(int issueCount, int knownIssueCount) {
        int total = issueCount + knownIssueCount;
        if (issueCount > 0 && knownIssueCount > 0) {
            return " with " + of(total, "issue") + " (including " + of(knownIssueCount, "known issue") + ")";
        }
        if (knownIssueCount > 0) {
            return " with " + of(knownIssueCount, "known issue");
        }
        if (issueCount > 0) {
            return " with " + of(issueCount, "issue");
        }
        return "";
    }
}
