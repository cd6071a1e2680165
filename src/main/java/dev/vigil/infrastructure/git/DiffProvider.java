package dev.vigil.infrastructure.git;

/**
 * Source of diff text for the working tree. Implementations never throw: failures come back
 * as {@code "Error: ..."} text and an empty side as one of the sentinels below.
 */
public interface DiffProvider {

    String NO_UNSTAGED_CHANGES = "(no unstaged changes)";
    String NOTHING_STAGED = "(nothing staged)";
    String ERROR_PREFIX = "Error: ";

    /** Index vs. working tree. */
    String unstagedDiff();

    /** HEAD vs. index. */
    String stagedDiff();

    /** True when {@code diff} is real diff text rather than a sentinel or an error. */
    static boolean hasChanges(String diff) {
        return diff != null
                && !diff.isBlank()
                && !NO_UNSTAGED_CHANGES.equals(diff)
                && !NOTHING_STAGED.equals(diff)
                && !diff.startsWith(ERROR_PREFIX);
    }
}
