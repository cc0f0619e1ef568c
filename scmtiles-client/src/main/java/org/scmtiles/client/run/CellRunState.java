package org.scmtiles.client.run;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * States of a single cell run.
 *
 * <pre>
 *   INIT -&gt; STAGED -&gt; EXECUTED -&gt; VERIFIED -&gt; ARCHIVED -&gt; CLEANED
 *   (any non-terminal state) -&gt; FAILED -&gt; CLEANED
 * </pre>
 */
public enum CellRunState {

    INIT,
    STAGED,
    EXECUTED,
    VERIFIED,
    ARCHIVED,
    FAILED,
    CLEANED;

    /**
     * What happens to a run directory once its run reaches a terminal state.
     */
    public enum CleanupAction {
        DELETE_RUN_DIRECTORY,
        RELOCATE_RUN_DIRECTORY
    }

    public boolean isTerminal() {
        return (this == ARCHIVED) || (this == FAILED);
    }

    public boolean canTransitionTo(final CellRunState next) {
        return getSuccessors().contains(next);
    }

    public Set<CellRunState> getSuccessors() {
        final Set<CellRunState> successors;
        switch (this) {
            case INIT:
                successors = EnumSet.of(STAGED, FAILED);
                break;
            case STAGED:
                successors = EnumSet.of(EXECUTED, FAILED);
                break;
            case EXECUTED:
                successors = EnumSet.of(VERIFIED, FAILED);
                break;
            case VERIFIED:
                successors = EnumSet.of(ARCHIVED, FAILED);
                break;
            case ARCHIVED:
            case FAILED:
                successors = EnumSet.of(CLEANED);
                break;
            default:
                successors = EnumSet.noneOf(CellRunState.class);
        }
        return Collections.unmodifiableSet(successors);
    }

    /**
     * @param  archiveFailedRuns  indicates whether failed run directories should be kept.
     *
     * @return cleanup action for a run that ended in this state.
     *
     * @throws IllegalStateException
     *   if this state is not terminal.
     */
    public CleanupAction getCleanupAction(final boolean archiveFailedRuns)
            throws IllegalStateException {
        if (! isTerminal()) {
            throw new IllegalStateException("cleanup action is only defined for terminal states " +
                                            Arrays.asList(ARCHIVED, FAILED) + ", not " + this);
        }
        return ((this == FAILED) && archiveFailedRuns) ? CleanupAction.RELOCATE_RUN_DIRECTORY :
               CleanupAction.DELETE_RUN_DIRECTORY;
    }
}
