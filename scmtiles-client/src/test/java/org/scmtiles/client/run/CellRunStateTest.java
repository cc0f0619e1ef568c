package org.scmtiles.client.run;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CellRunState} class.
 */
public class CellRunStateTest {

    @Test
    public void testTransitions() {
        Assert.assertTrue("INIT should allow staging", CellRunState.INIT.canTransitionTo(CellRunState.STAGED));
        Assert.assertTrue("INIT should allow failure", CellRunState.INIT.canTransitionTo(CellRunState.FAILED));
        Assert.assertFalse("INIT should not skip execution", CellRunState.INIT.canTransitionTo(CellRunState.VERIFIED));
        Assert.assertTrue("VERIFIED should allow archival failure",
                          CellRunState.VERIFIED.canTransitionTo(CellRunState.FAILED));
        Assert.assertTrue("ARCHIVED should only allow cleanup",
                          CellRunState.ARCHIVED.canTransitionTo(CellRunState.CLEANED));
        Assert.assertFalse("FAILED should not allow archival",
                           CellRunState.FAILED.canTransitionTo(CellRunState.ARCHIVED));
        Assert.assertTrue("CLEANED should be final", CellRunState.CLEANED.getSuccessors().isEmpty());
    }

    @Test
    public void testCleanupActions() {
        Assert.assertEquals("archived run should be deleted",
                            CellRunState.CleanupAction.DELETE_RUN_DIRECTORY,
                            CellRunState.ARCHIVED.getCleanupAction(true));
        Assert.assertEquals("failed run should be deleted when not archiving",
                            CellRunState.CleanupAction.DELETE_RUN_DIRECTORY,
                            CellRunState.FAILED.getCleanupAction(false));
        Assert.assertEquals("failed run should be relocated when archiving",
                            CellRunState.CleanupAction.RELOCATE_RUN_DIRECTORY,
                            CellRunState.FAILED.getCleanupAction(true));
    }

    @Test(expected = IllegalStateException.class)
    public void testCleanupActionRequiresTerminalState() {
        CellRunState.EXECUTED.getCleanupAction(false);
    }
}
