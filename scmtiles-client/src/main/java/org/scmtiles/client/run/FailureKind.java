package org.scmtiles.client.run;

/**
 * Reasons a cell run can fail.
 */
public enum FailureKind {

    /** The run directory or the model input file could not be prepared. */
    STAGING,

    /** The run directory does not contain the model executable. */
    EXECUTABLE_MISSING,

    /** The model executable exists but cannot be executed. */
    NOT_EXECUTABLE,

    /** The model process could not be started or waited for. */
    LAUNCH_FAILURE,

    /** The model process returned a non-zero exit status. */
    NONZERO_EXIT,

    /** The model process did not write all expected output files. */
    VERIFICATION,

    /** The model output files could not be moved to the output directory. */
    ARCHIVAL,

    /** The archived output files could not be loaded for assembly. */
    LOADING
}
