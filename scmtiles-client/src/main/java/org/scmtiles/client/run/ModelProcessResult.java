package org.scmtiles.client.run;

/**
 * Exit status and captured output of one model process.
 */
public class ModelProcessResult {

    private final int exitCode;
    private final String standardOutput;
    private final String standardError;

    public ModelProcessResult(final int exitCode,
                              final String standardOutput,
                              final String standardError) {
        this.exitCode = exitCode;
        this.standardOutput = standardOutput;
        this.standardError = standardError;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStandardOutput() {
        return standardOutput;
    }

    public String getStandardError() {
        return standardError;
    }

    public boolean isSuccessful() {
        return exitCode == 0;
    }

    @Override
    public String toString() {
        return "ModelProcessResult{exitCode=" + exitCode + '}';
    }
}
