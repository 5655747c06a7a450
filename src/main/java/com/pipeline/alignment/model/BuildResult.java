package com.pipeline.alignment.model;

/**
 * build/rebuild 的返回结果
 */
public final class BuildResult {
    private final BuildStatus status;
    private final int rowsAdded;
    private final String message;

    private BuildResult(BuildStatus status, int rowsAdded, String message) {
        this.status = status;
        this.rowsAdded = rowsAdded;
        this.message = message;
    }

    public static BuildResult of(BuildStatus status, int rowsAdded) {
        return new BuildResult(status, rowsAdded, null);
    }

    public static BuildResult failure(BuildStatus status, String message) {
        return new BuildResult(status, 0, message);
    }

    public BuildStatus getStatus() { return status; }
    public int getRowsAdded() { return rowsAdded; }
    public String getMessage() { return message; }

    public boolean isFailure() { return status.isFailure(); }

    @Override
    public String toString() {
        return "BuildResult{status=" + status + ", rowsAdded=" + rowsAdded
                + (message != null ? ", message='" + message + "'" : "") + "}";
    }
}
