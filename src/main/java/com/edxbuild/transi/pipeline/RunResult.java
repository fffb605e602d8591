package com.edxbuild.transi.pipeline;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one pipeline run.
 */
@Data
@Builder
public class RunResult {
    private boolean success;
    private String errorMessage;
    private String errorType;
    private String stage;

    @Builder.Default
    private List<Path> artifacts = List.of();
    private Path summaryPath;

    private int rowCount;
    private int mClassCount;
    private int nonMClassCount;
    private int unmatchedCount;
    private int unresolvedReferenceCount;

    private int changeCount;
    private int changedRowCount;

    private int suggestedCount;

    public static RunResult failure(String stage, Exception cause) {
        return RunResult.builder()
                .success(false)
                .stage(stage)
                .errorMessage(cause.getMessage())
                .errorType(cause.getClass().getSimpleName())
                .build();
    }
}
