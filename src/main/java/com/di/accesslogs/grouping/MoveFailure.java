package com.di.accesslogs.grouping;

/**
 * A raw log object that could not be relocated.
 */
public record MoveFailure(String bucket, String sourceKey, MoveStage stage, String message) {
}
