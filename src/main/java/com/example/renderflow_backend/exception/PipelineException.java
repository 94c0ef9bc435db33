package com.example.renderflow_backend.exception;

import com.example.renderflow_backend.util.ErrorKind;

public class PipelineException extends RuntimeException {
    private final PipelineError error;

    public PipelineException(PipelineError error) {
        super(error.message());
        this.error = error;
    }

    public PipelineException(PipelineError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public static PipelineException engine(String message, Throwable cause) {
        return new PipelineException(PipelineError.of(ErrorKind.ENGINE_ERROR, message), cause);
    }

    public static PipelineException artifact(String message) {
        return new PipelineException(PipelineError.of(ErrorKind.ARTIFACT_ERROR, message));
    }

    public static PipelineException timeout(String message) {
        return new PipelineException(PipelineError.of(ErrorKind.TIMEOUT_ERROR, message));
    }

    public static PipelineException configuration(String message) {
        return new PipelineException(PipelineError.of(ErrorKind.CONFIGURATION_ERROR, message));
    }

    public static PipelineException validation(String message) {
        return new PipelineException(PipelineError.of(ErrorKind.VALIDATION_ERROR, message));
    }

    public PipelineError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind();
    }
}
