package io.beaconmesh.exception;

import lombok.Getter;

@Getter
public class MeshException extends RuntimeException {
    private final MeshExceptionType type;

    public MeshException(MeshExceptionType type, String errorMessage) {
        super(errorMessage);
        this.type = type;
    }

    public MeshException(MeshExceptionType type, String errorMessage, Throwable cause) {
        super(errorMessage, cause);
        this.type = type;
    }
}
