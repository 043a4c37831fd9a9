package io.beaconmesh.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum MeshExceptionType {
    RADIO_IN_USE(0),
    CHANNEL_HASH_COLLISION(1),
    RESERVED_CHANNEL(2),
    ENGINE_STOPPED(3),
    INVALID_CONFIG(4),
    ;

    private final int code;
}
