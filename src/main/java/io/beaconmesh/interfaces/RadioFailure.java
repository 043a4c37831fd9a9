package io.beaconmesh.interfaces;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

import static io.beaconmesh.interfaces.ErrorCategory.CAPABILITY;
import static io.beaconmesh.interfaces.ErrorCategory.CAPACITY;
import static io.beaconmesh.interfaces.ErrorCategory.TRANSIENT_RADIO;

/**
 * Failure reported by the radio stack for a scan or advertise start. Codes follow the platform numbering.
 */
@Getter
@RequiredArgsConstructor
public enum RadioFailure {
    DATA_TOO_LARGE(1, CAPACITY),
    TOO_MANY_ADVERTISERS(2, TRANSIENT_RADIO),
    ALREADY_STARTED(3, TRANSIENT_RADIO),
    INTERNAL_ERROR(4, TRANSIENT_RADIO),
    FEATURE_UNSUPPORTED(5, CAPABILITY),
    REGISTRATION_FAILED(6, TRANSIENT_RADIO),
    PERMISSION_DENIED(7, CAPABILITY),
    UNKNOWN(-1, TRANSIENT_RADIO),
    ;

    private final int code;
    private final ErrorCategory category;

    public static RadioFailure fromCode(final int code) {
        return Arrays.stream(values())
                .filter(failure -> failure.getCode() == code)
                .findFirst()
                .orElse(UNKNOWN);
    }

    public static RadioFailure fromException(final RuntimeException e) {
        return e instanceof SecurityException ? PERMISSION_DENIED : INTERNAL_ERROR;
    }

    public boolean isCapability() {
        return category == CAPABILITY;
    }
}
