package io.beaconmesh.interfaces;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RadioFailureTest {

    @ParameterizedTest
    @CsvSource({
            "1, DATA_TOO_LARGE, CAPACITY",
            "2, TOO_MANY_ADVERTISERS, TRANSIENT_RADIO",
            "3, ALREADY_STARTED, TRANSIENT_RADIO",
            "4, INTERNAL_ERROR, TRANSIENT_RADIO",
            "5, FEATURE_UNSUPPORTED, CAPABILITY",
            "6, REGISTRATION_FAILED, TRANSIENT_RADIO",
            "7, PERMISSION_DENIED, CAPABILITY",
            "42, UNKNOWN, TRANSIENT_RADIO",
    })
    void fromCode(int code, RadioFailure expected, ErrorCategory category) {
        var failure = RadioFailure.fromCode(code);

        assertEquals(expected, failure);
        assertEquals(category, failure.getCategory());
    }

    @Test
    void fromException() {
        assertEquals(RadioFailure.PERMISSION_DENIED, RadioFailure.fromException(new SecurityException()));
        assertEquals(RadioFailure.INTERNAL_ERROR, RadioFailure.fromException(new IllegalStateException()));
    }

    @Test
    void isCapability() {
        assertTrue(RadioFailure.PERMISSION_DENIED.isCapability());
        assertTrue(RadioFailure.FEATURE_UNSUPPORTED.isCapability());
        assertFalse(RadioFailure.ALREADY_STARTED.isCapability());
        assertFalse(RadioFailure.DATA_TOO_LARGE.isCapability());
    }
}
