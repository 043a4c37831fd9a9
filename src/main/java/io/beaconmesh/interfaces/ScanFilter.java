package io.beaconmesh.interfaces;

import lombok.Builder;
import lombok.Value;

/**
 * Only broadcasts carrying service data for this service uuid are reported.
 */
@Value
@Builder
public class ScanFilter {
    String serviceUuid;
}
