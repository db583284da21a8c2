package io.surfworks.entitlement.lifecycle;

import java.io.IOException;

/**
 * Load/save access to the single license record. Last writer wins.
 */
public interface LicenseStateStore {

    /**
     * Load the current record, or a fresh UNCONFIGURED one if none exists.
     */
    LicenseState load();

    void save(LicenseState state) throws IOException;
}
