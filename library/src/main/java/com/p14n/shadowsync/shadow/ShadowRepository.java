package com.p14n.shadowsync.shadow;

import java.util.List;
import java.util.Optional;

/**
 * Storage for shadow documents. Callers serialize writes per device; a save
 * replaces the stored document for its device unless the stored one carries a
 * newer version.
 */
public interface ShadowRepository {

    Optional<ShadowDocument> loadShadow(String deviceId);

    /**
     * @return false if the stored document has a newer version and was kept
     */
    boolean saveShadow(ShadowDocument document);

    /**
     * Saved versions of a device's shadow, newest first. Each version appears
     * once, as it was last saved.
     *
     * @param limit the most entries to return
     */
    List<ShadowDocument> history(String deviceId, int limit);
}
