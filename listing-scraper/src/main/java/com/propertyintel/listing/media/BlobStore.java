package com.propertyintel.listing.media;

import java.util.Optional;

/**
 * Opaque object storage for mirrored images.
 */
public interface BlobStore {

    /**
     * Store bytes under a name. Storing the same name twice keeps the first copy.
     *
     * @return the location to record for the stored object
     */
    String put(byte[] bytes, String name);

    Optional<byte[]> get(String location);

    boolean exists(String name);

    String locationOf(String name);
}
