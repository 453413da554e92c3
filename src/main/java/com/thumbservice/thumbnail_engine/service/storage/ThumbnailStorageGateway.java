package com.thumbservice.thumbnail_engine.service.storage;

import java.nio.file.Path;

/**
 * Content-addressed store for rendered thumbnails.
 * The store is the only cache: a key that exists never needs to be generated again.
 */
public interface ThumbnailStorageGateway {

    String JPEG_CONTENT_TYPE = "image/jpeg";

    /**
     * @return true only when the object is known to exist; any lookup failure reads as absent
     */
    boolean exists(String key);

    /**
     * Writes the file under {@code key}, replacing any existing object.
     *
     * @throws com.thumbservice.thumbnail_engine.exception.ThumbnailException STORAGE_FAILED on any store error
     */
    void upload(String key, Path file, String contentType);

    /**
     * Signs a time-limited GET URL. Does not check that the object exists.
     */
    String presignedUrl(String key);
}
