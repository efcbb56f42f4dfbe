package com.example.clipscore_backend.service.video;

import com.example.clipscore_backend.model.VideoRecord;

/**
 * Source of video records. Implementations perform network I/O and never run inside the scoring core.
 */
public interface VideoDataProvider {

    /**
     * @param videoId platform video identifier.
     * @return populated record; optional parts may be missing.
     * @throws VideoDataAccessException when the video cannot be retrieved.
     */
    VideoRecord fetch(String videoId);
}
