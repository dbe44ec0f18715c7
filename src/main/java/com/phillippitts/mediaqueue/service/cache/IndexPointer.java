package com.phillippitts.mediaqueue.service.cache;

import org.json.JSONObject;

/**
 * Latest artifact location published for a track.
 *
 * @param trackId    track identifier
 * @param configHash analysis configuration hash
 * @param sourceHash source audio content hash
 * @param artifact   artifact path on the cache
 * @param manifest   manifest path on the cache
 * @param etag       artifact validator, may be null
 */
public record IndexPointer(
        String trackId,
        String configHash,
        String sourceHash,
        String artifact,
        String manifest,
        String etag
) {

    static IndexPointer fromJson(JSONObject json) {
        return new IndexPointer(
                json.getString("track_id"),
                json.getString("config_hash"),
                json.getString("source_hash"),
                json.getString("artifact"),
                json.getString("manifest"),
                json.optString("etag", null));
    }
}
