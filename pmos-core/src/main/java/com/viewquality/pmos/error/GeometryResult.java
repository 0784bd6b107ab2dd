package com.viewquality.pmos.error;

import com.viewquality.pmos.model.ViewingGeometry;

/**
 * Outcome of the geometry-only entry point: a {@link ViewingGeometry} or a {@link MosError}.
 */
public record GeometryResult(
    ViewingGeometry geometry,
    MosError error,
    String message
) {
    public static GeometryResult of(ViewingGeometry geometry) {
        return new GeometryResult(geometry, null, null);
    }

    public static GeometryResult failure(MosComputationException e) {
        return new GeometryResult(null, e.getError(), e.getMessage());
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Legacy status code: 0 on success, the negative error code otherwise. */
    public int status() {
        return error == null ? 0 : error.code();
    }
}
