package com.viewquality.pmos.error;

import com.viewquality.pmos.model.ViewingGeometry;

/**
 * Outcome of a MOS prediction: either a score in [1, 5] or a {@link MosError}.
 *
 * <p>On success {@code error} and {@code message} are {@code null} and
 * {@code geometry} holds the viewing setup the score was computed for.
 * On failure {@code mos} is {@code NaN} and {@code geometry} may be {@code null}.
 *
 * @param mos      predicted mean opinion score
 * @param geometry viewing geometry the score was computed for
 * @param error    rejection reason, or {@code null}
 * @param message  human-readable detail for the rejection, or {@code null}
 */
public record MosResult(
    double mos,
    ViewingGeometry geometry,
    MosError error,
    String message
) {
    public static MosResult of(double mos, ViewingGeometry geometry) {
        return new MosResult(mos, geometry, null, null);
    }

    public static MosResult failure(MosError error, String message) {
        return new MosResult(Double.NaN, null, error, message);
    }

    public static MosResult failure(MosComputationException e) {
        return failure(e.getError(), e.getMessage());
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns the score, or throws if the computation was rejected.
     *
     * @throws MosComputationException carrying the rejection reason
     */
    public double mosOrThrow() {
        if (error != null) {
            throw new MosComputationException(error, message);
        }
        return mos;
    }

    /**
     * Single-channel form: the score on success, the negative error code otherwise.
     * Callers must branch on sign; a valid score is always at least 1.
     */
    public double toLegacyValue() {
        return error == null ? mos : error.code();
    }
}
