package com.viewquality.pmos.wr;

import com.viewquality.pmos.model.UpsamplingMethod;

/**
 * Generalized Westerink-Roufs (WR) perceptual quality model.
 *
 * <p>Predicts quality from viewing geometry alone:
 * <pre>
 *   f_φ = (1 + (φ/φ_s)^(−k))^(−γ/k)
 *   f_u = (1 + (u/u_s)^(−l))^(−δ/l)
 *   Q   = clamp( ln(α + β · f_φ · f_u), 1, 5 )
 * </pre>
 * Quality rises with both viewing angle and angular resolution and saturates
 * past φ_s and u_s.
 *
 * <p>Preconditions: φ ∈ (0, 180), u ∈ (0, 1000). Callers validate geometry
 * first; a violation here raises {@link IllegalArgumentException}.
 */
public final class WesterinkRoufsModel {

    static final double MOS_MIN = 1.0;
    static final double MOS_MAX = 5.0;

    private WesterinkRoufsModel() {}

    /**
     * @param viewingAngle      φ [degrees]
     * @param angularResolution u [cycles per degree]
     * @param hdr               whether the content is HDR
     * @param upsampling        assumed upsampling method
     * @return WR quality score in [1, 5]
     */
    public static double score(double viewingAngle, double angularResolution,
                               boolean hdr, UpsamplingMethod upsampling) {
        if (!(viewingAngle > 0 && viewingAngle < 180)) {
            throw new IllegalArgumentException("viewing angle must be in (0, 180), got " + viewingAngle);
        }
        if (!(angularResolution > 0 && angularResolution < 1000)) {
            throw new IllegalArgumentException("angular resolution must be in (0, 1000), got " + angularResolution);
        }
        if (upsampling == null) {
            throw new IllegalArgumentException("upsampling method is required");
        }

        return score(viewingAngle, angularResolution, WrModelParameters.select(hdr, upsampling));
    }

    static double score(double phi, double u, WrModelParameters p) {
        double fPhi = Math.pow(1.0 + Math.pow(phi / p.phiS(), -p.k()), -p.gamma() / p.k());
        double fU   = Math.pow(1.0 + Math.pow(u / p.uS(), -p.l()), -p.delta() / p.l());
        double raw  = Math.log(p.alpha() + p.beta() * fPhi * fU);
        return clamp(raw);
    }

    static double clamp(double mos) {
        return Math.max(MOS_MIN, Math.min(MOS_MAX, mos));
    }
}
