package com.viewquality.pmos.fusion;

import com.viewquality.pmos.model.QualityMetric;
import com.viewquality.pmos.model.UpsamplingMethod;

/**
 * Contract for combining the WR geometry score with one objective metric into a MOS.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no side effects</li>
 *   <li><b>Bounded</b>: results always in [1, 5]</li>
 * </ul>
 *
 * <p>Arguments are assumed validated; implementations reject violations with
 * {@link IllegalArgumentException}.
 */
public interface MosFusionModel {

    /** The objective metric this model consumes. */
    QualityMetric metric();

    /**
     * @param viewingAngle      φ [degrees], in (0, 180)
     * @param angularResolution u [cycles per degree], in (0, 1000)
     * @param hdr               whether the content is HDR
     * @param upsampling        assumed upsampling method
     * @param metricValue       objective metric value within {@link QualityMetric#accepts(double)}
     * @return fused MOS in [1, 5]
     */
    double fuse(double viewingAngle, double angularResolution, boolean hdr,
                UpsamplingMethod upsampling, double metricValue);
}
