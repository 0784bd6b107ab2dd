package com.viewquality.pmos.wr;

import com.viewquality.pmos.model.UpsamplingMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WesterinkRoufsModelTest {

    // 1080p video full-screen on a 4K TV at 3H
    private static final double TV_PHI = 33.008722763510036;
    private static final double TV_U = 28.274334780111232;

    @Nested
    @DisplayName("coefficient selection")
    class SelectionTests {

        @Test
        @DisplayName("SDR ignores the upsampling method")
        void sdrIgnoresUpsampling() {
            for (UpsamplingMethod method : UpsamplingMethod.values()) {
                assertSame(WrModelParameters.SDR, WrModelParameters.select(false, method));
            }
            assertSame(WrModelParameters.SDR, WrModelParameters.select(false, null));
        }

        @Test
        @DisplayName("HDR picks one tuple per upsampling method")
        void hdrPerMethod() {
            assertSame(WrModelParameters.HDR_BICUBIC,
                WrModelParameters.select(true, UpsamplingMethod.BICUBIC));
            assertSame(WrModelParameters.HDR_NEAREST_NEIGHBOR,
                WrModelParameters.select(true, UpsamplingMethod.NEAREST_NEIGHBOR));
            assertSame(WrModelParameters.HDR_SUPER_RESOLUTION,
                WrModelParameters.select(true, UpsamplingMethod.SUPER_RESOLUTION));
        }

        @Test
        @DisplayName("HDR exponents are the SDR ones scaled by 1.08")
        void hdrExponentScale() {
            assertEquals(1.55 * 1.08, WrModelParameters.HDR_BICUBIC.gamma(), 1e-12);
            assertEquals(2.12 * 1.08, WrModelParameters.HDR_SUPER_RESOLUTION.delta(), 1e-12);
        }
    }

    @Nested
    @DisplayName("score()")
    class ScoreTests {

        @Test
        @DisplayName("SDR 1080p on 4K TV → ~4.491")
        void sdrTvScore() {
            double q = WesterinkRoufsModel.score(TV_PHI, TV_U, false, UpsamplingMethod.BICUBIC);
            assertEquals(4.4911, q, 1e-3);
        }

        @Test
        @DisplayName("HDR variants order: super-resolution > bicubic > nearest neighbour")
        void hdrVariantsOrdered() {
            double bc = WesterinkRoufsModel.score(TV_PHI, TV_U, true, UpsamplingMethod.BICUBIC);
            double nn = WesterinkRoufsModel.score(TV_PHI, TV_U, true, UpsamplingMethod.NEAREST_NEIGHBOR);
            double sr = WesterinkRoufsModel.score(TV_PHI, TV_U, true, UpsamplingMethod.SUPER_RESOLUTION);
            assertEquals(4.1409, bc, 1e-3);
            assertEquals(4.0315, nn, 1e-3);
            assertEquals(4.2816, sr, 1e-3);
            assertTrue(sr > bc && bc > nn);
        }

        @Test
        @DisplayName("quality rises with angular resolution")
        void monotoneInResolution() {
            double previous = 0;
            for (double u = 1; u <= 200; u += 1) {
                double q = WesterinkRoufsModel.score(TV_PHI, u, false, UpsamplingMethod.BICUBIC);
                assertTrue(q >= previous, "u=" + u);
                previous = q;
            }
        }

        @Test
        @DisplayName("validity bounds produce finite scores in [1, 5]")
        void boundsAreFinite() {
            double[][] corners = {{1, 1}, {1, 200}, {179.999, 1}, {179.999, 200}};
            for (double[] c : corners) {
                for (boolean hdr : new boolean[] {false, true}) {
                    for (UpsamplingMethod method : UpsamplingMethod.values()) {
                        double q = WesterinkRoufsModel.score(c[0], c[1], hdr, method);
                        assertTrue(Double.isFinite(q));
                        assertTrue(q >= 1.0 && q <= 5.0, "phi=" + c[0] + " u=" + c[1] + " q=" + q);
                    }
                }
            }
        }

        @Test
        @DisplayName("preconditions are enforced")
        void preconditions() {
            assertThrows(IllegalArgumentException.class,
                () -> WesterinkRoufsModel.score(0, 10, false, UpsamplingMethod.BICUBIC));
            assertThrows(IllegalArgumentException.class,
                () -> WesterinkRoufsModel.score(180, 10, false, UpsamplingMethod.BICUBIC));
            assertThrows(IllegalArgumentException.class,
                () -> WesterinkRoufsModel.score(30, 1000, false, UpsamplingMethod.BICUBIC));
            assertThrows(IllegalArgumentException.class,
                () -> WesterinkRoufsModel.score(30, 10, true, null));
        }
    }

    @Test
    @DisplayName("clamp bounds raw values to [1, 5]")
    void clamp() {
        assertEquals(1.0, WesterinkRoufsModel.clamp(0.2));
        assertEquals(5.0, WesterinkRoufsModel.clamp(7.0));
        assertEquals(3.3, WesterinkRoufsModel.clamp(3.3));
    }
}
