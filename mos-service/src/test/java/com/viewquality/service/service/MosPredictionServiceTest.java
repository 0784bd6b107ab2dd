package com.viewquality.service.service;

import com.viewquality.pmos.ParametricMos;
import com.viewquality.pmos.error.MosError;
import com.viewquality.pmos.error.MosResult;
import com.viewquality.pmos.evaluation.LabelledSample;
import com.viewquality.pmos.model.DeviceParams;
import com.viewquality.pmos.model.PlaybackSetup;
import com.viewquality.pmos.model.QualityMetric;
import com.viewquality.service.config.MosDefaultsProperties;
import com.viewquality.service.dataset.ReferenceDatasetLoader;
import com.viewquality.service.dto.MosRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MosPredictionServiceTest {

    private MosDefaultsProperties defaults;
    private MosPredictionService service;

    @BeforeEach
    void setUp() {
        defaults = new MosDefaultsProperties();
        ReferenceDatasetLoader loader = new ReferenceDatasetLoader();
        ReflectionTestUtils.setField(loader, "dataset", new ClassPathResource("datasets/netflix-public-hdtv.csv"));
        loader.load();
        service = new MosPredictionService(defaults, loader);
    }

    private static MosRequest request(Double value, int width, int height) {
        return new MosRequest(value, width, height, null, null, null, null, null, null);
    }

    @Nested
    @DisplayName("predict()")
    class PredictTests {

        @Test
        @DisplayName("omitted selectors default to full-screen SDR bicubic on the TV")
        void defaultsToTvFullScreen() {
            StepVerifier.create(service.predict(QualityMetric.PSNR, request(41.03835, 1920, 1080)))
                .assertNext(result -> {
                    assertTrue(result.isSuccess());
                    assertEquals(4.4382, result.mos(), 1e-3);
                    assertEquals(33.0087, result.geometry().viewingAngle(), 1e-3);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("configured default device is honoured")
        void configuredDefaultDevice() {
            defaults.setDevice(0);
            PlaybackSetup setup = service.toSetup(request(40.0, 1920, 1080));
            assertEquals(2400, setup.playerWidth());
            assertEquals(1080, setup.playerHeight());
            assertEquals(0, setup.device());
        }

        @Test
        @DisplayName("explicit player size wins over full-screen default")
        void explicitPlayer() {
            MosRequest r = new MosRequest(40.0, 1280, 720, 1280, 720, 1, 2, 2, null);
            PlaybackSetup setup = service.toSetup(r);
            assertEquals(1280, setup.playerWidth());
            assertEquals(1, setup.hdr());
            assertEquals(2, setup.upsampling());
        }

        @Test
        @DisplayName("missing metric value → INVALID_METRIC")
        void missingValue() {
            StepVerifier.create(service.predict(QualityMetric.SSIM, request(null, 1920, 1080)))
                .assertNext(result -> assertEquals(MosError.INVALID_METRIC, result.error()))
                .verifyComplete();
        }

        @Test
        @DisplayName("custom device without profile and without player size → MISSING_PARAMETER")
        void customWithoutProfile() {
            MosRequest r = new MosRequest(80.0, 1920, 1080, null, null, null, null, 4, null);
            StepVerifier.create(service.predict(QualityMetric.VMAF, r))
                .assertNext(result -> assertEquals(MosError.MISSING_PARAMETER, result.error()))
                .verifyComplete();
        }

        @Test
        @DisplayName("unknown device without player size → INVALID_DEVICE")
        void unknownDevice() {
            MosRequest r = new MosRequest(80.0, 1920, 1080, null, null, null, null, 9, null);
            StepVerifier.create(service.predict(QualityMetric.VMAF, r))
                .assertNext(result -> assertEquals(MosError.INVALID_DEVICE, result.error()))
                .verifyComplete();
        }

        @Test
        @DisplayName("video size is checked before the device when the player size is omitted")
        void resolutionCheckedBeforeDevice() {
            MosRequest r = new MosRequest(40.0, 0, 1080, null, null, 7, null, 4, null);
            MosResult direct = ParametricMos.predict(QualityMetric.PSNR, 40.0, 0, 1080, 1920, 1080, 7, 0, 4, null);
            StepVerifier.create(service.predict(QualityMetric.PSNR, r))
                .assertNext(result -> {
                    assertEquals(MosError.INVALID_RESOLUTION, result.error());
                    assertEquals(direct.error(), result.error());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("HDR flag is checked before the device when the player size is omitted")
        void hdrCheckedBeforeDevice() {
            MosRequest r = new MosRequest(40.0, 1920, 1080, null, null, 7, null, 9, null);
            StepVerifier.create(service.predict(QualityMetric.PSNR, r))
                .assertNext(result -> assertEquals(MosError.INVALID_HDR_FLAG, result.error()))
                .verifyComplete();
            StepVerifier.create(service.viewingGeometry(r))
                .assertNext(result -> assertEquals(MosError.INVALID_HDR_FLAG, result.error()))
                .verifyComplete();
        }

        @Test
        @DisplayName("custom device fills the player from its own display size")
        void customFullScreen() {
            DeviceParams laptop = DeviceParams.inches(1920, 1080, 141, 141, 20);
            MosRequest r = new MosRequest(85.0, 1280, 720, null, null, null, null, 4, laptop);
            StepVerifier.create(service.predict(QualityMetric.VMAF, r))
                .assertNext(result -> assertEquals(3.8381, result.mos(), 1e-3))
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("viewingGeometry() propagates rejections as values")
    void geometry() {
        StepVerifier.create(service.viewingGeometry(request(null, 0, 1080)))
            .assertNext(result -> assertEquals(MosError.INVALID_RESOLUTION, result.error()))
            .verifyComplete();

        StepVerifier.create(service.viewingGeometry(request(null, 1920, 1080)))
            .assertNext(result -> assertEquals(28.2743, result.geometry().angularResolution(), 1e-3))
            .verifyComplete();
    }

    @Nested
    @DisplayName("evaluation")
    class EvaluationTests {

        @Test
        @DisplayName("reference dataset: PSNR and SSIM models both reach RMS below 0.5")
        void referenceRms() {
            for (QualityMetric metric : List.of(QualityMetric.PSNR, QualityMetric.SSIM)) {
                StepVerifier.create(service.evaluateReference(metric))
                    .assertNext(report -> {
                        assertEquals(70, report.evaluated());
                        assertTrue(report.failures().isEmpty());
                        assertTrue(report.rms() < 0.5, metric + " rms=" + report.rms());
                    })
                    .verifyComplete();
            }
        }

        @Test
        @DisplayName("reference dataset has no VIF values → every sample is a failure")
        void referenceWithoutVif() {
            StepVerifier.create(service.evaluateReference(QualityMetric.VIF))
                .assertNext(report -> {
                    assertEquals(0, report.evaluated());
                    assertEquals(70, report.failures().size());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("null sample is listed as a failure, not an error signal")
        void nullSample() {
            StepVerifier.create(service.evaluate(Arrays.asList((LabelledSample) null), QualityMetric.PSNR, null))
                .assertNext(report -> {
                    assertEquals(0, report.evaluated());
                    assertEquals(List.of("#0: null sample"), report.failures());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("caller samples with explicit setup")
        void callerSamples() {
            List<LabelledSample> samples = List.of(
                new LabelledSample("a", 1920, 1080, null, null, null, 90.0, 4.5));
            PlaybackSetup setup = new PlaybackSetup(3840, 2160, 0, 0, 3, null);
            StepVerifier.create(service.evaluate(samples, QualityMetric.VMAF, setup))
                .assertNext(report -> {
                    assertEquals(1, report.evaluated());
                    assertEquals(4.4089 - 4.5, report.predictions().get(0).delta(), 1e-3);
                })
                .verifyComplete();
        }
    }
}
