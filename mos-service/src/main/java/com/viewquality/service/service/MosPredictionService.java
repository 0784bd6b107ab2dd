package com.viewquality.service.service;

import com.viewquality.pmos.ParametricMos;
import com.viewquality.pmos.device.DeviceProfileResolver;
import com.viewquality.pmos.error.GeometryResult;
import com.viewquality.pmos.error.MosComputationException;
import com.viewquality.pmos.error.MosError;
import com.viewquality.pmos.error.MosResult;
import com.viewquality.pmos.evaluation.EvaluationReport;
import com.viewquality.pmos.evaluation.LabelledSample;
import com.viewquality.pmos.evaluation.MosEvaluator;
import com.viewquality.pmos.model.DeviceParams;
import com.viewquality.pmos.model.DeviceType;
import com.viewquality.pmos.model.PlaybackSetup;
import com.viewquality.pmos.model.QualityMetric;
import com.viewquality.service.config.MosDefaultsProperties;
import com.viewquality.service.dataset.ReferenceDatasetLoader;
import com.viewquality.service.dto.MosRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reactive wrapper around {@link ParametricMos} and {@link MosEvaluator}.
 *
 * <p>Fills request gaps from {@link MosDefaultsProperties} and the device table,
 * then delegates. The models are pure arithmetic, so calls run inline via
 * {@code Mono.fromCallable} without a scheduler hop.
 *
 * <p>Model rejections come back as failed {@link MosResult}/{@link GeometryResult}
 * values, not as error signals; only unexpected exceptions reach {@code onError}.
 */
@Service
public class MosPredictionService {

    private static final Logger log = LoggerFactory.getLogger(MosPredictionService.class);

    /** Valid player dimension used only when the device is rejected anyway. */
    private static final int UNRESOLVED_PLAYER_DIMENSION = 1;

    private final MosDefaultsProperties defaults;
    private final ReferenceDatasetLoader referenceDataset;

    public MosPredictionService(MosDefaultsProperties defaults, ReferenceDatasetLoader referenceDataset) {
        this.defaults = defaults;
        this.referenceDataset = referenceDataset;
    }

    public Mono<MosResult> predict(QualityMetric metric, MosRequest request) {
        return Mono.fromCallable(() -> {
            if (request.metricValue() == null) {
                return MosResult.failure(MosError.INVALID_METRIC, metric + " value is required");
            }
            PlaybackSetup setup = toSetup(request);
            return ParametricMos.predict(metric, request.metricValue(),
                request.videoWidth(), request.videoHeight(), setup);
        }).doOnNext(result -> logOutcome(metric.name(), request, result.isSuccess(),
            result.isSuccess() ? String.format("mos=%.4f", result.mos()) : result.error() + " " + result.message()));
    }

    public Mono<GeometryResult> viewingGeometry(MosRequest request) {
        return Mono.fromCallable(() -> {
            PlaybackSetup setup = toSetup(request);
            return ParametricMos.viewingGeometry(request.videoWidth(), request.videoHeight(),
                setup.playerWidth(), setup.playerHeight(), setup.hdr(), setup.upsampling(),
                setup.device(), setup.customDevice());
        }).doOnNext(result -> logOutcome("GEOMETRY", request, result.isSuccess(),
            result.isSuccess() ? result.geometry().toString() : result.error() + " " + result.message()));
    }

    /** Evaluates the bundled reference dataset under its own viewing conditions. */
    public Mono<EvaluationReport> evaluateReference(QualityMetric metric) {
        return evaluate(referenceDataset.samples(), metric, null)
            .doOnNext(report -> log.info("[MosService] reference evaluation. metric={} evaluated={} rms={}",
                metric, report.evaluated(), String.format("%.4f", report.rms())));
    }

    /**
     * Evaluates caller samples. A null setup means full-screen SDR on the built-in TV.
     */
    public Mono<EvaluationReport> evaluate(List<LabelledSample> samples, QualityMetric metric, PlaybackSetup setup) {
        PlaybackSetup effective = setup != null ? setup : referenceSetup();
        return Mono.fromCallable(() -> MosEvaluator.evaluate(samples, metric, effective))
            .doOnNext(report -> {
                if (!report.failures().isEmpty()) {
                    log.warn("[MosService] evaluation skipped {} samples. metric={} first={}",
                        report.failures().size(), metric, report.failures().get(0));
                }
            });
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static PlaybackSetup referenceSetup() {
        return PlaybackSetup.fullScreen(DeviceType.TV, DeviceProfileResolver.builtInProfiles().get(DeviceType.TV));
    }

    /**
     * Applies defaults. A missing player size means full screen on the resolved display.
     *
     * <p>When the device cannot be resolved the missing dimension is left as a placeholder
     * and the facade reports the rejection, so video size, player size, HDR and upsampling
     * errors still take precedence over device errors.
     */
    PlaybackSetup toSetup(MosRequest request) {
        int device     = request.device()     != null ? request.device()     : defaults.getDevice();
        int hdr        = request.hdr()        != null ? request.hdr()        : defaults.getHdr();
        int upsampling = request.upsampling() != null ? request.upsampling() : defaults.getUpsampling();

        int playerWidth;
        int playerHeight;
        if (request.playerWidth() != null && request.playerHeight() != null) {
            playerWidth  = request.playerWidth();
            playerHeight = request.playerHeight();
        } else {
            DeviceParams display = fullScreenDisplay(device, request.customDevice());
            playerWidth  = request.playerWidth()  != null ? request.playerWidth()
                : display != null ? display.displayWidth()  : UNRESOLVED_PLAYER_DIMENSION;
            playerHeight = request.playerHeight() != null ? request.playerHeight()
                : display != null ? display.displayHeight() : UNRESOLVED_PLAYER_DIMENSION;
        }
        return new PlaybackSetup(playerWidth, playerHeight, hdr, upsampling, device, request.customDevice());
    }

    private static DeviceParams fullScreenDisplay(int device, DeviceParams customDevice) {
        try {
            return DeviceProfileResolver.resolve(device, customDevice).params();
        } catch (MosComputationException e) {
            // re-resolved and reported by ParametricMos after the earlier checks
            log.debug("[MosService] full-screen size unavailable. device={} reason={}", device, e.getError());
            return null;
        }
    }

    private void logOutcome(String operation, MosRequest request, boolean success, String detail) {
        if (success) {
            log.info("[MosService] {} complete. video={}x{} device={} result={}", operation,
                request.videoWidth(), request.videoHeight(), request.device(), detail);
        } else {
            log.warn("[MosService] {} rejected. video={}x{} device={} reason={}", operation,
                request.videoWidth(), request.videoHeight(), request.device(), detail);
        }
    }
}
