package com.viewquality.service.controller;

import com.viewquality.pmos.device.DeviceProfileResolver;
import com.viewquality.pmos.error.MosError;
import com.viewquality.pmos.evaluation.EvaluationReport;
import com.viewquality.pmos.model.DeviceParams;
import com.viewquality.pmos.model.DeviceType;
import com.viewquality.pmos.model.QualityMetric;
import com.viewquality.service.dto.ErrorResponse;
import com.viewquality.service.dto.EvaluationRequest;
import com.viewquality.service.dto.MosRequest;
import com.viewquality.service.dto.MosResponse;
import com.viewquality.service.service.MosPredictionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * HTTP front end for the parametric MOS models.
 *
 * <ul>
 *   <li>{@code POST /api/v1/mos/{metric}}: fused MOS for psnr / ssim / vif / vmaf</li>
 *   <li>{@code POST /api/v1/mos/viewing-geometry}: viewing angle and angular resolution only</li>
 *   <li>{@code GET  /api/v1/mos/devices}: built-in device table</li>
 *   <li>{@code GET  /api/v1/mos/evaluation/reference?metric=}: accuracy on the bundled dataset</li>
 *   <li>{@code POST /api/v1/mos/evaluation?metric=}: accuracy on a caller dataset</li>
 * </ul>
 *
 * <p>Model rejections and unreadable bodies map to 400 with the legacy error code;
 * anything else is a 500.
 */
@RestController
@RequestMapping("/api/v1/mos")
public class MosController {

    private static final Logger log = LoggerFactory.getLogger(MosController.class);

    private final MosPredictionService predictionService;

    public MosController(MosPredictionService predictionService) {
        this.predictionService = predictionService;
    }

    @PostMapping("/{metric}")
    public Mono<ResponseEntity<Object>> predict(@PathVariable String metric, @RequestBody MosRequest request) {
        Optional<QualityMetric> kind = QualityMetric.fromName(metric);
        if (kind.isEmpty()) {
            return Mono.just(unknownMetric(metric));
        }
        return predictionService.predict(kind.get(), request)
            .map(result -> result.isSuccess()
                ? ResponseEntity.ok((Object) new MosResponse(kind.get(), result.mos(),
                    result.geometry().viewingAngle(), result.geometry().angularResolution()))
                : ResponseEntity.badRequest().body((Object) ErrorResponse.of(result.error(), result.message())))
            .onErrorResume(e -> {
                log.error("[MosAPI] predict error. metric={}", metric, e);
                return Mono.just(ResponseEntity.status(500).<Object>body(ErrorResponse.unexpected(e.getMessage())));
            });
    }

    @PostMapping("/viewing-geometry")
    public Mono<ResponseEntity<Object>> viewingGeometry(@RequestBody MosRequest request) {
        return predictionService.viewingGeometry(request)
            .map(result -> result.isSuccess()
                ? ResponseEntity.ok((Object) result.geometry())
                : ResponseEntity.badRequest().body((Object) ErrorResponse.of(result.error(), result.message())))
            .onErrorResume(e -> {
                log.error("[MosAPI] viewing-geometry error", e);
                return Mono.just(ResponseEntity.status(500).<Object>body(ErrorResponse.unexpected(e.getMessage())));
            });
    }

    @GetMapping("/devices")
    public ResponseEntity<Map<DeviceType, DeviceParams>> devices() {
        return ResponseEntity.ok(DeviceProfileResolver.builtInProfiles());
    }

    @GetMapping("/evaluation/reference")
    public Mono<ResponseEntity<Object>> evaluateReference(@RequestParam(defaultValue = "PSNR") String metric) {
        log.info("[MosAPI] reference evaluation requested. metric={}", metric);
        Optional<QualityMetric> kind = QualityMetric.fromName(metric);
        if (kind.isEmpty()) {
            return Mono.just(unknownMetric(metric));
        }
        return toResponse(predictionService.evaluateReference(kind.get()), metric);
    }

    @PostMapping("/evaluation")
    public Mono<ResponseEntity<Object>> evaluate(@RequestParam String metric,
                                                 @RequestBody EvaluationRequest request) {
        Optional<QualityMetric> kind = QualityMetric.fromName(metric);
        if (kind.isEmpty()) {
            return Mono.just(unknownMetric(metric));
        }
        log.info("[MosAPI] evaluation requested. metric={} samples={}", metric,
            request.samples() == null ? 0 : request.samples().size());
        return toResponse(predictionService.evaluate(request.samples(), kind.get(), request.setup()), metric);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    /** Missing or unreadable request bodies get the same rejection shape as model errors. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> unreadableRequest(ServerWebInputException e) {
        log.warn("[MosAPI] unreadable request. reason={}", e.getReason());
        return ResponseEntity.badRequest().body(ErrorResponse.of(MosError.MISSING_PARAMETER,
            e.getReason() != null ? e.getReason() : "request body is missing or malformed"));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Mono<ResponseEntity<Object>> toResponse(Mono<EvaluationReport> report, String metric) {
        return report
            .map(r -> ResponseEntity.ok((Object) r))
            .onErrorResume(e -> {
                log.error("[MosAPI] evaluation error. metric={}", metric, e);
                return Mono.just(ResponseEntity.status(500).<Object>body(ErrorResponse.unexpected(e.getMessage())));
            });
    }

    private ResponseEntity<Object> unknownMetric(String metric) {
        log.warn("[MosAPI] unknown metric={}", metric);
        return ResponseEntity.badRequest().<Object>body(ErrorResponse.of(MosError.INVALID_METRIC,
            "metric must be one of psnr, ssim, vif, vmaf; got " + metric));
    }
}
