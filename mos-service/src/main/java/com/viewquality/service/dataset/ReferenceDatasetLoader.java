package com.viewquality.service.dataset;

import com.viewquality.pmos.evaluation.LabelledSample;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the bundled subjective dataset (Netflix public set, HDTV, SDR, full-screen)
 * used by {@code GET /api/v1/mos/evaluation/reference}.
 *
 * <h3>Format</h3>
 * <pre>
 *   name,width,height,psnr,ssim,mos[,vif][,vmaf]
 * </pre>
 * Columns are matched by header name in any order. {@code name}, {@code width},
 * {@code height} and {@code mos} are required; empty metric cells become {@code null}.
 * Blank lines and lines starting with {@code #} are skipped.
 *
 * <p>A malformed dataset fails start-up: the reference evaluation would otherwise
 * silently report on a partial set.
 */
@Component
public class ReferenceDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDatasetLoader.class);

    @Value("${mos.evaluation.reference-dataset:classpath:datasets/netflix-public-hdtv.csv}")
    private Resource dataset;

    private List<LabelledSample> samples = List.of();

    @PostConstruct
    public void load() {
        samples = parse(dataset);
        log.info("[ReferenceDataset] loaded {} samples from {}", samples.size(), dataset.getDescription());
    }

    /** Immutable list of reference samples in file order. */
    public List<LabelledSample> samples() {
        return samples;
    }

    /**
     * Parses a dataset resource.
     *
     * @throws IllegalStateException if the header or a row is malformed
     * @throws UncheckedIOException  if the resource cannot be read
     */
    public static List<LabelledSample> parse(Resource resource) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String header = nextDataLine(reader);
            if (header == null) {
                throw new IllegalStateException("Dataset is empty: " + resource.getDescription());
            }
            Map<String, Integer> columns = indexColumns(header);

            List<LabelledSample> parsed = new ArrayList<>();
            String line;
            int lineNo = 1;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank() || line.startsWith("#")) continue;
                parsed.add(parseRow(line, columns, lineNo));
            }
            return Collections.unmodifiableList(parsed);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read dataset " + resource.getDescription(), e);
        }
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static String nextDataLine(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank() && !line.startsWith("#")) return line;
        }
        return null;
    }

    private static Map<String, Integer> indexColumns(String header) {
        String[] names = header.split(",");
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            columns.put(names[i].trim().toLowerCase(), i);
        }
        for (String required : List.of("name", "width", "height", "mos")) {
            if (!columns.containsKey(required)) {
                throw new IllegalStateException("Dataset header missing column '" + required + "': " + header);
            }
        }
        return columns;
    }

    private static LabelledSample parseRow(String line, Map<String, Integer> columns, int lineNo) {
        String[] cells = line.split(",", -1);
        try {
            return new LabelledSample(
                cell(cells, columns, "name"),
                Integer.parseInt(cell(cells, columns, "width")),
                Integer.parseInt(cell(cells, columns, "height")),
                optionalDouble(cells, columns, "psnr"),
                optionalDouble(cells, columns, "ssim"),
                optionalDouble(cells, columns, "vif"),
                optionalDouble(cells, columns, "vmaf"),
                Double.parseDouble(cell(cells, columns, "mos")));
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            throw new IllegalStateException("Malformed dataset row " + lineNo + ": " + line, e);
        }
    }

    private static String cell(String[] cells, Map<String, Integer> columns, String name) {
        return cells[columns.get(name)].trim();
    }

    private static Double optionalDouble(String[] cells, Map<String, Integer> columns, String name) {
        Integer idx = columns.get(name);
        if (idx == null || idx >= cells.length || cells[idx].isBlank()) return null;
        return Double.valueOf(cells[idx].trim());
    }
}
