package com.viewquality.service.dataset;

import com.viewquality.pmos.evaluation.LabelledSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDatasetLoaderTest {

    @Test
    @DisplayName("bundled reference dataset has 70 labelled samples")
    void bundledDataset() {
        ReferenceDatasetLoader loader = new ReferenceDatasetLoader();
        ReflectionTestUtils.setField(loader, "dataset", new ClassPathResource("datasets/netflix-public-hdtv.csv"));
        loader.load();

        List<LabelledSample> samples = loader.samples();
        assertEquals(70, samples.size());

        LabelledSample s10 = samples.get(9);
        assertEquals("s10", s10.name());
        assertEquals(1920, s10.width());
        assertEquals(1080, s10.height());
        assertEquals(41.03835, s10.psnr());
        assertEquals(0.977687, s10.ssim());
        assertNull(s10.vif());
        assertNull(s10.vmaf());
        assertEquals(4.8077, s10.mos());
        assertThrows(UnsupportedOperationException.class, () -> samples.add(s10));
    }

    @Test
    @DisplayName("columns matched by header; comments, blank lines and empty cells tolerated")
    void mixedColumns() {
        List<LabelledSample> samples =
            ReferenceDatasetLoader.parse(new ClassPathResource("datasets/mixed-metrics.csv"));
        assertEquals(3, samples.size());
        assertEquals(93.5, samples.get(0).vmaf());
        assertNull(samples.get(1).vmaf());
        assertNull(samples.get(2).ssim());
        assertEquals(1280, samples.get(2).width());
        assertEquals(720, samples.get(2).height());
    }

    @Test
    @DisplayName("unparseable cell fails loudly with the line number")
    void malformedRow() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> ReferenceDatasetLoader.parse(new ClassPathResource("datasets/malformed.csv")));
        assertTrue(e.getMessage().contains("row 2"), e.getMessage());
    }

    @Test
    @DisplayName("missing required column is rejected")
    void missingColumn() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> ReferenceDatasetLoader.parse(new ClassPathResource("datasets/missing-column.csv")));
        assertTrue(e.getMessage().contains("height"));
    }
}
