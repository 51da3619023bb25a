package com.panorama.imageOperator;

import com.panorama.TestImages;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.bytedeco.opencv.global.opencv_core.CV_32F;

class GrayImageIOTest {

    @TempDir
    Path tempDir;

    private final GrayImageIO io = new GrayImageIO();

    @Test
    void pngKeepsEightBitPrecision() throws IOException {
        Mat image = TestImages.texture(40, 30, 1.5, 2L);
        Path file = tempDir.resolve("nested/out.png");

        io.save(image, file);
        Mat loaded = io.load(file);

        assertThat(Files.exists(file)).isTrue();
        assertThat(loaded.type()).isEqualTo(CV_32F);
        assertThat(loaded.cols()).isEqualTo(40);
        assertThat(loaded.rows()).isEqualTo(30);
        for (int y = 0; y < 30; y += 7) {
            for (int x = 0; x < 40; x += 9) {
                assertThat(TestImages.get(loaded, x, y)).isCloseTo(TestImages.get(image, x, y), within(1f / 255));
            }
        }
    }

    @Test
    void missingFileIsAnIOException() {
        assertThatThrownBy(() -> io.load(tempDir.resolve("missing.png")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("missing.png");
    }

    @Test
    void undecodableFileIsAnIOException() throws IOException {
        Path garbage = Files.write(tempDir.resolve("garbage.jpg"), new byte[]{1, 2, 3, 4});

        assertThatThrownBy(() -> io.load(garbage)).isInstanceOf(IOException.class);
    }
}
