package com.colorcorrection.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ImageIoCodecTest {

    @TempDir
    Path dir;

    private final ImageIoCodec codec = new ImageIoCodec(90);

    @Test
    void readsPixelsIntoUnitRange() throws IOException {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0xFF0000);
        image.setRGB(1, 0, 0x0080FF);
        Path file = dir.resolve("pixels.png");
        ImageIO.write(image, "png", file.toFile());

        try (ImageFrame frame = codec.read(file)) {
            assertThat(frame.width()).isEqualTo(2);
            assertThat(frame.height()).isEqualTo(1);
            double[] samples = frame.samples();
            assertThat(samples[0]).isEqualTo(1.0);
            assertThat(samples[1]).isZero();
            assertThat(samples[4]).isCloseTo(128 / 255.0, within(1e-9));
            assertThat(samples[5]).isEqualTo(1.0);
        }
    }

    @Test
    void rejectsMissingAndUndecodableFiles() throws IOException {
        assertThatThrownBy(() -> codec.read(dir.resolve("missing.jpg")))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Failed to load image:");

        Path garbage = Files.writeString(dir.resolve("garbage.jpg"), "not an image");
        assertThatThrownBy(() -> codec.read(garbage)).isInstanceOf(IOException.class);
    }

    @Test
    void encodesJpegDataUri() throws IOException {
        ImageFrame frame = new ImageFrame(2, 2, new double[]{
                0.5, 0.5, 0.5, 0.5, 0.5, 0.5,
                0.5, 0.5, 0.5, 0.5, 0.5, 0.5});

        String uri = codec.encode(frame);

        assertThat(uri).startsWith("data:image/jpeg;base64,");
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(codec.decode(uri)));
        assertThat(decoded.getWidth()).isEqualTo(2);
        assertThat(decoded.getHeight()).isEqualTo(2);
    }

    @Test
    void decodeAcceptsBareBase64() {
        assertThat(codec.decode("AQID")).containsExactly(1, 2, 3);
    }

    @Test
    void releasedFrameCannotBeEncoded() {
        ImageFrame frame = new ImageFrame(1, 1, new double[]{0, 0, 0});
        frame.close();

        assertThatThrownBy(() -> codec.encode(frame)).isInstanceOf(IllegalStateException.class);
    }
}
