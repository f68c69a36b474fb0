package com.colorcorrection.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Iterator;

/**
 * {@link ImageCodec} backed by the JDK's ImageIO. Encodes JPEG.
 */
@Component
@Slf4j
public class ImageIoCodec implements ImageCodec {

    private static final String DATA_URI_PREFIX = "data:image/jpeg;base64,";

    private final float jpegQuality;

    public ImageIoCodec(@Value("${app.codec.jpeg-quality:85}") int jpegQuality) {
        this.jpegQuality = Math.max(1, Math.min(100, jpegQuality)) / 100f;
    }

    @Override
    public ImageFrame read(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IOException("Failed to load image: " + path);
        }
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Failed to load image: " + path);
        }
        int width = image.getWidth();
        int height = image.getHeight();
        double[] samples = new double[width * height * ImageFrame.CHANNELS];
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                samples[i++] = ((argb >> 16) & 0xFF) / 255.0;
                samples[i++] = ((argb >> 8) & 0xFF) / 255.0;
                samples[i++] = (argb & 0xFF) / 255.0;
            }
        }
        return new ImageFrame(width, height, samples);
    }

    @Override
    public String encode(ImageFrame frame) throws IOException {
        BufferedImage image = new BufferedImage(frame.width(), frame.height(), BufferedImage.TYPE_INT_RGB);
        double[] samples = frame.samples();
        int i = 0;
        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                int r = toByte(samples[i++]);
                int g = toByte(samples[i++]);
                int b = toByte(samples[i++]);
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return DATA_URI_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray());
    }

    @Override
    public byte[] decode(String dataUri) {
        String payload = dataUri;
        int comma = payload.indexOf(',');
        if (comma >= 0) {
            payload = payload.substring(comma + 1);
        }
        return Base64.getDecoder().decode(payload);
    }

    private static int toByte(double value) {
        long scaled = Math.round(value * 255.0);
        return (int) Math.max(0, Math.min(255, scaled));
    }
}
