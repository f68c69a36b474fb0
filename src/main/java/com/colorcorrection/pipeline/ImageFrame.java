package com.colorcorrection.pipeline;

/**
 * Decoded RGB image in the pipeline's numeric domain: interleaved
 * {@code double} samples in [0, 1], row-major.
 *
 * Frames are large. Close them as soon as they are no longer needed so
 * concurrent workers do not pile up decoded buffers.
 */
public final class ImageFrame implements AutoCloseable {

    public static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private volatile double[] rgb;

    public ImageFrame(int width, int height, double[] rgb) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid frame size " + width + "x" + height);
        }
        if (rgb == null || rgb.length != width * height * CHANNELS) {
            throw new IllegalArgumentException("Sample buffer does not match " + width + "x" + height + " RGB");
        }
        this.width = width;
        this.height = height;
        this.rgb = rgb;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Raw sample buffer.
     *
     * @throws IllegalStateException if the frame has been released
     */
    public double[] samples() {
        double[] data = rgb;
        if (data == null) {
            throw new IllegalStateException("Image frame already released");
        }
        return data;
    }

    public boolean isReleased() {
        return rgb == null;
    }

    @Override
    public void close() {
        rgb = null;
    }
}
