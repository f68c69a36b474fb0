package com.colorcorrection.pipeline;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads source images into {@link ImageFrame}s and encodes pipeline output
 * for transport.
 */
public interface ImageCodec {

    /**
     * Decodes an image file into the pipeline's RGB float domain.
     *
     * @throws IOException if the file cannot be read or decoded
     */
    ImageFrame read(Path path) throws IOException;

    /**
     * Encodes a frame as a {@code data:image/jpeg;base64,...} URI.
     */
    String encode(ImageFrame frame) throws IOException;

    /**
     * Extracts the bytes of a data URI (or a bare base64 string).
     */
    byte[] decode(String dataUri);
}
