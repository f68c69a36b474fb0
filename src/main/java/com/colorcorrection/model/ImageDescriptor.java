package com.colorcorrection.model;

import java.nio.file.Path;

/**
 * An image registered in the session.
 *
 * @param filename display name
 * @param path     location on disk
 * @param preview  encoded preview (data URI), may be null
 */
public record ImageDescriptor(
    String filename,
    Path path,
    String preview
) {}
