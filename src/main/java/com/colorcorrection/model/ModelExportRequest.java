package com.colorcorrection.model;

/**
 * @param name   file name without extension, blank for a timestamped default
 * @param folder target directory, blank for the configured models folder
 */
public record ModelExportRequest(
    String name,
    String folder
) {}
