package com.colorcorrection.model;

import java.nio.file.Path;

public record ModelExportResult(
    String name,
    Path path,
    Path directory
) {}
