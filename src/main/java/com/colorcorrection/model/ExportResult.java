package com.colorcorrection.model;

import java.nio.file.Path;
import java.util.List;

/**
 * @param directory  where the files were written
 * @param saved      files written
 * @param failed     names of the images that could not be written
 * @param imageCount number of source images the files came from
 */
public record ExportResult(
    Path directory,
    List<Path> saved,
    List<String> failed,
    int imageCount
) {
    public ExportResult {
        saved = List.copyOf(saved);
        failed = List.copyOf(failed);
    }
}
