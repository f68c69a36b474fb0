package com.colorcorrection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Color Correction Batch Service.
 *
 * The correction library itself is plugged in as a CorrectionPipelineFactory
 * bean; without one the service starts and reports the pipeline as unavailable.
 */
@SpringBootApplication
public class ColorCorrectionBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ColorCorrectionBatchApplication.class, args);
    }
}
