package com.colorcorrection.pipeline;

/**
 * Reports whether pipeline work can run on a GPU.
 */
public interface GpuProbe {

    boolean isGpuAvailable();
}
