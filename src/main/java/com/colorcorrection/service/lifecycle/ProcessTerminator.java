package com.colorcorrection.service.lifecycle;

/**
 * Ends the process after an explicit shutdown request.
 */
@FunctionalInterface
public interface ProcessTerminator {

    void terminate(int exitCode);
}
