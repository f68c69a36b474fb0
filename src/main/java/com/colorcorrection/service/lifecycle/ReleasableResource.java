package com.colorcorrection.service.lifecycle;

/**
 * Something that must be released once when the service shuts down.
 */
public interface ReleasableResource {

    String resourceName();

    void release() throws Exception;
}
