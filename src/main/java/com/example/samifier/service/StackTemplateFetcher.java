package com.example.samifier.service;

/**
 * Supplies the template of a deployed stack. No implementation ships with the tool;
 * register one as a bean to enable {@code --stack} without a cdk.out directory.
 */
public interface StackTemplateFetcher {

    /**
     * @throws com.example.samifier.exception.TemplateSourceException when the stack cannot be read
     */
    String fetch(String stackName);
}
