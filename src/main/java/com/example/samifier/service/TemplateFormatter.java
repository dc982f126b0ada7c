package com.example.samifier.service;

import com.example.samifier.model.OutputFormat;

/**
 * Post-processes the serialized template, e.g. an external pretty printer.
 */
public interface TemplateFormatter {

    String format(String templateText, OutputFormat format);
}
