package com.eyelevel.dispatcher.model;

/**
 * A file produced by a service while analysing another file.
 */
public record ExtractedFile(String sha256, String fileType, String name) {
}
