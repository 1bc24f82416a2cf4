package com.eyelevel.dispatcher.dto.message;

/**
 * A file declared in a submission request. The blob is expected in the file store under its sha256.
 */
public record SubmittedFile(String sha256, String fileType, String name) {
}
