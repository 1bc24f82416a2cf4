package com.eyelevel.dispatcher.dto.message;

/**
 * Message on the archive queue.
 *
 * @param archiveType kind of document to archive, only {@code submission} is supported
 * @param id          id of the document
 * @param deleteAfter remove the hot copy of each file blob once it is in the archive store
 */
public record ArchiveRequest(String archiveType, String id, boolean deleteAfter) {
}
