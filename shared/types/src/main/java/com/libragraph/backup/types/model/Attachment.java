package com.libragraph.backup.types.model;

/**
 * Reference to a media attachment stored outside the message row.
 */
public record Attachment(
        String contentType,
        String fileName,
        long size,
        String cdnKey,
        boolean voiceNote
) {}
