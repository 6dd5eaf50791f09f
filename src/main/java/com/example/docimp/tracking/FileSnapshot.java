package com.example.docimp.tracking;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;

/**
 * Content fingerprint of one tracked file at capture time.
 *
 * @param filepath  path as given by the caller
 * @param timestamp last-modified time of the file, written as fractional epoch seconds
 * @param checksum  SHA-256 hex digest of the file contents
 * @param size      size in bytes
 */
public record FileSnapshot(
        String filepath,
        @JsonFormat(shape = JsonFormat.Shape.NUMBER) Instant timestamp,
        String checksum,
        long size
) {
}
