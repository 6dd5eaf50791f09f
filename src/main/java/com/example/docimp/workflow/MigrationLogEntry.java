package com.example.docimp.workflow;

/**
 * One applied ledger schema migration.
 */
public record MigrationLogEntry(String from, String to, String timestamp) {
}
