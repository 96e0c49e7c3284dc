package com.gamelog.core.parser;

/**
 * A log line split into its clock text and everything after it.
 */
public record TokenizedLine(String timestamp, String content) {
}
