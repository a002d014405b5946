package com.qoeguard.dispatch.cli;

/**
 * Report formats accepted by {@code --format}.
 */
public enum OutputFormat {
    summary,
    json,
    github
}
