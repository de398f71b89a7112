package org.carball.querylens.config;

public enum OutputFormat {
    JSON,
    TEXT,
    BOTH
}
