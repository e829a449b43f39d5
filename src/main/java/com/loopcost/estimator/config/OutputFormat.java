package com.loopcost.estimator.config;

import java.util.Locale;

/**
 * How results are printed to standard output.
 */
public enum OutputFormat {
    TEXT,
    JSON;

    public static OutputFormat fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
