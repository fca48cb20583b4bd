package com.sqlpush.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default observer: one INFO line per transpiled pattern.
 */
public final class LoggingTranspileObserver implements TranspileObserver {

    private static final Logger logger = LoggerFactory.getLogger(LoggingTranspileObserver.class);

    @Override
    public void onTranspile(FormatMode mode, String input, String output) {
        logger.info("Translated host date format `{}` to remote date format {}: `{}`",
            input, mode == FormatMode.SYMBOLS ? "symbols" : "specifiers", output);
    }
}
