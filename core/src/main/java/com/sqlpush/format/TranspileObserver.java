package com.sqlpush.format;

/**
 * Receives one notification per transpiled date pattern.
 */
@FunctionalInterface
public interface TranspileObserver {

    /**
     * Called after a pattern has been transpiled.
     *
     * @param mode the target notation
     * @param input the host pattern
     * @param output the remote pattern
     */
    void onTranspile(FormatMode mode, String input, String output);

    TranspileObserver NONE = (mode, input, output) -> { };
}
