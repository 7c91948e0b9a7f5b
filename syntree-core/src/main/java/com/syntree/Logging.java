package com.syntree;

import org.apache.log4j.Logger;

/**
 * Loggers for the library, all below {@code com.syntree}. Configure them
 * through the usual log4j setup of the host application.
 */
public final class Logging {

    private static final String SYNTREE_LOGGER_NAME = "com.syntree";

    private Logging() {
        // Utility class
    }

    /**
     * @param component suffix appended to the root logger name
     * @return logger for one component of the library
     */
    public static Logger getLogger(String component) {
        return Logger.getLogger(SYNTREE_LOGGER_NAME + "." + component);
    }
}
