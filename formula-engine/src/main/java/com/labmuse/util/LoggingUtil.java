package com.labmuse.util;

import java.io.IOException;
import java.util.logging.*;

/**
 * Centralized logging for the formula engine.
 * Thin static wrapper around java.util.logging so engine classes can log
 * without carrying logger instances around.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.labmuse");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean consoleLogging = false;
    private static boolean fileLogging = false;
    private static String logFileName = "formula-engine.log";
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    private static class StdOutHandler extends StreamHandler {
        public StdOutHandler(Level level) {
            super(System.out, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    private static class StdErrHandler extends StreamHandler {
        public StdErrHandler(Level level) {
            super(System.err, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Initialize the logging system from engine configuration.
     * Later calls are ignored until {@link #reset()}.
     */
    public static synchronized void initialize(EngineConfig config) {
        if (!initialized) {
            consoleOutputMode = config.getConsoleOutputMode();
        }
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    public static synchronized void initialize(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        setLoggingLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                fileLogging = false;
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        logger.fine("Logging initialized: level=" + currentLevel +
                ", console=" + consoleLogging +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    /**
     * Drop handlers and return to the uninitialized state.
     */
    public static synchronized void reset() {
        clearHandlers();
        initialized = false;
        consoleLogging = false;
        fileLogging = false;
        currentLevel = Level.INFO;
        consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;
    }

    private static void setLoggingLevel(String levelStr) {
        String level = levelStr == null ? "INFO" : levelStr.toUpperCase();
        switch (level) {
            case "SEVERE": case "ERROR": currentLevel = Level.SEVERE; break;
            case "WARNING": case "WARN": currentLevel = Level.WARNING; break;
            case "DEBUG": currentLevel = Level.FINE; break;
            case "TRACE": currentLevel = Level.FINEST; break;
            case "OFF": currentLevel = Level.OFF; break;
            default: currentLevel = Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new StdOutHandler(currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new StdErrHandler(currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                StdOutHandler out = new StdOutHandler(currentLevel);
                out.setFilter(r -> r.getLevel().intValue() < Level.SEVERE.intValue());
                logger.addHandler(out);
                logger.addHandler(new StdErrHandler(Level.SEVERE));
                break;
        }
        consoleLogging = true;
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void debug(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.FINE, message, t);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void warn(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.WARNING, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, logFileName);
        }
    }
}
