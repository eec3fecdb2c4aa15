package com.xilinx.rapidwright.rapidflowmap.utils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class HierarchicalLogger {
    public static class CustomFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            return record.getLevel() + ": " + record.getMessage() + "\n";
        }
    }

    private final Logger logger;
    private int logHierDepth = 0;

    public HierarchicalLogger(String name) {
        logger = Logger.getLogger(name);
        logger.setUseParentHandlers(false);
    }

    public void setLevel(Level level) {
        logger.setLevel(level);
    }

    public boolean isLoggable(Level level) {
        return logger.isLoggable(level);
    }

    public void addHandler(Handler handler) {
        logger.addHandler(handler);
    }

    public synchronized void log(Level level, String msg) {
        if (logHierDepth > 0) {
            msg = "#".repeat(logHierDepth) + " " + msg;
        }
        logger.log(level, msg);
    }

    public void warning(String msg) {
        log(Level.WARNING, msg);
    }

    public void info(String msg) {
        log(Level.INFO, msg);
    }

    public void fine(String msg) {
        log(Level.FINE, msg);
    }

    public synchronized void newSubStep() {
        logHierDepth++;
    }

    public synchronized void endSubStep() {
        if (logHierDepth > 0) {
            logHierDepth--;
        }
    }

    public void logHeader(Level level, String headerName) {
        int headerLen = 80;
        int frontBlankSpace = (headerLen - 4 - headerName.length()) / 2;
        int backBlankSpace = headerLen - 4 - headerName.length() - frontBlankSpace;
        String separatorStr = "=".repeat(headerLen);
        String nameStr = "==" + " ".repeat(Math.max(frontBlankSpace, 0)) + headerName + " ".repeat(Math.max(backBlankSpace, 0)) + "==";

        log(level, "");
        log(level, separatorStr);
        log(level, nameStr);
        log(level, separatorStr);
    }

    public void infoHeader(String name) {
        logHeader(Level.INFO, name);
    }

    public static HierarchicalLogger createLogger(String logName, Path logFilePath, boolean enableConsole, Level level) {
        HierarchicalLogger logger = new HierarchicalLogger(logName);
        for (Handler handler : logger.logger.getHandlers()) {
            // loggers are cached by name, drop handlers from a previous run
            logger.logger.removeHandler(handler);
            handler.close();
        }

        if (logFilePath != null) {
            try {
                FileHandler fileHandler = new FileHandler(logFilePath.toString(), false);
                fileHandler.setFormatter(new CustomFormatter());
                fileHandler.setLevel(Level.ALL);
                logger.addHandler(fileHandler);
            } catch (IOException e) {
                throw new UncheckedIOException("Fail to open log file: " + logFilePath, e);
            }
        }

        if (enableConsole) {
            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setFormatter(new CustomFormatter());
            consoleHandler.setLevel(Level.ALL);
            logger.addHandler(consoleHandler);
        }
        logger.setLevel(level);

        return logger;
    }

    public static HierarchicalLogger createPseduoLogger(String logName) {
        return createLogger(logName, null, false, Level.INFO);
    }
}
