package com.taskboard;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide log written to the configured log file and, optionally, the console.
 * Each session starts with a banner naming where data lives and which chat backend is in use.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    private static AppLogger instance;

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private volatile boolean debugEnabled;

    AppLogger(Path logFile, PrintStream consoleOutput, boolean consoleEnabled, String sessionDetails)
        throws IOException {
        this.consoleOutput = consoleOutput;
        this.consoleEnabled = consoleEnabled;
        if (logFile == null) {
            this.fileOutput = null;
            return;
        }
        Path parent = logFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.fileOutput = new PrintStream(new FileOutputStream(logFile.toFile(), true), true,
            StandardCharsets.UTF_8.name());
        fileOutput.println();
        fileOutput.println("---- Taskboard session " + LocalDateTime.now().format(TIME_FORMAT) + " ----");
        if (sessionDetails != null && !sessionDetails.isBlank()) {
            fileOutput.println("---- " + sessionDetails + " ----");
        }
    }

    /**
     * Start the process log from configuration. Later calls keep the first logger.
     */
    public static synchronized void initialize(AppConfig config, boolean consoleEnabled) throws IOException {
        if (instance != null) {
            return;
        }
        instance = new AppLogger(config.getLogPath(), System.out, consoleEnabled, describe(config));
        instance.setDebugEnabled(config.isDebug());
    }

    public static AppLogger get() {
        return instance;
    }

    static String describe(AppConfig config) {
        String data = config.getDataDirectory() != null ? config.getDataDirectory().toString() : "memory only";
        return "data: " + data + ", chat: " + config.getChatProvider() + " " + config.getChatModel()
            + " at " + config.getChatBaseUrl();
    }

    public void setDebugEnabled(boolean debugEnabled) {
        this.debugEnabled = debugEnabled;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void debug(String message) {
        if (debugEnabled) {
            write(Level.DEBUG, message, null);
        }
    }

    public void info(String message) {
        write(Level.INFO, message, null);
    }

    public void warn(String message) {
        write(Level.WARN, message, null);
    }

    public void error(String message) {
        write(Level.ERROR, message, null);
    }

    public void error(String message, Throwable cause) {
        write(Level.ERROR, message, cause);
    }

    static String format(LocalDateTime time, Level level, String message) {
        return String.format("%s %-5s %s", time.format(TIME_FORMAT), level, message);
    }

    // one lock so a line and its stack trace stay together when requests log concurrently
    private synchronized void write(Level level, String message, Throwable cause) {
        String line = format(LocalDateTime.now(), level, message);
        if (fileOutput != null) {
            fileOutput.println(line);
            if (cause != null) {
                cause.printStackTrace(fileOutput);
            }
        }
        if (consoleEnabled) {
            consoleOutput.println(line);
            if (cause != null) {
                cause.printStackTrace(consoleOutput);
            }
        }
    }

    public synchronized void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
