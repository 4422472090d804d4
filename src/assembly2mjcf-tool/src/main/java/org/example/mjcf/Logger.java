package org.example.mjcf;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Console logger for the exporter. The level is read once from the
 * {@code assembly2mjcf.loglevel} system property (none, error, warn, info,
 * debug; default warn). Errors and warnings go to stderr, everything else to
 * stdout. Every line carries the tool name so messages stay recognizable when
 * the exporter runs inside a larger pipeline.
 */
public class Logger {
    public enum Level {
        NONE(0), ERROR(1), WARN(2), INFO(3), DEBUG(4);
        final int value;
        Level(int value) { this.value = value; }
    }

    static final String TOOL_NAME = "assembly2mjcf";

    private static final Level CURRENT_LEVEL;

    static {
        String prop = System.getProperty(TOOL_NAME + ".loglevel", "warn").toUpperCase();
        Level detected;
        try {
            detected = Level.valueOf(prop);
        } catch (IllegalArgumentException e) {
            detected = Level.WARN;
        }
        CURRENT_LEVEL = detected;
    }

    public static Level getLevel() {
        return CURRENT_LEVEL;
    }

    public static boolean isDebugEnabled() { return CURRENT_LEVEL.value >= Level.DEBUG.value; }
    public static boolean isInfoEnabled()  { return CURRENT_LEVEL.value >= Level.INFO.value; }
    public static boolean isWarnEnabled()  { return CURRENT_LEVEL.value >= Level.WARN.value; }
    public static boolean isErrorEnabled() { return CURRENT_LEVEL.value >= Level.ERROR.value; }

    public static void error(String msg, Object... args) {
        if (isErrorEnabled()) System.err.printf(format("ERROR", msg), args);
    }

    public static void warn(String msg, Object... args) {
        if (isWarnEnabled()) System.err.printf(format("WARN", msg), args);
    }

    public static void info(String msg, Object... args) {
        if (isInfoEnabled()) System.out.printf(format("INFO", msg), args);
    }

    public static void debug(String msg, Object... args) {
        if (isDebugEnabled()) System.out.printf(format("DEBUG", msg), args);
    }

    public static void error(String msg, Throwable t) {
        if (isErrorEnabled()) {
            StringWriter sw = new StringWriter();
            t.printStackTrace(new PrintWriter(sw));
            error("%s%n%s", msg, sw.toString());
        }
    }

    private static String format(String level, String msg) {
        return String.format("[%-5s] %s: ", level, TOOL_NAME) + msg + "%n";
    }
}
