package dumb.argue.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Log {

    private static final Logger logger = LoggerFactory.getLogger("dumb.argue");

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void debug(String message) {
        message(message, LogLevel.DEBUG);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void error(String message, Throwable cause) {
        logger.error(message, cause);
    }

    public static void message(String message, LogLevel level) {
        switch (level) {
            case DEBUG -> logger.debug(message);
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
    }

    public enum LogLevel {
        DEBUG, INFO, WARNING, ERROR
    }
}
