package io.reqbind.standalone.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.reqbind.standalone.config.ServerConfig;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of {@link ServerConfig} to Logback, replacing whatever
 * {@code logback.xml} set up.
 *
 * <p>The configured level applies to {@code io.reqbind} and the root logger. Jetty and Javalin are
 * capped by {@link #LIBRARY_LEVELS} so DEBUG does not flood the output with connector chatter.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDOUT";

    /** Text layout; {@code requestId} comes from the MDC set by {@link EndpointHandler}. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level [%X{requestId:-startup}] %logger{24} - %msg%n";

    static final Map<String, Level> LIBRARY_LEVELS = Map.of(
            "org.eclipse.jetty", Level.WARN,
            "io.javalin", Level.INFO);

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Reconfigures logging from the server config. An unknown level name falls back to INFO.
     */
    public static void configure(ServerConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level level = Level.toLevel(config.loggingLevel(), Level.INFO);

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.addAppender(consoleAppender(context, encoder(context, config.loggingFormat())));
        root.setLevel(level);

        context.getLogger("io.reqbind").setLevel(level);
        LIBRARY_LEVELS.forEach((name, cap) -> context.getLogger(name).setLevel(cap));
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            // one JSON object per line, MDC included
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }

    private static ConsoleAppender<ILoggingEvent> consoleAppender(
            LoggerContext context, Encoder<ILoggingEvent> encoder) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }
}
