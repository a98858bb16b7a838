package org.javai.wwisedsl.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

/**
 * Captures what one class logs through SLF4J while a test runs.
 * <pre>
 * try (LogCapture log = LogCapture.of(ExecutionPlanner.class, Level.DEBUG)) {
 *     planner.execute(statements, registry);
 *     assertThat(log.messagesAt(Level.WARN)).anyMatch(m -> m.contains("UNRESOLVED_REFERENCE"));
 * }
 * </pre>
 */
public final class LogCapture extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final boolean addedConfig;
	private final Level previousLevel;
	private final List<Captured> captured = new CopyOnWriteArrayList<>();

	private LogCapture(LoggerContext context, LoggerConfig loggerConfig, boolean addedConfig, Level previousLevel) {
		super("LogCapture-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.addedConfig = addedConfig;
		this.previousLevel = previousLevel;
	}

	public static LogCapture of(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);
		boolean added = false;
		if (!loggerConfig.getName().equals(loggerName)) {
			loggerConfig = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, loggerConfig);
			added = true;
		}
		Level previous = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		LogCapture capture = new LogCapture(context, loggerConfig, added, previous);
		capture.start();
		loggerConfig.addAppender(capture, level, null);
		context.updateLoggers();
		return capture;
	}

	@Override
	public void append(LogEvent event) {
		captured.add(new Captured(event.getLevel(), event.getMessage().getFormattedMessage()));
	}

	public List<String> messages() {
		return captured.stream().map(Captured::message).toList();
	}

	public List<String> messagesAt(Level level) {
		return captured.stream().filter(c -> c.level() == level).map(Captured::message).toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (addedConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		}
		else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
	}

	private record Captured(Level level, String message) {
	}
}
