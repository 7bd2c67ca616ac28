package org.javai.dialogs.testsupport;

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
 * Collects the log events of one logger while open.
 *
 * <pre>
 * try (LogCapture logs = LogCapture.of(TurnDispatcher.class, Level.INFO)) {
 *     dispatcher.onTurn(activity);
 *     assertThat(logs.messages(Level.INFO)).anyMatch(m -> m.contains("None"));
 * }
 * </pre>
 */
public final class LogCapture extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final Level restoreLevel;
	private final boolean addedConfig;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCapture(LoggerContext context, LoggerConfig loggerConfig, Level restoreLevel, boolean addedConfig) {
		super("LogCapture-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.restoreLevel = restoreLevel;
		this.addedConfig = addedConfig;
	}

	public static LogCapture of(Class<?> loggerClass, Level level) {
		String name = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig config = configuration.getLoggerConfig(name);
		boolean added = false;
		if (!config.getName().equals(name)) {
			config = new LoggerConfig(name, level, true);
			configuration.addLogger(name, config);
			added = true;
		}
		LogCapture capture = new LogCapture(context, config, config.getLevel(), added);
		config.setLevel(level);
		capture.start();
		config.addAppender(capture, level, null);
		context.updateLoggers();
		return capture;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<String> messages() {
		return events.stream().map(e -> e.getMessage().getFormattedMessage()).toList();
	}

	public List<String> messages(Level level) {
		return events.stream()
				.filter(e -> e.getLevel() == level)
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (addedConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		}
		else {
			loggerConfig.setLevel(restoreLevel);
		}
		context.updateLoggers();
	}
}
