package org.javai.status.ops.log4j;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.status.Classification;
import org.javai.status.Context;
import org.javai.status.Status;
import org.javai.status.ops.StatusReporter;
import org.javai.status.render.Renderer;

/**
 * Reports statuses using Log4j2 logging.
 *
 * <p>Each status is logged once, with the {@code STATUS} marker, as a single line holding the
 * rendered message, the context of every level, and the rendered causes:
 * <pre>
 * Status [config.load_failed]: Could not load profile prod | context={profile=prod}
 *   | caused by [io.error]: disk full | context={exception.type=java.io.IOException}
 * </pre>
 * (shown wrapped here; the actual entry is one line).
 *
 * <p>The log level is chosen per classification and defaults to WARN.
 */
public class Log4jStatusReporter implements StatusReporter {

	static final String DEFAULT_LOGGER_NAME = "org.javai.status.StatusReporter";

	private static final Marker STATUS_MARKER = MarkerManager.getMarker("STATUS");

	private final Logger logger;
	private final Renderer renderer;
	private final Locale locale;
	private final Function<Classification, Level> levels;

	/**
	 * Creates a reporter using the default logger name, logging every status at WARN.
	 *
	 * @param renderer renders the messages
	 * @param locale the locale messages are rendered in
	 */
	public Log4jStatusReporter(Renderer renderer, Locale locale) {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME), renderer, locale, classification -> Level.WARN);
	}

	/**
	 * Creates a reporter with full control over logger and level selection.
	 *
	 * @param logger the Log4j logger to use
	 * @param renderer renders the messages
	 * @param locale the locale messages are rendered in
	 * @param levels chooses the log level for a status by its outermost classification
	 */
	public Log4jStatusReporter(Logger logger, Renderer renderer, Locale locale,
			Function<Classification, Level> levels) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
		this.locale = Objects.requireNonNull(locale, "locale must not be null");
		this.levels = Objects.requireNonNull(levels, "levels must not be null");
	}

	@Override
	public void report(Status status) {
		Level level = Objects.requireNonNullElse(levels.apply(status.classification()), Level.WARN);

		logger.atLevel(level)
			.withMarker(STATUS_MARKER)
			.log(formatStatusMessage(status));
	}

	String formatStatusMessage(Status status) {
		StringBuilder sb = new StringBuilder();
		for (Status current : status.chain()) {
			if (current != status) {
				sb.append(" | caused by ");
			} else {
				sb.append("Status ");
			}
			sb.append("""
				[%s]: %s%s\
				""".formatted(
					current.classification().id(),
					renderer.render(current, locale),
					formatContext(current.context())));
		}
		return sb.toString();
	}

	private static String formatContext(Context context) {
		if (context.isEmpty()) {
			return "";
		}
		return " | context=" + context.stream()
				.map(Object::toString)
				.collect(Collectors.joining(", ", "{", "}"));
	}
}
