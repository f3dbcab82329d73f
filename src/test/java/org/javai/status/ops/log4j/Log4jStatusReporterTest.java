package org.javai.status.ops.log4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.status.SampleError;
import org.javai.status.Status;
import org.javai.status.render.MapTemplateResolver;
import org.javai.status.render.Renderer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class Log4jStatusReporterTest {

	private static final String LOGGER_NAME = "org.javai.status.test.StatusReporter";

	private final Renderer renderer = Renderer.of(MapTemplateResolver.builder()
			.template(SampleError.CONFIG_LOAD_FAILED, Locale.ENGLISH, "Could not load profile {profile}")
			.build());

	private Logger logger;
	private CapturingAppender appender;

	@BeforeEach
	void setUp() {
		logger = (Logger) LogManager.getLogger(LOGGER_NAME);
		appender = new CapturingAppender();
		appender.start();
		logger.addAppender(appender);
		logger.setLevel(Level.ALL);
	}

	@AfterEach
	void tearDown() {
		logger.removeAppender(appender);
		appender.stop();
	}

	@Test
	void formatStatusMessage_includesEveryLevelOfChain() {
		Log4jStatusReporter reporter = new Log4jStatusReporter(renderer, Locale.ENGLISH);
		Status status = Status.of(SampleError.IO_ERROR)
				.withMessage("disk full")
				.wrap(SampleError.CONFIG_LOAD_FAILED)
				.withContext("profile", "prod");

		String message = reporter.formatStatusMessage(status);

		assertThat(message).isEqualTo(
				"Status [ConfigLoadFailed]: Could not load profile prod | context={profile=prod}"
						+ " | caused by [IOError]: disk full");
	}

	@Test
	void report_logsOnceWithMarkerAtWarn() {
		Log4jStatusReporter reporter = new Log4jStatusReporter(logger, renderer, Locale.ENGLISH,
				classification -> Level.WARN);

		reporter.report(Status.of(SampleError.NOT_FOUND).withContext("path", "/etc/x"));

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker().getName()).isEqualTo("STATUS");
		assertThat(event.getMessage().getFormattedMessage())
				.isEqualTo("Status [NotFound]: NotFound [path] | context={path=/etc/x}");
	}

	@Test
	void report_levelChosenByClassification() {
		Log4jStatusReporter reporter = new Log4jStatusReporter(logger, renderer, Locale.ENGLISH,
				classification -> classification == SampleError.PERMISSION_DENIED ? Level.ERROR : Level.INFO);

		reporter.report(Status.of(SampleError.PERMISSION_DENIED));
		reporter.report(Status.of(SampleError.NOT_FOUND));

		assertThat(appender.events).extracting(LogEvent::getLevel).containsExactly(Level.ERROR, Level.INFO);
	}

	@Test
	void report_doesNotModifyStatus() {
		Log4jStatusReporter reporter = new Log4jStatusReporter(logger, renderer, Locale.ENGLISH,
				classification -> Level.WARN);
		Status status = Status.of(SampleError.NOT_FOUND).withContext("path", "/etc/x");

		reporter.report(status);

		assertThat(status.contextEntries()).hasSize(1);
		assertThat(status.isAttached()).isFalse();
	}

	private static final class CapturingAppender extends AbstractAppender {
		private final List<LogEvent> events = new ArrayList<>();

		CapturingAppender() {
			super("Capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
