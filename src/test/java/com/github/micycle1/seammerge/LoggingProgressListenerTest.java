package com.github.micycle1.seammerge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

class LoggingProgressListenerTest {

	private static List<String> captured(Consumer<LoggingProgressListener> run, LoggingProgressListener listener) {
		Logger logger = (Logger) LoggerFactory.getLogger(LoggingProgressListener.class);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
		try {
			run.accept(listener);
		} finally {
			logger.detachAppender(appender);
			appender.stop();
		}
		return appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
	}

	@Test
	void rejects_out_of_range_step() {
		assertThatThrownBy(() -> new LoggingProgressListener(0)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new LoggingProgressListener(101)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void logs_once_per_step_bucket() {
		List<String> lines = captured(l -> {
			for (int i = 0; i < 10; i++) {
				l.progress(i, 10);
			}
			l.done();
		}, new LoggingProgressListener(25));

		assertThat(lines).containsExactly("Merging seam 1/10 (0%)", "Merging seam 4/10 (30%)", "Merging seam 6/10 (50%)", "Merging seam 9/10 (80%)",
				"Seam merging done");
	}

	@Test
	void reused_listener_reports_start_of_every_run() {
		List<String> lines = captured(l -> {
			l.progress(0, 10);
			l.progress(1, 10);
			// second run without done() in between
			l.progress(0, 10);
		}, new LoggingProgressListener());

		assertThat(lines).containsExactly("Merging seam 1/10 (0%)", "Merging seam 2/10 (10%)", "Merging seam 1/10 (0%)");
	}

	@Test
	void drives_a_full_run() {
		SeamMerger.Params params = new SeamMerger.Params();
		params.progress = new LoggingProgressListener(25);
		params.tieBreaker = TieBreaker.seeded(1);

		assertThatCode(() -> new SeamMerger(Grids.randomImage(4, 9, 1, 3), Grids.random(4, 9, 4, 1), Grids.constant(4, 9, 1), 5, 0, 0.5, 0.5, params)
				.generate()).doesNotThrowAnyException();
	}
}
