package com.github.micycle1.seammerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports progress to SLF4J at info level, at most once per {@code step} percent.
 * A call with {@code current == 0} starts a new run, so an instance can be
 * reused after a run that ended without {@link #done()}.
 *
 * @author Michael Carleton
 */
public final class LoggingProgressListener implements ProgressListener {

	private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

	private final int step;
	private int lastReported = -1;

	public LoggingProgressListener() {
		this(10);
	}

	/**
	 * @param step reporting granularity in percent, 1..100
	 */
	public LoggingProgressListener(int step) {
		if (step < 1 || step > 100) {
			throw new IllegalArgumentException("step must be in [1, 100]: " + step);
		}
		this.step = step;
	}

	@Override
	public void progress(int current, int total) {
		if (current == 0) {
			lastReported = -1;
		}
		int percent = total == 0 ? 100 : (int) (100L * current / total);
		int bucket = percent / step;
		if (bucket != lastReported) {
			lastReported = bucket;
			log.info("Merging seam {}/{} ({}%)", current + 1, total, percent);
		}
	}

	@Override
	public void done() {
		log.info("Seam merging done");
		lastReported = -1;
	}
}
