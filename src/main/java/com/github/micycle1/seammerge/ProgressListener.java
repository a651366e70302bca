package com.github.micycle1.seammerge;

/**
 * Receives progress of a merge run. Calls are synchronous and must not touch the
 * run's state.
 *
 * @author Michael Carleton
 */
public interface ProgressListener {

	/** Ignores all progress. */
	ProgressListener NONE = (current, total) -> {
	};

	/**
	 * Called before seam {@code current} (zero-based) of {@code total} is merged.
	 */
	void progress(int current, int total);

	/**
	 * Called once after the last seam.
	 */
	default void done() {
	}
}
