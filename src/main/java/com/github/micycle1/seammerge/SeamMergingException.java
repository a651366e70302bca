package com.github.micycle1.seammerge;

/**
 * Base class of seam merging failures.
 *
 * @author Michael Carleton
 */
public class SeamMergingException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public SeamMergingException(String message) {
		super(message);
	}

	public SeamMergingException(String message, Throwable cause) {
		super(message, cause);
	}
}
