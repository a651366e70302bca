package com.github.micycle1.seammerge;

/**
 * Thrown when an energy term cannot be normalized because its maximum seam
 * energy is zero or not finite.
 *
 * @author Michael Carleton
 */
public class DegenerateNormalizationException extends SeamMergingException {

	private static final long serialVersionUID = 1L;

	public DegenerateNormalizationException(String message) {
		super(message);
	}
}
