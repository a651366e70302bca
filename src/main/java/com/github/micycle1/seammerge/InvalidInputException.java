package com.github.micycle1.seammerge;

/**
 * Input grids or counts that the merger cannot work with.
 *
 * @author Michael Carleton
 */
public class InvalidInputException extends SeamMergingException {

	private static final long serialVersionUID = 1L;

	public InvalidInputException(String message) {
		super(message);
	}
}
