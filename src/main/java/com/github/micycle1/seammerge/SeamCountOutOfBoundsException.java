package com.github.micycle1.seammerge;

/**
 * More seams requested than the image width allows.
 *
 * @author Michael Carleton
 */
public class SeamCountOutOfBoundsException extends SeamMergingException {

	private static final long serialVersionUID = 1L;

	private final int requested;
	private final int width;

	public SeamCountOutOfBoundsException(int requested, int width) {
		super("Cannot merge " + requested + " seams from an image " + width + " columns wide; at most " + (width - 1) + " allowed.");
		this.requested = requested;
		this.width = width;
	}

	public int getRequested() {
		return requested;
	}

	public int getWidth() {
		return width;
	}
}
