package com.github.micycle1.seammerge;

/**
 * Back-pointers of the path search: for every cell below row 0, the predecessor
 * in the row above that achieved the minimum cumulative cost.
 */
final class PathMap {

	enum Direction {
		LEFT(-1), UP(0), RIGHT(1);

		private final int offset;

		Direction(int offset) {
			this.offset = offset;
		}

		/**
		 * @return column offset of the predecessor in the row above
		 */
		int offset() {
			return offset;
		}
	}

	private static final Direction[] DIRECTIONS = Direction.values();

	private final int rows;
	private final int cols;
	private final byte[] data;

	PathMap(int rows, int cols) {
		this.rows = rows;
		this.cols = cols;
		this.data = new byte[rows * cols];
	}

	int rows() {
		return rows;
	}

	int cols() {
		return cols;
	}

	Direction get(int row, int col) {
		return DIRECTIONS[data[row * cols + col]];
	}

	void set(int row, int col, Direction direction) {
		data[row * cols + col] = (byte) direction.ordinal();
	}
}
