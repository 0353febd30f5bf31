package org.plenum.tally;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Arrays;

/**
 * Simple two dimensional matrix of long values.
 * Used for the pairwise duel matrix and the strongest paths.
 */
public class Matrix {

	private static final ObjectMapper mapper = new ObjectMapper();

	private final long[][] data;

	public Matrix(int rows, int cols) {
		if (rows < 0 || cols < 0) throw new IllegalArgumentException("Matrix dimensions must not be negative");
		this.data = new long[rows][cols];
	}

	public Matrix(long[][] data) {
		int cols = data.length > 0 ? data[0].length : 0;
		this.data = new long[data.length][cols];
		for (int i = 0; i < data.length; i++) {
			if (data[i].length != cols) throw new IllegalArgumentException("All rows of a matrix must have the same length");
			System.arraycopy(data[i], 0, this.data[i], 0, cols);
		}
	}

	public int getRows() {
		return data.length;
	}

	public int getCols() {
		return data.length > 0 ? data[0].length : 0;
	}

	public long get(int row, int col) {
		return data[row][col];
	}

	public void set(int row, int col, long value) {
		data[row][col] = value;
	}

	public void inc(int row, int col) {
		data[row][col]++;
	}

	/** @return a copy of the raw data */
	public long[][] getData() {
		long[][] copy = new long[data.length][];
		for (int i = 0; i < data.length; i++) copy[i] = data[i].clone();
		return copy;
	}

	public boolean isSquare() {
		return getRows() == getCols();
	}

	/** @return the matrix as JSON array of rows, e.g. [[0,2],[1,0]] */
	public String toJsonValue() {
		try {
			return mapper.writeValueAsString(data);
		} catch (JsonProcessingException e) {
			throw new RuntimeException("Cannot serialize matrix to JSON", e);
		}
	}

	public static Matrix fromJsonValue(String json) {
		try {
			return new Matrix(mapper.readValue(json, long[][].class));
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Cannot parse matrix from JSON: " + json, e);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Arrays.deepEquals(data, ((Matrix) o).data);
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(data);
	}

	@Override
	public String toString() {
		return "Matrix" + toJsonValue();
	}
}
