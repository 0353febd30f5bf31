package org.plenum.ballot.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;
import org.plenum.tally.Matrix;

/**
 * Stores the pairwise duel matrix of a tallied ballot as a JSON array of rows, e.g. <pre>[[0,3],[1,0]]</pre>
 * An open ballot has no matrix yet. Its column is NULL.
 *
 * Only square matrices are accepted in both directions. A column that holds anything else
 * means the row was edited by hand and must not be read back as a tally.
 */
@Slf4j
@Converter
public class MatrixConverter implements AttributeConverter<Matrix, String> {

	@Override
	public String convertToDatabaseColumn(Matrix duelMatrix) {
		if (duelMatrix == null) return null;
		requireSquare(duelMatrix, "store");
		return duelMatrix.toJsonValue();
	}

	@Override
	public Matrix convertToEntityAttribute(String column) {
		if (column == null || column.isBlank()) return null;
		Matrix duelMatrix = Matrix.fromJsonValue(column.trim());
		requireSquare(duelMatrix, "load");
		return duelMatrix;
	}

	private static void requireSquare(Matrix duelMatrix, String action) {
		if (duelMatrix.isSquare()) return;
		String msg = "Cannot " + action + " duel matrix with " + duelMatrix.getRows() + " rows and " + duelMatrix.getCols() + " columns. It must be square.";
		log.error(msg);
		throw new IllegalArgumentException(msg);
	}
}
