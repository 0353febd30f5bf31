package org.plenum.tally;

import lombok.Value;

import java.util.List;

/**
 * A classical vote: the shortnames of the selected candidates and, if the ballot has a bar, the "reject all" flag.
 * Selected is kept as a list, so that the codec can detect duplicates.
 */
@Value
public class ClassicalSelection implements VotePayload {
	List<String> selected;
	boolean rejectAll;

	public static ClassicalSelection of(String... selected) {
		return new ClassicalSelection(List.of(selected), false);
	}

	public static ClassicalSelection rejectAll() {
		return new ClassicalSelection(List.of(), true);
	}

	@Override
	public VoteMode getMode() {
		return VoteMode.CLASSICAL;
	}

	@Override
	public String toString() {
		return "ClassicalSelection[...]";
	}
}
