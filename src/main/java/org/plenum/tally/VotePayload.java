package org.plenum.tally;

/**
 * The raw input of a voter, before it is encoded into a {@link PreferencePartition} by the {@link VoteCodec}.
 * There is one kind of payload per {@link VoteMode}.
 */
public interface VotePayload {

	/** The vote mode this payload is meant for */
	VoteMode getMode();
}
