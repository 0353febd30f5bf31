package org.plenum.tally;

import lombok.Value;

/**
 * A preferential vote as a relation string, e.g. "C=D&gt;A&gt;B=E&gt;J".
 * A blank ranking means abstention.
 */
@Value
public class PreferentialVote implements VotePayload {
	String ranking;

	@Override
	public VoteMode getMode() {
		return VoteMode.PREFERENTIAL;
	}

	/** Do not expose the voter's ranking in logs */
	@Override
	public String toString() {
		return "PreferentialVote[...]";
	}
}
