package org.plenum.vote;

import lombok.Data;
import lombok.NonNull;

/**
 * Returned to the voter after their vote was accepted.
 * The receiptSecret is shown exactly once. It is not stored in plain anywhere.
 */
@Data
public class CastVoteResponse {
	@NonNull
	Long ballotId;

	/** the canonical form of the accepted vote */
	@NonNull
	String vote;

	/** With this secret the voter can later verify their vote. */
	@NonNull
	String receiptSecret;

	/** true if an earlier vote of this voter was replaced */
	boolean replaced;
}
