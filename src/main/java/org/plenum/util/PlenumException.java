package org.plenum.util;


import jakarta.ws.rs.core.Response;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * <h1>PlenumException</h1>
 *
 * PlenumException is the one central place for handling exceptions in PLENUM.
 * There are two kind of exceptions:
 * <ul>
 * <li>Severe system errors. Things that should never happen, e.g. a tally that cannot be reproduced.</li>
 * <li>And normal business exceptions. For example when a vote is malformed or a ballot is not open.</li>
 * </ul>
 * When a PlenumException is thrown, then this is handled in the {@link PlenumErrorExtensionProvider}. There
 * the errorName and errorCode are added to the GraphQL extensions JSON field:
 *
 * <pre>
 * {
 *   "data": {
 *     "castPreferentialVote": null
 *   },
 *   "errors": [
 *     {
 *       "message": "Candidate 'F' is not on this ballot.",
 *       "path": [ "castPreferentialVote" ],
 *       "extensions": {
 *         "plenumException": {
 *           "plenumErrorName": "UNKNOWN_CANDIDATE",
 *           "plenumErrorCode": 103,
 *           "plenumErrorMessage": "Candidate 'F' is not on this ballot."
 *         }
 *       }
 *     }
 *   ]
 * }
 * </pre>
 */
@Slf4j
public class PlenumException extends Exception {

	/** PLENUM error code */
	@Getter
	Errors error;

	/**
	 * These codes are pretty fine-grained. The idea here is that a client can show
	 * useful and localized messages to a human depending on these codes.
	 */
	public enum Errors {
		// Assembly and ballot lifecycle
		CANNOT_CREATE_ASSEMBLY(10, Response.Status.BAD_REQUEST),
		CANNOT_SIGNUP(11, Response.Status.BAD_REQUEST),
		CANNOT_CONCLUDE_ASSEMBLY(12, Response.Status.BAD_REQUEST),              // open or untallied ballots remain
		CANNOT_CREATE_BALLOT(20, Response.Status.BAD_REQUEST),
		CANNOT_ADD_CANDIDATE(21, Response.Status.BAD_REQUEST),
		CANNOT_START_VOTING_PHASE(22, Response.Status.BAD_REQUEST),
		CANNOT_FINISH_VOTING_PHASE(23, Response.Status.BAD_REQUEST),

		// Casting a vote
		CANNOT_CAST_VOTE(50, Response.Status.BAD_REQUEST),                      // ballot is not open for votes
		NOT_ATTENDING(51, Response.Status.UNAUTHORIZED),                        // voter did not sign up for the assembly
		VOTE_NOT_FOUND(52, Response.Status.NOT_FOUND),                          // unknown or already purged receipt secret. Never tell which one!

		// Malformed votes. These are reported to the voter and never silently fixed.
		MALFORMED_VOTE(100, Response.Status.BAD_REQUEST),
		INCOMPLETE_RANKING(101, Response.Status.BAD_REQUEST),
		DUPLICATE_CANDIDATE(102, Response.Status.BAD_REQUEST),
		UNKNOWN_CANDIDATE(103, Response.Status.BAD_REQUEST),
		TOO_MANY_VOTES(104, Response.Status.BAD_REQUEST),
		REJECTION_IS_EXCLUSIVE(105, Response.Status.BAD_REQUEST),
		BAR_NOT_AVAILABLE(106, Response.Status.BAD_REQUEST),
		MISPLACED_BAR(107, Response.Status.BAD_REQUEST),
		TOO_MANY_LEVELS(108, Response.Status.BAD_REQUEST),
		LEGACY_VOTE_AMBIGUOUS(109, Response.Status.CONFLICT),                   // legacy classical vote where abstention and approval cannot be told apart

		// Tallying
		BALLOT_NOT_CLOSED(70, Response.Status.BAD_REQUEST),
		TALLY_INTEGRITY_VIOLATION(71, Response.Status.INTERNAL_SERVER_ERROR),  // recomputed result differs from the published one. This must never happen!
		CANNOT_READ_RESULT(72, Response.Status.BAD_REQUEST),                   // result record JSON cannot be parsed

		// general errors
		CANNOT_FIND_ENTITY(404, Response.Status.NOT_FOUND),
		INTERNAL_ERROR(500, Response.Status.INTERNAL_SERVER_ERROR);

		@Getter
		final int plenumErrorCode;

		final Response.Status httpResponseStatus;

		Errors(int code, Response.Status httpResponseStatus) {
			this.plenumErrorCode = code;
			this.httpResponseStatus = httpResponseStatus;
		}

		public Response.Status getHttpResponseStatus() {
			return this.httpResponseStatus;
		}
	}

	/**
	 * A PlenumException must always have an error code and a human-readable error message
	 */
	public PlenumException(Errors errCode, String msg) {
		super(msg);
		this.error = errCode;
	}

	public PlenumException(Errors errCode, String msg, Throwable childException) {
		super(msg, childException);
		this.error = errCode;
	}

	/**
	 * This utility method can be passed to java.util.Optional methods, e.g.
	 * <pre>Optional.orElseThrow(PlenumException.notFound("not found"))</pre>
	 * @param msg The human-readable error message
	 * @return a Supplier for that PlenumException that can be passed to java.util.Optional methods.
	 */
	public static Supplier<PlenumException> notFound(String msg) {
		return () -> new PlenumException(Errors.CANNOT_FIND_ENTITY, msg);
	}

	public static void checkOrThrow(boolean condition, Errors err, String message) throws PlenumException {
		if (!condition) throw new PlenumException(err, message);
	}

	/**
	 * Supply an exception. This can be used in Optional methods, e.g.
	 * <pre>Optional.orElseThrow(PlenumException.supply(PlenumException.SOME_NAME, "Some message"))</pre>
	 * @param error PLENUM Error Code
	 * @param msg Human-readable error message
	 * @return a Supplier for the PlenumException
	 */
	public static Supplier<PlenumException> supply(Errors error, String msg) {
		return () -> new PlenumException(error, msg);
	}

	/**
	 * Supply a PlenumException that will automatically log the error message when thrown.
	 * Server errors are logged as errors, everything else as info.
	 */
	public static Supplier<PlenumException> supplyAndLog(Errors error, String msg) {
		return () -> {
			if (error.httpResponseStatus.getStatusCode() >= 500) {
				log.error(error.name() + ": " + msg);
			} else {
				log.info(error.name() + ": " + msg);
			}
			return new PlenumException(error, msg);
		};
	}

	public int getErrorCodeAsInt() {
		return this.error.plenumErrorCode;
	}

	public String getErrorName() {
		return this.error.name();
	}

	public Response.Status getHttpResponseStatus() {
		return this.error.httpResponseStatus;
	}

	public String toString() {
		StringBuilder b = new StringBuilder("PlenumException[");
		b.append("plenumErrorCode=");
		b.append(this.getErrorCodeAsInt());
		b.append(", errorName=");
		b.append(this.getErrorName());
		b.append(", msg=");
		b.append(this.getMessage());
		if (this.getCause() != null) {
			b.append(", cause=");
			b.append(this.getCause().toString());
		}
		b.append("]");
		return b.toString();
	}
}
