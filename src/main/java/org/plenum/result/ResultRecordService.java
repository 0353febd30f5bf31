package org.plenum.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.plenum.ballot.BallotEntity;
import org.plenum.tally.*;
import org.plenum.util.PlenumException;
import org.plenum.vote.VoteEntity;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Builds the public {@link BallotResultRecord} of a ballot and renders it as JSON.
 * The same votes always lead to exactly the same JSON bytes.
 */
@Slf4j
@ApplicationScoped
public class ResultRecordService {

	/** Sort order of votes in the record. It must not reveal the order in which votes were cast. */
	public static final Comparator<BallotResultRecord.RecordedVote> VOTE_ORDER =
			Comparator.comparing(BallotResultRecord.RecordedVote::getVote)
					.thenComparing(BallotResultRecord.RecordedVote::getSalt)
					.thenComparing(BallotResultRecord.RecordedVote::getHash);

	private static final DefaultPrettyPrinter CANONICAL_PRINTER =
			new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("  ", "\n"));

	/**
	 * Tally the stored votes of a ballot and build its result record.
	 * @param ballot a ballot that is not open for votes anymore
	 * @param votes all votes of this ballot
	 * @return the tally and the record
	 * @throws PlenumException when a stored vote is not valid for this ballot
	 */
	public TalliedRecord buildRecord(BallotEntity ballot, List<VoteEntity> votes) throws PlenumException {
		BallotSpec spec = ballot.getBallotSpec();
		List<BallotResultRecord.RecordedVote> recordedVotes = votes.stream()
				.map(v -> new BallotResultRecord.RecordedVote(v.getVote(), v.getSalt(), v.getHash()))
				.sorted(VOTE_ORDER)
				.toList();
		TallyResult tally = BallotTallier.tallyVoteStrings(spec, recordedVotes.stream().map(BallotResultRecord.RecordedVote::getVote).toList());
		BallotResultRecord record = toRecord(ballot.getAssembly().getTitle(), ballot.getTitle(), tally, recordedVotes);
		return new TalliedRecord(tally, record, render(record));
	}

	/**
	 * Build a record from a tally.
	 * @param assemblyTitle title of the assembly
	 * @param ballotTitle title of the ballot
	 * @param tally the tally
	 * @param sortedVotes the votes that were tallied, already in {@link #VOTE_ORDER}
	 * @return the record
	 */
	public static BallotResultRecord toRecord(String assemblyTitle, String ballotTitle, TallyResult tally, List<BallotResultRecord.RecordedVote> sortedVotes) {
		BallotSpec spec = tally.getBallot();
		CandidateSet candidateSet = spec.getCandidateSet();
		ResultStatistics statistics = tally.getStatistics();

		BallotResultRecord record = new BallotResultRecord();
		record.setAssembly(assemblyTitle);
		record.setBallot(ballotTitle);
		LinkedHashMap<String, String> candidates = new LinkedHashMap<>();
		candidateSet.getCandidates().forEach(c -> candidates.put(c.getShortname(), c.getTitle()));
		record.setCandidates(candidates);
		record.setUseBar(candidateSet.isUseBar());
		record.setMode(spec.getMode().name());
		record.setNumVotes(spec.getNumVotes());
		record.setCandidateOrder(candidateSet.getAllShortnames());
		record.setPairwise(tally.getDuelMatrix().getData());
		record.setVotes(sortedVotes);
		record.setResult(tally.getResultString());
		record.setBoundaries(statistics.getBoundaries().stream()
				.map(b -> new BallotResultRecord.Boundary(b.getUpper(), b.getLower(), b.getPro(), b.getContra()))
				.toList());
		record.setCounts(spec.isClassical() ? new LinkedHashMap<>(statistics.getCounts()) : null);
		record.setAbstentions(statistics.getAbstentions());
		record.setNumberOfVotes(statistics.getNumVotes());
		return record;
	}

	/**
	 * Render a record as JSON. Deterministic and independent of configuration and platform:
	 * objects are indented by two spaces and lines always end with '\n'.
	 * The audit compares these bytes, so this format must never change for published records.
	 */
	public static String render(BallotResultRecord record) throws PlenumException {
		try {
			return createMapper().writer(CANONICAL_PRINTER).writeValueAsString(record);
		} catch (JsonProcessingException e) {
			throw new PlenumException(PlenumException.Errors.INTERNAL_ERROR, "Cannot render result record of ballot '" + record.getBallot() + "'", e);
		}
	}

	/** Parse a published record. */
	public static BallotResultRecord parse(String json) throws PlenumException {
		try {
			return createMapper().readValue(json, BallotResultRecord.class);
		} catch (JsonProcessingException e) {
			throw new PlenumException(PlenumException.Errors.CANNOT_READ_RESULT, "Cannot read result record: " + e.getOriginalMessage(), e);
		}
	}

	public static String sha256(String json) {
		return DigestUtils.sha256Hex(json);
	}

	static ObjectMapper createMapper() {
		return new ObjectMapper()
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
	}
}
