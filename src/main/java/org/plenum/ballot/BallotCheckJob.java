package org.plenum.ballot;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.plenum.result.TallyService;
import org.plenum.util.PlenumException;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Regularly closes ballots whose voting period has ended and tallies them.
 */
@Slf4j
@ApplicationScoped
public class BallotCheckJob {

	@Inject
	BallotService ballotService;

	@Inject
	TallyService tallyService;

	@Scheduled(every = "{plenum.ballot-check-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
	void checkBallots() {
		checkBallots(LocalDateTime.now());
	}

	/**
	 * Close ended ballots and tally every CLOSED ballot.
	 * This also retries ballots whose tally failed in an earlier run and ballots that were closed by hand.
	 * A failing ballot is logged and does not stop the others.
	 *
	 * @param now the current time
	 * @return number of ballots that were tallied
	 */
	public int checkBallots(LocalDateTime now) {
		List<Long> closed = ballotService.closeEndedBallots(now);
		List<Long> untallied = ballotService.listClosedBallotIds();
		int tallied = 0;
		for (Long ballotId : untallied) {
			try {
				tallyService.tally(ballotId);
				tallied++;
			} catch (PlenumException | RuntimeException e) {
				// the ballot stays CLOSED and is tried again in the next run
				log.error("Cannot tally ballot(id=" + ballotId + "): " + e, e);
			}
		}
		if (!untallied.isEmpty()) log.info("Ballot check: closed " + closed.size() + ", tallied " + tallied + " of " + untallied.size() + " closed ballots.");
		return tallied;
	}
}
