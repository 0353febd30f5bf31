package org.plenum.result;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;
import org.plenum.util.PlenumException;

/**
 * Download the published result record of a ballot. This is the exact JSON that was published.
 * The SHA-256 of the body is returned in the ETag header.
 */
@Slf4j
@Path("/api/v1/ballots")
public class ResultRest {

	@Inject
	TallyService tallyService;

	@GET
	@Path("/{ballotId}/result")
	@Produces(MediaType.APPLICATION_JSON)
	public Response downloadResult(@PathParam("ballotId") Long ballotId) {
		try {
			ResultEntity result = tallyService.getPublishedRecord(ballotId);
			return Response.ok(result.getJson())
					.tag(result.getSha256())
					.header("Content-Disposition", "attachment; filename=\"result_ballot_" + ballotId + ".json\"")
					.build();
		} catch (PlenumException e) {
			log.info("Cannot download result of ballot(id={}): {}", ballotId, e.getMessage());
			return Response.status(e.getHttpResponseStatus())
					.type(MediaType.TEXT_PLAIN)
					.entity(e.getMessage())
					.build();
		}
	}
}
