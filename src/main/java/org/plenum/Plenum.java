package org.plenum;

import io.agroal.api.AgroalDataSource;
import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.configuration.ConfigUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.plenum.assembly.AssemblyEntity;
import org.plenum.assembly.AttendeeEntity;
import org.plenum.ballot.BallotEntity;
import org.plenum.result.ResultEntity;
import org.plenum.util.PlenumConfig;
import org.plenum.vote.ReceiptEntity;
import org.plenum.vote.VoteEntity;

import java.sql.Connection;
import java.sql.SQLException;

@Slf4j
@ApplicationScoped
public class Plenum {

	@Inject
	AgroalDataSource dataSource;

	@Inject
	PlenumConfig config;

	@ConfigProperty(name = "quarkus.hibernate-orm.database.generation")
	String hibernateDbGeneration;

	@ConfigProperty(name = "quarkus.datasource.jdbc.url")
	String jdbcUrl;

	@ConfigProperty(name = "quarkus.http.port")
	int port;

	/**
	 * Print the voting configuration and the state of the DB when the app has started.
	 * Fails the startup when the DB cannot be reached or has no PLENUM schema.
	 */
	@Transactional
	void onStart(@Observes StartupEvent ev) {
		LaunchMode launchMode = LaunchMode.current();
		System.out.println("============ STARTING PLENUM in [" + launchMode + "]==================");
		System.out.println("   QUARKUS_PROFILE : " + String.join(",", ConfigUtils.getProfiles()));
		System.out.println("   HTTP port       : " + port);
		System.out.println("   Voting phase    : " + config.durationOfVotingPhase() + " days");
		System.out.println("   Ballot check    : every " + config.ballotCheckInterval());
		System.out.println("   Legacy ties     : " + config.legacyTiePolicy());
		System.out.println("============= DB INFO ===============");
		System.out.println("   DB JDBC URL     : " + jdbcUrl);
		System.out.println("   DB Generation   : " + hibernateDbGeneration);

		try (Connection con = dataSource.getConnection()) {
			System.out.println("   DB Connection   : " + con.getMetaData().getURL());
		} catch (SQLException e) {
			log.error("=====================================");
			log.error("Cannot connect to DB! {}", e.getMessage());
			log.error("=====================================");
			throw new RuntimeException(e);
		}

		try {
			System.out.println("============= Table counts ==========");
			System.out.println("   #Assemblies     : " + AssemblyEntity.count());
			System.out.println("   #Attendees      : " + AttendeeEntity.count());
			System.out.println("   #Ballots        : " + BallotEntity.count() + " (" + BallotEntity.count("status", BallotEntity.BallotStatus.VOTING) + " in voting)");
			System.out.println("   #Votes          : " + VoteEntity.count());
			System.out.println("   #Receipts       : " + ReceiptEntity.count());
			System.out.println("   #Results        : " + ResultEntity.count());
		} catch (Exception e) {
			log.error("==================================================");
			log.error(" Assemblies, Ballots or Votes table does not exist.");
			log.error(" Is your database initialized with the correct schema?");
			log.error("==================================================");
			throw e;
		}
		System.out.println("=====================================");

		long untallied = BallotEntity.count("status", BallotEntity.BallotStatus.CLOSED);
		if (untallied > 0)
			log.warn(untallied + " closed ballot(s) still wait to be tallied.");
	}
}
