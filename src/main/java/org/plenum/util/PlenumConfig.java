package org.plenum.util;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import jakarta.validation.constraints.NotNull;
import org.plenum.tally.LegacyVoteImporter;

/**
 * PLENUM configurations from application.properties
 */
@ConfigMapping(prefix = "plenum")
public interface PlenumConfig {

    // the secret only known to the server. Used to hash vote keys and receipt secrets.
    @NotNull
    String hashSecret();

    // voting phase ends after this many days at midnight, if no explicit end was given
    @WithDefault("14")
    int durationOfVotingPhase();

    // how often the scheduler looks for ballots whose voting period has ended
    @WithDefault("60s")
    String ballotCheckInterval();

    // what to do with legacy classical votes where everything is tied and no bar was recorded
    @WithDefault("REJECT")
    LegacyVoteImporter.LegacyTiePolicy legacyTiePolicy();

}
