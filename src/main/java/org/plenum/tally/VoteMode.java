package org.plenum.tally;

/** How voters express their will on a ballot */
public enum VoteMode {
	PREFERENTIAL,   // full ranking like "C=D>A>B"
	CLASSICAL       // select up to N candidates (and maybe reject all)
}
