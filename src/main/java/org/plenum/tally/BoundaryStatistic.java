package org.plenum.tally;

import lombok.Value;

/**
 * How clear is the boundary between two adjacent levels of a result?
 * Upper and lower are the first candidates (in display order) of the two levels.
 */
@Value
public class BoundaryStatistic {
	String upper;
	String lower;
	/** number of votes that prefer upper over lower */
	long pro;
	/** number of votes that prefer lower over upper */
	long contra;
}
