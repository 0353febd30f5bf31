package org.plenum.tally;

import lombok.NonNull;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * One option on a ballot. The shortname is the token that is used in vote strings, e.g. "Anton" in "Anton>Berta=_bar_".
 * The title is only for display.
 */
@Value
public class Candidate {

	/** Reserved token of the synthetic rejection candidate. */
	public static final String BAR_SHORTNAME = "_bar_";

	/** Shortnames must not contain the relation signs '>' and '='. */
	public static final Pattern SHORTNAME_PATTERN = Pattern.compile("[A-Za-z0-9_.\\-]+");

	@NonNull
	String shortname;

	String title;

	public static Candidate bar() {
		return new Candidate(BAR_SHORTNAME, "Rejection limit");
	}

	public boolean isBar() {
		return BAR_SHORTNAME.equals(shortname);
	}

	/**
	 * @param shortname a proposed shortname for a real candidate
	 * @return true if this shortname can be used in vote strings and does not clash with the bar
	 */
	public static boolean isValidShortname(String shortname) {
		return shortname != null
				&& SHORTNAME_PATTERN.matcher(shortname).matches()
				&& !BAR_SHORTNAME.equals(shortname);
	}

	@Override
	public String toString() {
		return shortname;
	}
}
