package org.plenum.tally;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The canonical form of a vote and of an aggregated result:
 * an ordered sequence of levels L1 &gt; L2 &gt; ... &gt; Lk. Candidates within one level are tied.
 *
 * Every candidate of the candidate set (including the bar, if used) is in exactly one level.
 * Members of a level are kept in display order of the candidate set, so that
 * {@link #toVoteString()} is canonical: parsing the vote string again yields an equal partition.
 *
 * Instances are immutable.
 */
public final class PreferencePartition {

	public static final String PREFERRED = ">";
	public static final String TIED = "=";

	private final CandidateSet candidateSet;

	/** levels of shortnames, most preferred first */
	private final List<List<String>> levels;

	/** level index per candidate index of the candidate set */
	private final int[] levelOf;

	private PreferencePartition(CandidateSet candidateSet, List<List<String>> levels, int[] levelOf) {
		this.candidateSet = candidateSet;
		this.levels = levels;
		this.levelOf = levelOf;
	}

	/**
	 * Build a partition from levels of shortnames.
	 * The caller must already have validated the input. Violations of the partition invariant are programming errors.
	 *
	 * @param candidateSet the ballot's candidates
	 * @param levels non-empty levels, most preferred first
	 * @return the partition with members of each level in canonical order
	 * @throws IllegalArgumentException when a level is empty, or a candidate is unknown, missing or duplicated
	 */
	public static PreferencePartition of(CandidateSet candidateSet, List<? extends Collection<String>> levels) {
		int[] levelOf = new int[candidateSet.size()];
		Arrays.fill(levelOf, -1);
		List<List<String>> canonical = new ArrayList<>();
		for (int l = 0; l < levels.size(); l++) {
			Collection<String> level = levels.get(l);
			if (level.isEmpty()) throw new IllegalArgumentException("Level " + l + " of partition is empty");
			for (String shortname : level) {
				int idx = candidateSet.indexOf(shortname);
				if (idx < 0) throw new IllegalArgumentException("Unknown candidate '" + shortname + "'");
				if (levelOf[idx] >= 0) throw new IllegalArgumentException("Candidate '" + shortname + "' appears twice");
				levelOf[idx] = l;
			}
			List<String> sorted = level.stream()
					.sorted(Comparator.comparingInt(candidateSet::indexOf))
					.toList();
			canonical.add(sorted);
		}
		for (int i = 0; i < levelOf.length; i++) {
			if (levelOf[i] < 0) throw new IllegalArgumentException("Candidate '" + candidateSet.get(i).getShortname() + "' is missing in partition");
		}
		return new PreferencePartition(candidateSet, Collections.unmodifiableList(canonical), levelOf);
	}

	/** Build a partition from levels given as candidate indexes of the candidate set. */
	public static PreferencePartition ofIndexes(CandidateSet candidateSet, List<? extends Collection<Integer>> indexLevels) {
		List<List<String>> levels = indexLevels.stream()
				.map(level -> level.stream().map(i -> candidateSet.get(i).getShortname()).toList())
				.toList();
		return of(candidateSet, levels);
	}

	/** Everybody tied: the vote of somebody who abstains. */
	public static PreferencePartition abstention(CandidateSet candidateSet) {
		return of(candidateSet, List.of(candidateSet.getAllShortnames()));
	}

	/**
	 * Drop a hidden bar, so that the partition can be shown. Levels that only held the bar disappear.
	 * @return this partition over the visible candidates, or this partition itself when the bar is not hidden
	 */
	public PreferencePartition withoutHiddenBar() {
		if (!candidateSet.isBarHidden()) return this;
		List<List<String>> visibleLevels = levels.stream()
				.map(level -> level.stream().filter(s -> !Candidate.BAR_SHORTNAME.equals(s)).toList())
				.filter(level -> !level.isEmpty())
				.toList();
		return of(candidateSet.visible(), visibleLevels);
	}

	public CandidateSet getCandidateSet() {
		return candidateSet;
	}

	public List<List<String>> getLevels() {
		return levels;
	}

	public int numLevels() {
		return levels.size();
	}

	/** A partition with only one level expresses no preference at all. */
	public boolean isAbstention() {
		return levels.size() == 1;
	}

	/**
	 * @param candidateIndex index of a candidate in the candidate set
	 * @return index of the level that contains this candidate. Smaller is more preferred.
	 */
	public int levelOf(int candidateIndex) {
		return levelOf[candidateIndex];
	}

	public int levelOf(String shortname) {
		int idx = candidateSet.indexOf(shortname);
		if (idx < 0) throw new IllegalArgumentException("Unknown candidate '" + shortname + "'");
		return levelOf[idx];
	}

	/** @return true if candidate a is strictly preferred over candidate b */
	public boolean prefers(String a, String b) {
		return levelOf(a) < levelOf(b);
	}

	/** @return the canonical vote string, e.g. "C=D&gt;A&gt;B=E&gt;J" */
	public String toVoteString() {
		return levels.stream()
				.map(level -> String.join(TIED, level))
				.collect(Collectors.joining(PREFERRED));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PreferencePartition other = (PreferencePartition) o;
		return levels.equals(other.levels);
	}

	@Override
	public int hashCode() {
		return levels.hashCode();
	}

	@Override
	public String toString() {
		return "PreferencePartition[" + toVoteString() + "]";
	}
}
