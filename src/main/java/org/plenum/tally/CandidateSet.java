package org.plenum.tally;

import lombok.Getter;

import java.util.*;

/**
 * The fixed list of candidates of one ballot, in display order, plus the optional bar.
 *
 * The bar is never part of {@link #getCandidates()}, but it is part of {@link #getAll()}
 * and takes part in every comparison when the ballot uses it.
 * Indexes returned by {@link #indexOf(String)} are the row/column indexes of the pairwise matrix.
 *
 * Classical ballots without the bar still carry a hidden bar. It separates "selected everybody"
 * from "selected nobody" in stored votes, but voters cannot rank it and results do not show it.
 */
public class CandidateSet {

	/** real candidates in display order */
	@Getter
	private final List<Candidate> candidates;

	/** voters can rank the bar and results show it */
	@Getter
	private final boolean useBar;

	/** the bar takes part in votes and in the matrix, but is not shown */
	@Getter
	private final boolean barHidden;

	/** candidates plus bar (visible or hidden) as the last element */
	private final List<Candidate> all;

	private final Map<String, Integer> indexes = new HashMap<>();

	public CandidateSet(List<Candidate> candidates, boolean useBar) {
		this(candidates, useBar, false);
	}

	private CandidateSet(List<Candidate> candidates, boolean useBar, boolean barHidden) {
		if (candidates == null || candidates.isEmpty())
			throw new IllegalArgumentException("A candidate set needs at least one candidate");
		for (Candidate c : candidates) {
			if (!Candidate.isValidShortname(c.getShortname()))
				throw new IllegalArgumentException("Invalid candidate shortname '" + c.getShortname() + "'");
		}
		List<Candidate> all = new ArrayList<>(candidates);
		if (useBar || barHidden) all.add(Candidate.bar());
		for (int i = 0; i < all.size(); i++) {
			if (indexes.put(all.get(i).getShortname(), i) != null)
				throw new IllegalArgumentException("Duplicate candidate shortname '" + all.get(i).getShortname() + "'");
		}
		this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
		this.all = Collections.unmodifiableList(all);
		this.useBar = useBar;
		this.barHidden = barHidden && !useBar;
	}

	/** @return this set with a hidden bar, or this set itself when it already has a bar */
	public CandidateSet withHiddenBar() {
		return hasBar() ? this : new CandidateSet(candidates, false, true);
	}

	/** @return the candidates that a result shows: without a hidden bar */
	public CandidateSet visible() {
		return barHidden ? new CandidateSet(candidates, false) : this;
	}

	/** @return true when the bar takes part in votes, visible or not */
	public boolean hasBar() {
		return useBar || barHidden;
	}

	/** Convenience factory for candidates without titles, e.g. in tests: CandidateSet.of(true, "A", "B") */
	public static CandidateSet of(boolean useBar, String... shortnames) {
		List<Candidate> list = new ArrayList<>();
		for (String s : shortnames) list.add(new Candidate(s, s));
		return new CandidateSet(list, useBar);
	}

	public List<Candidate> getAll() {
		return all;
	}

	/** shortnames of all participants (candidates plus bar) in matrix order */
	public List<String> getAllShortnames() {
		return all.stream().map(Candidate::getShortname).toList();
	}

	public int size() {
		return all.size();
	}

	public boolean contains(String shortname) {
		return indexes.containsKey(shortname);
	}

	/**
	 * @param shortname shortname of a candidate or the bar
	 * @return index in {@link #getAll()} or -1 if unknown
	 */
	public int indexOf(String shortname) {
		Integer idx = indexes.get(shortname);
		return idx == null ? -1 : idx;
	}

	public Candidate get(int index) {
		return all.get(index);
	}

	@Override
	public String toString() {
		return "CandidateSet[" + String.join(",", getAllShortnames()) + "]";
	}
}
