package tberg.partialcrf.sequence;

import tberg.partialcrf.arrays.a;

/**
 * Per-row log scores together with (expected) counts of every node, start,
 * end and transition score. From forward-backward the log score is logZ and
 * the counts are posterior marginals; for a single gold path the log score
 * is that path's score and the counts are indicators.
 */
public class Marginals {
	
	private final double[] sequenceLogScores;
	private final double[][][] nodeMarginals;
	private final double[] startCounts;
	private final double[] endCounts;
	private final double[][] transitionCounts;
	
	public Marginals(double[] sequenceLogScores, double[][][] nodeMarginals, double[] startCounts, double[] endCounts, double[][] transitionCounts) {
		this.sequenceLogScores = sequenceLogScores;
		this.nodeMarginals = nodeMarginals;
		this.startCounts = startCounts;
		this.endCounts = endCounts;
		this.transitionCounts = transitionCounts;
	}
	
	public int numSequences() {
		return sequenceLogScores.length;
	}
	
	public double sequenceLogScore(int d) {
		return sequenceLogScores[d];
	}
	
	public double[] sequenceLogScores() {
		return a.copy(sequenceLogScores);
	}
	
	public double logScore() {
		return a.sum(sequenceLogScores);
	}
	
	/**
	 * Distribution over tags at a valid position; all zeros at padding.
	 */
	public double[] nodeMarginals(int d, int t) {
		return a.copy(nodeMarginals[d][t]);
	}
	
	public double[][][] nodeMarginals() {
		return a.copy(nodeMarginals);
	}
	
	public double[] startCounts() {
		return a.copy(startCounts);
	}
	
	public double[] endCounts() {
		return a.copy(endCounts);
	}
	
	public double[][] transitionCounts() {
		return a.copy(transitionCounts);
	}
	
	/**
	 * Counts laid out like CrfParameters.toArray.
	 */
	public double[] toParameterArray() {
		return a.append(a.append(startCounts, endCounts), a.flatten(transitionCounts));
	}
	
}
