package tberg.partialcrf.sequence;

import tberg.partialcrf.arrays.a;
import tberg.partialcrf.opt.DifferentiableFunction;
import tberg.partialcrf.tuple.Pair;

/**
 * Summed negative log-likelihood of a fixed batch as a function of the
 * flattened CRF parameters (see CrfParameters.toArray), with its exact
 * gradient: expected counts under the full chain minus the counts of the
 * supervision, where the supervision is either the gold path or the
 * distribution restricted to the candidate sets.
 */
public class CrfObjective implements DifferentiableFunction {
	
	private final SequenceBatch batch;
	private final int[][] tags;
	private final CandidateMask candidates;
	private final double impossibleScore;
	private final double sentinelMargin;
	
	private CrfObjective(SequenceBatch batch, int[][] tags, CandidateMask candidates, double impossibleScore, double sentinelMargin) {
		this.batch = batch;
		this.tags = tags;
		this.candidates = candidates;
		this.impossibleScore = impossibleScore;
		this.sentinelMargin = sentinelMargin;
	}
	
	public static CrfObjective fullySupervised(SequenceBatch batch, int[][] tags) {
		batch.checkTags(tags, "CrfObjective.fullySupervised");
		int[][] copy = new int[tags.length][];
		for (int d=0; d<tags.length; ++d) copy[d] = a.copy(tags[d]);
		return new CrfObjective(batch, copy, null, 0.0, 0.0);
	}
	
	public static CrfObjective partiallySupervised(SequenceBatch batch, CandidateMask candidates, double impossibleScore, double sentinelMargin) {
		candidates.validate(batch);
		return new CrfObjective(batch, null, candidates, impossibleScore, sentinelMargin);
	}
	
	public int dimension() {
		return CrfParameters.dimension(batch.numTags());
	}

	public Pair<Double, double[]> calculate(double[] x) {
		CrfParameters params = CrfParameters.fromArray(batch.numTags(), x);
		Marginals full = ForwardBackward.computeMarginals(new CrfLattice(params, batch));
		Marginals supervised = supervision(params);
		double value = full.logScore() - supervised.logScore();
		double[] gradient = a.comb(full.toParameterArray(), 1.0, supervised.toParameterArray(), -1.0);
		return Pair.makePair(value, gradient);
	}
	
	/**
	 * Derivative of the loss with respect to every emission score,
	 * [batch][padded length][tags], zero at padding. This is what flows back
	 * into the encoder that produced the emissions.
	 */
	public double[][][] emissionGradient(double[] x) {
		CrfParameters params = CrfParameters.fromArray(batch.numTags(), x);
		double[][][] gradient = ForwardBackward.computeMarginals(new CrfLattice(params, batch)).nodeMarginals();
		a.combi(gradient, 1.0, supervision(params).nodeMarginals(), -1.0);
		return gradient;
	}
	
	private Marginals supervision(CrfParameters params) {
		if (tags != null) {
			return GoldScorer.statistics(params, batch, tags);
		} else {
			return PartialGoldScorer.statistics(params, batch, candidates, impossibleScore, sentinelMargin);
		}
	}

}
