package tberg.partialcrf.sequence;

import java.util.Random;

import org.jblas.DoubleMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tberg.partialcrf.arrays.a;

/**
 * Linear-chain CRF over tags 0..T-1 with start, end and transition scores,
 * supporting full supervision (one gold tag per position) and partial
 * supervision (a candidate set per position).
 * 
 * Emission scores come from outside, one [padded length x tags] matrix per
 * row of a SequenceBatch. Training losses are negative log-likelihoods,
 * logZ minus the gold (or restricted) score, summed over the batch; their
 * gradients are available through CrfObjective.
 * 
 * Parameters are read, never written, during a computation. Updating them
 * while a computation is running is the caller's problem: there is no
 * locking here.
 */
public class LinearChainCRF {
	
	private static final Logger logger = LoggerFactory.getLogger(LinearChainCRF.class);
	
	public static final double DEFAULT_IMPOSSIBLE_SCORE = -1e7;
	public static final double DEFAULT_INIT_RANGE = 0.1;
	public static final double DEFAULT_SENTINEL_MARGIN = 1e3;
	
	private final CrfParameters params;
	private final double impossibleScore;
	private final double initRange;
	private final double sentinelMargin;
	
	public LinearChainCRF(int numTags) {
		this(numTags, new Random());
	}
	
	public LinearChainCRF(int numTags, Random rand) {
		this(CrfParameters.random(numTags, DEFAULT_INIT_RANGE, rand), DEFAULT_IMPOSSIBLE_SCORE, DEFAULT_INIT_RANGE, DEFAULT_SENTINEL_MARGIN);
	}
	
	public LinearChainCRF(CrfParameters params) {
		this(params, DEFAULT_IMPOSSIBLE_SCORE, DEFAULT_INIT_RANGE, DEFAULT_SENTINEL_MARGIN);
	}

	public LinearChainCRF(CrfParameters params, double impossibleScore) {
		this(params, impossibleScore, DEFAULT_INIT_RANGE, DEFAULT_SENTINEL_MARGIN);
	}
	
	public LinearChainCRF(CrfParameters params, double impossibleScore, double initRange, double sentinelMargin) {
		if (!(impossibleScore < 0.0) || Double.isInfinite(impossibleScore)) {
			throw new IllegalArgumentException("[LinearChainCRF] Impossible score must be finite and negative: " + impossibleScore);
		}
		if (!(initRange >= 0.0)) throw new IllegalArgumentException("[LinearChainCRF] Init range must be non-negative: " + initRange);
		this.params = params;
		this.impossibleScore = impossibleScore;
		this.initRange = initRange;
		this.sentinelMargin = sentinelMargin;
	}
	
	public CrfParameters parameters() {
		return params;
	}
	
	public int numTags() {
		return params.numTags();
	}
	
	public double impossibleScore() {
		return impossibleScore;
	}
	
	public double sentinelMargin() {
		return sentinelMargin;
	}
	
	public void resetParameters(Random rand) {
		params.reset(initRange, rand);
	}
	
	private CrfLattice lattice(SequenceBatch batch) {
		logger.debug("Batch of {} rows, padded length {}, {} tags", batch.numSequences(), batch.paddedLength(), batch.numTags());
		return new CrfLattice(params, batch);
	}
	
	/**
	 * logZ per row.
	 */
	public double[] logPartition(SequenceBatch batch) {
		return ForwardBackward.computeLogPartition(lattice(batch));
	}
	
	/**
	 * Forward scores as [batch][padded length][tags]. At padding positions
	 * the values repeat those of the row's last valid position.
	 */
	public double[][][] forwardScores(SequenceBatch batch) {
		CrfLattice lattice = lattice(batch);
		DoubleMatrix[] alphas = ForwardBackward.computeLogAlphas(lattice);
		ForwardBackward.checkFinite(alphas, lattice, "LinearChainCRF.forwardScores");
		return toBatchMajor(alphas);
	}
	
	/**
	 * Backward scores as [batch][padded length][tags], aligned with
	 * forwardScores so that forward + backward - logZ is a log marginal.
	 */
	public double[][][] backwardScores(SequenceBatch batch) {
		CrfLattice lattice = lattice(batch);
		DoubleMatrix[] betas = ForwardBackward.computeLogBetas(lattice);
		ForwardBackward.checkFinite(betas, lattice, "LinearChainCRF.backwardScores");
		return toBatchMajor(betas);
	}
	
	public Marginals marginals(SequenceBatch batch) {
		return ForwardBackward.computeMarginals(lattice(batch));
	}
	
	/**
	 * Per-position tag probabilities, zero at padding.
	 */
	public double[][][] marginalProbabilities(SequenceBatch batch) {
		return marginals(batch).nodeMarginals();
	}
	
	public double[] goldScore(SequenceBatch batch, int[][] tags) {
		return GoldScorer.score(params, batch, tags);
	}
	
	public double[] partialGoldScore(SequenceBatch batch, CandidateMask candidates) {
		return PartialGoldScorer.score(params, batch, candidates, impossibleScore, sentinelMargin);
	}
	
	public double negativeLogLikelihood(SequenceBatch batch, int[][] tags) {
		double[] gold = goldScore(batch, tags);
		double[] logZ = logPartition(batch);
		return a.sum(logZ) - a.sum(gold);
	}
	
	public double partialNegativeLogLikelihood(SequenceBatch batch, CandidateMask candidates) {
		double[] restricted = partialGoldScore(batch, candidates);
		double[] logZ = logPartition(batch);
		return a.sum(logZ) - a.sum(restricted);
	}
	
	public ViterbiPaths viterbiDecode(SequenceBatch batch) {
		return ForwardBackward.computeViterbiPaths(lattice(batch));
	}
	
	/**
	 * Best path per row among those consistent with the candidate sets.
	 */
	public ViterbiPaths viterbiDecode(SequenceBatch batch, CandidateMask candidates) {
		return ForwardBackward.computeViterbiPaths(PartialGoldScorer.restrict(params, batch, candidates, impossibleScore, sentinelMargin));
	}
	
	public CrfObjective objective(SequenceBatch batch, int[][] tags) {
		return CrfObjective.fullySupervised(batch, tags);
	}

	public CrfObjective partialObjective(SequenceBatch batch, CandidateMask candidates) {
		return CrfObjective.partiallySupervised(batch, candidates, impossibleScore, sentinelMargin);
	}
	
	private static double[][][] toBatchMajor(DoubleMatrix[] passes) {
		int numSequences = passes[0].rows;
		int numStates = passes[0].columns;
		double[][][] result = new double[numSequences][passes.length][numStates];
		for (int t=0; t<passes.length; ++t) {
			for (int d=0; d<numSequences; ++d) {
				for (int s=0; s<numStates; ++s) {
					result[d][t][s] = passes[t].get(d, s);
				}
			}
		}
		return result;
	}
	
}
