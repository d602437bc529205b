package tberg.partialcrf.sequence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log-sum of scores over every tag path consistent with per-position
 * candidate sets, computed by running the partition function over a
 * RestrictedLattice.
 */
public class PartialGoldScorer {
	
	private static final Logger logger = LoggerFactory.getLogger(PartialGoldScorer.class);
	
	public static double[] score(CrfParameters params, SequenceBatch batch, CandidateMask candidates, double impossibleScore, double sentinelMargin) {
		return ForwardBackward.computeLogPartition(restrict(params, batch, candidates, impossibleScore, sentinelMargin));
	}
	
	/**
	 * Expected counts under the restricted distribution. Disallowed cells
	 * come out as zero, matching the gradient of score(), in which they are
	 * constants.
	 */
	public static Marginals statistics(CrfParameters params, SequenceBatch batch, CandidateMask candidates, double impossibleScore, double sentinelMargin) {
		return ForwardBackward.computeMarginals(restrict(params, batch, candidates, impossibleScore, sentinelMargin));
	}
	
	public static RestrictedLattice restrict(CrfParameters params, SequenceBatch batch, CandidateMask candidates, double impossibleScore, double sentinelMargin) {
		candidates.validate(batch);
		// warns only; a weak sentinel still yields a usable lattice
		checkSentinel(params, batch, impossibleScore, sentinelMargin);
		return new RestrictedLattice(new CrfLattice(params, batch), candidates, impossibleScore);
	}
	
	/**
	 * The sentinel only excludes paths if it dwarfs what a legitimate path can
	 * accumulate over the batch's padded length. Returns false, and warns,
	 * when |impossibleScore| < margin * length * (per-step score range).
	 */
	public static boolean checkSentinel(CrfParameters params, SequenceBatch batch, double impossibleScore, double sentinelMargin) {
		double[] emissionRange = batch.emissionRange();
		double stepRange = (emissionRange[1] - emissionRange[0]) + 4.0 * params.maxAbs();
		double required = sentinelMargin * batch.paddedLength() * stepRange;
		if (Math.abs(impossibleScore) < required) {
			logger.warn("Impossible score {} may not dominate: {} steps with per-step score range {} call for magnitude at least {}", impossibleScore, batch.paddedLength(), stepRange, required);
			return false;
		}
		return true;
	}

}
