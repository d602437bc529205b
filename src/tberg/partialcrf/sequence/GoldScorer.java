package tberg.partialcrf.sequence;

/**
 * Exact score of one given tag path per row: start score of the first tag,
 * emissions at valid positions, transitions between consecutive valid
 * positions and the end score of the tag at the row's own last valid
 * position.
 */
public class GoldScorer {
	
	public static double[] score(CrfParameters params, SequenceBatch batch, int[][] tags) {
		checkInputs(params, batch, tags, "GoldScorer.score");
		double[] scores = new double[batch.numSequences()];
		for (int d=0; d<batch.numSequences(); ++d) {
			int length = batch.sequenceLength(d);
			double score = params.start(tags[d][0]);
			for (int t=0; t<length; ++t) {
				score += batch.emission(d, t, tags[d][t]);
				if (t > 0) score += params.transition(tags[d][t-1], tags[d][t]);
			}
			score += params.end(tags[d][length-1]);
			ForwardBackward.checkFinite(score, d, "GoldScorer.score");
			scores[d] = score;
		}
		return scores;
	}
	
	/**
	 * The gold path as a point-mass distribution: its score plus indicator
	 * counts of every score it touches, in the same layout that
	 * forward-backward produces.
	 */
	public static Marginals statistics(CrfParameters params, SequenceBatch batch, int[][] tags) {
		double[] scores = score(params, batch, tags);
		int numTags = batch.numTags();
		double[][][] nodeCounts = new double[batch.numSequences()][batch.paddedLength()][numTags];
		double[] startCounts = new double[numTags];
		double[] endCounts = new double[numTags];
		double[][] transitionCounts = new double[numTags][numTags];
		for (int d=0; d<batch.numSequences(); ++d) {
			int length = batch.sequenceLength(d);
			startCounts[tags[d][0]] += 1.0;
			for (int t=0; t<length; ++t) {
				nodeCounts[d][t][tags[d][t]] = 1.0;
				if (t > 0) transitionCounts[tags[d][t-1]][tags[d][t]] += 1.0;
			}
			endCounts[tags[d][length-1]] += 1.0;
		}
		return new Marginals(scores, nodeCounts, startCounts, endCounts, transitionCounts);
	}
	
	private static void checkInputs(CrfParameters params, SequenceBatch batch, int[][] tags, String where) {
		if (params.numTags() != batch.numTags()) throw CrfException.shapeMismatch(where, "Model has %d tags but emissions have %d", params.numTags(), batch.numTags());
		batch.checkTags(tags, where);
	}

}
