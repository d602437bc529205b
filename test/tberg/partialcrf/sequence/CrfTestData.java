package tberg.partialcrf.sequence;

import java.util.Random;

/**
 * Small fixtures shared by the sequence tests.
 */
public class CrfTestData {
	
	/**
	 * Two tags, three positions: start=[0.1,-0.2], end=[0.3,0.1],
	 * transition=[[0.5,-0.5],[-0.5,0.5]], emissions=[[1,0],[0,1],[1,0]].
	 */
	public static CrfParameters scenarioParameters() {
		return new CrfParameters(new double[] {0.1, -0.2}, new double[] {0.3, 0.1}, new double[][] {{0.5, -0.5}, {-0.5, 0.5}});
	}
	
	public static SequenceBatch scenarioBatch() {
		return new SequenceBatch(new double[][][] {{{1, 0}, {0, 1}, {1, 0}}});
	}
	
	public static double[][][] randomEmissions(int numSequences, int length, int numTags, double scale, Random rand) {
		double[][][] emissions = new double[numSequences][length][numTags];
		for (int d=0; d<numSequences; ++d) {
			for (int t=0; t<length; ++t) {
				for (int s=0; s<numTags; ++s) {
					emissions[d][t][s] = scale * (2.0 * rand.nextDouble() - 1.0);
				}
			}
		}
		return emissions;
	}
	
	public static boolean[][] prefixMask(int length, int... lengths) {
		boolean[][] mask = new boolean[lengths.length][length];
		for (int d=0; d<lengths.length; ++d) {
			for (int t=0; t<lengths[d]; ++t) mask[d][t] = true;
		}
		return mask;
	}
	
	/**
	 * Three rows of different lengths (4, 2, 1) padded to 4, with garbage in
	 * the padding.
	 */
	public static SequenceBatch raggedBatch(int numTags, Random rand) {
		return new SequenceBatch(randomEmissions(3, 4, numTags, 2.0, rand), prefixMask(4, 4, 2, 1));
	}
	
	public static int[][] randomTags(SequenceBatch batch, Random rand) {
		int[][] tags = new int[batch.numSequences()][batch.paddedLength()];
		for (int d=0; d<batch.numSequences(); ++d) {
			for (int t=0; t<batch.paddedLength(); ++t) {
				tags[d][t] = (t < batch.sequenceLength(d) ? rand.nextInt(batch.numTags()) : 0);
			}
		}
		return tags;
	}
	
	/**
	 * Copies the batch with extra masked-out positions full of large junk
	 * scores appended to every row.
	 */
	public static SequenceBatch padded(SequenceBatch batch, int extra, Random rand) {
		int length = batch.paddedLength() + extra;
		double[][][] emissions = new double[batch.numSequences()][length][batch.numTags()];
		boolean[][] mask = new boolean[batch.numSequences()][length];
		for (int d=0; d<batch.numSequences(); ++d) {
			for (int t=0; t<length; ++t) {
				for (int s=0; s<batch.numTags(); ++s) {
					emissions[d][t][s] = (t < batch.paddedLength() ? batch.emission(d, t, s) : 100.0 * rand.nextGaussian());
				}
				mask[d][t] = (t < batch.paddedLength() && batch.isValid(d, t));
			}
		}
		return new SequenceBatch(emissions, mask);
	}
	
}
