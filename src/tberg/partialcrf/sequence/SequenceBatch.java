package tberg.partialcrf.sequence;

import java.util.Arrays;

import org.jblas.DoubleMatrix;

import tberg.partialcrf.arrays.a;

/**
 * A right-padded batch of emission score matrices with its validity mask.
 * Valid positions of each row form a non-empty prefix. The batch keeps its
 * own copy of the caller's arrays and never changes after construction.
 */
public class SequenceBatch {
	
	private final double[][][] emissions;
	private final boolean[][] mask;
	private final int[] lengths;
	private final int numTags;
	private final DoubleMatrix[] emissionsByTime;
	
	public SequenceBatch(double[][][] emissions) {
		this(emissions, fullMask(emissions));
	}

	public SequenceBatch(double[][][] emissions, boolean[][] mask) {
		if (emissions == null || mask == null) throw new NullPointerException("[SequenceBatch] Emissions and mask must be non-null");
		if (emissions.length == 0) throw CrfException.shapeMismatch("SequenceBatch", "Batch has no rows");
		if (mask.length != emissions.length) throw CrfException.shapeMismatch("SequenceBatch", "Emissions have %d rows but mask has %d", emissions.length, mask.length);
		int paddedLength = emissions[0].length;
		if (paddedLength == 0) throw CrfException.shapeMismatch("SequenceBatch", "Padded length must be at least 1");
		if (emissions[0][0] == null || emissions[0][0].length == 0) throw CrfException.shapeMismatch("SequenceBatch", "Number of tags must be at least 1");
		this.numTags = emissions[0][0].length;
		this.lengths = new int[emissions.length];
		for (int d=0; d<emissions.length; ++d) {
			if (emissions[d].length != paddedLength) throw CrfException.shapeMismatch("SequenceBatch", "Row %d has length %d, expected %d", d, emissions[d].length, paddedLength);
			if (mask[d].length != paddedLength) throw CrfException.shapeMismatch("SequenceBatch", "Mask row %d has length %d, expected %d", d, mask[d].length, paddedLength);
			for (int t=0; t<paddedLength; ++t) {
				if (emissions[d][t].length != numTags) throw CrfException.shapeMismatch("SequenceBatch", "Row %d position %d has %d tag scores, expected %d", d, t, emissions[d][t].length, numTags);
			}
			lengths[d] = a.count(mask[d]);
			if (lengths[d] == 0) throw new CrfException(CrfException.Kind.ZERO_LENGTH_SEQUENCE, "[SequenceBatch] Row " + d + " has no valid positions");
			for (int t=0; t<lengths[d]; ++t) {
				if (!mask[d][t]) throw new CrfException(CrfException.Kind.NON_CONTIGUOUS_MASK, "[SequenceBatch] Row " + d + " has a gap at position " + t);
			}
		}
		this.emissions = a.copy(emissions);
		this.mask = a.copy(mask);
		this.emissionsByTime = new DoubleMatrix[paddedLength];
		for (int t=0; t<paddedLength; ++t) {
			DoubleMatrix scores = new DoubleMatrix(emissions.length, numTags);
			for (int d=0; d<emissions.length; ++d) {
				for (int s=0; s<numTags; ++s) {
					scores.put(d, s, emissions[d][t][s]);
				}
			}
			emissionsByTime[t] = scores;
		}
	}
	
	private static boolean[][] fullMask(double[][][] emissions) {
		if (emissions == null) return null;
		boolean[][] result = new boolean[emissions.length][];
		for (int d=0; d<emissions.length; ++d) {
			result[d] = new boolean[emissions[d].length];
			Arrays.fill(result[d], true);
		}
		return result;
	}
	
	public int numSequences() {
		return emissions.length;
	}
	
	public int paddedLength() {
		return emissions[0].length;
	}
	
	public int numTags() {
		return numTags;
	}
	
	public int sequenceLength(int d) {
		return lengths[d];
	}
	
	public int[] sequenceLengths() {
		return a.copy(lengths);
	}
	
	public boolean isValid(int d, int t) {
		return mask[d][t];
	}
	
	public double emission(int d, int t, int s) {
		return emissions[d][t][s];
	}

	/**
	 * Emission scores at one time step for every row, as a [batch x tags]
	 * matrix. Shared; callers must not modify it.
	 */
	DoubleMatrix emissionsAt(int t) {
		return emissionsByTime[t];
	}
	
	/**
	 * Smallest and largest emission score over valid positions.
	 */
	public double[] emissionRange() {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int d=0; d<emissions.length; ++d) {
			for (int t=0; t<lengths[d]; ++t) {
				min = Math.min(min, a.min(emissions[d][t]));
				max = Math.max(max, a.max(emissions[d][t]));
			}
		}
		return new double[] {min, max};
	}
	
	/**
	 * Checks an integer tag array against this batch. Only entries at valid
	 * positions have to be in range.
	 */
	public void checkTags(int[][] tags, String where) {
		if (tags == null) throw new NullPointerException("[" + where + "] Tags must be non-null");
		if (tags.length != numSequences()) throw CrfException.shapeMismatch(where, "Tags have %d rows but batch has %d", tags.length, numSequences());
		for (int d=0; d<tags.length; ++d) {
			if (tags[d].length != paddedLength()) throw CrfException.shapeMismatch(where, "Tag row %d has length %d, expected %d", d, tags[d].length, paddedLength());
			for (int t=0; t<lengths[d]; ++t) {
				if (tags[d][t] < 0 || tags[d][t] >= numTags) throw CrfException.shapeMismatch(where, "Tag %d at row %d position %d is outside [0, %d)", tags[d][t], d, t, numTags);
			}
		}
	}

}
