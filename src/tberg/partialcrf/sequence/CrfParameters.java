package tberg.partialcrf.sequence;

import java.util.Random;

import org.jblas.DoubleMatrix;

import tberg.partialcrf.arrays.a;

/**
 * Start, end and transition scores of a linear-chain CRF over tags 0..T-1.
 * transition[u][v] scores moving from tag u to tag v. The arrays are owned by
 * this object and are updated in place by whoever trains the model; nothing
 * in this package writes to them during inference.
 */
public class CrfParameters {
	
	private final int numTags;
	private final double[] start;
	private final double[] end;
	private final double[][] transition;
	
	public CrfParameters(double[] start, double[] end, double[][] transition) {
		this.numTags = start.length;
		if (numTags == 0) throw CrfException.shapeMismatch("CrfParameters", "Number of tags must be at least 1");
		if (end.length != numTags) throw CrfException.shapeMismatch("CrfParameters", "End scores have %d tags, start scores have %d", end.length, numTags);
		if (transition.length != numTags) throw CrfException.shapeMismatch("CrfParameters", "Transition matrix has %d rows, expected %d", transition.length, numTags);
		for (int u=0; u<numTags; ++u) {
			if (transition[u].length != numTags) throw CrfException.shapeMismatch("CrfParameters", "Transition row %d has %d columns, expected %d", u, transition[u].length, numTags);
		}
		this.start = a.copy(start);
		this.end = a.copy(end);
		this.transition = a.copy(transition);
	}
	
	public static CrfParameters zeros(int numTags) {
		return new CrfParameters(new double[numTags], new double[numTags], new double[numTags][numTags]);
	}
	
	public static CrfParameters random(int numTags, double range, Random rand) {
		CrfParameters result = zeros(numTags);
		result.reset(range, rand);
		return result;
	}
	
	public static int dimension(int numTags) {
		return 2 * numTags + numTags * numTags;
	}
	
	/**
	 * Inverse of toArray: start scores, then end scores, then the transition
	 * matrix row by row.
	 */
	public static CrfParameters fromArray(int numTags, double[] x) {
		if (x.length != dimension(numTags)) throw CrfException.shapeMismatch("CrfParameters.fromArray", "Expected %d values for %d tags, got %d", dimension(numTags), numTags, x.length);
		double[] start = new double[numTags];
		double[] end = new double[numTags];
		System.arraycopy(x, 0, start, 0, numTags);
		System.arraycopy(x, numTags, end, 0, numTags);
		return new CrfParameters(start, end, a.unflatten(x, 2 * numTags, numTags, numTags));
	}

	public double[] toArray() {
		return a.append(a.append(start, end), a.flatten(transition));
	}
	
	/**
	 * Redraws every score uniformly from [-range, range].
	 */
	public void reset(double range, Random rand) {
		for (int s=0; s<numTags; ++s) {
			start[s] = uniform(range, rand);
			end[s] = uniform(range, rand);
			for (int v=0; v<numTags; ++v) {
				transition[s][v] = uniform(range, rand);
			}
		}
	}
	
	private static double uniform(double range, Random rand) {
		return (2.0 * rand.nextDouble() - 1.0) * range;
	}
	
	public int numTags() {
		return numTags;
	}
	
	public double[] start() {
		return start;
	}
	
	public double[] end() {
		return end;
	}
	
	public double[][] transition() {
		return transition;
	}
	
	public double start(int s) {
		return start[s];
	}
	
	public double end(int s) {
		return end[s];
	}
	
	public double transition(int u, int v) {
		return transition[u][v];
	}
	
	/**
	 * Largest absolute value over all scores.
	 */
	public double maxAbs() {
		double result = Math.max(a.max(a.abs(start)), a.max(a.abs(end)));
		for (double[] row : transition) result = Math.max(result, a.max(a.abs(row)));
		return result;
	}
	
	DoubleMatrix startRow() {
		return new DoubleMatrix(1, numTags, a.copy(start));
	}
	
	DoubleMatrix endRow() {
		return new DoubleMatrix(1, numTags, a.copy(end));
	}
	
	/**
	 * Row vector of transition(u, s) over sources u when backward is false, or
	 * of transition(s, v) over destinations v when backward is true.
	 */
	DoubleMatrix transitionRow(int s, boolean backward) {
		DoubleMatrix result = new DoubleMatrix(1, numTags);
		for (int other=0; other<numTags; ++other) {
			result.put(0, other, backward ? transition[s][other] : transition[other][s]);
		}
		return result;
	}
	
}
