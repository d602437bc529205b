package tberg.partialcrf.sequence;

import tberg.partialcrf.arrays.a;

public class ViterbiPaths {
	
	private final int[][] paths;
	private final double[] scores;
	
	public ViterbiPaths(int[][] paths, double[] scores) {
		this.paths = paths;
		this.scores = scores;
	}
	
	public int numSequences() {
		return paths.length;
	}
	
	public int[] path(int d) {
		return a.copy(paths[d]);
	}
	
	public int[][] paths() {
		int[][] result = new int[paths.length][];
		for (int d=0; d<paths.length; ++d) result[d] = a.copy(paths[d]);
		return result;
	}
	
	/**
	 * Score of the best path of row d, start and end scores included.
	 */
	public double score(int d) {
		return scores[d];
	}
	
	public double[] scores() {
		return a.copy(scores);
	}
	
}
