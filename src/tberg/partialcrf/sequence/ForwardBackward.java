package tberg.partialcrf.sequence;

import org.jblas.DoubleMatrix;
import org.jblas.MatrixFunctions;

import tberg.partialcrf.math.m;

/**
 * Exact log-space inference over a batch of linear chains. Every time step
 * advances all rows of the batch at once: the running scores are a
 * [batch x states] matrix and each step is a handful of broadcasts and
 * row-wise reductions over it. The time axis itself is a plain sequential
 * scan.
 * 
 * Positions past a row's length copy the previous scores through unchanged,
 * so padding never contributes and never advances the chain.
 */
public class ForwardBackward {
	
	/**
	 * A batch of chains sharing one padded length and one state space. All
	 * matrices are [numSequences x numStates] and are read-only for callers.
	 */
	public static interface Lattice {
		public int numSequences();
		public int paddedLength();
		public int numStates();
		public int sequenceLength(int d);
		public boolean isValid(int d, int t);
		public DoubleMatrix startLogPotentials();
		public DoubleMatrix endLogPotentials();
		public DoubleMatrix nodeLogPotentials(int t);
		/**
		 * Scores of the edges between positions t-1 and t that touch state s.
		 * Forward: column u holds the edge from u at t-1 into s at t.
		 * Backward: column v holds the edge from s at t-1 into v at t.
		 */
		public DoubleMatrix edgeLogPotentials(int t, int s, boolean backward);
	}
	
	/**
	 * alphas[t](d, s) is the log-sum of all prefixes ending in state s at t,
	 * including the start score and the node score at t.
	 */
	public static DoubleMatrix[] computeLogAlphas(Lattice lattice) {
		int length = lattice.paddedLength();
		int numStates = lattice.numStates();
		DoubleMatrix[] alphas = new DoubleMatrix[length];
		alphas[0] = lattice.startLogPotentials().add(lattice.nodeLogPotentials(0));
		for (int t=1; t<length; ++t) {
			DoubleMatrix prev = alphas[t-1];
			DoubleMatrix next = new DoubleMatrix(lattice.numSequences(), numStates);
			for (int s=0; s<numStates; ++s) {
				DoubleMatrix inner = prev.add(lattice.edgeLogPotentials(t, s, false));
				next.putColumn(s, m.logSumExp(inner, m.COLUMNS));
			}
			next.addi(lattice.nodeLogPotentials(t));
			alphas[t] = carryPadding(lattice, t, prev, next);
		}
		return alphas;
	}
	
	/**
	 * betas[t](d, s) is the log-sum of all suffixes leaving state s at t,
	 * excluding the node score at t and including the end score. At a row's
	 * last valid position beta is exactly the end score.
	 */
	public static DoubleMatrix[] computeLogBetas(Lattice lattice) {
		int length = lattice.paddedLength();
		int numStates = lattice.numStates();
		DoubleMatrix[] betas = new DoubleMatrix[length];
		betas[length-1] = lattice.endLogPotentials().dup();
		for (int t=length-1; t>0; --t) {
			DoubleMatrix prev = betas[t];
			DoubleMatrix ahead = prev.add(lattice.nodeLogPotentials(t));
			DoubleMatrix next = new DoubleMatrix(lattice.numSequences(), numStates);
			for (int s=0; s<numStates; ++s) {
				DoubleMatrix inner = ahead.add(lattice.edgeLogPotentials(t, s, true));
				next.putColumn(s, m.logSumExp(inner, m.COLUMNS));
			}
			betas[t-1] = carryPadding(lattice, t, prev, next);
		}
		return betas;
	}
	
	private static DoubleMatrix carryPadding(Lattice lattice, int t, DoubleMatrix prev, DoubleMatrix next) {
		for (int d=0; d<lattice.numSequences(); ++d) {
			if (!lattice.isValid(d, t)) {
				next.putRow(d, prev.getRow(d));
			}
		}
		return next;
	}
	
	public static double[] computeLogPartition(Lattice lattice) {
		return logPartition(lattice, computeLogAlphas(lattice)).toArray();
	}
	
	private static DoubleMatrix logPartition(Lattice lattice, DoubleMatrix[] alphas) {
		DoubleMatrix stops = alphas[alphas.length-1].add(lattice.endLogPotentials());
		DoubleMatrix logZ = m.logSumExp(stops, m.COLUMNS);
		for (int d=0; d<logZ.rows; ++d) {
			checkFinite(logZ.get(d), d, "ForwardBackward.computeLogPartition");
		}
		return logZ;
	}
	
	/**
	 * Node marginals and expected counts of every start, end and transition
	 * score, i.e. the gradient of the summed log-partition with respect to
	 * each of them.
	 */
	public static Marginals computeMarginals(Lattice lattice) {
		int numSequences = lattice.numSequences();
		int length = lattice.paddedLength();
		int numStates = lattice.numStates();
		DoubleMatrix[] alphas = computeLogAlphas(lattice);
		DoubleMatrix[] betas = computeLogBetas(lattice);
		DoubleMatrix logZ = logPartition(lattice, alphas);
		
		double[][][] nodeMarginals = new double[numSequences][length][numStates];
		double[] startCounts = new double[numStates];
		double[] endCounts = new double[numStates];
		for (int t=0; t<length; ++t) {
			DoubleMatrix probs = MatrixFunctions.expi(alphas[t].add(betas[t]).subiColumnVector(logZ));
			for (int d=0; d<numSequences; ++d) {
				if (!lattice.isValid(d, t)) continue;
				for (int s=0; s<numStates; ++s) {
					double p = probs.get(d, s);
					checkFinite(p, d, "ForwardBackward.computeMarginals");
					nodeMarginals[d][t][s] = p;
					if (t == 0) startCounts[s] += p;
					if (t == lattice.sequenceLength(d)-1) endCounts[s] += p;
				}
			}
		}
		
		double[][] transitionCounts = new double[numStates][numStates];
		for (int t=1; t<length; ++t) {
			DoubleMatrix ahead = betas[t].add(lattice.nodeLogPotentials(t)).subiColumnVector(logZ);
			for (int v=0; v<numStates; ++v) {
				DoubleMatrix edgeProbs = MatrixFunctions.expi(alphas[t-1].add(lattice.edgeLogPotentials(t, v, false)).addiColumnVector(ahead.getColumn(v)));
				for (int d=0; d<numSequences; ++d) {
					if (!lattice.isValid(d, t)) continue;
					for (int u=0; u<numStates; ++u) {
						transitionCounts[u][v] += edgeProbs.get(d, u);
					}
				}
			}
		}
		return new Marginals(logZ.toArray(), nodeMarginals, startCounts, endCounts, transitionCounts);
	}
	
	/**
	 * Max-plus version of the forward pass. Backpointers are recorded only at
	 * valid positions; each row's path has that row's length.
	 */
	public static ViterbiPaths computeViterbiPaths(Lattice lattice) {
		int numSequences = lattice.numSequences();
		int length = lattice.paddedLength();
		int numStates = lattice.numStates();
		int[][][] backpointers = new int[length][][];
		DoubleMatrix scores = lattice.startLogPotentials().add(lattice.nodeLogPotentials(0));
		// rowMaxs skips NaN, so each step is checked before it is reduced
		checkFinite(scores, lattice, 0, "ForwardBackward.computeViterbiPaths");
		for (int t=1; t<length; ++t) {
			DoubleMatrix next = new DoubleMatrix(numSequences, numStates);
			backpointers[t] = new int[numSequences][numStates];
			for (int s=0; s<numStates; ++s) {
				DoubleMatrix inner = scores.add(lattice.edgeLogPotentials(t, s, false));
				int[] argmaxes = inner.rowArgmaxs();
				next.putColumn(s, inner.rowMaxs());
				for (int d=0; d<numSequences; ++d) {
					backpointers[t][d][s] = (lattice.isValid(d, t) ? argmaxes[d] : -1);
				}
			}
			next.addi(lattice.nodeLogPotentials(t));
			checkFinite(next, lattice, t, "ForwardBackward.computeViterbiPaths");
			scores = carryPadding(lattice, t, scores, next);
		}
		scores.addi(lattice.endLogPotentials());
		
		int[] bestLast = scores.rowArgmaxs();
		DoubleMatrix bestScores = scores.rowMaxs();
		int[][] paths = new int[numSequences][];
		for (int d=0; d<numSequences; ++d) {
			checkFinite(bestScores.get(d), d, "ForwardBackward.computeViterbiPaths");
			int sequenceLength = lattice.sequenceLength(d);
			int[] path = new int[sequenceLength];
			path[sequenceLength-1] = bestLast[d];
			for (int t=sequenceLength-1; t>0; --t) {
				path[t-1] = backpointers[t][d][path[t]];
			}
			paths[d] = path;
		}
		return new ViterbiPaths(paths, bestScores.toArray());
	}
	
	static void checkFinite(double value, int d, String where) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new CrfException(CrfException.Kind.NUMERIC_OVERFLOW, "[" + where + "] Non-finite value " + value + " in row " + d);
		}
	}
	
	static void checkFinite(DoubleMatrix[] passes, Lattice lattice, String where) {
		for (int t=0; t<passes.length; ++t) {
			checkFinite(passes[t], lattice, t, where);
		}
	}
	
	/**
	 * Checks the rows of one time step that are valid at t.
	 */
	static void checkFinite(DoubleMatrix scores, Lattice lattice, int t, String where) {
		for (int d=0; d<lattice.numSequences(); ++d) {
			if (!lattice.isValid(d, t)) continue;
			for (int s=0; s<lattice.numStates(); ++s) {
				checkFinite(scores.get(d, s), d, where);
			}
		}
	}
	
}
