package tberg.partialcrf.opt;

import tberg.partialcrf.tuple.Pair;

/**
 * A scalar function of a flat parameter vector that can report its own
 * gradient. The optimizer that consumes it lives outside this library.
 */
public interface DifferentiableFunction {
	public int dimension();
	public abstract Pair<Double, double[]> calculate(double[] x);
}
