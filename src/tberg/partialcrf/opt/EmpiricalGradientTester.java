package tberg.partialcrf.opt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tberg.partialcrf.arrays.a;

/**
 * Compares an analytic gradient against central finite differences.
 */
public class EmpiricalGradientTester {
	
	private static final Logger logger = LoggerFactory.getLogger(EmpiricalGradientTester.class);
	private static final double EPS = 1e-7;

	/**
	 * Returns the indices of dimensions whose analytic derivative disagrees with
	 * every empirical estimate tried, halving the step from delInitial down to
	 * delMin. An empty result means the gradient checks out.
	 */
	public static int[] test(DifferentiableFunction func, double[] x, double relEps, double delInitial, double delMin) {
		if (x.length != func.dimension()) {
			throw new IllegalArgumentException(String.format("[EmpiricalGradientTester.test] Point has dimension %d, function expects %d", x.length, func.dimension()));
		}
		double[] grad = func.calculate(x).getSecond();
		int[] failed = new int[x.length];
		int numFailed = 0;
		for (int i=0; i<x.length; ++i) {
			if (!test(func, x, grad, relEps, delInitial, delMin, i)) {
				failed[numFailed++] = i;
			}
		}
		int[] result = new int[numFailed];
		System.arraycopy(failed, 0, result, 0, numFailed);
		return result;
	}
	
	public static boolean test(DifferentiableFunction func, double[] x, double relEps, double delInitial, double delMin, int i) {
		return test(func, x, func.calculate(x).getSecond(), relEps, delInitial, delMin, i);
	}

	private static boolean test(DifferentiableFunction func, double[] x, double[] grad, double relEps, double delInitial, double delMin, int i) {
		double[] nextX = a.copy(x);
		double delta = delInitial;
		double empDeriv = 0.0;
		while (delta > delMin) {
			nextX[i] = x[i] + delta;
			double upVal = func.calculate(nextX).getFirst();
			nextX[i] = x[i] - delta;
			double downVal = func.calculate(nextX).getFirst();
			nextX[i] = x[i];
			empDeriv = (upVal - downVal) / (2.0 * delta);
			if (close(empDeriv, grad[i], relEps)) {
				logger.debug("Gradient ok for dim {}, delta {}, calculated {}, empirical {}", i, delta, grad[i], empDeriv);
				return true;
			}
			delta /= 2.0;
		}
		logger.warn(String.format("Empirical gradient step-size underflow dim %d, delta %.12f, calculated %.12f, empirical: %.12f", i, delta, grad[i], empDeriv));
		return false;
	}

	public static boolean close(double x, double y, double relEps) {
		if (Math.abs(x - y) < EPS) return true;
		double avgMag = (Math.abs(x) + Math.abs(y)) / 2.0;
		return Math.abs(x - y) / avgMag < relEps;
	}
}
