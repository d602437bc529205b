package tberg.partialcrf.opt;

import static org.fest.assertions.Assertions.assertThat;

import org.junit.Test;

import tberg.partialcrf.tuple.Pair;

public class EmpiricalGradientTesterTest {
	
	private static class Quadratic implements DifferentiableFunction {
		private final double[] center;
		private final int brokenDim;
		
		public Quadratic(double[] center, int brokenDim) {
			this.center = center;
			this.brokenDim = brokenDim;
		}
		
		public int dimension() {
			return center.length;
		}
		
		public Pair<Double, double[]> calculate(double[] x) {
			double value = 0.0;
			double[] grad = new double[x.length];
			for (int i=0; i<x.length; ++i) {
				double diff = x[i] - center[i];
				value += diff * diff;
				grad[i] = (i == brokenDim ? 3.0 : 2.0) * diff;
			}
			return Pair.makePair(value, grad);
		}
	}

	@Test
	public void testCorrectGradientPasses() {
		Quadratic func = new Quadratic(new double[] {1.0, -2.0, 0.5}, -1);
		assertThat(EmpiricalGradientTester.test(func, new double[] {0.3, 0.7, -1.1}, 1e-4, 1e-2, 1e-8)).isEmpty();
	}
	
	@Test
	public void testWrongDimensionIsReported() {
		Quadratic func = new Quadratic(new double[] {1.0, -2.0, 0.5}, 1);
		double[] x = {0.3, 0.7, -1.1};
		assertThat(EmpiricalGradientTester.test(func, x, 1e-4, 1e-2, 1e-8)).isEqualTo(new int[] {1});
		assertThat(EmpiricalGradientTester.test(func, x, 1e-4, 1e-2, 1e-8, 0)).isTrue();
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testDimensionMismatch() {
		EmpiricalGradientTester.test(new Quadratic(new double[2], -1), new double[3], 1e-4, 1e-2, 1e-8);
	}
	
	@Test
	public void testClose() {
		assertThat(EmpiricalGradientTester.close(1.0, 1.00001, 1e-4)).isTrue();
		assertThat(EmpiricalGradientTester.close(1.0, 1.1, 1e-4)).isFalse();
		assertThat(EmpiricalGradientTester.close(0.0, 1e-9, 1e-4)).isTrue();
	}

}
