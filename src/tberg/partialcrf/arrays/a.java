package tberg.partialcrf.arrays;

import java.util.Arrays;

public class a {

	public static double[] copy(double[] x) {
		return Arrays.copyOf(x, x.length);
	}
	
	public static double[][] copy(double[][] x) {
		double[][] result = new double[x.length][];
		for (int i=0; i<x.length; ++i) {
			result[i] = copy(x[i]);
		}
		return result;
	}
	
	public static double[][][] copy(double[][][] x) {
		double[][][] result = new double[x.length][][];
		for (int i=0; i<x.length; ++i) {
			result[i] = copy(x[i]);
		}
		return result;
	}
	
	public static boolean[] copy(boolean[] x) {
		return Arrays.copyOf(x, x.length);
	}
	
	public static boolean[][] copy(boolean[][] x) {
		boolean[][] result = new boolean[x.length][];
		for (int i=0; i<x.length; ++i) {
			result[i] = copy(x[i]);
		}
		return result;
	}
	
	public static boolean[][][] copy(boolean[][][] x) {
		boolean[][][] result = new boolean[x.length][][];
		for (int i=0; i<x.length; ++i) {
			result[i] = copy(x[i]);
		}
		return result;
	}
	
	public static int[] copy(int[] x) {
		return Arrays.copyOf(x, x.length);
	}

	public static double sum(double[] x) {
		double result = 0.0;
		for (double v : x) result += v;
		return result;
	}
	
	public static int count(boolean[] x) {
		int result = 0;
		for (boolean v : x) if (v) result++;
		return result;
	}
	
	public static double max(double[] x) {
		double result = Double.NEGATIVE_INFINITY;
		for (double v : x) if (v > result) result = v;
		return result;
	}
	
	public static double min(double[] x) {
		double result = Double.POSITIVE_INFINITY;
		for (double v : x) if (v < result) result = v;
		return result;
	}
	
	public static double[] abs(double[] x) {
		double[] result = new double[x.length];
		for (int i=0; i<x.length; ++i) result[i] = Math.abs(x[i]);
		return result;
	}
	
	public static double[] comb(double[] x, double xScale, double[] y, double yScale) {
		double[] result = new double[x.length];
		for (int i=0; i<x.length; ++i) result[i] = xScale * x[i] + yScale * y[i];
		return result;
	}
	
	public static void combi(double[] x, double xScale, double[] y, double yScale) {
		for (int i=0; i<x.length; ++i) x[i] = xScale * x[i] + yScale * y[i];
	}
	
	public static void combi(double[][] x, double xScale, double[][] y, double yScale) {
		for (int i=0; i<x.length; ++i) combi(x[i], xScale, y[i], yScale);
	}
	
	public static void combi(double[][][] x, double xScale, double[][][] y, double yScale) {
		for (int i=0; i<x.length; ++i) combi(x[i], xScale, y[i], yScale);
	}
	
	public static double[] append(double[] x, double[] y) {
		double[] result = new double[x.length + y.length];
		System.arraycopy(x, 0, result, 0, x.length);
		System.arraycopy(y, 0, result, x.length, y.length);
		return result;
	}
	
	public static double[] flatten(double[][] x) {
		int length = 0;
		for (double[] row : x) length += row.length;
		double[] result = new double[length];
		int offset = 0;
		for (double[] row : x) {
			System.arraycopy(row, 0, result, offset, row.length);
			offset += row.length;
		}
		return result;
	}
	
	public static double[][] unflatten(double[] x, int offset, int rows, int cols) {
		double[][] result = new double[rows][cols];
		for (int r=0; r<rows; ++r) {
			System.arraycopy(x, offset + r*cols, result[r], 0, cols);
		}
		return result;
	}
	
	public static boolean isFinite(double[] x) {
		for (double v : x) if (Double.isNaN(v) || Double.isInfinite(v)) return false;
		return true;
	}
	
}
