package tberg.partialcrf.math;

import org.jblas.DoubleMatrix;
import org.jblas.MatrixFunctions;

public class m {
	
	public static final int ROWS = 0;
	public static final int COLUMNS = 1;

	public static double logSumExp(double[] x) {
		double max = Double.NEGATIVE_INFINITY;
		for (double v : x) if (v > max) max = v;
		if (Double.isInfinite(max)) return max;
		double sum = 0.0;
		for (double v : x) sum += Math.exp(v - max);
		return max + Math.log(sum);
	}
	
	/**
	 * Computes log(sum(exp(x))) along one axis. Reducing over COLUMNS collapses
	 * each row to a single value (result is rows x 1); reducing over ROWS
	 * collapses each column (result is 1 x columns).
	 * 
	 * The group maximum is subtracted before exponentiating, so a group made
	 * entirely of large negative scores stays large and negative rather than
	 * underflowing to -Infinity or NaN. A group that is entirely -Infinity
	 * reduces to -Infinity.
	 */
	public static DoubleMatrix logSumExp(DoubleMatrix x, int axis) {
		if (axis == COLUMNS) {
			return logSumExpRows(x);
		} else if (axis == ROWS) {
			return logSumExpRows(x.transpose()).transpose();
		} else {
			throw new IllegalArgumentException("[m.logSumExp] Unknown axis: " + axis);
		}
	}
	
	private static DoubleMatrix logSumExpRows(DoubleMatrix x) {
		DoubleMatrix shift = x.rowMaxs();
		for (int r=0; r<shift.rows; ++r) {
			if (Double.isInfinite(shift.get(r)) || Double.isNaN(shift.get(r))) shift.put(r, 0.0);
		}
		DoubleMatrix sums = MatrixFunctions.expi(x.subColumnVector(shift)).rowSums();
		return MatrixFunctions.logi(sums).addi(shift);
	}
	
}
