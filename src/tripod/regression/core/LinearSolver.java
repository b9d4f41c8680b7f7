package tripod.regression.core;

import java.util.Arrays;
import java.util.logging.Logger;
import java.util.logging.Level;

/**
 * Solves [ M ][ C ] = [ A ] for a square matrix M by Gaussian
 * elimination. The answer column is appended to M and each column
 * is pivoted on the first unfinished row with a nonzero entry, so
 * pivot rows are not necessarily in column order; the column to
 * pivot row mapping is kept for the back substitution.
 *
 * An entry counts as zero when its magnitude is at or below
 * {@link #SINGULARITY_THRESHOLD} times the largest magnitude in M,
 * so rounding residue left by eliminating a dependent row is never
 * taken as a pivot.
 */
public class LinearSolver {
    private static final Logger logger =
        Logger.getLogger(LinearSolver.class.getName());

    /**
     * Relative magnitude below which an entry is considered 0
     */
    public static final double SINGULARITY_THRESHOLD =
        Double.parseDouble(System.getProperty
                           ("regression.singularityThreshold", "1e-12"));

    private LinearSolver () {}

    /**
     * @param matrix square matrix M of degree d; not modified
     * @param answers d x 1 column A; not modified
     * @return d x 1 column C indexed by column of M
     * @throws SingularMatrixException if some column has no pivot
     */
    public static double[][] solve (double[][] matrix, double[][] answers) {
        int degree = Matrices.rows (matrix);
        if (Matrices.columns (matrix) != degree) {
            throw new IllegalArgumentException
                ("Matrix is not square: "+degree+"x"
                 +Matrices.columns (matrix));
        }
        if (Matrices.rows (answers) != degree
            || Matrices.columns (answers) != 1) {
            throw new IllegalArgumentException
                ("Answers must be a "+degree+"x1 column; got "
                 +Matrices.rows (answers)+"x"+Matrices.columns (answers));
        }

        // augmented working copy
        double[][] work = new double[degree][degree+1];
        for (int row = 0; row < degree; ++row) {
            System.arraycopy(matrix[row], 0, work[row], 0, degree);
            work[row][degree] = answers[row][0];
        }

        boolean[] finished = new boolean[degree];
        int[] order = new int[degree]; // column -> pivot row
        double tolerance = SINGULARITY_THRESHOLD * maxMagnitude (matrix);

        for (int column = 0; column < degree; ++column) {
            int pivot = findPivot (work, finished, column, tolerance);
            if (pivot < 0) {
                logger.fine("No pivot for column "+column
                            +" of "+degree+"x"+degree+" matrix");
                throw new SingularMatrixException (column);
            }
            order[column] = pivot;

            double value = work[pivot][column];
            for (int j = column; j <= degree; ++j)
                work[pivot][j] /= value;
            finished[pivot] = true;

            for (int row = 0; row < degree; ++row) {
                if (!finished[row] && work[row][column] != 0.) {
                    eliminate (work, row, pivot, column);
                }
            }
        }

        // back substitution in reverse column order
        Arrays.fill(finished, false);
        double[][] solution = new double[degree][1];
        for (int column = degree - 1; column >= 0; --column) {
            int pivot = order[column];
            finished[pivot] = true;

            for (int row = 0; row < degree; ++row) {
                if (!finished[row]) {
                    eliminate (work, row, pivot, column);
                }
            }
            solution[column][0] = work[pivot][degree];
        }

        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Pivot order "+Arrays.toString(order));
        }

        return solution;
    }

    /*
     * first unfinished row whose entry in column exceeds tolerance in
     * magnitude; -1 if none
     */
    static int findPivot (double[][] work, boolean[] finished, int column,
                          double tolerance) {
        for (int row = 0; row < work.length; ++row) {
            if (!finished[row] && Math.abs(work[row][column]) > tolerance) {
                return row;
            }
        }
        return -1;
    }

    static double maxMagnitude (double[][] matrix) {
        double max = 0.;
        for (double[] row : matrix)
            for (double v : row)
                max = Math.max(max, Math.abs(v));
        return max;
    }

    static void eliminate (double[][] work, int row, int pivot, int column) {
        double factor = work[row][column];
        for (int j = column; j < work[row].length; ++j)
            work[row][j] -= factor * work[pivot][j];
    }
}
