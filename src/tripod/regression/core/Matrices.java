package tripod.regression.core;

import org.apache.commons.math.linear.Array2DRowRealMatrix;
import org.apache.commons.math.linear.RealMatrix;

/**
 * Dense matrix utilities over double[rows][columns] arrays, backed
 * by Commons Math's {@link Array2DRowRealMatrix}
 */
public class Matrices {
    private Matrices () {}

    public static double[][] transpose (double[][] matrix) {
        int rows = rows (matrix), cols = columns (matrix);
        if (rows == 0 || cols == 0) {
            return new double[cols][rows];
        }
        return new Array2DRowRealMatrix (matrix, false).transpose().getData();
    }

    /**
     * [ A ][ B ]; the number of columns of A must match the number
     * of rows of B.
     */
    public static double[][] multiply (double[][] a, double[][] b) {
        int n = rows (a), k = columns (a), m = columns (b);
        if (k != rows (b)) {
            throw new IllegalArgumentException
                ("Can't multiply "+n+"x"+k+" by "+rows (b)+"x"+m+" matrix");
        }
        if (n == 0 || k == 0 || m == 0) {
            return new double[n][m];
        }

        RealMatrix product = new Array2DRowRealMatrix (a, false)
            .multiply(new Array2DRowRealMatrix (b, false));
        return product.getData();
    }

    /**
     * Single column matrix from a vector
     */
    public static double[][] column (double[] vector) {
        double[][] col = new double[vector.length][1];
        for (int i = 0; i < vector.length; ++i)
            col[i][0] = vector[i];
        return col;
    }

    static int rows (double[][] matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException ("Matrix is null");
        }
        return matrix.length;
    }

    // all rows must be of equal length
    static int columns (double[][] matrix) {
        if (rows (matrix) == 0) {
            return 0;
        }

        int cols = matrix[0].length;
        for (int i = 1; i < matrix.length; ++i) {
            if (matrix[i].length != cols) {
                throw new IllegalArgumentException
                    ("Row "+i+" has "+matrix[i].length
                     +" column(s); expecting "+cols);
            }
        }
        return cols;
    }
}
