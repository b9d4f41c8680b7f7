package tripod.regression.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class LinearSolverTest {

    @Test
    public void solvesWellConditionedSystem() {
        double[][] m = {{2, 1}, {1, 3}};
        double[][] a = {{5}, {10}};

        double[][] c = LinearSolver.solve(m, a);

        assertThat(c).hasDimensions(2, 1);
        assertThat(c[0][0]).isCloseTo(1.0, within(1e-12));
        assertThat(c[1][0]).isCloseTo(3.0, within(1e-12));
    }

    @Test
    public void solutionIsIndexedByColumnWhenPivotsAreOutOfOrder() {
        // column 0 pivots on row 1, column 1 on row 0
        double[][] m = {{0, 1}, {1, 0}};
        double[][] a = {{2}, {3}};

        double[][] c = LinearSolver.solve(m, a);

        assertThat(c[0][0]).isEqualTo(3.0);
        assertThat(c[1][0]).isEqualTo(2.0);
    }

    @Test
    public void solvesThreeByThreeWithZeroOnDiagonal() {
        double[][] m = {{1, 2, 3}, {0, 1, 4}, {5, 6, 0}};
        double[][] a = {{14}, {14}, {17}};

        double[][] c = LinearSolver.solve(m, a);

        assertThat(c[0][0]).isCloseTo(1.0, within(1e-9));
        assertThat(c[1][0]).isCloseTo(2.0, within(1e-9));
        assertThat(c[2][0]).isCloseTo(3.0, within(1e-9));
    }

    @Test
    public void inputsAreLeftUntouched() {
        double[][] m = {{4, 2}, {2, 3}};
        double[][] a = {{2}, {1}};

        LinearSolver.solve(m, a);

        assertThat(m).isDeepEqualTo(new double[][] {{4, 2}, {2, 3}});
        assertThat(a).isDeepEqualTo(new double[][] {{2}, {1}});
    }

    @Test
    public void zeroRowIsSingular() {
        double[][] m = {{1, 2}, {0, 0}};
        double[][] a = {{1}, {1}};

        assertThatThrownBy(() -> LinearSolver.solve(m, a))
            .isInstanceOf(SingularMatrixException.class)
            .extracting("column").isEqualTo(1);
    }

    @Test
    public void identicalRowsAreSingular() {
        double[][] m = {{1, 2}, {1, 2}};
        double[][] a = {{3}, {3}};

        assertThatThrownBy(() -> LinearSolver.solve(m, a))
            .isInstanceOf(SingularMatrixException.class);
    }

    @Test
    public void proportionalRowsLeavingRoundingResidueAreSingular() {
        // 0.6 - 0.2 * (0.3 / 0.1) isn't exactly zero in floating point
        double[][] m = {{0.1, 0.3}, {0.2, 0.6}};
        double[][] a = {{1}, {2}};

        assertThatThrownBy(() -> LinearSolver.solve(m, a))
            .isInstanceOf(SingularMatrixException.class)
            .extracting("column").isEqualTo(1);
    }

    @Test
    public void smallButWellConditionedSystemIsSolved() {
        double[][] m = {{2e-9, 1e-9}, {1e-9, 3e-9}};
        double[][] a = {{5e-9}, {10e-9}};

        double[][] c = LinearSolver.solve(m, a);

        assertThat(c[0][0]).isCloseTo(1.0, within(1e-9));
        assertThat(c[1][0]).isCloseTo(3.0, within(1e-9));
    }

    @Test
    public void zeroColumnIsSingular() {
        double[][] m = {{0, 1, 2}, {0, 3, 4}, {0, 5, 7}};
        double[][] a = {{1}, {2}, {3}};

        assertThatThrownBy(() -> LinearSolver.solve(m, a))
            .isInstanceOf(SingularMatrixException.class)
            .extracting("column").isEqualTo(0);
    }

    @Test
    public void nonSquareMatrixIsRejected() {
        double[][] m = {{1, 2, 3}, {4, 5, 6}};
        double[][] a = {{1}, {2}};

        assertThatThrownBy(() -> LinearSolver.solve(m, a))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void answersMustMatchDegree() {
        double[][] m = {{2, 1}, {1, 3}};

        assertThatThrownBy(() -> LinearSolver.solve(m, new double[][] {{5}}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LinearSolver.solve
                           (m, new double[][] {{5, 1}, {10, 1}}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
