package atmogrid.physics.solver.impl;

import atmogrid.config.InterpolationConfig;
import atmogrid.domain.exception.FitDivergenceException;
import atmogrid.physics.solver.FitConfiguration;
import atmogrid.physics.solver.PenaltyTerm;
import atmogrid.physics.solver.ShiftComponent;
import atmogrid.physics.solver.ShiftFitProblem;
import atmogrid.physics.solver.ShiftFitResult;
import atmogrid.physics.solver.ShiftFitter;
import atmogrid.physics.solver.ShiftParameters;
import atmogrid.physics.solver.ShiftedInterpolator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.Pair;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Implementación de {@link ShiftFitter} basada en el optimizador Levenberg-Marquardt de Commons Math.
 * <p>
 * Sólo los componentes libres forman el vector que ve el optimizador; los fijos se reinyectan
 * con su valor inicial en cada evaluación. Cada penalización se añade como una fila extra cuyo
 * valor modelado es el propio parámetro y cuyo objetivo es el de la penalización, con peso
 * {@code 1/σ²}. El jacobiano se obtiene por diferencias finitas centradas.
 * <p>
 * Un ajuste que agota sus límites, produce valores no finitos o cuyo jacobiano ponderado en el
 * óptimo está mal condicionado se considera divergente.
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
public class LevenbergMarquardtShiftFitter implements ShiftFitter {

    private final InterpolationConfig config;

    public LevenbergMarquardtShiftFitter(InterpolationConfig config) {
        this.config = config;
    }

    public LevenbergMarquardtShiftFitter() {
        this(InterpolationConfig.getDefaults());
    }

    @Override
    public ShiftFitResult fit(ShiftFitProblem problem, ShiftParameters initialGuess, FitConfiguration configuration) {
        final List<ShiftComponent> free = configuration.freeComponentsInOrder();
        final List<Map.Entry<ShiftComponent, PenaltyTerm>> penalties = new ArrayList<>(configuration.getPenalties().entrySet());
        final int nData = problem.size();
        final int nRows = nData + penalties.size();

        if (nRows < free.size()) {
            throw new FitDivergenceException(String.format(
                    "Ajuste indeterminado: %d filas para %d parámetros libres.", nRows, free.size()));
        }
        if (!initialGuess.isFinite()) {
            throw new FitDivergenceException("Semilla no finita: " + initialGuess);
        }

        // --- Objetivo y pesos (datos + penalizaciones) ---
        final double[] target = new double[nRows];
        final double[] weights = new double[nRows];
        final double[] y1 = problem.y1();
        final double[] sigma = problem.uncertainties();
        for (int i = 0; i < nData; i++) {
            target[i] = y1[i];
            weights[i] = 1.0 / (sigma[i] * sigma[i]);
        }
        for (int k = 0; k < penalties.size(); k++) {
            PenaltyTerm term = penalties.get(k).getValue();
            target[nData + k] = term.target();
            weights[nData + k] = 1.0 / (term.uncertainty() * term.uncertainty());
        }

        final double[] start = new double[free.size()];
        for (int j = 0; j < free.size(); j++) {
            start[j] = initialGuess.get(free.get(j));
        }

        MultivariateJacobianFunction model = point -> {
            double[] p = point.toArray();
            double[] values = evaluateRows(problem, expand(initialGuess, free, p), penalties);
            return new Pair<RealVector, RealMatrix>(
                    new ArrayRealVector(values, false),
                    numericJacobian(problem, initialGuess, free, p, penalties));
        };

        LeastSquaresProblem lsq = new LeastSquaresBuilder()
                .start(start)
                .model(model)
                .target(target)
                .weight(new DiagonalMatrix(weights))
                .maxEvaluations(config.maxFitEvaluations())
                .maxIterations(config.maxFitIterations())
                .build();

        final LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = new LevenbergMarquardtOptimizer().optimize(lsq);
        } catch (MathIllegalStateException e) {
            throw new FitDivergenceException("El ajuste de desplazamientos no converge: " + e.getMessage(), e);
        }

        final ShiftParameters best = expand(initialGuess, free, optimum.getPoint().toArray());
        if (!best.isFinite()) {
            throw new FitDivergenceException("El ajuste produjo parámetros no finitos: " + best);
        }

        // --- Condicionamiento en el óptimo ---
        double condition = new SingularValueDecomposition(optimum.getJacobian()).getConditionNumber();
        if (!Double.isFinite(condition) || condition > config.maxConditionNumber()) {
            throw new FitDivergenceException(String.format(
                    "Ajuste mal condicionado (número de condición %.3e, límite %.3e). %s",
                    condition, config.maxConditionNumber(), problem));
        }

        double[] fitted = ShiftedInterpolator.evaluate(problem.x1(), best, problem.x2(), problem.y2(), problem.clipReference());
        double sum = 0.0;
        for (int i = 0; i < nData; i++) {
            double r = (y1[i] - fitted[i]) / sigma[i];
            sum += r * r;
        }
        double rms = Math.sqrt(sum / nData);

        log.debug("Ajuste convergido: {} (rms={}, evaluaciones={}, iteraciones={}, condición={})",
                best, rms, optimum.getEvaluations(), optimum.getIterations(), condition);
        return new ShiftFitResult(best, fitted, rms, optimum.getEvaluations());
    }

    private static ShiftParameters expand(ShiftParameters initialGuess, List<ShiftComponent> free, double[] point) {
        double[] full = initialGuess.toArray();
        for (int j = 0; j < free.size(); j++) {
            full[free.get(j).index()] = point[j];
        }
        return ShiftParameters.of(full);
    }

    private static double[] evaluateRows(ShiftFitProblem problem, ShiftParameters p,
                                         List<Map.Entry<ShiftComponent, PenaltyTerm>> penalties) {
        double[] curve = ShiftedInterpolator.evaluate(problem.x1(), p, problem.x2(), problem.y2(), problem.clipReference());
        double[] rows = new double[curve.length + penalties.size()];
        System.arraycopy(curve, 0, rows, 0, curve.length);
        for (int k = 0; k < penalties.size(); k++) {
            rows[curve.length + k] = p.get(penalties.get(k).getKey());
        }
        return rows;
    }

    private RealMatrix numericJacobian(ShiftFitProblem problem, ShiftParameters initialGuess,
                                       List<ShiftComponent> free, double[] point,
                                       List<Map.Entry<ShiftComponent, PenaltyTerm>> penalties) {
        final int nRows = problem.size() + penalties.size();
        final double[][] jacobian = new double[nRows][free.size()];
        for (int j = 0; j < free.size(); j++) {
            final double h = config.jacobianStep() * Math.max(1.0, Math.abs(point[j]));
            double[] forward = point.clone();
            double[] backward = point.clone();
            forward[j] += h;
            backward[j] -= h;
            double[] fPlus = evaluateRows(problem, expand(initialGuess, free, forward), penalties);
            double[] fMinus = evaluateRows(problem, expand(initialGuess, free, backward), penalties);
            for (int i = 0; i < nRows; i++) {
                jacobian[i][j] = (fPlus[i] - fMinus[i]) / (2.0 * h);
            }
        }
        return new Array2DRowRealMatrix(jacobian, false);
    }
}
