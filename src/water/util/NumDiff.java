package water.util;

import org.apache.commons.math3.complex.Complex;

/**
 * Numerical first derivatives for functions without a closed-form one.
 *
 * Step sizes scale with max(|x|, 0.1):
 * <ul>
 * <li>forward difference, h = eps^(1/2) * max(|x|, 0.1), error O(h);</li>
 * <li>centered difference, h = eps^(1/3) * max(|x|, 0.1), error O(h^2);</li>
 * <li>complex step, h = eps * max(|x|, 0.1). f must be analytic and accept a
 * complex argument; there is no subtractive cancellation so the result is
 * accurate to machine precision.</li>
 * </ul>
 */
public final class NumDiff {
  private static final double EPS = MathUtils.FLOAT_EPS;
  private static final double EPS_SQRT = Math.sqrt(EPS);
  private static final double EPS_CBRT = Math.cbrt(EPS);

  /** Real function of one real variable. */
  public interface Function {
    double apply(double x);
  }

  /** Complex extension of a real function. */
  public interface ComplexFunction {
    Complex apply(Complex z);
  }

  private NumDiff() {}

  static double step(double x, double base) {
    return base * Math.max(Math.abs(x), 0.1);
  }

  public static double forward(Function f, double x) {
    double h = step(x, EPS_SQRT);
    return (f.apply(x + h) - f.apply(x)) / h;
  }

  public static double centered(Function f, double x) {
    double h = step(x, EPS_CBRT);
    return (f.apply(x + h) - f.apply(x - h)) / (2 * h);
  }

  public static double complexStep(ComplexFunction f, double x) {
    double h = step(x, EPS);
    return f.apply(new Complex(x, h)).getImaginary() / h;
  }
}
