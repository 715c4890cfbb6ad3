package hex.glm;

import static water.util.MathUtils.FLOAT_EPS;
import static water.util.MathUtils.clipPos;
import static water.util.MathUtils.clipProb;

import java.util.Arrays;

import org.apache.commons.math3.complex.Complex;

import water.util.MathUtils;
import water.util.NumDiff;

import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;

/**
 * Variance function V(mu) of an exponential family.
 *
 * Binomial variances carry the number of trials, either one count for all
 * observations or one per observation. The scalar methods need a single
 * count; the array methods use n[i] for observation i.
 */
public final class Variance {

  public enum Kind {
    constant,
    power,
    binomial,
    nbinom;
  }

  public final Kind _kind;
  public final double _power;
  public final double _alpha;
  private final double [] _n;

  private Variance(Kind kind, double power, double alpha, double [] n) {
    _kind = kind;
    _power = power;
    _alpha = alpha;
    _n = n;
  }

  private static final Variance CONSTANT = new Variance(Kind.constant, Double.NaN, Double.NaN, null);
  private static final Variance MU = power(1);
  private static final Variance MU_SQUARED = power(2);
  private static final Variance MU_CUBED = power(3);
  private static final Variance BINARY = binomial(1);
  private static final Variance NBINOM = nbinom(1);

  public static Variance constant()  { return CONSTANT; }
  public static Variance mu()        { return MU; }
  public static Variance muSquared() { return MU_SQUARED; }
  public static Variance muCubed()   { return MU_CUBED; }
  public static Variance binary()    { return BINARY; }
  public static Variance nbinom()    { return NBINOM; }

  public static Variance power(double power) {
    return new Variance(Kind.power, power, Double.NaN, null);
  }

  public static Variance binomial(double... n) {
    Preconditions.checkArgument(n.length > 0, "binomial variance needs the number of trials");
    for( double d : n )
      Preconditions.checkArgument(d > 0, "number of trials must be positive, got %s", d);
    return new Variance(Kind.binomial, Double.NaN, Double.NaN, n.clone());
  }

  public static Variance nbinom(double alpha) {
    return new Variance(Kind.nbinom, Double.NaN, alpha, null);
  }

  /** Number of trials for observation i. */
  public double n(int i) {
    Preconditions.checkState(_kind == Kind.binomial, "not a binomial variance: %s", this);
    return _n.length == 1 ? _n[0] : _n[i];
  }

  private double scalarN() {
    Preconditions.checkState(_n.length == 1,
        "binomial variance with %s trial counts needs the array form", _n.length);
    return _n[0];
  }

  /** V(mu) */
  public double variance(double mu) {
    return _kind == Kind.binomial ? binomial(mu, scalarN()) : eval(mu);
  }

  /** V'(mu) */
  public double deriv(double mu) {
    return _kind == Kind.binomial ? binomialDeriv(mu, scalarN()) : evalDeriv(mu);
  }

  public double [] variance(double [] mu) {
    double [] res = new double[mu.length];
    if( _kind != Kind.binomial ) {
      for( int i = 0; i < mu.length; ++i ) res[i] = eval(mu[i]);
      return res;
    }
    MathUtils.checkBroadcast(_n, mu.length, "trial counts");
    for( int i = 0; i < mu.length; ++i )
      res[i] = binomial(mu[i], n(i));
    return res;
  }

  public double [] deriv(double [] mu) {
    double [] res = new double[mu.length];
    if( _kind != Kind.binomial ) {
      for( int i = 0; i < mu.length; ++i ) res[i] = evalDeriv(mu[i]);
      return res;
    }
    MathUtils.checkBroadcast(_n, mu.length, "trial counts");
    for( int i = 0; i < mu.length; ++i )
      res[i] = binomialDeriv(mu[i], n(i));
    return res;
  }

  private static final NumDiff.ComplexFunction CONSTANT_FN = new NumDiff.ComplexFunction() {
    @Override public Complex apply(Complex z) { return Complex.ONE; }
  };

  private double eval(double mu) {
    switch( _kind ) {
    case constant:
      return 1;
    case power:
      return Math.pow(Math.abs(mu), _power);
    case nbinom:
      mu = clipPos(mu);
      return mu + _alpha * mu * mu;
    default:
      throw new Error("unknown variance function " + _kind);
    }
  }

  private double evalDeriv(double mu) {
    switch( _kind ) {
    case constant:
      return NumDiff.complexStep(CONSTANT_FN, mu);
    case power:
      // |mu| has no complex extension
      return NumDiff.forward(new NumDiff.Function() {
          @Override public double apply(double x) { return eval(x); }
        }, mu);
    case nbinom:
      return 1 + 2 * _alpha * clipPos(mu);
    default:
      throw new Error("unknown variance function " + _kind);
    }
  }

  private static double binomial(double mu, double n) {
    double p = clipProb(mu / n);
    return p * (1 - p) * n;
  }

  private static double binomialDeriv(final double mu, final double n) {
    return NumDiff.complexStep(new NumDiff.ComplexFunction() {
        @Override public Complex apply(Complex x) {
          Complex p = x.divide(n);
          // clipped values are constant in mu
          if( p.getReal() < FLOAT_EPS || p.getReal() > 1 - FLOAT_EPS )
            p = new Complex(clipProb(p.getReal()));
          return p.multiply(p.negate().add(1)).multiply(n);
        }
      }, mu);
  }

  public JsonObject toJson(){
    JsonObject res = new JsonObject();
    res.addProperty("variance", _kind.toString());
    if( _kind == Kind.power ) res.addProperty("power", _power);
    if( _kind == Kind.nbinom ) res.addProperty("alpha", _alpha);
    if( _kind == Kind.binomial && _n.length == 1 ) res.addProperty("n", _n[0]);
    return res;
  }

  @Override public String toString() {
    switch( _kind ) {
    case power:    return "power(" + _power + ")";
    case nbinom:   return "nbinom(" + _alpha + ")";
    case binomial: return "binomial(n=" + (_n.length == 1 ? Double.toString(_n[0]) : Arrays.toString(_n)) + ")";
    default:       return _kind.toString();
    }
  }
}
