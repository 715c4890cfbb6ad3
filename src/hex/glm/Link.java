package hex.glm;

import static water.util.MathUtils.clipPos;
import static water.util.MathUtils.clipProb;

import org.apache.commons.math3.distribution.CauchyDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;

import water.util.NumDiff;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;

/**
 * Link function g of a GLM, mapping the mean mu to the linear predictor
 * eta = g(mu).
 *
 * A link is one of a closed set of kinds, each with its own parameter:
 * <ul>
 * <li>{@link Kind#logit}</li>
 * <li>{@link Kind#power}, exponent {@code _power}; identity, sqrt, inverse and
 * inverse_squared are named powers</li>
 * <li>{@link Kind#log}</li>
 * <li>{@link Kind#cdf}, quantile function of a distribution {@code _dist};
 * probit and cauchy are named distributions</li>
 * <li>{@link Kind#cloglog}</li>
 * <li>{@link Kind#nbinom}, ancillary parameter {@code _alpha}</li>
 * </ul>
 * Links are immutable. Every operation has a scalar and an elementwise array
 * form which give identical results.
 */
public final class Link {

  public enum Kind {
    logit,
    power,
    log,
    cdf,
    cloglog,
    nbinom;
  }

  public final Kind _kind;
  public final double _power;
  public final double _alpha;
  public final RealDistribution _dist;
  private final String _name;

  private Link(Kind kind, String name, double power, double alpha, RealDistribution dist) {
    _kind = kind;
    _name = name;
    _power = power;
    _alpha = alpha;
    _dist = dist;
  }

  private static final Link LOGIT = new Link(Kind.logit, "logit", Double.NaN, Double.NaN, null);
  private static final Link LOG = new Link(Kind.log, "log", Double.NaN, Double.NaN, null);
  private static final Link CLOGLOG = new Link(Kind.cloglog, "cloglog", Double.NaN, Double.NaN, null);
  private static final Link IDENTITY = power(1.0);
  private static final Link SQRT = power(0.5);
  private static final Link INVERSE = power(-1.0);
  private static final Link INVERSE_SQUARED = power(-2.0);
  // no random generator, these are never sampled
  private static final Link PROBIT = new Link(Kind.cdf, "probit", Double.NaN, Double.NaN,
                                              new NormalDistribution(null, 0, 1));
  private static final Link CAUCHY = new Link(Kind.cdf, "cauchy", Double.NaN, Double.NaN,
                                              new CauchyDistribution(null, 0, 1));
  private static final Link NBINOM = nbinom(1.0);

  public static Link logit()          { return LOGIT; }
  public static Link identity()       { return IDENTITY; }
  public static Link sqrt()           { return SQRT; }
  public static Link inverse()        { return INVERSE; }
  public static Link inverseSquared() { return INVERSE_SQUARED; }
  public static Link log()            { return LOG; }
  public static Link probit()         { return PROBIT; }
  public static Link cauchy()         { return CAUCHY; }
  public static Link cloglog()        { return CLOGLOG; }
  public static Link nbinom()         { return NBINOM; }

  public static Link power(double power) {
    Preconditions.checkArgument(power != 0 && !Double.isNaN(power), "illegal power %s", power);
    String name;
    if( power == 1 ) name = "identity";
    else if( power == 0.5 ) name = "sqrt";
    else if( power == -1 ) name = "inverse";
    else if( power == -2 ) name = "inverse_squared";
    else name = "power(" + power + ")";
    return new Link(Kind.power, name, power, Double.NaN, null);
  }

  // names of the built-in links, links compare by name
  private static final ImmutableSet<String> RESERVED = ImmutableSet.of(
      "logit", "identity", "sqrt", "inverse", "inverse_squared",
      "log", "probit", "cauchy", "cloglog", "nbinom");

  /**
   * Link g = dist.quantile; name identifies the distribution and must not be
   * the name of a built-in link.
   */
  public static Link cdf(String name, RealDistribution dist) {
    Preconditions.checkNotNull(dist);
    String n = name.trim().toLowerCase();
    if( RESERVED.contains(n) || n.startsWith("power(") || n.startsWith("nbinom(") )
      throw new GLMException("cdf link name " + name + " is taken by a built-in link");
    return new Link(Kind.cdf, name, Double.NaN, Double.NaN, dist);
  }

  public static Link nbinom(double alpha) {
    Preconditions.checkArgument(alpha > 0, "alpha must be positive, got %s", alpha);
    return new Link(Kind.nbinom, alpha == 1 ? "nbinom" : "nbinom(" + alpha + ")", Double.NaN, alpha, null);
  }

  /** Resolve one of the named links, e.g. "logit" or "inverse_squared". */
  public static Link forName(String name) {
    switch( name.trim().toLowerCase() ) {
    case "logit":           return LOGIT;
    case "identity":        return IDENTITY;
    case "sqrt":            return SQRT;
    case "inverse":         return INVERSE;
    case "inverse_squared": return INVERSE_SQUARED;
    case "log":             return LOG;
    case "probit":          return PROBIT;
    case "cauchy":          return CAUCHY;
    case "cloglog":         return CLOGLOG;
    case "nbinom":          return NBINOM;
    default:
      throw new GLMException("unknown link " + name);
    }
  }

  public String name() { return _name; }

  public boolean isIdentity() {
    return _kind == Kind.power && _power == 1;
  }

  private boolean isStandardCauchy() {
    if( !(_dist instanceof CauchyDistribution) ) return false;
    CauchyDistribution c = (CauchyDistribution)_dist;
    return c.getMedian() == 0 && c.getScale() == 1;
  }

  /** g(p) */
  public double link(double p) {
    switch( _kind ) {
    case logit:
      p = clipProb(p);
      return Math.log(p / (1 - p));
    case power:
      return Math.pow(p, _power);
    case log:
      return Math.log(clipPos(p));
    case cdf:
      return _dist.inverseCumulativeProbability(clipProb(p));
    case cloglog:
      p = clipProb(p);
      return Math.log(-Math.log1p(-p));
    case nbinom:
      p = clipPos(p);
      return Math.log(p / (p + 1 / _alpha));
    default:
      throw new Error("unsupported link function id " + _kind);
    }
  }

  /** g^-1(z) */
  public double linkInv(double z) {
    switch( _kind ) {
    case logit:
      return 1.0 / (1.0 + Math.exp(-z));
    case power:
      return Math.pow(z, 1.0 / _power);
    case log:
      return Math.exp(z);
    case cdf:
      return _dist.cumulativeProbability(z);
    case cloglog:
      return -Math.expm1(-Math.exp(z));
    case nbinom:
      return -1 / (_alpha * (1 - Math.exp(-z)));
    default:
      throw new Error("unexpected link function id " + _kind);
    }
  }

  /** g'(p) */
  public double linkDeriv(double p) {
    switch( _kind ) {
    case logit:
      p = clipProb(p);
      return 1 / (p * (1 - p));
    case power:
      return _power * Math.pow(p, _power - 1);
    case log:
      return 1 / clipPos(p);
    case cdf:
      return 1 / _dist.density(_dist.inverseCumulativeProbability(clipProb(p)));
    case cloglog:
      p = clipProb(p);
      return 1 / ((p - 1) * Math.log1p(-p));
    case nbinom:
      p = clipPos(p);
      return 1 / (p + _alpha * p * p);
    default:
      throw new Error("unexpected link function id " + _kind);
    }
  }

  /**
   * g''(p). Closed form for every kind but a general cdf link, which uses a
   * centered difference of g' (quantile functions have no complex extension,
   * so the complex step is not available there).
   */
  public double linkDeriv2(double p) {
    switch( _kind ) {
    case logit: {
      p = clipProb(p);
      double v = p * (1 - p);
      return (2 * p - 1) / (v * v);
    }
    case power:
      if( _power == 1 ) return 0;
      return _power * (_power - 1) * Math.pow(p, _power - 2);
    case log:
      p = clipPos(p);
      return -1 / (p * p);
    case cdf:
      if( isStandardCauchy() ) {
        double a = Math.PI * (p - 0.5);
        double c = Math.cos(a);
        return 2 * Math.PI * Math.PI * Math.sin(a) / (c * c * c);
      }
      return NumDiff.centered(new NumDiff.Function() {
          @Override public double apply(double x) { return linkDeriv(x); }
        }, p);
    case cloglog: {
      p = clipProb(p);
      double fl = Math.log1p(-p);
      return -1 / ((1 - p) * (1 - p) * fl) * (1 + 1 / fl);
    }
    case nbinom: {
      double d = p + _alpha * p * p;
      return -(1 + 2 * _alpha * p) / (d * d);
    }
    default:
      throw new Error("unexpected link function id " + _kind);
    }
  }

  /** d g^-1(z) / dz */
  public double linkInvDeriv(double z) {
    switch( _kind ) {
    case logit: {
      // e^z/(1+e^z)^2 is symmetric in z, use -|z| so the exponential never overflows
      double t = Math.exp(-Math.abs(z));
      return t / ((1 + t) * (1 + t));
    }
    case power:
      return Math.pow(z, (1 - _power) / _power) / _power;
    case log:
      return Math.exp(z);
    case cdf:
      return 1 / linkDeriv(linkInv(z));
    case cloglog:
      return Math.exp(z - Math.exp(z));
    case nbinom: {
      double t = Math.exp(z);
      return t / (_alpha * (1 - t) * (1 - t));
    }
    default:
      throw new Error("unexpected link function id " + _kind);
    }
  }

  public double [] link(double [] p) {
    double [] res = new double[p.length];
    for( int i = 0; i < p.length; ++i ) res[i] = link(p[i]);
    return res;
  }

  public double [] linkInv(double [] z) {
    double [] res = new double[z.length];
    for( int i = 0; i < z.length; ++i ) res[i] = linkInv(z[i]);
    return res;
  }

  public double [] linkDeriv(double [] p) {
    double [] res = new double[p.length];
    for( int i = 0; i < p.length; ++i ) res[i] = linkDeriv(p[i]);
    return res;
  }

  public double [] linkDeriv2(double [] p) {
    double [] res = new double[p.length];
    for( int i = 0; i < p.length; ++i ) res[i] = linkDeriv2(p[i]);
    return res;
  }

  public double [] linkInvDeriv(double [] z) {
    double [] res = new double[z.length];
    for( int i = 0; i < z.length; ++i ) res[i] = linkInvDeriv(z[i]);
    return res;
  }

  public JsonObject toJson(){
    JsonObject res = new JsonObject();
    res.addProperty("link", _name);
    res.addProperty("kind", _kind.toString());
    if( _kind == Kind.power ) res.addProperty("power", _power);
    if( _kind == Kind.nbinom ) res.addProperty("alpha", _alpha);
    return res;
  }

  @Override public boolean equals(Object o) {
    return o instanceof Link && ((Link)o)._name.equals(_name);
  }

  @Override public int hashCode() {
    return _name.hashCode();
  }

  @Override public String toString() {
    return _name;
  }
}
