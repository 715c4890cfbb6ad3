package hex.glm;

import static water.util.MathUtils.TINY;
import static water.util.MathUtils.bcast;
import static water.util.MathUtils.clipPos;
import static water.util.MathUtils.clipProb;
import static water.util.MathUtils.sign;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.logging.Logger;

import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Gamma;

import water.util.MathUtils;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.gson.JsonObject;

/**
 * One-parameter exponential family: a link and a variance function plus the
 * deviance, likelihood and residual formulas an IRLS fit needs.
 *
 * Families are immutable. A grouped binomial family (one with per-observation
 * trial counts) is obtained from {@link #initialize(double[][])} and is bound
 * to the response it was initialized with.
 *
 * Array arguments: y and mu have one entry per observation. Frequency weights
 * may be null (all ones), a single value or one value per observation.
 */
public final class Family {
  private static final Logger LOG = Logger.getLogger(Family.class.getName());

  // B(2/3, 2/3), scales the regularized incomplete beta in the binomial anscombe residual
  private static final double BETA_2_3 = Math.exp(Beta.logBeta(2 / 3.0, 2 / 3.0));

  public enum Kind {
    poisson(Range.atLeast(0.0), EnumSet.of(Link.Kind.log),
            Link.log(), Link.identity(), Link.sqrt()),
    quasipoisson(Range.atLeast(0.0), EnumSet.of(Link.Kind.log),
                 Link.log(), Link.identity(), Link.sqrt()),
    gaussian(Range.<Double>all(), EnumSet.of(Link.Kind.log, Link.Kind.power),
             Link.identity(), Link.log(), Link.inverse()),
    gamma(Range.<Double>all(), EnumSet.of(Link.Kind.log),
          Link.inverse(), Link.log(), Link.identity()),
    binomial(Range.<Double>all(), EnumSet.of(Link.Kind.logit, Link.Kind.cdf, Link.Kind.cloglog),
             Link.logit(), Link.probit(), Link.cauchy(), Link.log(), Link.cloglog(), Link.identity());

    public final Range<Double> _valid;
    final EnumSet<Link.Kind> _safe;
    public final Link _defaultLink;
    public final ImmutableList<Link> _links;

    Kind(Range<Double> valid, EnumSet<Link.Kind> safe, Link dflt, Link... others) {
      _valid = valid;
      _safe = safe;
      _defaultLink = dflt;
      _links = ImmutableList.<Link>builder().add(dflt).add(others).build();
    }

    Variance variance() {
      switch( this ) {
      case poisson:
      case quasipoisson:
        return Variance.mu();
      case gaussian:
        return Variance.constant();
      case gamma:
        return Variance.muSquared();
      case binomial:
        return Variance.binary();
      default:
        throw new Error("unknown family Id " + this);
      }
    }
  }

  public final Kind _kind;
  public final Link _link;
  public final Variance _variance;
  // binomial trial counts, null for binary data
  private final double [] _n;

  private Family(Kind kind, Link link, double [] n) {
    Preconditions.checkNotNull(link, "link");
    if( !kind._links.contains(link) )
      throw new GLMException("Invalid link for family " + kind + ", should be in ["
          + Joiner.on(", ").join(kind._links) + "] (got " + link + ")");
    if( !kind._safe.contains(link._kind) )
      LOG.warning("link " + link + " is not a safe link for family " + kind
          + ", fitted means may leave the valid range");
    _kind = kind;
    _link = link;
    _n = n;
    _variance = n == null ? kind.variance() : Variance.binomial(n);
  }

  public static Family make(Kind kind, Link link) { return new Family(kind, link, null); }
  public static Family make(Kind kind)            { return make(kind, kind._defaultLink); }

  public static Family poisson()                 { return make(Kind.poisson); }
  public static Family poisson(Link link)        { return make(Kind.poisson, link); }
  public static Family quasiPoisson()            { return make(Kind.quasipoisson); }
  public static Family quasiPoisson(Link link)   { return make(Kind.quasipoisson, link); }
  public static Family gaussian()                { return make(Kind.gaussian); }
  public static Family gaussian(Link link)       { return make(Kind.gaussian, link); }
  public static Family gamma()                   { return make(Kind.gamma); }
  public static Family gamma(Link link)          { return make(Kind.gamma, link); }
  public static Family binomial()                { return make(Kind.binomial); }
  public static Family binomial(Link link)       { return make(Kind.binomial, link); }

  /** Binomial family for grouped data with n[i] trials for observation i. */
  public static Family binomial(Link link, double [] n) {
    Preconditions.checkArgument(n.length > 0, "no trial counts");
    return new Family(Kind.binomial, link, n.clone());
  }

  /** Family by name with its default link. */
  public static Family forName(String name) {
    return make(kindForName(name));
  }

  public static Kind kindForName(String name) {
    try {
      return Kind.valueOf(name.trim().toLowerCase());
    } catch( IllegalArgumentException e ) {
      throw new GLMException("unknown family " + name);
    }
  }

  /** Same family (and trial counts) with another link. */
  public Family withLink(Link link) {
    return new Family(_kind, link, _n);
  }

  public boolean accepts(Link link) { return _kind._links.contains(link); }
  public boolean isSafeLink()       { return _kind._safe.contains(_link._kind); }
  public boolean isValid(double y)  { return _kind._valid.contains(y); }
  public Range<Double> valid()      { return _kind._valid; }
  public ImmutableList<Link> links(){ return _kind._links; }

  /** True for a binomial family bound to per-observation trial counts. */
  public boolean isGrouped() { return _n != null; }

  /** Trial counts of a grouped binomial family, null otherwise. */
  public double [] n() { return _n == null ? null : _n.clone(); }

  private double n(int i) { return bcast(_n, i, 1.0); }

  /** Response prepared for fitting: the response, its trial counts and the family bound to them. */
  public static final class Response {
    public final double [] _y;
    public final double [] _n;
    public final Family _family;
    Response(double [] y, double [] n, Family family) {
      _y = y;
      _n = n;
      _family = family;
    }
  }

  /**
   * Single-column response: used as is, one trial per observation. A grouped
   * family hands back the binary family with the same link.
   */
  public Response initialize(double [] y) {
    double [] n = new double[y.length];
    Arrays.fill(n, 1.0);
    return new Response(y.clone(), n, _n == null ? this : make(_kind, _link));
  }

  /**
   * Response given as rows. One column is used as is. Binomial families also
   * take (successes, failures) rows: the response becomes successes/n with
   * n = successes + failures, and the returned family is bound to n.
   */
  public Response initialize(double [][] endog) {
    Preconditions.checkArgument(endog.length > 0, "empty response");
    int ncols = endog[0].length;
    for( double [] row : endog )
      Preconditions.checkArgument(row.length == ncols, "ragged response rows");
    if( ncols == 1 ) {
      double [] y = new double[endog.length];
      for( int i = 0; i < y.length; ++i ) y[i] = endog[i][0];
      return initialize(y);
    }
    Preconditions.checkArgument(_kind == Kind.binomial,
        "family %s takes a single response column, got %s", _kind, ncols);
    double [] y = new double[endog.length];
    double [] n = new double[endog.length];
    for( int i = 0; i < endog.length; ++i ) {
      n[i] = MathUtils.sum(endog[i]);
      Preconditions.checkArgument(n[i] > 0, "no trials in row %s", i);
      y[i] = endog[i][0] / n[i];
    }
    LOG.fine("grouped binomial response, " + n.length + " rows");
    return new Response(y, n, binomial(_link, n));
  }

  /** First guess at mu for IRLS. */
  public double [] startingMu(double [] y) {
    double [] res = new double[y.length];
    if( _kind == Kind.binomial ) {
      for( int i = 0; i < y.length; ++i ) res[i] = (y[i] + 0.5) / 2;
    } else {
      double m = MathUtils.mean(y);
      for( int i = 0; i < y.length; ++i ) res[i] = (y[i] + m) / 2;
    }
    return res;
  }

  /** IRLS weight of a single observation, needs a scalar variance. */
  public double weight(double mu) {
    double d = _link.linkDeriv(mu);
    return 1.0 / (d * d * _variance.variance(mu));
  }

  /** IRLS weights 1/(g'(mu)^2 V(mu)). */
  public double [] weights(double [] mu) {
    double [] d = _link.linkDeriv(mu);
    double [] v = _variance.variance(mu);
    double [] res = new double[mu.length];
    for( int i = 0; i < mu.length; ++i )
      res[i] = 1.0 / (d[i] * d[i] * v[i]);
    return res;
  }

  /** Means from linear predictors. */
  public double [] fitted(double [] eta) { return _link.linkInv(eta); }

  /** Linear predictors from means. */
  public double [] predict(double [] mu) { return _link.link(mu); }

  public double deviance(double [] y, double [] mu) {
    return deviance(y, mu, null, 1.0);
  }

  /**
   * Twice the log-likelihood ratio of the saturated model to this fit.
   * Divided by scale for the poisson, quasi-poisson and gaussian families;
   * gamma and binomial ignore it.
   */
  public double deviance(double [] y, double [] mu, double [] freqWeights, double scale) {
    check(y, mu, freqWeights);
    double dev = 0;
    for( int i = 0; i < y.length; ++i )
      dev += bcast(freqWeights, i, 1.0) * unitDeviance(y[i], mu[i], i);
    switch( _kind ) {
    case gamma:
    case binomial:
      return dev;
    default:
      return dev / scale;
    }
  }

  // per-observation contribution to the deviance, unweighted
  private double unitDeviance(double y, double mu, int i) {
    switch( _kind ) {
    case poisson:
    case quasipoisson:
      return 2 * y * Math.log(clipPos(y / mu));
    case gaussian:
      return (y - mu) * (y - mu);
    case gamma:
      return 2 * ((y - mu) / mu - Math.log(clipPos(y / mu)));
    case binomial:
      if( _n == null ) {
        return y == 1
            ? -2 * Math.log(mu + TINY)
            : -2 * Math.log(1 - mu + TINY);
      }
      return 2 * n(i) * binomialTerm(y, mu);
    default:
      throw new Error("unimplemented deviance for family " + _kind);
    }
  }

  private static double binomialTerm(double y, double mu) {
    return y * Math.log(y / mu + TINY) + (1 - y) * Math.log((1 - y) / (1 - mu) + TINY);
  }

  public double [] residDev(double [] y, double [] mu) {
    return residDev(y, mu, 1.0);
  }

  /** Signed deviance residuals, divided by scale for every family but gamma. */
  public double [] residDev(double [] y, double [] mu, double scale) {
    check(y, mu, null);
    double [] res = new double[y.length];
    for( int i = 0; i < y.length; ++i ) {
      double yi = y[i], m = mu[i];
      double r;
      switch( _kind ) {
      case poisson:
      case quasipoisson:
        r = sign(yi - m) * safeSqrt(2 * (yi * Math.log(clipPos(yi / m)) - (yi - m)));
        break;
      case gaussian:
        r = (yi - m) / Math.sqrt(_variance.variance(m));
        break;
      case gamma:
        r = sign(yi - m) * safeSqrt(-2 * (-(yi - m) / m + Math.log(clipPos(yi / m))));
        break;
      case binomial:
        m = clipProb(m);
        if( _n == null )
          r = sign(yi - m) * safeSqrt(-2 * Math.log(yi == 1 ? m : 1 - m));
        else
          r = sign(yi - m) * safeSqrt(2 * n(i) * binomialTerm(yi, m));
        break;
      default:
        throw new Error("unimplemented deviance residuals for family " + _kind);
      }
      res[i] = _kind == Kind.gamma ? r : r / scale;
    }
    return res;
  }

  private static double safeSqrt(double x) {
    // rounding can leave a zero deviance slightly negative
    return Math.sqrt(Math.max(0, x));
  }

  public double loglike(double [] y, double [] mu) {
    return loglike(y, mu, null, 1.0);
  }

  /**
   * Log-likelihood of the fitted means. NaN for the quasi-poisson family,
   * which has no likelihood.
   */
  public double loglike(double [] y, double [] mu, double [] freqWeights, double scale) {
    check(y, mu, freqWeights);
    switch( _kind ) {
    case quasipoisson:
      return Double.NaN;
    case poisson: {
      double ll = 0;
      for( int i = 0; i < y.length; ++i )
        ll += bcast(freqWeights, i, 1.0) * (y[i] * Math.log(mu[i]) - mu[i] - Gamma.logGamma(y[i] + 1));
      return scale * ll;
    }
    case gaussian: {
      if( _link.isIdentity() ) {
        // classical OLS likelihood, scale concentrated out
        double nobs2 = y.length / 2.0;
        double ssr = 0;
        for( int i = 0; i < y.length; ++i )
          ssr += (y[i] - mu[i]) * (y[i] - mu[i]);
        return -Math.log(ssr) * nobs2 - (1 + Math.log(Math.PI / nobs2)) * nobs2;
      }
      double ll = 0;
      for( int i = 0; i < y.length; ++i )
        ll += bcast(freqWeights, i, 1.0) * ((y[i] * mu[i] - mu[i] * mu[i] / 2) / scale
            - y[i] * y[i] / (2 * scale) - 0.5 * Math.log(2 * Math.PI * scale));
      return ll;
    }
    case gamma: {
      double c = Math.log(scale) + scale * Gamma.logGamma(1.0 / scale);
      double ll = 0;
      for( int i = 0; i < y.length; ++i )
        ll += bcast(freqWeights, i, 1.0) * (y[i] / mu[i] + Math.log(mu[i]) + (scale - 1) * Math.log(y[i]) + c);
      return -ll / scale;
    }
    case binomial: {
      double ll = 0;
      for( int i = 0; i < y.length; ++i ) {
        double w = bcast(freqWeights, i, 1.0);
        double m = mu[i];
        if( _n == null ) {
          ll += w * (y[i] * Math.log(m / (1 - m) + TINY) + Math.log(1 - m));
        } else {
          double n = n(i);
          double k = y[i] * n; // back to successes
          ll += w * (Gamma.logGamma(n + 1) - Gamma.logGamma(k + 1) - Gamma.logGamma(n - k + 1)
              + k * Math.log(m / (1 - m)) + n * Math.log(1 - m));
        }
      }
      return scale * ll;
    }
    default:
      throw new Error("unimplemented loglike for family " + _kind);
    }
  }

  /** Anscombe (variance stabilized) residuals. */
  public double [] residAnscombe(double [] y, double [] mu) {
    check(y, mu, null);
    double [] res = new double[y.length];
    for( int i = 0; i < y.length; ++i ) {
      double yi = y[i], m = mu[i];
      switch( _kind ) {
      case poisson:
      case quasipoisson:
        res[i] = 1.5 * (Math.pow(yi, 2 / 3.0) - Math.pow(m, 2 / 3.0)) / Math.pow(m, 1 / 6.0);
        break;
      case gaussian:
        res[i] = yi - m;
        break;
      case gamma:
        res[i] = 3 * (Math.cbrt(yi) - Math.cbrt(m)) / Math.cbrt(m);
        break;
      case binomial:
        res[i] = Math.sqrt(n(i)) * (coxSnell(yi) - coxSnell(m))
            / (Math.pow(m, 1 / 6.0) * Math.pow(1 - m, 1 / 6.0));
        break;
      default:
        throw new Error("unimplemented anscombe residuals for family " + _kind);
      }
    }
    return res;
  }

  // incomplete beta B(x; 2/3, 2/3)
  private static double coxSnell(double x) {
    return Beta.regularizedBeta(x, 2 / 3.0, 2 / 3.0) * BETA_2_3;
  }

  private void check(double [] y, double [] mu, double [] freqWeights) {
    MathUtils.checkSameLength(y, mu);
    MathUtils.checkBroadcast(freqWeights, y.length, "frequency weights");
    if( _n != null ) MathUtils.checkBroadcast(_n, y.length, "trial counts");
  }

  public JsonObject toJson(){
    JsonObject res = new JsonObject();
    res.addProperty("family", _kind.toString());
    res.add("link", _link.toJson());
    res.add("variance", _variance.toJson());
    res.addProperty("safeLink", isSafeLink());
    if( _n != null ) res.addProperty("groups", _n.length);
    return res;
  }

  @Override public String toString() {
    return _kind + "(" + _link + ")";
  }
}
