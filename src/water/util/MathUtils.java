package water.util;

import com.google.common.base.Preconditions;

/**
 * Small elementwise helpers shared by the link, variance and family code.
 */
public final class MathUtils {
  /** Machine epsilon of a 64-bit double, 2^-52. */
  public static final double FLOAT_EPS = Math.ulp(1.0);

  // added inside logs to keep log(0) finite
  public static final double TINY = 1e-200;

  private MathUtils() {}

  public static double clip(double x, double lo, double hi) {
    return x < lo ? lo : (x > hi ? hi : x);
  }

  /** Clip a probability to [eps, 1-eps]. */
  public static double clipProb(double p) {
    return clip(p, FLOAT_EPS, 1.0 - FLOAT_EPS);
  }

  /** Clip to [eps, inf). */
  public static double clipPos(double x) {
    return x < FLOAT_EPS ? FLOAT_EPS : x;
  }

  public static double sign(double x) {
    return x > 0 ? 1 : (x < 0 ? -1 : 0);
  }

  public static double sum(double [] x) {
    double s = 0;
    for( double d : x ) s += d;
    return s;
  }

  public static double mean(double [] x) {
    Preconditions.checkArgument(x.length > 0, "mean of an empty array");
    return sum(x)/x.length;
  }

  /**
   * Value at index i of an array that is either null (broadcast dflt), of
   * length 1 (broadcast its only element) or of the full length.
   */
  public static double bcast(double [] x, int i, double dflt) {
    if( x == null ) return dflt;
    return x.length == 1 ? x[0] : x[i];
  }

  public static void checkBroadcast(double [] x, int n, String what) {
    Preconditions.checkArgument(x == null || x.length == 1 || x.length == n,
        "%s has length %s, expected 1 or %s", what, x == null ? 0 : x.length, n);
  }

  public static void checkSameLength(double [] a, double [] b) {
    Preconditions.checkArgument(a.length == b.length,
        "arrays of different length: %s vs %s", a.length, b.length);
  }
}
