package test;
import static org.junit.Assert.*;

import hex.glm.Variance;

import org.junit.Test;

import water.util.MathUtils;

public class VarianceTest extends TestUtil {

  @Test public void testConstant() {
    Variance v = Variance.constant();
    assertArrayClose(fill(3, 1.0), v.variance(new double[]{-1, 0, 7}), 0);
    assertEquals(0.0, v.deriv(3.0), 0);
  }

  @Test public void testPower() {
    assertEquals(2.0, Variance.mu().variance(-2.0), 0);
    assertEquals(9.0, Variance.muSquared().variance(3.0), 1e-15);
    assertEquals(8.0, Variance.muCubed().variance(-2.0), 1e-15);
    assertEquals(Math.pow(2.0, 1.5), Variance.power(1.5).variance(2.0), 1e-15);
    // forward difference, O(sqrt(eps)) accurate
    assertEquals(1.0, Variance.mu().deriv(3.0), 1e-6);
    assertEquals(6.0, Variance.muSquared().deriv(3.0), 1e-5);
    assertEquals(27.0, Variance.muCubed().deriv(3.0), 1e-5);
  }

  @Test public void testBinary() {
    Variance v = Variance.binary();
    assertEquals(0.21, v.variance(0.3), 1e-15);
    assertEquals(0.4, v.deriv(0.3), 1e-12);
    // clipped, still positive at the edges
    assertTrue(v.variance(0.0) > 0);
    assertTrue(v.variance(1.0) > 0);
    assertEquals(MathUtils.FLOAT_EPS * (1 - MathUtils.FLOAT_EPS), v.variance(0.0), 1e-30);
    assertEquals(0.0, v.deriv(0.0), 0);
  }

  @Test public void testBinomialTrials() {
    Variance v = Variance.binomial(10);
    assertEquals(0.3 * 0.7 * 10, v.variance(3.0), 1e-12);
    assertEquals(1 - 2 * 3.0 / 10, v.deriv(3.0), 1e-12);

    // one count per observation
    Variance g = Variance.binomial(2, 4);
    assertArrayClose(new double[]{0.5, 0.75}, g.variance(new double[]{1, 1}), 1e-15);
    assertArrayClose(new double[]{0.0, 0.5}, g.deriv(new double[]{1, 1}), 1e-12);
    assertEquals(4.0, g.n(1), 0);
    try {
      g.variance(1.0);
      fail("per-observation trial counts need the array form");
    } catch( IllegalStateException e ) { }
    try {
      g.variance(new double[]{1, 1, 1});
      fail("three means, two trial counts");
    } catch( IllegalArgumentException e ) { }
  }

  @Test public void testNegativeBinomial() {
    assertEquals(6.0, Variance.nbinom().variance(2.0), 1e-15);
    assertEquals(4.0, Variance.nbinom(0.5).variance(2.0), 1e-15);
    assertEquals(3.0, Variance.nbinom(0.5).deriv(2.0), 1e-15);
    assertTrue(Variance.nbinom().variance(-1.0) > 0);
  }

  @Test public void testNonNegative() {
    Variance [] vs = {Variance.constant(), Variance.mu(), Variance.muSquared(), Variance.muCubed(),
                      Variance.binary(), Variance.binomial(5), Variance.nbinom()};
    for( Variance v : vs )
      for( double mu : new double[]{0.0, 0.01, 0.5, 0.99, 1.0, 3.0} )
        assertTrue(v + " at " + mu, v.variance(mu) >= 0);
  }

  @Test public void testToJson() {
    assertEquals("power", Variance.muSquared().toJson().get("variance").getAsString());
    assertEquals(2.0, Variance.muSquared().toJson().get("power").getAsDouble(), 0);
    assertEquals(1.0, Variance.binary().toJson().get("n").getAsDouble(), 0);
    assertEquals("binomial(n=[2.0, 4.0])", Variance.binomial(2, 4).toString());
  }
}
