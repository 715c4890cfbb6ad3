package test;
import static org.junit.Assert.*;

import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

import water.util.MathUtils;
import water.util.NumDiff;

public class NumDiffTest extends TestUtil {

  static final NumDiff.Function SIN = new NumDiff.Function() {
    @Override public double apply(double x) { return Math.sin(x); }
  };
  static final NumDiff.Function EXP = new NumDiff.Function() {
    @Override public double apply(double x) { return Math.exp(x); }
  };
  static final NumDiff.Function SQUARE = new NumDiff.Function() {
    @Override public double apply(double x) { return x * x; }
  };
  static final NumDiff.ComplexFunction CSIN = new NumDiff.ComplexFunction() {
    @Override public Complex apply(Complex z) { return z.sin(); }
  };
  static final NumDiff.ComplexFunction CEXP = new NumDiff.ComplexFunction() {
    @Override public Complex apply(Complex z) { return z.exp(); }
  };

  @Test public void testSin() {
    double expected = Math.cos(1.0);
    assertEquals(expected, NumDiff.forward(SIN, 1.0), 1e-7);
    assertEquals(expected, NumDiff.centered(SIN, 1.0), 1e-9);
    assertEquals(expected, NumDiff.complexStep(CSIN, 1.0), 1e-14);
  }

  // small |x| still gets a usable step
  @Test public void testNearZero() {
    assertEquals(1.0, NumDiff.centered(EXP, 0.0), 1e-9);
    assertEquals(1.0, NumDiff.complexStep(CEXP, 0.0), 1e-15);
    assertEquals(2e-3, NumDiff.centered(SQUARE, 1e-3), 1e-9);
  }

  @Test public void testClip() {
    assertEquals(MathUtils.FLOAT_EPS, MathUtils.clipProb(0.0), 0);
    assertEquals(1 - MathUtils.FLOAT_EPS, MathUtils.clipProb(1.0), 0);
    assertEquals(0.3, MathUtils.clipProb(0.3), 0);
    assertEquals(MathUtils.FLOAT_EPS, MathUtils.clipPos(-2.0), 0);
    assertEquals(7.0, MathUtils.clipPos(7.0), 0);
    assertEquals(2.0, MathUtils.clip(5.0, -2.0, 2.0), 0);
  }

  @Test public void testBroadcast() {
    assertEquals(1.5, MathUtils.bcast(null, 3, 1.5), 0);
    assertEquals(4.0, MathUtils.bcast(new double[]{4}, 3, 1.5), 0);
    assertEquals(6.0, MathUtils.bcast(new double[]{4, 5, 6}, 2, 1.5), 0);
    MathUtils.checkBroadcast(null, 3, "w");
    MathUtils.checkBroadcast(new double[]{1}, 3, "w");
    try {
      MathUtils.checkBroadcast(new double[]{1, 2}, 3, "w");
      fail("two values for three observations");
    } catch( IllegalArgumentException e ) {
      assertTrue(e.getMessage().startsWith("w has length 2"));
    }
  }
}
