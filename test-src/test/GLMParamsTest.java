package test;
import static org.junit.Assert.*;

import hex.glm.Family;
import hex.glm.GLMException;
import hex.glm.GLMParams;
import hex.glm.Link;

import java.util.Properties;

import org.junit.Test;

import com.google.gson.JsonObject;

public class GLMParamsTest extends TestUtil {

  static Properties props(String... kv) {
    Properties p = new Properties();
    for( int i = 0; i < kv.length; i += 2 ) p.setProperty(kv[i], kv[i + 1]);
    return p;
  }

  @Test public void testDefaults() {
    GLMParams p = GLMParams.fromProperties(new Properties());
    assertEquals(Family.Kind.gaussian, p._family);
    assertNull(p._link);
    Family f = p.makeFamily();
    assertEquals(Family.Kind.gaussian, f._kind);
    assertEquals(Link.identity(), f._link);
    assertEquals(Link.inverse(), new GLMParams(Family.Kind.gamma).link());
  }

  @Test public void testFromProperties() {
    Family f = GLMParams.fromProperties(props("family", "Binomial", "link", "probit")).makeFamily();
    assertEquals(Family.Kind.binomial, f._kind);
    assertEquals(Link.probit(), f._link);
    f = GLMParams.fromProperties(props("family", "poisson", "link", " Sqrt ")).makeFamily();
    assertEquals(Link.sqrt(), f._link);
  }

  @Test public void testPowerAndAlpha() {
    GLMParams p = GLMParams.fromProperties(props("family", "gaussian", "link", "power", "power", "1"));
    assertEquals(Link.identity(), p.link());
    assertEquals(Link.identity(), p.makeFamily()._link);
    p = GLMParams.fromProperties(props("link", "power", "power", "3"));
    assertEquals(Link.power(3), p.link());
    p = GLMParams.fromProperties(props("link", "nbinom", "alpha", "0.5"));
    assertEquals(Link.nbinom(0.5), p.link());
    assertEquals(0.5, p.link()._alpha, 0);
    assertEquals(Link.nbinom(), GLMParams.fromProperties(props("link", "nbinom")).link());
  }

  @Test public void testErrors() {
    try {
      GLMParams.fromProperties(props("family", "tweedie"));
      fail("unknown family");
    } catch( GLMException e ) {
      assertEquals("unknown family tweedie", e.getMessage());
    }
    try {
      GLMParams.fromProperties(props("power", "two"));
      fail("malformed power");
    } catch( GLMException e ) {
      assertTrue(e.getMessage().contains("two"));
    }
    try {
      GLMParams.fromProperties(props("link", "power")).link();
      fail("power link without a power");
    } catch( GLMException e ) { }
    try {
      GLMParams.fromProperties(props("family", "poisson", "link", "logit")).makeFamily();
      fail("logit is not a poisson link");
    } catch( GLMException e ) {
      assertTrue(e.getMessage().startsWith("Invalid link for family poisson"));
    }
  }

  @Test public void testJson() {
    GLMParams p = new GLMParams(Family.Kind.binomial, "CLogLog");
    JsonObject json = p.toJson();
    assertEquals("binomial", json.get("family").getAsString());
    assertEquals("cloglog", json.get("link").getAsString());
    assertFalse(json.has("power"));
    GLMParams q = GLMParams.fromJson(json.toString());
    assertEquals(p._family, q._family);
    assertEquals(p.link(), q.link());

    // the default link is written out by name
    assertEquals("log", new GLMParams(Family.Kind.poisson).toJson().get("link").getAsString());

    GLMParams pw = GLMParams.fromJson("{\"family\":\"gaussian\",\"link\":\"power\",\"power\":-1}");
    assertEquals(Link.inverse(), pw.link());
    assertEquals(Link.inverse(), GLMParams.fromJson(pw.toJson()).link());
    try {
      GLMParams.fromJson("[1, 2]");
      fail("not an object");
    } catch( GLMException e ) { }
  }
}
