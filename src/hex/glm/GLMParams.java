package hex.glm;

import java.util.Properties;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Family/link choice for a fit. A null link means the family's default;
 * _power and _alpha only apply to the "power" and "nbinom" links.
 */
public class GLMParams {
  public Family.Kind _family = Family.Kind.gaussian;
  public String _link;
  public double _power = Double.NaN;
  public double _alpha = Double.NaN;

  public GLMParams() {}

  public GLMParams(Family.Kind family) { _family = family; }

  public GLMParams(Family.Kind family, String link) {
    _family = family;
    _link = link;
  }

  /**
   * Read from properties "family" (default gaussian), "link" (default: the
   * family's default link), "power" and "alpha".
   */
  public static GLMParams fromProperties(Properties p) {
    GLMParams res = new GLMParams();
    res._family = Family.kindForName(p.getProperty("family", "gaussian"));
    res._link = p.getProperty("link");
    res._power = number(p.getProperty("power"), "power");
    res._alpha = number(p.getProperty("alpha"), "alpha");
    return res;
  }

  private static double number(String s, String what) {
    if( s == null ) return Double.NaN;
    try {
      return Double.valueOf(s.trim());
    } catch( NumberFormatException e ) {
      throw new GLMException("illegal " + what + " value " + s);
    }
  }

  public Link link() {
    if( _link == null ) return _family._defaultLink;
    String l = _link.trim().toLowerCase();
    if( l.equals("power") ) {
      if( Double.isNaN(_power) ) throw new GLMException("power link needs a power");
      return Link.power(_power);
    }
    if( l.equals("nbinom") && !Double.isNaN(_alpha) )
      return Link.nbinom(_alpha);
    return Link.forName(l);
  }

  /** Family with the configured link, validated. */
  public Family makeFamily() {
    return Family.make(_family, link());
  }

  public JsonObject toJson(){
    JsonObject res = new JsonObject();
    res.addProperty("family", _family.toString());
    res.addProperty("link", _link == null ? link().name() : _link.trim().toLowerCase());
    if( !Double.isNaN(_power) ) res.addProperty("power", _power);
    if( !Double.isNaN(_alpha) ) res.addProperty("alpha", _alpha);
    return res;
  }

  public static GLMParams fromJson(JsonObject json) {
    GLMParams res = new GLMParams();
    JsonElement f = json.get("family");
    if( f != null ) res._family = Family.kindForName(f.getAsString());
    JsonElement l = json.get("link");
    if( l != null ) res._link = l.getAsString();
    if( json.has("power") ) res._power = json.get("power").getAsDouble();
    if( json.has("alpha") ) res._alpha = json.get("alpha").getAsDouble();
    return res;
  }

  public static GLMParams fromJson(String json) {
    JsonElement e = JsonParser.parseString(json);
    if( !e.isJsonObject() ) throw new GLMException("expected a json object, got " + json);
    return fromJson(e.getAsJsonObject());
  }
}
