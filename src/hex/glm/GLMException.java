package hex.glm;

/** Invalid GLM configuration: an unknown name or a link the family does not accept. */
public class GLMException extends RuntimeException {
  public GLMException(String msg){super(msg);}
}
