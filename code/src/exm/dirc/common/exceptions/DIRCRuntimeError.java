package exm.dirc.common.exceptions;

/**
 * This represents an internal error in the IR core.
 * These always indicate a malformed tree or a caller bug, never a
 * condition that can be recovered from.
 * */
public class DIRCRuntimeError extends RuntimeException
{
  public DIRCRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
