package exm.dirc.common.exceptions;

/**
 * Represents a malformed configuration value
 * */
public class InvalidOptionException
extends Exception
{
  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
