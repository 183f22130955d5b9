package io.spendwise.ledger.security;

/** Thrown when code that requires an authenticated caller runs without one. */
public class UserContextNotBoundException extends RuntimeException {

  public UserContextNotBoundException() {
    super("No authenticated user is bound to the current request");
  }
}
