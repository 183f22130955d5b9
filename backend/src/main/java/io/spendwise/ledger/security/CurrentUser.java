package io.spendwise.ledger.security;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Reads the caller identity from the security context. The JWT subject is the owner id of every
 * template and ledger entry the caller creates.
 */
public final class CurrentUser {

  private CurrentUser() {}

  /** Returns the subject of the authenticated caller, or throws if the request is anonymous. */
  public static String requireUserId() {
    String userId = userIdOrNull();
    if (userId == null) {
      throw new UserContextNotBoundException();
    }
    return userId;
  }

  /** Returns the subject of the authenticated caller, or {@code null} outside a user request. */
  public static String userIdOrNull() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return null;
    }
    return authentication.getName();
  }
}
