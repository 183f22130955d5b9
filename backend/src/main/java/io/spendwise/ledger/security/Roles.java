package io.spendwise.ledger.security;

/**
 * Role constants shared by the JWT converter and {@code @PreAuthorize} expressions.
 *
 * <p>Token roles come from the {@code roles} claim. Every authenticated caller is a ledger user;
 * the {@code admin} role additionally unlocks operator endpoints such as manual processing.
 */
public final class Roles {

  // Values of the "roles" JWT claim
  public static final String USER = "user";
  public static final String ADMIN = "admin";

  // Spring Security granted authorities
  public static final String AUTHORITY_USER = "ROLE_USER";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";

  private Roles() {}
}
