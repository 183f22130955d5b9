package io.spendwise.ledger.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Every authenticated subject is a ledger user and gets {@code ROLE_USER}; {@code admin} in the
 * {@code roles} claim adds {@code ROLE_ADMIN}. Other claim values are ignored.
 */
@Component
public class LedgerJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLES_CLAIM = "roles";

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    List<GrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(Roles.AUTHORITY_USER));

    List<String> roles = jwt.getClaimAsStringList(ROLES_CLAIM);
    if (roles != null && roles.contains(Roles.ADMIN)) {
      authorities.add(new SimpleGrantedAuthority(Roles.AUTHORITY_ADMIN));
    }
    return authorities;
  }
}
