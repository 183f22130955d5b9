package io.spendwise.ledger.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class LedgerJwtAuthenticationConverterTest {

  private final LedgerJwtAuthenticationConverter converter =
      new LedgerJwtAuthenticationConverter();

  @Test
  void convert_tokenWithoutRoles_grantsUserOnly() {
    var authentication = converter.convert(jwt("user_plain", null));

    assertThat(authentication.getName()).isEqualTo("user_plain");
    assertThat(authentication.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_USER);
  }

  @Test
  void convert_adminRole_grantsUserAndAdmin() {
    var authentication = converter.convert(jwt("user_operator", List.of("user", "admin")));

    assertThat(authentication.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactlyInAnyOrder(Roles.AUTHORITY_USER, Roles.AUTHORITY_ADMIN);
  }

  @Test
  void convert_userRoleClaim_grantsUserOnly() {
    var authentication = converter.convert(jwt("user_member", List.of("user")));

    assertThat(authentication.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_USER);
  }

  @Test
  void convert_unknownRoles_areIgnored() {
    var authentication = converter.convert(jwt("user_other", List.of("auditor", "ADMIN")));

    assertThat(authentication.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_USER);
  }

  private static Jwt jwt(String subject, List<String> roles) {
    var builder =
        Jwt.withTokenValue("token")
            .header("alg", "RS256")
            .subject(subject)
            .issuedAt(Instant.parse("2024-03-10T09:00:00Z"))
            .expiresAt(Instant.parse("2024-03-10T10:00:00Z"));
    if (roles != null) {
      builder.claim(LedgerJwtAuthenticationConverter.ROLES_CLAIM, roles);
    }
    return builder.build();
  }
}
