package org.toiletmap.global.rest;

import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.JWTVerifier;
import com.auth0.jwt.interfaces.Verification;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Verifies bearer tokens and turns them into an authentication whose principal is the contributor name.
 * <p>
 * The contributor is taken from the nickname of the profile claim when configured, then from the
 * <code>nickname</code>, <code>name</code> and <code>sub</code> claims. A valid token carrying none of them is rejected.
 */
@Component
@Slf4j
public class JwtAuthenticationManager implements ReactiveAuthenticationManager, InitializingBean {

	public static final String AUTHORITY_CONTRIBUTOR = "contributor";

	private static final String CLAIM_NICKNAME = "nickname";
	private static final String CLAIM_NAME = "name";

	@Value("${toiletmap.jwt.secret}")
	private String secret;
	@Value("${toiletmap.jwt.issuer:}")
	private String issuer;
	@Value("${toiletmap.jwt.audience:}")
	private String audience;
	@Value("${toiletmap.jwt.profile-claim:}")
	private String profileClaim;

	private JWTVerifier verifier;

	@Override
	public void afterPropertiesSet() throws Exception {
		if (StringUtils.isBlank(secret)) throw new IllegalStateException("toiletmap.jwt.secret must be configured");
		Verification verification = JWT.require(Algorithm.HMAC512(secret));
		if (StringUtils.isNotBlank(issuer)) verification = verification.withIssuer(issuer);
		if (StringUtils.isNotBlank(audience)) verification = verification.withAudience(audience);
		verifier = verification.build();
	}

	public boolean isIssuerChecked() {
		return StringUtils.isNotBlank(issuer) && StringUtils.isNotBlank(audience);
	}

	@Override
	public Mono<Authentication> authenticate(Authentication authentication) {
		return Mono.defer(() -> {
			String token = authentication.getCredentials().toString();
			DecodedJWT decoded;
			try {
				decoded = verifier.verify(token);
			} catch (Exception e) {
				log.info("Invalid token: {}", e.getMessage());
				return Mono.empty();
			}
			String contributor = extractContributor(decoded);
			if (contributor == null) {
				log.info("Token of {} does not identify a contributor", decoded.getSubject());
				return Mono.empty();
			}
			return Mono.just(new UsernamePasswordAuthenticationToken(contributor, token, List.of(new SimpleGrantedAuthority(AUTHORITY_CONTRIBUTOR))));
		});
	}

	private String extractContributor(DecodedJWT decoded) {
		if (StringUtils.isNotBlank(profileClaim)) {
			Map<String, Object> profile = decoded.getClaim(profileClaim).asMap();
			if (profile != null && profile.get(CLAIM_NICKNAME) instanceof String nickname && StringUtils.isNotBlank(nickname))
				return nickname.trim();
		}
		for (String claim : List.of(CLAIM_NICKNAME, CLAIM_NAME)) {
			String value = decoded.getClaim(claim).asString();
			if (StringUtils.isNotBlank(value)) return value.trim();
		}
		return StringUtils.trimToNull(decoded.getSubject());
	}

}
