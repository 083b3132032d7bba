package org.toiletmap.global.rest;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContextImpl;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Authenticates the request when it carries a valid bearer token.
 * A missing or invalid token leaves the request anonymous, the security rules decide what it can reach.
 */
@RequiredArgsConstructor
public class JwtFilter implements WebFilter {

	private static final String BEARER = "Bearer ";

	private final ReactiveAuthenticationManager authManager;

	@Override
	public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
		String token = bearerToken(exchange.getRequest());
		if (token == null) return chain.filter(exchange);
		return authManager.authenticate(new UsernamePasswordAuthenticationToken(null, token))
		.map(auth -> new SecurityContextImpl(auth))
		.flatMap(securityContext -> chain.filter(exchange)
			.contextWrite(ReactiveSecurityContextHolder.withSecurityContext(Mono.just(securityContext)))
			.thenReturn(Boolean.TRUE)
		)
		.switchIfEmpty(Mono.defer(() -> chain.filter(exchange).thenReturn(Boolean.TRUE)))
		.then();
	}

	static String bearerToken(ServerHttpRequest request) {
		String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
		if (header == null || !header.startsWith(BEARER)) return null;
		String token = header.substring(BEARER.length()).trim();
		return token.isEmpty() ? null : token;
	}

}
