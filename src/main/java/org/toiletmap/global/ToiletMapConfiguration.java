package org.toiletmap.global;

import java.security.SecureRandom;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.ReactivePageableHandlerMethodArgumentResolver;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity.CsrfSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.FormLoginSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.HttpBasicSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.LogoutSpec;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;
import org.springframework.web.server.session.WebSessionManager;
import org.toiletmap.global.exceptions.UnauthorizedException;
import org.toiletmap.global.rest.HttpFilter;
import org.toiletmap.global.rest.JwtFilter;

import com.fasterxml.jackson.core.JsonProcessingException;

import reactor.core.publisher.Mono;

@Configuration
public class ToiletMapConfiguration implements WebFluxConfigurer {

	@Bean
	WebSessionManager webSessionManager() {
		return exchange -> Mono.empty();
	}

	@Bean
	SecurityWebFilterChain springSecurityFilterChain(ServerHttpSecurity http, ReactiveAuthenticationManager authManager) {
		return http
		.csrf(CsrfSpec::disable)
		.formLogin(FormLoginSpec::disable)
		.httpBasic(HttpBasicSpec::disable)
		.logout(LogoutSpec::disable)
		.authorizeExchange(auth -> auth
			.pathMatchers(HttpMethod.GET, "/api/health/**").permitAll()
			.pathMatchers(HttpMethod.GET, "/api/loos/**").permitAll()
			.pathMatchers(HttpMethod.GET, "/api/loos").permitAll()
			.pathMatchers("/**").authenticated()
		)
		.addFilterBefore(new HttpFilter(), SecurityWebFiltersOrder.HTTP_BASIC)
		.addFilterBefore(new JwtFilter(authManager), SecurityWebFiltersOrder.HTTP_BASIC)
		.securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
		.exceptionHandling(handling ->
			handling.authenticationEntryPoint(
				(exchange, error) -> {
					var response = exchange.getResponse();
					response.setStatusCode(HttpStatus.UNAUTHORIZED);
					response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
					byte[] body;
					try {
						body = ToiletMapUtils.mapper.writeValueAsBytes(new UnauthorizedException().toApiError());
					} catch (JsonProcessingException e) {
						return Mono.error(e);
					}
					DataBuffer buffer = response.bufferFactory().wrap(body);
					return response.writeWith(Mono.just(buffer));
				}
			)
		)
		.build();
	}

	@Bean
	SecureRandom secureRandom() {
		return new SecureRandom();
	}

	@Override
	public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
		var resolver = new ReactivePageableHandlerMethodArgumentResolver();
		resolver.setFallbackPageable(Pageable.unpaged());
		resolver.setMaxPageSize(ToiletMapUtils.MAX_PAGE_SIZE);
		configurer.addCustomResolver(resolver);
	}

}
