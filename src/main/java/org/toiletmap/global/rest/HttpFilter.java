package org.toiletmap.global.rest;

import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.mutable.MutableObject;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Logs slow requests, and requests still not answered after a while. */
@Slf4j
public class HttpFilter implements WebFilter {

	private static final long SLOW_REQUEST_MILLIS = 2000;
	private static final long STUCK_REQUEST_SECONDS = 10;

	@Override
	public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
		long start = System.currentTimeMillis();
		var request = exchange.getRequest();
		MutableObject<Disposable> watchdog = new MutableObject<>(null);
		exchange.getResponse().beforeCommit(() -> Mono.fromRunnable(() -> {
			Disposable d = watchdog.getValue();
			if (d != null && !d.isDisposed()) d.dispose();
			long time = System.currentTimeMillis() - start;
			if (time > SLOW_REQUEST_MILLIS) log.info("Slow request ({} ms): {} {}", time, request.getMethod(), request.getPath());
		}));
		watchdog.setValue(Schedulers.boundedElastic().schedule(() -> {
			watchdog.setValue(null);
			log.warn("Request still not committed after {} seconds: {} {}", STUCK_REQUEST_SECONDS, request.getMethod(), request.getPath());
		}, STUCK_REQUEST_SECONDS, TimeUnit.SECONDS));
		return chain.filter(exchange);
	}

}
