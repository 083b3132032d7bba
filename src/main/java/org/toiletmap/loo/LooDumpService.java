package org.toiletmap.loo;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.toiletmap.global.ToiletMapUtils;
import org.toiletmap.global.dto.ListResponse;
import org.toiletmap.global.exceptions.ValidationUtils;
import org.toiletmap.loo.db.LooEntity;
import org.toiletmap.loo.db.LooPersistence;
import org.toiletmap.loo.dto.DumpRow;
import org.toiletmap.loo.dto.LooUpdates;

import com.fasterxml.jackson.core.JsonProcessingException;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Public export of the active loos.
 * <p>
 * The export is rebuilt on each call and never memoized here: the response is publicly cacheable,
 * repeated reads are absorbed by the HTTP caches in front of the service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LooDumpService {

	private final LooPersistence persistence;
	private final LooService looService;

	@Value("${toiletmap.dump.cache-seconds:3600}")
	private long cacheSeconds;

	@Getter
	@AllArgsConstructor
	public static class Dump {
		private final byte[] body;
		private final String etag;
		private final long maxAge;
	}

	/** Compact dump: one <code>[id, geohash, mask]</code> row per active loo, ordered by identifier. */
	public Mono<Dump> dump() {
		return persistence.findActiveForDump()
		.map(LooDumpService::toDumpRow)
		.collectList()
		.flatMap(rows -> serialize(new ListResponse<>(rows)));
	}

	/** Same loos as {@link #dump()}, with all their attributes. */
	public Mono<Dump> richDump() {
		return persistence.findActiveForDump()
		.map(looService::toDto)
		.collectList()
		.flatMap(loos -> serialize(new ListResponse<>(loos)));
	}

	public Mono<LooUpdates> getUpdates(Long since) {
		long from = ValidationUtils.field("since", since).notNull().min(0).get();
		return persistence.findUpdatedSince(from).collectList().map(entities -> {
			List<DumpRow> upserted = new ArrayList<>();
			List<String> deleted = new ArrayList<>();
			long until = from;
			for (LooEntity e : entities) {
				if (e.isActive() && e.getGeohash() != null) upserted.add(toDumpRow(e));
				else deleted.add(e.getId());
				until = Math.max(until, e.getUpdatedAt());
			}
			return new LooUpdates(from, until, upserted, deleted);
		});
	}

	static DumpRow toDumpRow(LooEntity entity) {
		return new DumpRow(entity.getId(), entity.getGeohash(), FilterMask.encode(entity));
	}

	private Mono<Dump> serialize(ListResponse<?> content) {
		byte[] body;
		try {
			body = ToiletMapUtils.mapper.writeValueAsBytes(content);
		} catch (JsonProcessingException e) {
			return Mono.error(e);
		}
		log.debug("Dump generated with {} loos, {} bytes", content.getCount(), body.length);
		return Mono.just(new Dump(body, "\"" + DigestUtils.sha256Hex(body) + "\"", cacheSeconds));
	}

}
