package org.toiletmap.loo;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.springframework.data.domain.Pageable;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.toiletmap.global.ToiletMapUtils;
import org.toiletmap.global.dto.ListResponse;
import org.toiletmap.global.dto.PageResult;
import org.toiletmap.global.exceptions.BadRequestException;
import org.toiletmap.global.exceptions.ConflictException;
import org.toiletmap.global.exceptions.NotFoundException;
import org.toiletmap.global.exceptions.ValidationUtils;
import org.toiletmap.loo.db.LooEntity;
import org.toiletmap.loo.db.LooPersistence;
import org.toiletmap.loo.db.LooVersionEntity;
import org.toiletmap.loo.dto.Coordinates;
import org.toiletmap.loo.dto.CreateLooRequest;
import org.toiletmap.loo.dto.Loo;
import org.toiletmap.loo.dto.LooMutation;
import org.toiletmap.loo.dto.LooReport;
import org.toiletmap.loo.dto.LooSearchCriteria;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.r2dbc.postgresql.codec.Json;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

@Service
@RequiredArgsConstructor
@Slf4j
public class LooService {

	public static final String LOO = "loo";

	private static final TypeReference<List<List<String>>> OPENING_TIMES_TYPE = new TypeReference<>() {};

	private final LooPersistence persistence;
	private final SecureRandom random;

	/** Creates a loo, with the identifier of the request or a new one. Fails with a conflict if the identifier is already used. */
	@Transactional
	public Mono<Loo> create(CreateLooRequest request, Authentication auth) {
		String contributor = auth.getPrincipal().toString();
		String id = request.getId() != null ? request.getId() : ToiletMapUtils.generateLooId(random);
		LooEntity entity = toEntity(id, request);
		return persistence.insert(entity, contributor)
		.flatMap(inserted -> {
			if (!inserted.booleanValue()) return Mono.error(new ConflictException(LOO, id));
			log.info("Loo {} created by {}", id, contributor);
			return recordVersion(id, contributor);
		});
	}

	/**
	 * Replaces the loo having the given identifier, or creates it.
	 * The boolean is true when the loo has been created.
	 */
	@Transactional
	public Mono<Tuple2<Loo, Boolean>> upsert(String id, LooMutation mutation, Authentication auth) {
		validateId(id);
		String contributor = auth.getPrincipal().toString();
		LooEntity entity = toEntity(id, mutation);
		return persistence.replace(entity, contributor)
		.flatMap(updated -> {
			if (updated.longValue() > 0) return Mono.just(Boolean.FALSE);
			return persistence.insert(entity, contributor)
			.flatMap(inserted -> {
				if (inserted.booleanValue()) return Mono.just(Boolean.TRUE);
				// created by a concurrent request since our update
				return persistence.replace(entity, contributor).thenReturn(Boolean.FALSE);
			});
		})
		.flatMap(created -> {
			log.info("Loo {} {} by {}", id, created.booleanValue() ? "created" : "updated", contributor);
			return recordVersion(id, contributor).map(loo -> Tuples.of(loo, created));
		});
	}

	private Mono<Loo> recordVersion(String id, String contributor) {
		return persistence.findById(id)
		.map(this::toDto)
		.flatMap(loo -> persistence.addVersion(new LooVersionEntity(null, id, contributor, loo.getUpdatedAt(), toJson(snapshot(loo)))).thenReturn(loo));
	}

	/** Contributions to a loo, oldest first, each with the attributes it changed. */
	public Mono<ListResponse<LooReport>> getReports(String id) {
		validateId(id);
		return persistence.findById(id)
		.switchIfEmpty(Mono.error(() -> new NotFoundException(LOO, id)))
		.flatMapMany(loo -> persistence.findVersions(id))
		.collectList()
		.map(versions -> {
			JsonNode previous = ToiletMapUtils.mapper.createObjectNode();
			List<LooReport> reports = new ArrayList<>(versions.size());
			for (LooVersionEntity version : versions) {
				JsonNode current = readJson(version.getSnapshot().asString());
				reports.add(new LooReport(version.getId(), version.getContributor(), version.getCreatedAt(), diff(previous, current)));
				previous = current;
			}
			return new ListResponse<>(reports);
		});
	}

	/** Attributes whose value differs, a missing attribute being null. */
	static Map<String, LooReport.Change> diff(JsonNode previous, JsonNode current) {
		Set<String> fields = new LinkedHashSet<>();
		for (Iterator<String> it = current.fieldNames(); it.hasNext();) fields.add(it.next());
		for (Iterator<String> it = previous.fieldNames(); it.hasNext();) fields.add(it.next());
		Map<String, LooReport.Change> diff = new LinkedHashMap<>();
		for (String field : fields) {
			JsonNode before = valueOf(previous, field);
			JsonNode after = valueOf(current, field);
			if (before == null ? after != null : !before.equals(after))
				diff.put(field, new LooReport.Change(before, after));
		}
		return diff;
	}

	private static JsonNode valueOf(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value;
	}

	private static ObjectNode snapshot(Loo loo) {
		ObjectNode node = ToiletMapUtils.mapper.valueToTree(loo);
		node.remove(List.of("id", "geohash", "createdAt", "updatedAt", "contributors"));
		return node;
	}

	public Mono<Loo> getById(String id) {
		validateId(id);
		return persistence.findById(id)
		.switchIfEmpty(Mono.error(() -> new NotFoundException(LOO, id)))
		.map(this::toDto);
	}

	/** Unknown identifiers are ignored, as are malformed ones. */
	public Mono<ListResponse<Loo>> getByIds(List<String> ids) {
		if (ids.isEmpty()) throw new BadRequestException(ValidationUtils.MISSING_PREFIX + "ids", "ids is required");
		List<String> valid = ids.stream().filter(ToiletMapUtils::isLooId).toList();
		return persistence.findByIds(valid).map(this::toDto).collectList().map(ListResponse::new);
	}

	public Mono<ListResponse<Loo>> getByGeohash(String geohash, ActiveFilter active) {
		String prefix = ValidationUtils.field("geohash", StringUtils.lowerCase(StringUtils.trimToNull(geohash)))
			.notNull()
			.check(Geohash::isValid, "geohash must be a geohash prefix of at most " + Geohash.PRECISION + " characters")
			.get();
		return persistence.findByGeohashPrefix(prefix, active.toBoolean()).map(this::toDto).collectList().map(ListResponse::new);
	}

	public Mono<PageResult<Loo>> search(LooSearchCriteria criteria, Pageable pageable) {
		ValidationUtils.field("search", criteria.getSearch()).maxLength(LooSearchCriteria.MAX_SEARCH_LENGTH);
		return persistence.search(criteria, pageable)
		.map(page -> new PageResult<>(pageable, page.getElements().stream().map(this::toDto).toList(), page.getCount()));
	}

	private void validateId(String id) {
		ValidationUtils.field("id", id).notNull().exactLength(ToiletMapUtils.LOO_ID_LENGTH);
	}

	private LooEntity toEntity(String id, LooMutation mutation) {
		LooEntity entity = new LooEntity();
		entity.setId(id);
		entity.setName(StringUtils.trimToNull(mutation.getName()));
		Coordinates location = mutation.getLocation();
		if (location != null) {
			entity.setLatitude(location.getLat());
			entity.setLongitude(location.getLng());
			entity.setGeohash(Geohash.encode(location.getLat(), location.getLng()));
		}
		entity.setActive(mutation.getActive() == null || mutation.getActive().booleanValue());
		entity.setAccessible(mutation.getAccessible());
		entity.setNoPayment(mutation.getNoPayment());
		entity.setAllGender(mutation.getAllGender());
		entity.setBabyChange(mutation.getBabyChange());
		entity.setMen(mutation.getMen());
		entity.setWomen(mutation.getWomen());
		entity.setChildren(mutation.getChildren());
		entity.setAutomatic(mutation.getAutomatic());
		entity.setAttended(mutation.getAttended());
		entity.setRadar(mutation.getRadar());
		entity.setUrinalOnly(mutation.getUrinalOnly());
		entity.setNotes(StringUtils.trimToNull(mutation.getNotes()));
		entity.setPaymentDetails(StringUtils.trimToNull(mutation.getPaymentDetails()));
		entity.setRemovalReason(StringUtils.trimToNull(mutation.getRemovalReason()));
		entity.setOpeningTimes(mutation.getOpeningTimes() != null ? toJson(mutation.getOpeningTimes()) : null);
		entity.setVerifiedAt(Boolean.TRUE.equals(mutation.getVerified()) ? System.currentTimeMillis() : null);
		return entity;
	}

	Loo toDto(LooEntity entity) {
		return new Loo(
			entity.getId(),
			entity.getName(),
			entity.getLatitude() != null && entity.getLongitude() != null ? new Coordinates(entity.getLatitude(), entity.getLongitude()) : null,
			entity.getGeohash(),
			entity.isActive(),
			entity.getAccessible(),
			entity.getNoPayment(),
			entity.getAllGender(),
			entity.getBabyChange(),
			entity.getMen(),
			entity.getWomen(),
			entity.getChildren(),
			entity.getAutomatic(),
			entity.getAttended(),
			entity.getRadar(),
			entity.getUrinalOnly(),
			entity.getNotes(),
			entity.getPaymentDetails(),
			entity.getRemovalReason(),
			entity.getOpeningTimes() != null ? readOpeningTimes(entity.getOpeningTimes()) : null,
			entity.getVerifiedAt(),
			entity.getCreatedAt(),
			entity.getUpdatedAt(),
			entity.getContributors()
		);
	}

	private static List<List<String>> readOpeningTimes(Json json) {
		try {
			return ToiletMapUtils.mapper.readValue(json.asString(), OPENING_TIMES_TYPE);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Invalid opening times stored", e);
		}
	}

	private static JsonNode readJson(String json) {
		try {
			return ToiletMapUtils.mapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Invalid loo version stored", e);
		}
	}

	private static Json toJson(Object value) {
		try {
			return Json.of(ToiletMapUtils.mapper.writeValueAsString(value));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
		}
	}

}
