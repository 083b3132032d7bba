package org.toiletmap.loo.rest;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.toiletmap.global.ToiletMapUtils;
import org.toiletmap.global.dto.ListResponse;
import org.toiletmap.global.dto.PageResult;
import org.toiletmap.loo.ActiveFilter;
import org.toiletmap.loo.LooDumpService;
import org.toiletmap.loo.LooService;
import org.toiletmap.loo.SearchFlag;
import org.toiletmap.loo.dto.CreateLooRequest;
import org.toiletmap.loo.dto.Loo;
import org.toiletmap.loo.dto.LooMutation;
import org.toiletmap.loo.dto.LooReport;
import org.toiletmap.loo.dto.LooSearchCriteria;
import org.toiletmap.loo.dto.LooUpdates;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/loos")
@RequiredArgsConstructor
public class LoosController {

	private final LooService service;
	private final LooDumpService dumpService;

	@GetMapping("/dump")
	public Mono<ResponseEntity<byte[]>> dump(@RequestParam(name = "rich", required = false, defaultValue = "false") boolean rich) {
		return (rich ? dumpService.richDump() : dumpService.dump())
		.map(dump -> ResponseEntity.ok()
			.contentType(MediaType.APPLICATION_JSON)
			.eTag(dump.getEtag())
			.header(HttpHeaders.CACHE_CONTROL, "public, max-age=" + dump.getMaxAge())
			.body(dump.getBody())
		);
	}

	@GetMapping("/updates")
	public Mono<LooUpdates> updates(@RequestParam(name = "since", required = false) Long since) {
		return dumpService.getUpdates(since);
	}

	@PostMapping
	public Mono<ResponseEntity<Loo>> create(@Valid @RequestBody CreateLooRequest request, Authentication auth) {
		return service.create(request, auth).map(loo -> ResponseEntity.status(HttpStatus.CREATED).body(loo));
	}

	@PutMapping("/{id}")
	public Mono<ResponseEntity<Loo>> upsert(@PathVariable("id") String id, @Valid @RequestBody LooMutation request, Authentication auth) {
		return service.upsert(id, request, auth)
		.map(result -> ResponseEntity.status(result.getT2().booleanValue() ? HttpStatus.CREATED : HttpStatus.OK).body(result.getT1()));
	}

	@GetMapping("/search")
	@SuppressWarnings("java:S107") // parameters
	public Mono<PageResult<Loo>> search(
		@RequestParam(name = "search", required = false) String search,
		@RequestParam(name = "active", required = false) String active,
		@RequestParam(name = "accessible", required = false) String accessible,
		@RequestParam(name = "allGender", required = false) String allGender,
		@RequestParam(name = "radar", required = false) String radar,
		@RequestParam(name = "babyChange", required = false) String babyChange,
		@RequestParam(name = "noPayment", required = false) String noPayment,
		@RequestParam(name = "verified", required = false) String verified,
		@RequestParam(name = "hasLocation", required = false) String hasLocation,
		@PageableDefault(size = 50, sort = "updatedAt", direction = Sort.Direction.DESC) Pageable pageable
	) {
		LooSearchCriteria criteria = new LooSearchCriteria(
			StringUtils.trimToNull(search),
			SearchFlag.parse("active", active),
			SearchFlag.parse("accessible", accessible),
			SearchFlag.parse("allGender", allGender),
			SearchFlag.parse("radar", radar),
			SearchFlag.parse("babyChange", babyChange),
			SearchFlag.parse("noPayment", noPayment),
			SearchFlag.parseBoolean("verified", verified),
			SearchFlag.parseBoolean("hasLocation", hasLocation)
		);
		return service.search(criteria, pageable);
	}

	@GetMapping("/{id}/reports")
	public Mono<ListResponse<LooReport>> getReports(@PathVariable("id") String id) {
		return service.getReports(id);
	}

	@GetMapping("/geohash/{geohash}")
	public Mono<ListResponse<Loo>> getByGeohash(@PathVariable("geohash") String geohash, @RequestParam(name = "active", required = false) String active) {
		return service.getByGeohash(geohash, ActiveFilter.parse(active));
	}

	@GetMapping("/{id}")
	public Mono<Loo> getById(@PathVariable("id") String id) {
		return service.getById(id);
	}

	@GetMapping
	public Mono<ListResponse<Loo>> getByIds(@RequestParam(name = "ids", required = false) List<String> ids) {
		return service.getByIds(ToiletMapUtils.splitValues(ids));
	}

}
