package org.toiletmap.loo.db;

import java.util.Collection;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Flux;

public interface LooRepository extends ReactiveCrudRepository<LooEntity, String> {

	Flux<LooEntity> findAllByActiveTrueAndGeohashIsNotNullOrderById();

	Flux<LooEntity> findAllByIdInOrderById(Collection<String> ids);

	Flux<LooEntity> findAllByGeohashStartingWithOrderById(String prefix);

	Flux<LooEntity> findAllByGeohashStartingWithAndActiveOrderById(String prefix, boolean active);

	Flux<LooEntity> findAllByUpdatedAtGreaterThanOrderByUpdatedAtAscIdAsc(long since);

}
