package org.toiletmap.loo.db;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Flux;

public interface LooVersionRepository extends ReactiveCrudRepository<LooVersionEntity, Long> {

	Flux<LooVersionEntity> findAllByLooIdOrderById(String looId);

}
