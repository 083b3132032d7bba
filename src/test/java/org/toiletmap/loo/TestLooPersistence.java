package org.toiletmap.loo;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.toiletmap.loo.db.LooEntity;
import org.toiletmap.loo.db.LooPersistence;
import org.toiletmap.test.AbstractTest;

import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class TestLooPersistence extends AbstractTest {

	@Autowired
	private LooPersistence persistence;

	private LooEntity entity(String id, String name) {
		LooEntity entity = new LooEntity();
		entity.setId(id);
		entity.setName(name);
		entity.setActive(true);
		return entity;
	}

	@Test
	void testReplaceUnknownUpdatesNothing() {
		StepVerifier.create(persistence.replace(entity(test.looId(), "ghost"), "someone"))
		.expectNext(0L)
		.verifyComplete();
	}

	@Test
	void testInsertOfAnExistingIdInsertsNothing() {
		String id = test.looId();
		StepVerifier.create(persistence.insert(entity(id, "first"), "a"))
		.expectNext(true)
		.verifyComplete();
		StepVerifier.create(persistence.insert(entity(id, "second"), "b"))
		.expectNext(false)
		.verifyComplete();
		StepVerifier.create(persistence.findById(id))
		.assertNext(e -> {
			assertThat(e.getName()).isEqualTo("first");
			assertThat(e.getContributors()).containsExactly("a");
			assertThat(e.getCreatedAt()).isPositive().isEqualTo(e.getUpdatedAt());
		})
		.verifyComplete();
	}

	@Test
	void testConcurrentInsertsOfTheSameId() {
		String id = test.looId();
		StepVerifier.create(
			Flux.range(0, 10)
			.flatMap(i -> persistence.insert(entity(id, "racer " + i), "racer-" + i).subscribeOn(Schedulers.parallel()), 10)
			.filter(Boolean::booleanValue)
			.count()
		)
		.expectNext(1L)
		.verifyComplete();
	}

	@Test
	void testConcurrentReplacesKeepEveryContributor() {
		String id = test.looId();
		persistence.insert(entity(id, "busy"), "creator").block();
		List<String> contributors = new ArrayList<>();
		for (int i = 0; i < 20; ++i) contributors.add("contributor-" + i);

		StepVerifier.create(
			Flux.fromIterable(contributors)
			.flatMap(c -> persistence.replace(entity(id, "busy " + c), c).subscribeOn(Schedulers.parallel()), 10)
			.reduce(0L, Long::sum)
		)
		.expectNext(20L)
		.verifyComplete();

		StepVerifier.create(persistence.findById(id))
		.assertNext(e -> {
			assertThat(e.getContributors()).hasSize(21).startsWith("creator");
			assertThat(e.getContributors().subList(1, 21)).containsExactlyInAnyOrderElementsOf(contributors);
			assertThat(e.getName()).startsWith("busy contributor-");
			assertThat(e.getCreatedAt()).isPositive();
		})
		.verifyComplete();
	}

}
