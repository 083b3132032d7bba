package org.toiletmap.loo.db;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.data.domain.Pageable;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.sql.Assignment;
import org.springframework.data.relational.core.sql.Assignments;
import org.springframework.data.relational.core.sql.AsteriskFromTable;
import org.springframework.data.relational.core.sql.Column;
import org.springframework.data.relational.core.sql.Condition;
import org.springframework.data.relational.core.sql.Conditions;
import org.springframework.data.relational.core.sql.Expression;
import org.springframework.data.relational.core.sql.Expressions;
import org.springframework.data.relational.core.sql.Insert;
import org.springframework.data.relational.core.sql.SQL;
import org.springframework.data.relational.core.sql.Update;
import org.springframework.r2dbc.core.binding.MutableBindings;
import org.springframework.stereotype.Component;
import org.toiletmap.global.db.DbUtils;
import org.toiletmap.global.db.SqlBuilder;
import org.toiletmap.global.dto.PageResult;
import org.toiletmap.loo.SearchFlag;
import org.toiletmap.loo.dto.LooSearchCriteria;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Storage of loos and of their versions.
 * <p>
 * Contributors are only ever appended by the database itself, so concurrent mutations of the same loo never lose an entry.
 * Creation and update times come from the database clock.
 * Uniqueness of identifiers is left to the primary key: an insert of an existing identifier inserts nothing.
 */
@Component
@RequiredArgsConstructor
public class LooPersistence {

	private static final Set<String> SET_BY_DATABASE = Set.of("createdAt", "updatedAt", "contributors");

	private static final Map<String, Object> sortFieldMapping = Map.of(
		"updatedAt", LooEntity.COL_UPDATED_AT,
		"createdAt", LooEntity.COL_CREATED_AT,
		"verifiedAt", LooEntity.COL_VERIFIED_AT,
		"name", LooEntity.COL_NAME
	);

	private final R2dbcEntityTemplate r2dbc;
	private final LooRepository repo;
	private final LooVersionRepository versionRepo;

	public Mono<LooEntity> findById(String id) {
		return repo.findById(id);
	}

	public Flux<LooEntity> findByIds(Collection<String> ids) {
		if (ids.isEmpty()) return Flux.empty();
		return repo.findAllByIdInOrderById(ids);
	}

	public Flux<LooEntity> findByGeohashPrefix(String prefix, Boolean active) {
		if (active == null) return repo.findAllByGeohashStartingWithOrderById(prefix);
		return repo.findAllByGeohashStartingWithAndActiveOrderById(prefix, active.booleanValue());
	}

	/** Active loos having a location, ordered by identifier. */
	public Flux<LooEntity> findActiveForDump() {
		return repo.findAllByActiveTrueAndGeohashIsNotNullOrderById();
	}

	public Flux<LooEntity> findUpdatedSince(long since) {
		return repo.findAllByUpdatedAtGreaterThanOrderByUpdatedAtAscIdAsc(since);
	}

	/**
	 * Inserts a new loo, with the given contributor as the only entry of its history.
	 * Emits false, inserting nothing, when the identifier is already used, including by a creation not yet committed.
	 */
	public Mono<Boolean> insert(LooEntity entity, String contributor) {
		MutableBindings bindings = DbUtils.createBindings(r2dbc);
		Map<Column, Expression> values = DbUtils.values(r2dbc, entity, LooEntity.TABLE, bindings, SET_BY_DATABASE, true);
		values.put(LooEntity.COL_CREATED_AT, DbUtils.NOW_MILLIS);
		values.put(LooEntity.COL_UPDATED_AT, DbUtils.NOW_MILLIS);
		var contributorMarker = bindings.bind(contributor);
		values.put(LooEntity.COL_CONTRIBUTORS, Expressions.just("ARRAY[" + contributorMarker.getPlaceholder() + "::text]"));
		Insert insert = Insert.builder()
		.into(LooEntity.TABLE)
		.columns(new ArrayList<>(values.keySet()))
		.values(new ArrayList<>(values.values()))
		.build();
		String sql = DbUtils.render(insert, r2dbc) + " ON CONFLICT (" + LooEntity.COL_ID.getName() + ") DO NOTHING";
		return r2dbc.getDatabaseClient().sql(DbUtils.operation(sql, bindings)).fetch().rowsUpdated().map(inserted -> inserted.longValue() > 0);
	}

	/**
	 * Replaces every attribute of an existing loo and appends the contributor to its history, in a single statement.
	 * Emits the number of updated rows: 0 when the loo does not exist.
	 */
	public Mono<Long> replace(LooEntity entity, String contributor) {
		MutableBindings bindings = DbUtils.createBindings(r2dbc);
		List<Assignment> assignments = new ArrayList<>(DbUtils.assignAll(r2dbc, entity, LooEntity.TABLE, bindings, SET_BY_DATABASE));
		assignments.add(Assignments.value(LooEntity.COL_UPDATED_AT, DbUtils.NOW_MILLIS));
		var contributorMarker = bindings.bind(contributor);
		assignments.add(Assignments.value(
			LooEntity.COL_CONTRIBUTORS,
			Expressions.just("array_append(" + LooEntity.COL_CONTRIBUTORS.getName() + ", " + contributorMarker.getPlaceholder() + "::text)")
		));
		var idMarker = bindings.bind(entity.getId());
		Update update = Update.builder()
		.table(LooEntity.TABLE)
		.set(assignments)
		.where(Conditions.isEqual(LooEntity.COL_ID, SQL.bindMarker(idMarker.getPlaceholder())))
		.build();
		return r2dbc.getDatabaseClient().sql(DbUtils.update(update, bindings, r2dbc)).fetch().rowsUpdated();
	}

	public Mono<LooVersionEntity> addVersion(LooVersionEntity version) {
		return r2dbc.insert(version);
	}

	/** Versions of a loo, oldest first. */
	public Flux<LooVersionEntity> findVersions(String looId) {
		return versionRepo.findAllByLooIdOrderById(looId);
	}

	public Mono<PageResult<LooEntity>> search(LooSearchCriteria criteria, Pageable pageable) {
		MutableBindings bindings = DbUtils.createBindings(r2dbc);
		Condition where = buildSearchCondition(criteria, bindings);
		String sql = new SqlBuilder()
		.select(AsteriskFromTable.create(LooEntity.TABLE))
		.from(LooEntity.TABLE)
		.where(where)
		.pageable(pageable, sortFieldMapping, LooEntity.COL_ID)
		.build();
		String countSql = new SqlBuilder()
		.select(Expressions.just("count(*) AS nb"))
		.from(LooEntity.TABLE)
		.where(where)
		.build();
		return Mono.zip(
			r2dbc.query(DbUtils.operation(sql, bindings), LooEntity.class).all().collectList().publishOn(Schedulers.parallel()),
			r2dbc.query(DbUtils.operation(countSql, bindings), row -> row.get("nb", Long.class)).one().publishOn(Schedulers.parallel())
		).map(result -> new PageResult<>(pageable, result.getT1(), result.getT2()));
	}

	private Condition buildSearchCondition(LooSearchCriteria criteria, MutableBindings bindings) {
		Condition where = null;
		if (criteria.getSearch() != null) {
			String placeholder = bindings.bind("%" + escapeLike(criteria.getSearch().toLowerCase()) + "%").getPlaceholder();
			List<String> matches = new ArrayList<>();
			for (Column col : List.of(LooEntity.COL_ID, LooEntity.COL_NAME, LooEntity.COL_GEOHASH, LooEntity.COL_NOTES))
				matches.add("lower(" + col + ") LIKE " + placeholder);
			where = and(where, Conditions.just("(" + String.join(" OR ", matches) + ")"));
		}
		where = and(where, LooEntity.COL_ACTIVE, criteria.getActive());
		where = and(where, LooEntity.COL_ACCESSIBLE, criteria.getAccessible());
		where = and(where, LooEntity.COL_ALL_GENDER, criteria.getAllGender());
		where = and(where, LooEntity.COL_RADAR, criteria.getRadar());
		where = and(where, LooEntity.COL_BABY_CHANGE, criteria.getBabyChange());
		where = and(where, LooEntity.COL_NO_PAYMENT, criteria.getNoPayment());
		where = andPresent(where, LooEntity.COL_VERIFIED_AT, criteria.getVerified());
		where = andPresent(where, LooEntity.COL_GEOHASH, criteria.getHasLocation());
		return where;
	}

	private static Condition and(Condition where, Column flag, SearchFlag filter) {
		if (filter == null) return where;
		switch (filter) {
			case TRUE: return and(where, Conditions.isEqual(flag, SQL.literalOf(true)));
			case FALSE: return and(where, Conditions.isEqual(flag, SQL.literalOf(false)));
			case UNKNOWN: return and(where, Conditions.isNull(flag));
			default: return where;
		}
	}

	private static Condition andPresent(Condition where, Column column, SearchFlag filter) {
		if (filter == null) return where;
		switch (filter) {
			case TRUE: return and(where, Conditions.isNull(column).not());
			case FALSE: return and(where, Conditions.isNull(column));
			default: return where;
		}
	}

	private static Condition and(Condition where, Condition condition) {
		return where == null ? condition : where.and(condition);
	}

	static String escapeLike(String s) {
		return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
	}

}
