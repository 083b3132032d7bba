package org.toiletmap.global.db;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.r2dbc.dialect.DialectResolver;
import org.springframework.data.relational.core.mapping.RelationalPersistentEntity;
import org.springframework.data.relational.core.sql.Assignment;
import org.springframework.data.relational.core.sql.Assignments;
import org.springframework.data.relational.core.sql.Column;
import org.springframework.data.relational.core.sql.Expression;
import org.springframework.data.relational.core.sql.Expressions;
import org.springframework.data.relational.core.sql.Insert;
import org.springframework.data.relational.core.sql.SQL;
import org.springframework.data.relational.core.sql.Table;
import org.springframework.data.relational.core.sql.Update;
import org.springframework.data.relational.core.sql.render.RenderContext;
import org.springframework.data.relational.core.sql.render.SqlRenderer;
import org.springframework.r2dbc.core.PreparedOperation;
import org.springframework.r2dbc.core.binding.BindTarget;
import org.springframework.r2dbc.core.binding.Bindings;
import org.springframework.r2dbc.core.binding.MutableBindings;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
@SuppressWarnings("deprecation")
public final class DbUtils {

	/** Current time of the database server, in epoch milliseconds. */
	public static final Expression NOW_MILLIS = Expressions.just("(extract(epoch from clock_timestamp()) * 1000)::bigint");

	public static PreparedOperation<Update> update(Update update, Bindings bindings, R2dbcEntityTemplate r2dbc) {
		return preparedOperation(update, bindings, () -> getRenderer(r2dbc).render(update));
	}

	public static PreparedOperation<String> operation(String sql, Bindings bindings) {
		return preparedOperation(sql, bindings, () -> sql);
	}

	private static <T> PreparedOperation<T> preparedOperation(T source, Bindings bindings, Supplier<String> toQuery) {
		return new PreparedOperation<T>() {
			@Override
			public void bindTo(BindTarget target) {
				if (bindings != null)
					bindings.apply(target);
			}

			@Override
			public T getSource() {
				return source;
			}

			@Override
			public String toQuery() {
				return toQuery.get();
			}
		};
	}

	public static MutableBindings createBindings(R2dbcEntityTemplate r2dbc) {
		var dialect = DialectResolver.getDialect(r2dbc.getDatabaseClient().getConnectionFactory());
		return new MutableBindings(dialect.getBindMarkersFactory().create());
	}

	/** Renders an INSERT, so a suffix such as ON CONFLICT can be appended. */
	public static String render(Insert insert, R2dbcEntityTemplate r2dbc) {
		return getRenderer(r2dbc).render(insert);
	}

	/**
	 * Builds one value per persistent property of the entity, by column, except the given properties.
	 * Null values are written as SQL NULL, others are bound.
	 */
	public static <T> Map<Column, Expression> values(R2dbcEntityTemplate r2dbc, T entity, Table table, MutableBindings bindings, Set<String> excludedProperties, boolean withId) {
		RelationalPersistentEntity<?> type = r2dbc.getConverter().getMappingContext().getRequiredPersistentEntity(entity.getClass());
		var accessor = type.getPropertyAccessor(entity);
		Map<Column, Expression> values = new LinkedHashMap<>();
		type.forEach(p -> {
			if ((p.isIdProperty() && !withId) || excludedProperties.contains(p.getName())) return;
			Object val = r2dbc.getConverter().writeValue(accessor.getProperty(p), p.getTypeInformation());
			Column column = Column.create(p.getColumnName(), table);
			if (val == null)
				values.put(column, SQL.nullLiteral());
			else
				values.put(column, SQL.bindMarker(bindings.bind(val).getPlaceholder()));
		});
		return values;
	}

	/** Assignments of every persistent property except the identifier, insert-only and given properties. */
	public static <T> List<Assignment> assignAll(R2dbcEntityTemplate r2dbc, T entity, Table table, MutableBindings bindings, Set<String> excludedProperties) {
		RelationalPersistentEntity<?> type = r2dbc.getConverter().getMappingContext().getRequiredPersistentEntity(entity.getClass());
		Set<String> excluded = new HashSet<>(excludedProperties);
		type.forEach(p -> {
			if (p.isInsertOnly()) excluded.add(p.getName());
		});
		List<Assignment> assignments = new LinkedList<>();
		values(r2dbc, entity, table, bindings, excluded, false).forEach((column, value) -> assignments.add(Assignments.value(column, value)));
		return assignments;
	}

	private static SqlRenderer getRenderer(R2dbcEntityTemplate r2dbc) {
		RenderContext ctx = r2dbc.getDataAccessStrategy().getStatementMapper().getRenderContext();
		return ctx != null ? SqlRenderer.create(ctx) : SqlRenderer.create();
	}

}
