package org.toiletmap.global.db;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort.Order;
import org.springframework.data.relational.core.sql.Aliased;
import org.springframework.data.relational.core.sql.Condition;
import org.springframework.data.relational.core.sql.Expression;
import org.springframework.data.relational.core.sql.Table;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public class SqlBuilder {

	private final StringBuilder sql = new StringBuilder();

	public SqlBuilder select(Expression... fields) {
		sql.append("SELECT ");
		append(fields);
		return this;
	}

	public SqlBuilder from(@NonNull Table table) {
		sql.append(" FROM ").append(table.toString());
		return this;
	}

	public SqlBuilder where(@Nullable Condition condition) {
		if (condition != null)
			sql.append(" WHERE ").append(condition.toString());
		return this;
	}

	/**
	 * Appends ORDER BY, LIMIT and OFFSET.
	 * Sort properties missing from the mapping are ignored, the tie breakers are always appended last.
	 */
	public SqlBuilder pageable(@NonNull Pageable pageable, @NonNull Map<String, Object> sortFieldMapping, Expression... tieBreakers) {
		orderBy(pageable.getSort(), sortFieldMapping, tieBreakers);
		if (pageable.isPaged())
			sql.append(" LIMIT ").append(pageable.getPageSize()).append(" OFFSET ").append(pageable.getOffset());
		return this;
	}

	public SqlBuilder orderBy(Iterable<Order> orders, Map<String, Object> sortFieldMapping, Expression... tieBreakers) {
		List<String> elements = new ArrayList<>();
		for (Order o : orders) {
			String s = order(o, sortFieldMapping);
			if (s != null) elements.add(s);
		}
		for (Expression e : tieBreakers) elements.add(e.toString() + " ASC");
		if (elements.isEmpty()) return this;
		sql.append(" ORDER BY ").append(String.join(",", elements));
		return this;
	}

	private String order(Order order, Map<String, Object> sortFieldMapping) {
		Object field = sortFieldMapping.get(order.getProperty());
		String expression;
		if (field instanceof CharSequence s) expression = s.toString();
		else if (field instanceof Expression e) expression = e.toString();
		else return null;
		return expression + ' ' + (order.isAscending() ? "ASC" : "DESC");
	}

	public String build() {
		return sql.toString();
	}

	private void append(Expression... expressions) {
		boolean first = true;
		for (Expression e : expressions) {
			if (first) first = false;
			else sql.append(',');
			sql.append(e.toString());
			if (e instanceof Aliased a) sql.append(" AS ").append(a.getAlias());
		}
	}

}
