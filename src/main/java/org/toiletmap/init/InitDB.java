package org.toiletmap.init;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;

import lombok.extern.slf4j.Slf4j;

/** Creates the tables that do not exist yet, from the scripts under <code>db_init</code>. */
@Slf4j
@SuppressWarnings("java:S6813") // use autowired instead of constructor
public class InitDB {

	@Autowired private R2dbcEntityTemplate db;

	private static final String[] TABLES = {
		"loos",
		"loo_versions"
	};

	public void init() {
		for (var table : TABLES) createTable(table);
	}

	@SuppressWarnings("java:S112") // RuntimeException
	private void createTable(String tableName) {
		log.info("Create table {}", tableName);
		String sql;
		try (InputStream in = InitDB.class.getClassLoader().getResourceAsStream("db_init/" + tableName + ".sql")) {
			if (in == null) throw new IllegalStateException("Missing script db_init/" + tableName + ".sql");
			sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new IllegalStateException("Cannot read script for table " + tableName, e);
		}
		try {
			db.getDatabaseClient().sql(sql).then().block();
		} catch (Exception e) {
			log.error("Error creating table {}", tableName, e);
			throw new RuntimeException("Database initialization error", e);
		}
	}

}
