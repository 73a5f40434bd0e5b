package com.skyreader.sync.r2dbc.store;

import org.springframework.r2dbc.core.DatabaseClient;

/**
 * Null-aware parameter binding. R2DBC needs the column type for nulls.
 */
final class Binds {

	private Binds() {
	}

	static DatabaseClient.GenericExecuteSpec nullable(DatabaseClient.GenericExecuteSpec spec, String name, Object value,
			Class<?> type) {
		if (value == null) {
			return spec.bindNull(name, type);
		}
		return spec.bind(name, value);
	}

	static String asString(Object v) {
		if (v == null)
			return null;
		if (v instanceof String s)
			return s;
		return String.valueOf(v);
	}
}
