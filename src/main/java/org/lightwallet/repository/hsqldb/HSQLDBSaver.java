package org.lightwallet.repository.hsqldb;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Saves one row: updates the row matching the key columns, or inserts it if there is none.
 * <p>
 * Example:
 * <pre>
 * new HSQLDBSaver("KeyValues").bindKey("bucket", bucket).bindKey("kv_key", key).bind("kv_value", value).execute(repository);
 * </pre>
 */
public class HSQLDBSaver {

	private final String table;

	private final List<String> keyColumns = new ArrayList<>();
	private final List<Object> keyObjects = new ArrayList<>();
	private final List<String> valueColumns = new ArrayList<>();
	private final List<Object> valueObjects = new ArrayList<>();

	public HSQLDBSaver(String table) {
		this.table = table;
	}

	/** Binds a column that identifies the row. */
	public HSQLDBSaver bindKey(String column, Object value) {
		this.keyColumns.add(column);
		this.keyObjects.add(value);
		return this;
	}

	public HSQLDBSaver bind(String column, Object value) {
		this.valueColumns.add(column);
		this.valueObjects.add(value);
		return this;
	}

	/** @return number of changed rows */
	public int execute(HSQLDBRepository repository) throws SQLException {
		if (!this.valueColumns.isEmpty()) {
			List<Object> updateObjects = new ArrayList<>(this.valueObjects);
			updateObjects.addAll(this.keyObjects);

			int updated = repository.executeCheckedUpdate(this.formatUpdateSql(), updateObjects.toArray());
			if (updated > 0)
				return updated;
		} else if (repository.exists(this.table, this.formatWhereClause(), this.keyObjects.toArray())) {
			return 0;
		}

		List<Object> insertObjects = new ArrayList<>(this.keyObjects);
		insertObjects.addAll(this.valueObjects);

		return repository.executeCheckedUpdate(this.formatInsertSql(), insertObjects.toArray());
	}

	private String formatWhereClause() {
		return this.keyColumns.stream().map(column -> column + " = ?").collect(Collectors.joining(" AND "));
	}

	private String formatUpdateSql() {
		StringBuilder sql = new StringBuilder(256);
		sql.append("UPDATE ").append(this.table).append(" SET ");
		sql.append(this.valueColumns.stream().map(column -> column + " = ?").collect(Collectors.joining(", ")));
		sql.append(" WHERE ").append(this.formatWhereClause());

		return sql.toString();
	}

	private String formatInsertSql() {
		List<String> columns = new ArrayList<>(this.keyColumns);
		columns.addAll(this.valueColumns);

		StringBuilder sql = new StringBuilder(256);
		sql.append("INSERT INTO ").append(this.table).append(" (");
		sql.append(String.join(", ", columns));
		sql.append(") VALUES (");
		sql.append(columns.stream().map(column -> "?").collect(Collectors.joining(", ")));
		sql.append(")");

		return sql.toString();
	}

}
