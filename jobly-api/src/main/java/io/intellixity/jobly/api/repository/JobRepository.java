package io.intellixity.jobly.api.repository;

import io.intellixity.jobly.api.domain.Job;
import io.intellixity.jobly.persistence.jdbc.QueryExecutor;
import io.intellixity.jobly.persistence.jdbc.RowReader;
import io.intellixity.jobly.persistence.sql.ColumnNames;
import io.intellixity.jobly.persistence.sql.FilterClauseBuilder;
import io.intellixity.jobly.persistence.sql.FilterRule;
import io.intellixity.jobly.persistence.sql.SqlFragment;
import io.intellixity.jobly.persistence.sql.SqlIdents;
import io.intellixity.jobly.persistence.sql.SqlValue;
import io.intellixity.jobly.persistence.sql.UpdateClauseBuilder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

@Repository
public final class JobRepository {
  public static final ColumnNames COLUMNS = ColumnNames.of("companyHandle", "company_handle");

  // hasEquity binds 0, not the flag: callers only pass the key when the flag is set.
  public static final List<FilterRule> FILTERS = List.of(
      FilterRule.containsIgnoreCase("title", "title"),
      FilterRule.atLeast("minSalary", "salary"),
      FilterRule.greaterThanConstant("hasEquity", "equity", SqlValue.integer(0)));

  private static final String RETURNING =
      "id, title, salary, equity, company_handle AS \"companyHandle\"";

  private static final RowReader<Job> JOB = row -> new Job(
      row.integer("id"),
      row.string("title"),
      row.integer("salary"),
      row.decimal("equity"),
      row.string("companyHandle"));

  private final QueryExecutor db;

  public JobRepository(QueryExecutor db) {
    this.db = db;
  }

  public Job insert(String title, SqlValue salary, SqlValue equity, String companyHandle) {
    return db.queryOne(
        "INSERT INTO jobs (title, salary, equity, company_handle)"
            + " VALUES ($1, $2, $3, $4)"
            + " RETURNING " + RETURNING,
        List.of(SqlValue.text(title), salary, equity, SqlValue.text(companyHandle)),
        JOB);
  }

  /** Jobs matching {@code criteria} (keys from {@link #FILTERS}), ordered by id. */
  public List<Job> findAll(Map<String, SqlValue> criteria) {
    SqlFragment where = FilterClauseBuilder.build(criteria, FILTERS);
    String sql = "SELECT " + RETURNING + " FROM jobs"
        + (where.isEmpty() ? "" : " WHERE " + where.clause())
        + " ORDER BY id";
    return db.query(sql, where.values(), JOB);
  }

  public Job findById(int id) {
    return db.queryOne("SELECT " + RETURNING + " FROM jobs WHERE id = $1", List.of(SqlValue.integer(id)), JOB);
  }

  public Job update(int id, Map<String, SqlValue> updates) {
    SqlFragment set = UpdateClauseBuilder.build(updates, COLUMNS);
    String sql = "UPDATE jobs SET " + set.clause()
        + " WHERE id = " + SqlIdents.placeholder(set.nextPosition())
        + " RETURNING " + RETURNING;
    return db.queryOne(sql, set.valuesWith(SqlValue.integer(id)), JOB);
  }

  public boolean delete(int id) {
    return db.update("DELETE FROM jobs WHERE id = $1", List.of(SqlValue.integer(id))) > 0;
  }
}
