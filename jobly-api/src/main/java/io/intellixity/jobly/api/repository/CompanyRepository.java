package io.intellixity.jobly.api.repository;

import io.intellixity.jobly.api.domain.Company;
import io.intellixity.jobly.api.domain.CompanyDetail.CompanyJob;
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
public final class CompanyRepository {
  public static final ColumnNames COLUMNS = ColumnNames.of(
      "numEmployees", "num_employees",
      "logoUrl", "logo_url");

  /** Declared order fixes the predicate and placeholder order of {@link #findAll}. */
  public static final List<FilterRule> FILTERS = List.of(
      FilterRule.containsIgnoreCase("name", "name"),
      FilterRule.atLeast("minEmployees", "num_employees"),
      FilterRule.atMost("maxEmployees", "num_employees"));

  private static final String RETURNING =
      "handle, name, description, num_employees AS \"numEmployees\", logo_url AS \"logoUrl\"";

  private static final RowReader<Company> COMPANY = row -> new Company(
      row.string("handle"),
      row.string("name"),
      row.string("description"),
      row.integer("numEmployees"),
      row.string("logoUrl"));

  private static final RowReader<CompanyJob> JOB = row -> new CompanyJob(
      row.integer("id"),
      row.string("title"),
      row.integer("salary"),
      row.decimal("equity"));

  private final QueryExecutor db;

  public CompanyRepository(QueryExecutor db) {
    this.db = db;
  }

  public boolean exists(String handle) {
    return db.queryOne("SELECT handle FROM companies WHERE handle = $1",
        List.of(SqlValue.text(handle)), row -> row.string("handle")) != null;
  }

  public Company insert(Company c) {
    return db.queryOne(
        "INSERT INTO companies (handle, name, description, num_employees, logo_url)"
            + " VALUES ($1, $2, $3, $4, $5)"
            + " RETURNING " + RETURNING,
        List.of(
            SqlValue.text(c.handle()),
            SqlValue.text(c.name()),
            SqlValue.text(c.description()),
            c.numEmployees() == null ? SqlValue.nullValue() : SqlValue.integer(c.numEmployees()),
            SqlValue.text(c.logoUrl())),
        COMPANY);
  }

  /** Companies matching {@code criteria} (keys from {@link #FILTERS}), ordered by name. */
  public List<Company> findAll(Map<String, SqlValue> criteria) {
    SqlFragment where = FilterClauseBuilder.build(criteria, FILTERS);
    String sql = "SELECT " + RETURNING + " FROM companies"
        + (where.isEmpty() ? "" : " WHERE " + where.clause())
        + " ORDER BY name";
    return db.query(sql, where.values(), COMPANY);
  }

  /** @return the company, or null when the handle is unknown */
  public Company findByHandle(String handle) {
    return db.queryOne("SELECT " + RETURNING + " FROM companies WHERE handle = $1",
        List.of(SqlValue.text(handle)), COMPANY);
  }

  public List<CompanyJob> findJobs(String handle) {
    return db.query("SELECT id, title, salary, equity FROM jobs WHERE company_handle = $1 ORDER BY salary",
        List.of(SqlValue.text(handle)), JOB);
  }

  /**
   * Partial update; only the supplied fields change.
   *
   * @return the updated company, or null when the handle is unknown
   */
  public Company update(String handle, Map<String, SqlValue> updates) {
    SqlFragment set = UpdateClauseBuilder.build(updates, COLUMNS);
    String sql = "UPDATE companies SET " + set.clause()
        + " WHERE handle = " + SqlIdents.placeholder(set.nextPosition())
        + " RETURNING " + RETURNING;
    return db.queryOne(sql, set.valuesWith(SqlValue.text(handle)), COMPANY);
  }

  /** @return false when nothing was deleted */
  public boolean delete(String handle) {
    return db.update("DELETE FROM companies WHERE handle = $1", List.of(SqlValue.text(handle))) > 0;
  }
}
