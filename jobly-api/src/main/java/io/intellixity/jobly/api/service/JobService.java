package io.intellixity.jobly.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.jobly.api.domain.Job;
import io.intellixity.jobly.api.error.NotFoundException;
import io.intellixity.jobly.api.repository.CompanyRepository;
import io.intellixity.jobly.api.repository.JobRepository;
import io.intellixity.jobly.api.service.RequestBodies.FieldKind;
import io.intellixity.jobly.api.service.RequestBodies.FieldSpec;
import io.intellixity.jobly.persistence.sql.SqlValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public final class JobService {
  private static final Logger log = LoggerFactory.getLogger(JobService.class);

  static final List<FieldSpec> NEW_JOB = List.of(
      FieldSpec.required("title", FieldKind.TEXT),
      FieldSpec.optional("salary", FieldKind.NON_NEGATIVE_INT),
      FieldSpec.optional("equity", FieldKind.EQUITY),
      FieldSpec.required("companyHandle", FieldKind.TEXT));

  // id and companyHandle are fixed once a job exists
  static final List<FieldSpec> JOB_UPDATE = List.of(
      FieldSpec.optionalNonNull("title", FieldKind.TEXT),
      FieldSpec.optional("salary", FieldKind.NON_NEGATIVE_INT),
      FieldSpec.optional("equity", FieldKind.EQUITY));

  static final Set<String> SEARCH_KEYS = Set.of("title", "minSalary", "hasEquity");

  private final JobRepository jobs;
  private final CompanyRepository companies;

  public JobService(JobRepository jobs, CompanyRepository companies) {
    this.jobs = jobs;
    this.companies = companies;
  }

  public Job create(JsonNode body) {
    Map<String, SqlValue> in = RequestBodies.forCreate(body, NEW_JOB);
    String companyHandle = (String) in.get("companyHandle").raw();
    if (!companies.exists(companyHandle)) throw new NotFoundException("No company: " + companyHandle);

    Job job = jobs.insert(
        (String) in.get("title").raw(),
        in.getOrDefault("salary", SqlValue.nullValue()),
        in.getOrDefault("equity", SqlValue.nullValue()),
        companyHandle);
    log.info("jobly.job_created id={} company={}", job == null ? null : job.id(), companyHandle);
    return job;
  }

  /**
   * Search by optional {@code title}, {@code minSalary} and {@code hasEquity}.
   *
   * <p>{@code hasEquity} filters only when it is the literal {@code true}; any other value means no equity
   * filter.</p>
   */
  public List<Job> findAll(Map<String, String> query) {
    Map<String, String> raw = (query == null) ? Map.of() : query;
    QueryParams.requireKnownKeys(raw, SEARCH_KEYS);

    Map<String, SqlValue> criteria = new LinkedHashMap<>();
    if (raw.containsKey("title")) criteria.put("title", QueryParams.text("title", raw.get("title")));
    if (raw.containsKey("minSalary")) {
      criteria.put("minSalary", QueryParams.nonNegativeInt("minSalary", raw.get("minSalary")));
    }
    if ("true".equals(raw.get("hasEquity"))) criteria.put("hasEquity", SqlValue.bool(true));
    return jobs.findAll(criteria);
  }

  public Job get(int id) {
    Job job = jobs.findById(id);
    if (job == null) throw new NotFoundException("No job: " + id);
    return job;
  }

  public Job update(int id, JsonNode body) {
    Map<String, SqlValue> updates = RequestBodies.forPatch(body, JOB_UPDATE);
    Job job = jobs.update(id, updates);
    if (job == null) throw new NotFoundException("No job: " + id);
    return job;
  }

  public void remove(int id) {
    if (!jobs.delete(id)) throw new NotFoundException("No job: " + id);
    log.info("jobly.job_deleted id={}", id);
  }
}
