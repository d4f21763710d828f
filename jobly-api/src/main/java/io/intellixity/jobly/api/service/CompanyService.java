package io.intellixity.jobly.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.jobly.api.domain.Company;
import io.intellixity.jobly.api.domain.CompanyDetail;
import io.intellixity.jobly.api.error.BadRequestException;
import io.intellixity.jobly.api.error.NotFoundException;
import io.intellixity.jobly.api.repository.CompanyRepository;
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
public final class CompanyService {
  private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

  static final List<FieldSpec> NEW_COMPANY = List.of(
      FieldSpec.required("handle", FieldKind.TEXT).maxLength(25),
      FieldSpec.required("name", FieldKind.TEXT),
      FieldSpec.optional("description", FieldKind.TEXT),
      FieldSpec.optional("numEmployees", FieldKind.NON_NEGATIVE_INT),
      FieldSpec.optional("logoUrl", FieldKind.TEXT));

  // handle is the key and cannot be patched
  static final List<FieldSpec> COMPANY_UPDATE = List.of(
      FieldSpec.optionalNonNull("name", FieldKind.TEXT),
      FieldSpec.optional("description", FieldKind.TEXT),
      FieldSpec.optional("numEmployees", FieldKind.NON_NEGATIVE_INT),
      FieldSpec.optional("logoUrl", FieldKind.TEXT));

  static final Set<String> SEARCH_KEYS = Set.of("name", "minEmployees", "maxEmployees");

  private final CompanyRepository companies;

  public CompanyService(CompanyRepository companies) {
    this.companies = companies;
  }

  public Company create(JsonNode body) {
    Map<String, SqlValue> in = RequestBodies.forCreate(body, NEW_COMPANY);
    String handle = (String) in.get("handle").raw();
    if (companies.exists(handle)) throw new BadRequestException("Duplicate company: " + handle);

    Company c = new Company(
        handle,
        (String) in.get("name").raw(),
        rawString(in.get("description")),
        rawInt(in.get("numEmployees")),
        rawString(in.get("logoUrl")));
    Company created = companies.insert(c);
    log.info("jobly.company_created handle={}", handle);
    return created;
  }

  /**
   * Search by optional {@code name}, {@code minEmployees} and {@code maxEmployees}.
   *
   * <p>Values are coerced first; the range check then compares real integers.</p>
   */
  public List<Company> findAll(Map<String, String> query) {
    Map<String, String> raw = (query == null) ? Map.of() : query;
    QueryParams.requireKnownKeys(raw, SEARCH_KEYS);

    Map<String, SqlValue> criteria = new LinkedHashMap<>();
    if (raw.containsKey("name")) criteria.put("name", QueryParams.text("name", raw.get("name")));
    if (raw.containsKey("minEmployees")) {
      criteria.put("minEmployees", QueryParams.nonNegativeInt("minEmployees", raw.get("minEmployees")));
    }
    if (raw.containsKey("maxEmployees")) {
      criteria.put("maxEmployees", QueryParams.nonNegativeInt("maxEmployees", raw.get("maxEmployees")));
    }

    if (criteria.get("minEmployees") instanceof SqlValue.Int min
        && criteria.get("maxEmployees") instanceof SqlValue.Int max
        && min.value() > max.value()) {
      throw new BadRequestException("minEmployees cannot be greater than maxEmployees");
    }
    return companies.findAll(criteria);
  }

  public CompanyDetail get(String handle) {
    Company c = companies.findByHandle(handle);
    if (c == null) throw new NotFoundException("No company: " + handle);
    return CompanyDetail.of(c, companies.findJobs(handle));
  }

  public Company update(String handle, JsonNode body) {
    Map<String, SqlValue> updates = RequestBodies.forPatch(body, COMPANY_UPDATE);
    Company c = companies.update(handle, updates);
    if (c == null) throw new NotFoundException("No company: " + handle);
    return c;
  }

  public void remove(String handle) {
    if (!companies.delete(handle)) throw new NotFoundException("No company: " + handle);
    log.info("jobly.company_deleted handle={}", handle);
  }

  private static String rawString(SqlValue v) {
    return (v == null) ? null : (String) v.raw();
  }

  private static Integer rawInt(SqlValue v) {
    if (v == null || v.raw() == null) return null;
    return ((Long) v.raw()).intValue();
  }
}
