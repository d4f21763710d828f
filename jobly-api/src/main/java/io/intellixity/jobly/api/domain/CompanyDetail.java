package io.intellixity.jobly.api.domain;

import java.math.BigDecimal;
import java.util.List;

/** A company together with its open jobs, ordered by salary. */
public record CompanyDetail(String handle,
                            String name,
                            String description,
                            Integer numEmployees,
                            String logoUrl,
                            List<CompanyJob> jobs) {
  public CompanyDetail {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }

  public static CompanyDetail of(Company c, List<CompanyJob> jobs) {
    return new CompanyDetail(c.handle(), c.name(), c.description(), c.numEmployees(), c.logoUrl(), jobs);
  }

  public record CompanyJob(int id, String title, Integer salary, BigDecimal equity) {}
}
