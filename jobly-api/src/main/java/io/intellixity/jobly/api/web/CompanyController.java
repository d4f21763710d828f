package io.intellixity.jobly.api.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.jobly.api.domain.Company;
import io.intellixity.jobly.api.domain.CompanyDetail;
import io.intellixity.jobly.api.service.CompanyService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/companies")
public final class CompanyController {
  private final CompanyService companies;

  public CompanyController(CompanyService companies) {
    this.companies = companies;
  }

  /** { handle, name, description, numEmployees, logoUrl } => { company } */
  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public Map<String, Company> create(@RequestBody(required = false) JsonNode body) {
    return Map.of("company", companies.create(body));
  }

  /** Optional filters: name (case-insensitive, partial), minEmployees, maxEmployees. */
  @GetMapping
  public Map<String, List<Company>> list(@RequestParam Map<String, String> query) {
    return Map.of("companies", companies.findAll(query));
  }

  @GetMapping("/{handle}")
  public Map<String, CompanyDetail> get(@PathVariable("handle") String handle) {
    return Map.of("company", companies.get(handle));
  }

  @PatchMapping("/{handle}")
  public Map<String, Company> update(@PathVariable("handle") String handle,
                                     @RequestBody(required = false) JsonNode body) {
    return Map.of("company", companies.update(handle, body));
  }

  @DeleteMapping("/{handle}")
  public Map<String, String> delete(@PathVariable("handle") String handle) {
    companies.remove(handle);
    return Map.of("deleted", handle);
  }
}
