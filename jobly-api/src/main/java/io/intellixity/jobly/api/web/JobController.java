package io.intellixity.jobly.api.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.jobly.api.domain.Job;
import io.intellixity.jobly.api.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/jobs")
public final class JobController {
  private final JobService jobs;

  public JobController(JobService jobs) {
    this.jobs = jobs;
  }

  /** { title, salary, equity, companyHandle } => { job } */
  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public Map<String, Job> create(@RequestBody(required = false) JsonNode body) {
    return Map.of("job", jobs.create(body));
  }

  /** Optional filters: title (case-insensitive, partial), minSalary, hasEquity=true. */
  @GetMapping
  public Map<String, List<Job>> list(@RequestParam Map<String, String> query) {
    return Map.of("jobs", jobs.findAll(query));
  }

  @GetMapping("/{id}")
  public Map<String, Job> get(@PathVariable("id") int id) {
    return Map.of("job", jobs.get(id));
  }

  @PatchMapping("/{id}")
  public Map<String, Job> update(@PathVariable("id") int id, @RequestBody(required = false) JsonNode body) {
    return Map.of("job", jobs.update(id, body));
  }

  @DeleteMapping("/{id}")
  public Map<String, Integer> delete(@PathVariable("id") int id) {
    jobs.remove(id);
    return Map.of("deleted", id);
  }
}
