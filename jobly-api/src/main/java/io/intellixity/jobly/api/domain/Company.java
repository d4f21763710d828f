package io.intellixity.jobly.api.domain;

public record Company(String handle,
                      String name,
                      String description,
                      Integer numEmployees,
                      String logoUrl) {}
