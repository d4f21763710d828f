package io.intellixity.jobly.api.domain;

import java.math.BigDecimal;

public record Job(int id,
                  String title,
                  Integer salary,
                  BigDecimal equity,
                  String companyHandle) {}
