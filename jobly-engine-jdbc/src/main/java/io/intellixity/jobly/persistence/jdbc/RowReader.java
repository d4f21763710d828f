package io.intellixity.jobly.persistence.jdbc;

@FunctionalInterface
public interface RowReader<T> {
  T read(RowAdapter row);
}
