package io.intellixity.paging.examples.domain;

import io.intellixity.paging.mapping.RowAdapter;
import io.intellixity.paging.mapping.RowReader;

public record Person(Long id, String firstName, String lastName, String email) {
  public static final RowReader<Person> READER = Person::read;

  private static Person read(RowAdapter row) {
    return new Person(
        row.longValue("id"),
        row.string("first_name"),
        row.string("last_name"),
        row.string("email"));
  }
}
