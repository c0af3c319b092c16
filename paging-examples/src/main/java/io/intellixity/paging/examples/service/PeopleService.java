package io.intellixity.paging.examples.service;

import io.intellixity.paging.examples.domain.Person;
import io.intellixity.paging.examples.domain.Sources;
import io.intellixity.paging.exec.DataEngine;
import io.intellixity.paging.exec.ResultSet;
import org.springframework.stereotype.Service;

@Service
public final class PeopleService {
  private final DataEngine engine;

  public PeopleService(DataEngine engine) {
    this.engine = engine;
  }

  public ResultSet<Person> people() {
    return engine.resultSet(Sources.PEOPLE, Person.READER);
  }
}
