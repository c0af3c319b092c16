package io.intellixity.paging.examples.web;

import io.intellixity.paging.examples.domain.Person;
import io.intellixity.paging.examples.service.PeopleService;
import io.intellixity.paging.paging.DoesPaging;
import io.intellixity.paging.paging.PagingSettings;
import io.intellixity.paging.paging.RequestParams;
import io.intellixity.paging.spring.DeletionResponse;
import io.intellixity.paging.spring.StoreResponse;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/people")
public final class PeopleController implements DoesPaging {
  private final PeopleService people;
  private final PagingSettings settings;

  public PeopleController(PeopleService people, PagingSettings settings) {
    this.people = people;
    this.settings = settings;
  }

  @Override
  public PagingSettings pagingSettings() {
    return settings;
  }

  /** Any non-paging parameter named after a column is a substring filter, e.g. {@code ?last_name=smi}. */
  @GetMapping
  public StoreResponse<Person> list(RequestParams params) {
    return StoreResponse.of(pageAndSort(params, search(params, people.people())));
  }

  @PostMapping("/delete")
  public DeletionResponse delete(RequestParams params) {
    return DeletionResponse.of(simpleDeletion(params, people.people()));
  }
}
