package com.brewdeck.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Installed formulae and casks captured for re-import on another machine. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PackageList(
    @JsonProperty("formulae") List<PackageListItem> formulae,
    @JsonProperty("casks") List<PackageListItem> casks,
    @JsonProperty("export_date") String exportDate) {

  public PackageList {
    formulae = formulae == null ? List.of() : List.copyOf(formulae);
    casks = casks == null ? List.of() : List.copyOf(casks);
  }

  @JsonIgnore
  public int totalCount() {
    return formulae.size() + casks.size();
  }
}
